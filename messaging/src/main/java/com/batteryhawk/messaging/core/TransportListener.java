/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.batteryhawk.messaging.core;

/**
 * Callbacks from a transport session. Invoked on transport threads, so implementations
 * only hand work off and return.
 */
public interface TransportListener {

    void onMessage(String topic, byte[] payload);

    void onConnectionLost(Throwable cause);
}
