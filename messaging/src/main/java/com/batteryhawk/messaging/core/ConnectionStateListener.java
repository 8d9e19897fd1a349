/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.batteryhawk.messaging.core;

/**
 * Notified after every connection state transition. Invoked on the thread that made the
 * transition, outside the state monitor; implementations must be quick and non-blocking.
 */
@FunctionalInterface
public interface ConnectionStateListener {
    void onStateChanged(ConnectionState previous, ConnectionState current);
}
