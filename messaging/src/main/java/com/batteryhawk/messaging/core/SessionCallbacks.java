/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.batteryhawk.messaging.core;

/**
 * Hooks the connection manager calls into the publish path.
 */
interface SessionCallbacks {

    /** A session was just established; restore subscriptions and drain the queue. */
    void onSessionEstablished();

    /** Periodic tick of the message-processor task. */
    void processQueue();

    void onInboundMessage(String topic, byte[] payload);
}
