/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.batteryhawk.messaging.core;

/**
 * Callback for messages arriving on a subscribed topic.
 */
@FunctionalInterface
public interface MessageHandler {
    /**
     * @param topic   full broker topic, including the namespace prefix
     * @param payload UTF-8 decoded message body
     */
    void onMessage(String topic, String payload);
}
