/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.batteryhawk.messaging.core;

import com.batteryhawk.common.exception.BrokerConnectionException;

import java.time.Duration;

/**
 * Abstract broker session factory. The resilient client never speaks the broker
 * protocol itself; an adapter such as the Paho MQTT v5 transport does.
 */
public interface BrokerTransport {

    /**
     * Open a session.
     *
     * @param settings endpoint, credentials and TLS parameters
     * @param timeout  upper bound the adapter should honour; the caller enforces it as well
     * @param listener receives inbound messages and connection-lost notifications for this session
     * @throws BrokerConnectionException if the session cannot be established
     */
    TransportHandle connect(MqttSettings settings, Duration timeout, TransportListener listener);
}
