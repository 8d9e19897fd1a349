/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.batteryhawk.messaging.core;

import com.batteryhawk.common.exception.BrokerConnectionException;

/**
 * One live broker session. Operations block until the broker acknowledges them
 * (for QoS &gt; 0) and throw {@link BrokerConnectionException} on any transport failure.
 */
public interface TransportHandle extends AutoCloseable {

    void publish(String topic, byte[] payload, int qos, boolean retain);

    void subscribe(String topic, int qos);

    void unsubscribe(String topic);

    /** Cheap liveness check used by the health-check loop. */
    boolean isUsable();

    /** Release the session. Never throws; failures are logged by the adapter. */
    @Override
    void close();
}
