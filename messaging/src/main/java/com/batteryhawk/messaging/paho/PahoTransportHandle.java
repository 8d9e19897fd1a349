/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.batteryhawk.messaging.paho;

import com.batteryhawk.common.exception.BrokerConnectionException;
import com.batteryhawk.messaging.core.TransportHandle;
import org.eclipse.paho.mqttv5.client.MqttAsyncClient;
import org.eclipse.paho.mqttv5.common.MqttException;
import org.eclipse.paho.mqttv5.common.MqttMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/** One Paho session. Operations block until the broker acknowledges or the timeout passes. */
class PahoTransportHandle implements TransportHandle {

    private static final Logger log = LoggerFactory.getLogger(PahoTransportHandle.class);
    private static final long QUIESCE_MS = 1000;

    private final MqttAsyncClient client;
    private final long timeoutMs;

    PahoTransportHandle(MqttAsyncClient client, Duration timeout) {
        this.client = client;
        this.timeoutMs = timeout.toMillis();
    }

    @Override
    public void publish(String topic, byte[] payload, int qos, boolean retain) {
        MqttMessage message = new MqttMessage(payload);
        message.setQos(qos);
        message.setRetained(retain);
        try {
            client.publish(topic, message).waitForCompletion(timeoutMs);
        } catch (MqttException e) {
            throw new BrokerConnectionException("Publish to '" + topic + "' failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void subscribe(String topic, int qos) {
        try {
            client.subscribe(topic, qos).waitForCompletion(timeoutMs);
        } catch (MqttException e) {
            throw new BrokerConnectionException("Subscribe to '" + topic + "' failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void unsubscribe(String topic) {
        try {
            client.unsubscribe(topic).waitForCompletion(timeoutMs);
        } catch (MqttException e) {
            throw new BrokerConnectionException("Unsubscribe from '" + topic + "' failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isUsable() {
        return client.isConnected();
    }

    @Override
    public void close() {
        try {
            if (client.isConnected()) {
                client.disconnect(QUIESCE_MS).waitForCompletion(timeoutMs);
            }
        } catch (MqttException e) {
            log.warn("Error disconnecting Paho client '{}': {}", client.getClientId(), e.getMessage());
        }
        try {
            client.close();
        } catch (MqttException e) {
            log.warn("Error closing Paho client '{}': {}", client.getClientId(), e.getMessage());
        }
    }
}
