/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.batteryhawk.messaging.paho;

import com.batteryhawk.messaging.core.TransportListener;
import org.eclipse.paho.mqttv5.client.IMqttToken;
import org.eclipse.paho.mqttv5.client.MqttCallback;
import org.eclipse.paho.mqttv5.client.MqttDisconnectResponse;
import org.eclipse.paho.mqttv5.common.MqttException;
import org.eclipse.paho.mqttv5.common.MqttMessage;
import org.eclipse.paho.mqttv5.common.packet.MqttProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards Paho callbacks to a {@link TransportListener}. Runs on Paho's callback thread,
 * so the listener must hand work off rather than block.
 */
class PahoCallbackBridge implements MqttCallback {

    private static final Logger log = LoggerFactory.getLogger(PahoCallbackBridge.class);

    private final TransportListener listener;

    PahoCallbackBridge(TransportListener listener) {
        this.listener = listener;
    }

    @Override
    public void disconnected(MqttDisconnectResponse response) {
        Throwable cause = response.getException();
        if (cause == null) {
            cause = new IllegalStateException("Broker closed the session: " + response.getReasonString());
        }
        listener.onConnectionLost(cause);
    }

    @Override
    public void mqttErrorOccurred(MqttException exception) {
        log.warn("MQTT error reported by client: {}", exception.getMessage());
    }

    @Override
    public void messageArrived(String topic, MqttMessage message) {
        listener.onMessage(topic, message.getPayload());
    }

    @Override
    public void deliveryComplete(IMqttToken token) {
        log.trace("Delivery complete for message {}", token.getMessageId());
    }

    @Override
    public void connectComplete(boolean reconnect, String serverUri) {
        log.debug("Connected to {} (reconnect={})", serverUri, reconnect);
    }

    @Override
    public void authPacketArrived(int reasonCode, MqttProperties properties) {
        log.debug("Auth packet arrived with reason code {}", reasonCode);
    }
}
