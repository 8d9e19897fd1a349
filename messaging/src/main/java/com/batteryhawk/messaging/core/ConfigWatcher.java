/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.batteryhawk.messaging.core;

import com.batteryhawk.common.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies changes of the {@code system} section's {@code mqtt} block to a running client.
 *
 * <p>New settings take effect for the next connection attempt and the next loop tick. A queue
 * size or overflow policy change resizes the queue in place. A change of endpoint, credentials,
 * TLS material or topic prefix on a connected client triggers a reconnection. An invalid block
 * is rejected and the current settings are kept.</p>
 */
public class ConfigWatcher implements ConfigChangeListener {

    private static final Logger log = LoggerFactory.getLogger(ConfigWatcher.class);

    public static final String SYSTEM_SECTION = "system";
    public static final String MQTT_KEY = "mqtt";

    private final ConnectionManager connection;
    private final MessageQueue queue;

    ConfigWatcher(ConnectionManager connection, MessageQueue queue) {
        this.connection = connection;
        this.queue = queue;
    }

    @Override
    public void onConfigChanged(String section, Map<String, Object> values) {
        if (!SYSTEM_SECTION.equals(section)) {
            return;
        }
        MqttSettings updated;
        try {
            updated = MqttSettings.fromSection(mqttBlock(values));
        } catch (ConfigurationException e) {
            log.error("Rejected MQTT configuration change, keeping current settings: {}", e.getMessage());
            return;
        }

        MqttSettings previous = connection.settings();
        ReconnectionConfig oldConfig = connection.reconnectionConfig();
        connection.updateSettings(updated);
        ReconnectionConfig newConfig = connection.reconnectionConfig();
        log.info("MQTT configuration updated: {}", updated);

        if (oldConfig.messageQueueSize() != newConfig.messageQueueSize()
                || oldConfig.overflowPolicy() != newConfig.overflowPolicy()) {
            queue.resize(newConfig.messageQueueSize(), newConfig.overflowPolicy());
            log.info("Message queue resized to {} ({})", newConfig.messageQueueSize(), newConfig.overflowPolicy());
        }

        if (updated.identityDiffers(previous) && connection.isConnected()) {
            log.info("MQTT connection parameters changed, reconnecting to {}", updated.endpoint());
            connection.requestReconnection();
        }
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> mqttBlock(Map<String, Object> systemSection) {
        Object block = systemSection != null ? systemSection.get(MQTT_KEY) : null;
        if (block == null) {
            return Map.of();
        }
        if (!(block instanceof Map)) {
            throw new ConfigurationException("'" + MQTT_KEY + "' must be an object, got " + block.getClass().getSimpleName());
        }
        return (Map<String, Object>) block;
    }
}
