/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.batteryhawk.messaging.core;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.batteryhawk.messaging.core.TestSupport.waitUntil;
import static org.assertj.core.api.Assertions.assertThat;

class ConfigWatcherTest {

    private final FakeBrokerTransport transport = new FakeBrokerTransport();
    private ResilientMqttClient client;
    private ConfigChangeListener watcher;

    @BeforeEach
    void setUp() {
        client = new ResilientMqttClient(TestSupport.settings(), transport, () -> 0.0);
        watcher = client.configWatcher();
    }

    @AfterEach
    void tearDown() {
        client.close();
    }

    private static Map<String, Object> block() {
        Map<String, Object> mqtt = new HashMap<>();
        mqtt.put("enabled", true);
        mqtt.put("broker", "broker.test");
        mqtt.put("port", 1883);
        mqtt.put("topic_prefix", "bh");
        mqtt.put("qos", 1);
        mqtt.put("max_retries", 2);
        mqtt.put("initial_retry_delay", 0.1);
        mqtt.put("max_retry_delay", 0.2);
        mqtt.put("jitter_factor", 0.0);
        mqtt.put("connection_timeout", 1.0);
        mqtt.put("health_check_interval", 60);
        mqtt.put("message_processor_interval", 60);
        mqtt.put("message_queue_size", 5);
        mqtt.put("message_retry_limit", 2);
        return mqtt;
    }

    private static Map<String, Object> system(Map<String, Object> mqtt) {
        Map<String, Object> section = new HashMap<>();
        section.put("mqtt", mqtt);
        section.put("logging", Map.of("level", "INFO"));
        return section;
    }

    @Test
    void resizesQueueWhenCapacityChanges() {
        for (int i = 1; i <= 5; i++) {
            client.publish("t", "m" + i);
        }
        Map<String, Object> mqtt = block();
        mqtt.put("message_queue_size", 2);

        watcher.onConfigChanged("system", system(mqtt));

        assertThat(client.queue().capacity()).isEqualTo(2);
        assertThat(client.queue().snapshot()).extracting(QueuedMessage::payload).containsExactly("m4", "m5");
        assertThat(client.connectionManager().reconnectionConfig().messageQueueSize()).isEqualTo(2);
    }

    @Test
    void keepsCurrentSettingsWhenBlockIsInvalid() {
        MqttSettings before = client.getSettings();
        Map<String, Object> mqtt = block();
        mqtt.put("port", 0);

        watcher.onConfigChanged("system", system(mqtt));

        assertThat(client.getSettings()).isSameAs(before);
    }

    @Test
    void ignoresOtherSections() {
        MqttSettings before = client.getSettings();

        watcher.onConfigChanged("devices", Map.of("devices", Map.of()));

        assertThat(client.getSettings()).isSameAs(before);
    }

    @Test
    void tuningChangeDoesNotReconnect() throws InterruptedException {
        client.connect();
        Map<String, Object> mqtt = block();
        mqtt.put("max_retries", 7);

        watcher.onConfigChanged("system", system(mqtt));

        assertThat(client.connectionManager().reconnectionConfig().maxRetries()).isEqualTo(7);
        Thread.sleep(200);
        assertThat(transport.handles).hasSize(1);
        assertThat(client.getStats().totalReconnections()).isZero();
    }

    @Test
    void endpointChangeReconnectsConnectedClient() {
        client.connect();
        Map<String, Object> mqtt = block();
        mqtt.put("broker", "other.test");

        watcher.onConfigChanged("system", system(mqtt));

        waitUntil(() -> transport.handles.size() == 2
                && client.getConnectionState() == ConnectionState.CONNECTED, "reconnection to the new broker");
        assertThat(client.getSettings().endpoint()).isEqualTo("other.test:1883");
        assertThat(client.getStats().totalReconnections()).isEqualTo(1);
    }

    @Test
    void endpointChangeWhileDisconnectedOnlyStoresSettings() throws InterruptedException {
        Map<String, Object> mqtt = block();
        mqtt.put("broker", "other.test");

        watcher.onConfigChanged("system", system(mqtt));

        Thread.sleep(200);
        assertThat(transport.connectCalls).hasValue(0);
        assertThat(client.getSettings().endpoint()).isEqualTo("other.test:1883");
    }

    @Test
    void fromConfigRegistersWatcher() {
        List<ConfigChangeListener> registered = new ArrayList<>();
        ConfigSource source = new ConfigSource() {
            @Override
            public Map<String, Object> getConfig(String section) {
                return system(block());
            }

            @Override
            public void registerListener(ConfigChangeListener listener) {
                registered.add(listener);
            }
        };

        try (ResilientMqttClient built = ResilientMqttClient.fromConfig(source, transport)) {
            assertThat(built.getSettings().endpoint()).isEqualTo("broker.test:1883");
            assertThat(registered).hasSize(1);

            Map<String, Object> mqtt = block();
            mqtt.put("message_queue_size", 3);
            registered.get(0).onConfigChanged("system", system(mqtt));

            assertThat(built.queue().capacity()).isEqualTo(3);
        }
    }
}
