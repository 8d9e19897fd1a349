/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.batteryhawk.messaging.core;

import com.batteryhawk.common.exception.BrokerConnectionException;
import com.batteryhawk.common.exception.PayloadSerializationException;
import com.batteryhawk.common.exception.QueueFullException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * MQTT publishing client that survives broker outages.
 *
 * <p>Messages published while the broker is unreachable are buffered in a bounded FIFO queue
 * and delivered in order once a session is back. Lost sessions are detected by a periodic
 * health check and by the transport's connection-lost callback, and are recovered with
 * exponential backoff.</p>
 *
 * <pre>{@code
 * ResilientMqttClient client = new ResilientMqttClient(settings, new PahoBrokerTransport());
 * client.connect();
 * client.publish("devices/AA:BB:CC:DD:EE:FF/reading", Map.of("voltage", 12.6));
 * client.disconnect();
 * }</pre>
 *
 * <p>All methods are safe to call from any thread.</p>
 */
public class ResilientMqttClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResilientMqttClient.class);

    private final ShutdownSignal shutdown = new ShutdownSignal();
    private final BackgroundTaskSupervisor supervisor;
    private final ConnectionManager connection;
    private final MessageQueue queue;
    private final PublishPath publishPath;

    public ResilientMqttClient(MqttSettings settings, BrokerTransport transport) {
        this(settings, transport, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param jitterSource uniform draws in [0, 1) for backoff jitter
     */
    public ResilientMqttClient(MqttSettings settings, BrokerTransport transport, DoubleSupplier jitterSource) {
        settings.validate();
        ReconnectionConfig cfg = settings.toReconnectionConfig();
        this.supervisor = new BackgroundTaskSupervisor(shutdown, "mqtt-");
        this.connection = new ConnectionManager(settings, transport, shutdown, supervisor, jitterSource);
        this.queue = new MessageQueue(cfg.messageQueueSize(), cfg.overflowPolicy());
        this.publishPath = new PublishPath(connection, queue, supervisor);
        connection.bind(publishPath);
        log.info("MQTT client created for {} (enabled={}, queue capacity {})",
                settings.endpoint(), settings.isEnabled(), cfg.messageQueueSize());
    }

    /**
     * Build a client from the {@code mqtt} block of a configuration source's {@code system}
     * section and keep it in sync with later changes.
     */
    public static ResilientMqttClient fromConfig(ConfigSource source, BrokerTransport transport) {
        MqttSettings settings = MqttSettings.fromSection(
                ConfigWatcher.mqttBlock(source.getConfig(ConfigWatcher.SYSTEM_SECTION)));
        ResilientMqttClient client = new ResilientMqttClient(settings, transport);
        source.registerListener(client.configWatcher());
        return client;
    }

    /** Listener that applies configuration changes to this client. */
    public ConfigChangeListener configWatcher() {
        return new ConfigWatcher(connection, queue);
    }

    // ─── Lifecycle ──────────────────────────────────────────────────

    /**
     * @throws BrokerConnectionException if every connection attempt failed
     */
    public void connect() {
        connection.connect();
    }

    public void disconnect() {
        connection.disconnect();
    }

    /** Disconnect and release the client's threads. The client cannot be reused. */
    @Override
    public void close() {
        disconnect();
        connection.shutdownExecutor();
    }

    // ─── Publish / subscribe ────────────────────────────────────────

    public void publish(String topic, String payload) {
        publish(topic, payload, false);
    }

    /**
     * Publish UTF-8 text to {@code prefix/topic}.
     *
     * @throws QueueFullException if the queue is full and the overflow policy is {@code reject}
     */
    public void publish(String topic, String payload, boolean retain) {
        publishPath.publish(QueuedMessage.text(topic, payload, retain));
    }

    public void publish(String topic, Map<String, ?> payload) {
        publish(topic, payload, false);
    }

    /**
     * Publish a map as JSON to {@code prefix/topic}.
     *
     * @throws PayloadSerializationException if the map cannot be encoded as JSON; nothing is queued
     * @throws QueueFullException if the queue is full and the overflow policy is {@code reject}
     */
    public void publish(String topic, Map<String, ?> payload, boolean retain) {
        publishPath.publish(QueuedMessage.json(topic, payload, retain));
    }

    /**
     * @throws BrokerConnectionException if not connected
     */
    public void subscribe(String topic, MessageHandler handler) {
        publishPath.subscribe(topic, handler);
    }

    public void unsubscribe(String topic) {
        publishPath.unsubscribe(topic);
    }

    /** Deliver queued messages now if connected. */
    public int flush() {
        return publishPath.flush();
    }

    // ─── Introspection ──────────────────────────────────────────────

    public ConnectionStats getStats() {
        return connection.snapshot(queue.size());
    }

    public ConnectionState getConnectionState() {
        return connection.state();
    }

    public boolean isConnected() {
        return connection.isConnected();
    }

    public MqttSettings getSettings() {
        return connection.settings();
    }

    public void addStateListener(ConnectionStateListener listener) {
        connection.addStateListener(listener);
    }

    public void removeStateListener(ConnectionStateListener listener) {
        connection.removeStateListener(listener);
    }

    MessageQueue queue() {
        return queue;
    }

    ConnectionManager connectionManager() {
        return connection;
    }

    BackgroundTaskSupervisor supervisor() {
        return supervisor;
    }
}
