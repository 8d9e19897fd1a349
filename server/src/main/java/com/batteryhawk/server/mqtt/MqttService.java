/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.batteryhawk.server.mqtt;

import com.batteryhawk.common.exception.BatteryHawkException;
import com.batteryhawk.common.exception.BrokerConnectionException;
import com.batteryhawk.common.model.BatteryReading;
import com.batteryhawk.common.model.DeviceStatus;
import com.batteryhawk.common.util.JsonUtil;
import com.batteryhawk.messaging.core.ResilientMqttClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs the publishing client for the server.
 *
 * <p>{@link #start()} connects, publishes an initial system status and schedules two jobs:
 * a periodic system status every {@code status_interval} seconds and a connection monitor that
 * reconnects an enabled client found disconnected or failed. A failed initial connect does not
 * stop the service; the monitor keeps trying. Publishing while the broker is away queues the
 * message in the client.</p>
 */
public class MqttService {

    private static final Logger log = LoggerFactory.getLogger(MqttService.class);

    static final String SERVICE_VERSION = "1.0.0";
    private static final Duration DEFAULT_MONITOR_INTERVAL = Duration.ofSeconds(30);

    private final ResilientMqttClient client;
    private final TelemetryPublisher publisher;
    private final MqttTopics topics;
    private final Duration monitorInterval;
    private volatile boolean running;
    private volatile Instant startedAt;
    private ScheduledExecutorService scheduler;

    public MqttService(ResilientMqttClient client) {
        this(client, DEFAULT_MONITOR_INTERVAL);
    }

    public MqttService(ResilientMqttClient client, Duration monitorInterval) {
        this.client = client;
        this.topics = new MqttTopics(client.getSettings().getTopicPrefix());
        this.publisher = new TelemetryPublisher(client, topics);
        this.monitorInterval = monitorInterval;
    }

    public boolean isEnabled() {
        return client.getSettings().isEnabled();
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isConnected() {
        return client.isConnected();
    }

    public MqttTopics topics() {
        return topics;
    }

    public synchronized void start() {
        if (!isEnabled()) {
            log.info("MQTT service is disabled");
            return;
        }
        if (running) {
            log.warn("MQTT service is already running");
            return;
        }
        log.info("Starting MQTT service");
        running = true;
        startedAt = Instant.now();
        try {
            client.connect();
            log.info("MQTT service connected successfully");
        } catch (BrokerConnectionException e) {
            log.warn("MQTT service started without a broker connection: {}", e.getMessage());
        }
        publishInitialStatus();

        scheduler = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "mqtt-service");
            t.setDaemon(true);
            return t;
        });
        long statusSeconds = Math.max(1, client.getSettings().getStatusInterval());
        scheduler.scheduleWithFixedDelay(this::publishPeriodicStatus, statusSeconds, statusSeconds, TimeUnit.SECONDS);
        scheduler.scheduleWithFixedDelay(this::monitorConnection,
                monitorInterval.toMillis(), monitorInterval.toMillis(), TimeUnit.MILLISECONDS);
        log.debug("Started MQTT service jobs (status every {} s, monitor every {} ms)",
                statusSeconds, monitorInterval.toMillis());
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        log.info("Stopping MQTT service");
        running = false;
        if (scheduler != null) {
            scheduler.shutdownNow();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("MQTT service jobs did not stop within 5 s");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            scheduler = null;
        }
        client.disconnect();
        log.info("MQTT service stopped");
    }

    // ─── Publishing ─────────────────────────────────────────────────

    public void publishDeviceReading(String deviceId, BatteryReading reading, String vehicleId, String deviceType) {
        try {
            publisher.publishDeviceReading(deviceId, reading, vehicleId, deviceType);
        } catch (BatteryHawkException e) {
            log.error("Failed to publish device reading for {}: {}", deviceId, e.getMessage());
        }
    }

    public void publishDeviceStatus(String deviceId, DeviceStatus status, String deviceType, String vehicleId,
                                    BatteryReading latestReading) {
        try {
            publisher.publishDeviceStatus(deviceId, status, deviceType, vehicleId, latestReading);
        } catch (BatteryHawkException e) {
            log.error("Failed to publish device status for {}: {}", deviceId, e.getMessage());
        }
    }

    public void publishVehicleSummary(String vehicleId, Map<String, ?> summary) {
        try {
            publisher.publishVehicleSummary(vehicleId, summary);
        } catch (BatteryHawkException e) {
            log.error("Failed to publish vehicle summary for {}: {}", vehicleId, e.getMessage());
        }
    }

    public void publishDeviceDiscovered(String macAddress, String deviceType, String name, Integer rssi,
                                        Map<String, ?> advertisementData) {
        try {
            publisher.publishDeviceDiscovered(macAddress, deviceType, name, rssi, advertisementData);
        } catch (BatteryHawkException e) {
            log.error("Failed to publish discovery of {}: {}", macAddress, e.getMessage());
        }
    }

    public Map<String, Object> getStats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("enabled", isEnabled());
        stats.put("running", running);
        stats.put("connected", isConnected());
        stats.put("mqtt_stats", JsonUtil.toMap(client.getStats()));
        return stats;
    }

    // ─── Scheduled jobs ─────────────────────────────────────────────

    void publishInitialStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("status", "running");
        status.put("mqtt_enabled", true);
        status.put("mqtt_connected", isConnected());
        status.put("service_version", SERVICE_VERSION);
        status.put("components", Map.of("mqtt_client", "active", "telemetry_publisher", "active"));
        try {
            publisher.publishSystemStatus(status);
            log.debug("Published initial system status");
        } catch (BatteryHawkException e) {
            log.error("Failed to publish initial status: {}", e.getMessage());
        }
    }

    void publishPeriodicStatus() {
        if (!running) return;
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("status", "running");
        status.put("uptime", Duration.between(startedAt, Instant.now()).toSeconds());
        status.put("mqtt_connected", isConnected());
        status.put("mqtt_stats", JsonUtil.toMap(client.getStats()));
        try {
            publisher.publishSystemStatus(status);
            log.debug("Published periodic system status");
        } catch (RuntimeException e) {
            log.error("Error in periodic status publisher", e);
        }
    }

    void monitorConnection() {
        if (!running || !isEnabled()) return;
        switch (client.getConnectionState()) {
            case DISCONNECTED:
            case FAILED:
                log.warn("MQTT connection lost, attempting reconnection");
                try {
                    client.connect();
                    if (client.isConnected()) {
                        log.info("MQTT connection restored");
                    }
                } catch (BrokerConnectionException e) {
                    log.error("Failed to reconnect to MQTT: {}", e.getMessage());
                } catch (RuntimeException e) {
                    log.error("Error in connection monitor", e);
                }
                break;
            default:
                break;
        }
    }
}
