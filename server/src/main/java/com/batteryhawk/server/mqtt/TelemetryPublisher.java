/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.batteryhawk.server.mqtt;

import com.batteryhawk.common.model.BatteryReading;
import com.batteryhawk.common.model.DeviceStatus;
import com.batteryhawk.messaging.core.ResilientMqttClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the JSON payloads of the telemetry namespace and publishes them with the retain flag
 * of their topic. Timestamps are ISO-8601 UTC.
 */
public class TelemetryPublisher {

    private static final Logger log = LoggerFactory.getLogger(TelemetryPublisher.class);

    private final ResilientMqttClient client;
    private final MqttTopics topics;
    private final Clock clock;

    public TelemetryPublisher(ResilientMqttClient client, MqttTopics topics) {
        this(client, topics, Clock.systemUTC());
    }

    public TelemetryPublisher(ResilientMqttClient client, MqttTopics topics, Clock clock) {
        this.client = client;
        this.topics = topics;
        this.clock = clock;
    }

    /**
     * @param vehicleId  optional vehicle association
     * @param deviceType optional device model, e.g. {@code BM6}
     */
    public void publishDeviceReading(String deviceId, BatteryReading reading, String vehicleId, String deviceType) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("device_id", deviceId);
        payload.put("timestamp", reading.getTimestamp() != null ? reading.getTimestamp().toString() : now());
        payload.put("voltage", reading.getVoltage());
        payload.put("current", reading.getCurrent());
        payload.put("temperature", reading.getTemperature());
        payload.put("state_of_charge", reading.getStateOfCharge());
        putIfPresent(payload, "capacity", reading.getCapacity());
        putIfPresent(payload, "cycles", reading.getCycles());
        putIfPresent(payload, "vehicle_id", vehicleId);
        putIfPresent(payload, "device_type", deviceType);
        if (reading.getExtra() != null && !reading.getExtra().isEmpty()) {
            payload.put("extra", reading.getExtra());
        }
        putIfPresent(payload, "power", reading.power());

        client.publish(topics.deviceReading(deviceId), payload, retained(MqttTopics.DEVICE_READING));
        log.debug("Published device reading for {} (vehicle: {})", deviceId, vehicleId != null ? vehicleId : "none");
    }

    /**
     * Retained status. When {@code latestReading} is given its values are copied into the payload
     * and also nested under {@code latest_reading}, so status subscribers see current metrics.
     */
    public void publishDeviceStatus(String deviceId, DeviceStatus status, String deviceType, String vehicleId,
                                    BatteryReading latestReading) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("device_id", deviceId);
        payload.put("timestamp", now());
        payload.put("connected", status.isConnected());
        putIfPresent(payload, "error_code", status.getErrorCode());
        putIfPresent(payload, "error_message", blankToNull(status.getErrorMessage()));
        putIfPresent(payload, "protocol_version", blankToNull(status.getProtocolVersion()));
        putIfPresent(payload, "last_command", blankToNull(status.getLastCommand()));
        putIfPresent(payload, "device_type", deviceType);
        putIfPresent(payload, "vehicle_id", vehicleId);
        if (status.getExtra() != null && !status.getExtra().isEmpty()) {
            payload.put("extra", status.getExtra());
        }
        if (latestReading != null) {
            payload.putAll(readingFields(latestReading, "reading_extra"));
            Map<String, Object> nested = readingFields(latestReading, "extra");
            if (latestReading.getTimestamp() != null) {
                nested.put("timestamp", latestReading.getTimestamp().toString());
            }
            payload.put("latest_reading", nested);
        }

        client.publish(topics.deviceStatus(deviceId), payload, retained(MqttTopics.DEVICE_STATUS));
        log.debug("Published device status for {} (connected: {})", deviceId, status.isConnected());
    }

    public void publishVehicleSummary(String vehicleId, Map<String, ?> summary) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("vehicle_id", vehicleId);
        payload.put("timestamp", now());
        payload.putAll(summary);
        client.publish(topics.vehicleSummary(vehicleId), payload, retained(MqttTopics.VEHICLE_SUMMARY));
        log.debug("Published vehicle summary for {}", vehicleId);
    }

    public void publishSystemStatus(Map<String, ?> status) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("timestamp", now());
        payload.putAll(status);
        client.publish(topics.systemStatus(), payload, retained(MqttTopics.SYSTEM_STATUS));
        log.debug("Published system status");
    }

    public void publishDeviceDiscovered(String macAddress, String deviceType, String name, Integer rssi,
                                        Map<String, ?> advertisementData) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("device_id", macAddress);
        payload.put("device_type", deviceType != null ? deviceType : "unknown");
        payload.put("name", name != null ? name : "Device_" + macAddress);
        payload.put("rssi", rssi);
        payload.put("timestamp", now());
        payload.put("advertisement_data", advertisementData != null ? advertisementData : Map.of());
        client.publish(topics.discoveryFound(), payload, retained(MqttTopics.DISCOVERY_FOUND));
        log.debug("Published device discovery for {} ({})", macAddress, deviceType);
    }

    private Map<String, Object> readingFields(BatteryReading reading, String extraKey) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("voltage", reading.getVoltage());
        fields.put("current", reading.getCurrent());
        fields.put("temperature", reading.getTemperature());
        fields.put("state_of_charge", reading.getStateOfCharge());
        putIfPresent(fields, "capacity", reading.getCapacity());
        putIfPresent(fields, "cycles", reading.getCycles());
        if (reading.getExtra() != null && !reading.getExtra().isEmpty()) {
            fields.put(extraKey, reading.getExtra());
        }
        putIfPresent(fields, "power", reading.power());
        return fields;
    }

    private boolean retained(String topicType) {
        return topics.topicInfo(topicType).map(MqttTopics.TopicInfo::retain).orElse(false);
    }

    private String now() {
        return Instant.now(clock).toString();
    }

    private static void putIfPresent(Map<String, Object> map, String key, Object value) {
        if (value != null) {
            map.put(key, value);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
