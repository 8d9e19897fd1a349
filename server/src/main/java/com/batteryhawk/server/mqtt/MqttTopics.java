/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.batteryhawk.server.mqtt;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Topic layout of the telemetry namespace.
 *
 * <pre>
 *   {prefix}/device/{mac}/reading     readings, QoS 1, not retained
 *   {prefix}/device/{mac}/status      connection status, QoS 1, retained
 *   {prefix}/vehicle/{id}/summary     vehicle aggregate, QoS 1, retained
 *   {prefix}/system/status            service status, QoS 2, retained
 *   {prefix}/discovery/found          new device found, QoS 1, not retained
 * </pre>
 *
 * Builders return topics relative to the prefix, which is what the publishing client expects.
 * Wildcard and parsing helpers work on full topics.
 */
public class MqttTopics {

    public static final String DEVICE_READING = "device_reading";
    public static final String DEVICE_STATUS = "device_status";
    public static final String VEHICLE_SUMMARY = "vehicle_summary";
    public static final String SYSTEM_STATUS = "system_status";
    public static final String DISCOVERY_FOUND = "discovery_found";

    private static final Pattern MAC = Pattern.compile("^([0-9A-Fa-f]{2}[:-]){5}([0-9A-Fa-f]{2})$");
    private static final Pattern VEHICLE_ID = Pattern.compile("^[a-zA-Z0-9_-]+$");

    /** Pattern with placeholders, delivery metadata and an example. */
    public record TopicInfo(String pattern, String description, int qos, boolean retain, String example) {}

    /** Result of {@link #parseTopic(String)}. {@code deviceId} or {@code vehicleId} is null when not applicable. */
    public record ParsedTopic(String category, String topicType, String deviceId, String vehicleId,
                              String fullTopic, int qos, boolean retain) {}

    private final String prefix;
    private final Map<String, TopicInfo> patterns;

    public MqttTopics(String prefix) {
        this.prefix = prefix;
        Map<String, TopicInfo> p = new LinkedHashMap<>();
        p.put(DEVICE_READING, new TopicInfo(prefix + "/device/{mac}/reading",
                "Device reading updates with battery sensor data", 1, false,
                prefix + "/device/AA:BB:CC:DD:EE:FF/reading"));
        p.put(DEVICE_STATUS, new TopicInfo(prefix + "/device/{mac}/status",
                "Device connection and operational status", 1, true,
                prefix + "/device/AA:BB:CC:DD:EE:FF/status"));
        p.put(VEHICLE_SUMMARY, new TopicInfo(prefix + "/vehicle/{id}/summary",
                "Vehicle summary data with aggregated metrics", 1, true,
                prefix + "/vehicle/my_vehicle/summary"));
        p.put(SYSTEM_STATUS, new TopicInfo(prefix + "/system/status",
                "System status and health information", 2, true,
                prefix + "/system/status"));
        p.put(DISCOVERY_FOUND, new TopicInfo(prefix + "/discovery/found",
                "New device discovery notifications", 1, false,
                prefix + "/discovery/found"));
        this.patterns = Collections.unmodifiableMap(p);
    }

    public String prefix() { return prefix; }

    // ─── Relative topics for publishing ─────────────────────────────

    public String deviceReading(String mac) { return "device/" + mac + "/reading"; }

    public String deviceStatus(String mac) { return "device/" + mac + "/status"; }

    public String vehicleSummary(String vehicleId) { return "vehicle/" + vehicleId + "/summary"; }

    public String systemStatus() { return "system/status"; }

    public String discoveryFound() { return "discovery/found"; }

    // ─── Full wildcard topics for subscribing ───────────────────────

    public String deviceWildcard(String mac) { return prefix + "/device/" + mac + "/+"; }

    public String allDeviceReadings() { return prefix + "/device/+/reading"; }

    public String allDeviceStatus() { return prefix + "/device/+/status"; }

    public String allVehicleSummaries() { return prefix + "/vehicle/+/summary"; }

    public String allTopics() { return prefix + "/+"; }

    public String allTopicsRecursive() { return prefix + "/#"; }

    public List<String> subscriptionTopics() {
        return List.of(allDeviceReadings(), allDeviceStatus(), allVehicleSummaries(),
                prefix + "/" + systemStatus(), prefix + "/" + discoveryFound());
    }

    // ─── Parsing and validation ─────────────────────────────────────

    public Optional<ParsedTopic> parseTopic(String topic) {
        if (!isBatteryHawkTopic(topic)) {
            return Optional.empty();
        }
        String[] parts = topic.substring(prefix.length() + 1).split("/");
        String category = parts[0];
        switch (category) {
            case "device":
                if (parts.length < 3) return Optional.empty();
                return Optional.of(parsed(category, parts[2], parts[1], null, topic));
            case "vehicle":
                if (parts.length < 3) return Optional.empty();
                return Optional.of(parsed(category, parts[2], null, parts[1], topic));
            case "system":
            case "discovery":
                if (parts.length < 2) return Optional.empty();
                return Optional.of(parsed(category, parts[1], null, null, topic));
            default:
                return Optional.empty();
        }
    }

    private ParsedTopic parsed(String category, String type, String deviceId, String vehicleId, String topic) {
        TopicInfo info = patterns.get(category + "_" + type);
        int qos = info != null ? info.qos() : 1;
        boolean retain = info != null && info.retain();
        return new ParsedTopic(category, type, deviceId, vehicleId, topic, qos, retain);
    }

    public Optional<TopicInfo> topicInfo(String topicType) {
        return Optional.ofNullable(patterns.get(topicType));
    }

    public Map<String, TopicInfo> allPatterns() {
        return patterns;
    }

    public boolean isBatteryHawkTopic(String topic) {
        return topic != null && topic.startsWith(prefix + "/");
    }

    public static boolean isValidMacAddress(String mac) {
        return mac != null && MAC.matcher(mac).matches();
    }

    public static boolean isValidVehicleId(String vehicleId) {
        return vehicleId != null && VEHICLE_ID.matcher(vehicleId).matches();
    }
}
