/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.batteryhawk.server.mqtt;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class MqttTopicsTest {

    private final MqttTopics topics = new MqttTopics("batteryhawk");

    @Test
    void buildsRelativeTopics() {
        assertThat(topics.deviceReading("AA:BB:CC:DD:EE:FF")).isEqualTo("device/AA:BB:CC:DD:EE:FF/reading");
        assertThat(topics.deviceStatus("AA:BB:CC:DD:EE:FF")).isEqualTo("device/AA:BB:CC:DD:EE:FF/status");
        assertThat(topics.vehicleSummary("van")).isEqualTo("vehicle/van/summary");
        assertThat(topics.systemStatus()).isEqualTo("system/status");
        assertThat(topics.discoveryFound()).isEqualTo("discovery/found");
    }

    @Test
    void buildsWildcards() {
        assertThat(topics.deviceWildcard("AA:BB:CC:DD:EE:FF")).isEqualTo("batteryhawk/device/AA:BB:CC:DD:EE:FF/+");
        assertThat(topics.allDeviceReadings()).isEqualTo("batteryhawk/device/+/reading");
        assertThat(topics.allTopicsRecursive()).isEqualTo("batteryhawk/#");
        assertThat(topics.subscriptionTopics()).containsExactly(
                "batteryhawk/device/+/reading",
                "batteryhawk/device/+/status",
                "batteryhawk/vehicle/+/summary",
                "batteryhawk/system/status",
                "batteryhawk/discovery/found");
    }

    @Test
    void parsesDeviceTopic() {
        MqttTopics.ParsedTopic parsed = topics.parseTopic("batteryhawk/device/AA:BB:CC:DD:EE:FF/status").orElseThrow();

        assertThat(parsed.category()).isEqualTo("device");
        assertThat(parsed.topicType()).isEqualTo("status");
        assertThat(parsed.deviceId()).isEqualTo("AA:BB:CC:DD:EE:FF");
        assertThat(parsed.vehicleId()).isNull();
        assertThat(parsed.retain()).isTrue();
    }

    @Test
    void parsesVehicleAndSystemTopics() {
        assertThat(topics.parseTopic("batteryhawk/vehicle/van/summary"))
                .hasValueSatisfying(p -> assertThat(p.vehicleId()).isEqualTo("van"));
        assertThat(topics.parseTopic("batteryhawk/system/status"))
                .hasValueSatisfying(p -> assertThat(p.qos()).isEqualTo(2));
    }

    @Test
    void rejectsForeignAndIncompleteTopics() {
        assertThat(topics.parseTopic("other/device/x/reading")).isEmpty();
        assertThat(topics.parseTopic("batteryhawk/device/x")).isEmpty();
        assertThat(topics.parseTopic("batteryhawk/unknown/x")).isEmpty();
        assertThat(topics.isBatteryHawkTopic("batteryhawkish/x")).isFalse();
    }

    @Test
    void deliveryMetadataPerTopicType() {
        assertThat(topics.topicInfo(MqttTopics.DEVICE_READING)).hasValueSatisfying(i -> assertThat(i.retain()).isFalse());
        assertThat(topics.topicInfo(MqttTopics.DEVICE_STATUS)).hasValueSatisfying(i -> assertThat(i.retain()).isTrue());
        assertThat(topics.topicInfo("nope")).isEmpty();
        assertThat(topics.allPatterns()).containsOnlyKeys(MqttTopics.DEVICE_READING, MqttTopics.DEVICE_STATUS,
                MqttTopics.VEHICLE_SUMMARY, MqttTopics.SYSTEM_STATUS, MqttTopics.DISCOVERY_FOUND);
    }

    @ParameterizedTest
    @ValueSource(strings = {"AA:BB:CC:DD:EE:FF", "aa-bb-cc-dd-ee-ff", "01:23:45:67:89:ab"})
    void validMacAddresses(String mac) {
        assertThat(MqttTopics.isValidMacAddress(mac)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "AA:BB:CC:DD:EE", "GG:BB:CC:DD:EE:FF", "AABBCCDDEEFF"})
    void invalidMacAddresses(String mac) {
        assertThat(MqttTopics.isValidMacAddress(mac)).isFalse();
    }

    @Test
    void vehicleIds() {
        assertThat(MqttTopics.isValidVehicleId("my_vehicle-2")).isTrue();
        assertThat(MqttTopics.isValidVehicleId("my vehicle")).isFalse();
        assertThat(MqttTopics.isValidVehicleId(null)).isFalse();
    }
}
