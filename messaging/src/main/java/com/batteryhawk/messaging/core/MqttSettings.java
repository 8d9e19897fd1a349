/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.batteryhawk.messaging.core;

import com.batteryhawk.common.exception.ConfigurationException;
import com.batteryhawk.common.util.JsonUtil;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Broker connection parameters, bound from the {@code mqtt} block of the {@code system}
 * configuration section. The same block also carries the reconnection policy keys,
 * see {@link #toReconnectionConfig()}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class MqttSettings {

    private static final int MAX_PORT_NUMBER = 65535;

    @JsonProperty("enabled")
    private boolean enabled = false;

    @JsonProperty("broker")
    private String broker = "localhost";

    @JsonProperty("port")
    private Integer port = 1883;

    @JsonProperty("username")
    private String username;

    @JsonProperty("password")
    private String password;

    @JsonProperty("client_id")
    private String clientId;

    @JsonProperty("topic_prefix")
    private String topicPrefix = "batteryhawk";

    @JsonProperty("qos")
    private int qos = 1;

    @JsonProperty("keepalive")
    private int keepalive = 60;

    @JsonProperty("tls")
    private boolean tls = false;

    @JsonProperty("ca_cert")
    private String caCert;

    @JsonProperty("cert_file")
    private String certFile;

    @JsonProperty("key_file")
    private String keyFile;

    // ─── Reconnection policy (seconds, as in the JSON files) ────────

    @JsonProperty("max_retries")
    private int maxRetries = 10;

    @JsonProperty("initial_retry_delay")
    private double initialRetryDelay = 1.0;

    @JsonProperty("max_retry_delay")
    private double maxRetryDelay = 300.0;

    @JsonProperty("backoff_multiplier")
    private double backoffMultiplier = 2.0;

    @JsonProperty("jitter_factor")
    private double jitterFactor = 0.1;

    @JsonProperty("connection_timeout")
    private double connectionTimeout = 30.0;

    @JsonProperty("health_check_interval")
    private double healthCheckInterval = 60.0;

    @JsonProperty("message_processor_interval")
    private double messageProcessorInterval = 5.0;

    @JsonProperty("message_queue_size")
    private int messageQueueSize = 1000;

    @JsonProperty("message_retry_limit")
    private int messageRetryLimit = 3;

    @JsonProperty("queue_overflow_policy")
    private String queueOverflowPolicy = "evict_oldest";

    @JsonProperty("status_interval")
    private int statusInterval = 300;

    public MqttSettings() {}

    /**
     * Bind and validate an {@code mqtt} block.
     *
     * @throws ConfigurationException if a value has the wrong type or fails validation
     */
    public static MqttSettings fromSection(Map<String, ?> mqttSection) {
        MqttSettings settings;
        try {
            settings = JsonUtil.convert(mqttSection != null ? mqttSection : Map.of(), MqttSettings.class);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Malformed MQTT configuration: " + e.getMessage(), e);
        }
        settings.validate();
        return settings;
    }

    /**
     * Fail fast on unusable parameters. A disabled configuration is not checked further.
     */
    public void validate() {
        if (!enabled) return;
        if (isBlank(broker)) throw new ConfigurationException("Missing required MQTT configuration field: broker");
        if (port == null) throw new ConfigurationException("Missing required MQTT configuration field: port");
        if (isBlank(topicPrefix)) {
            throw new ConfigurationException("Missing required MQTT configuration field: topic_prefix");
        }
        if (port < 1 || port > MAX_PORT_NUMBER) {
            throw new ConfigurationException("Invalid MQTT port: " + port + ". Must be between 1 and " + MAX_PORT_NUMBER);
        }
        if (qos < 0 || qos > 2) {
            throw new ConfigurationException("Invalid MQTT QoS level: " + qos + ". Must be 0, 1, or 2");
        }
        if (keepalive < 0) throw new ConfigurationException("Invalid MQTT keepalive: " + keepalive);
        toReconnectionConfig();
    }

    public ReconnectionConfig toReconnectionConfig() {
        ReconnectionConfig.OverflowPolicy policy;
        try {
            policy = ReconnectionConfig.OverflowPolicy.valueOf(
                    Objects.requireNonNullElse(queueOverflowPolicy, "evict_oldest").trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown queue_overflow_policy '" + queueOverflowPolicy
                    + "'. Use evict_oldest or reject.", e);
        }
        return ReconnectionConfig.builder()
                .maxRetries(maxRetries)
                .initialRetryDelay(seconds(initialRetryDelay))
                .maxRetryDelay(seconds(maxRetryDelay))
                .backoffMultiplier(backoffMultiplier)
                .jitterFactor(jitterFactor)
                .connectionTimeout(seconds(connectionTimeout))
                .healthCheckInterval(seconds(healthCheckInterval))
                .messageProcessorInterval(seconds(messageProcessorInterval))
                .messageQueueSize(messageQueueSize)
                .messageRetryLimit(messageRetryLimit)
                .overflowPolicy(policy)
                .build();
    }

    /**
     * Whether a change from {@code other} to this configuration requires a new broker session:
     * endpoint, credentials, TLS or topic namespace differ.
     */
    public boolean identityDiffers(MqttSettings other) {
        return other == null
                || !Objects.equals(broker, other.broker)
                || !Objects.equals(port, other.port)
                || !Objects.equals(username, other.username)
                || !Objects.equals(password, other.password)
                || tls != other.tls
                || !Objects.equals(caCert, other.caCert)
                || !Objects.equals(certFile, other.certFile)
                || !Objects.equals(keyFile, other.keyFile)
                || !Objects.equals(topicPrefix, other.topicPrefix);
    }

    /** {@code host:port}, used in logs and connection errors. */
    public String endpoint() {
        return broker + ":" + port;
    }

    /** Full broker topic for a topic name relative to the configured prefix. */
    public String qualify(String relativeTopic) {
        return topicPrefix + "/" + relativeTopic;
    }

    private static Duration seconds(double value) {
        if (Double.isNaN(value) || value < 0) {
            throw new ConfigurationException("Durations must be non-negative seconds, got " + value);
        }
        return Duration.ofMillis(Math.round(value * 1000.0));
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public String getBroker() { return broker; }
    public void setBroker(String broker) { this.broker = broker; }
    public Integer getPort() { return port; }
    public void setPort(Integer port) { this.port = port; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public String getClientId() { return clientId; }
    public void setClientId(String clientId) { this.clientId = clientId; }
    public String getTopicPrefix() { return topicPrefix; }
    public void setTopicPrefix(String topicPrefix) { this.topicPrefix = topicPrefix; }
    public int getQos() { return qos; }
    public void setQos(int qos) { this.qos = qos; }
    public int getKeepalive() { return keepalive; }
    public void setKeepalive(int keepalive) { this.keepalive = keepalive; }
    public boolean isTls() { return tls; }
    public void setTls(boolean tls) { this.tls = tls; }
    public String getCaCert() { return caCert; }
    public void setCaCert(String caCert) { this.caCert = caCert; }
    public String getCertFile() { return certFile; }
    public void setCertFile(String certFile) { this.certFile = certFile; }
    public String getKeyFile() { return keyFile; }
    public void setKeyFile(String keyFile) { this.keyFile = keyFile; }
    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    public double getInitialRetryDelay() { return initialRetryDelay; }
    public void setInitialRetryDelay(double initialRetryDelay) { this.initialRetryDelay = initialRetryDelay; }
    public double getMaxRetryDelay() { return maxRetryDelay; }
    public void setMaxRetryDelay(double maxRetryDelay) { this.maxRetryDelay = maxRetryDelay; }
    public double getBackoffMultiplier() { return backoffMultiplier; }
    public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }
    public double getJitterFactor() { return jitterFactor; }
    public void setJitterFactor(double jitterFactor) { this.jitterFactor = jitterFactor; }
    public double getConnectionTimeout() { return connectionTimeout; }
    public void setConnectionTimeout(double connectionTimeout) { this.connectionTimeout = connectionTimeout; }
    public double getHealthCheckInterval() { return healthCheckInterval; }
    public void setHealthCheckInterval(double healthCheckInterval) { this.healthCheckInterval = healthCheckInterval; }
    public double getMessageProcessorInterval() { return messageProcessorInterval; }
    public void setMessageProcessorInterval(double v) { this.messageProcessorInterval = v; }
    public int getMessageQueueSize() { return messageQueueSize; }
    public void setMessageQueueSize(int messageQueueSize) { this.messageQueueSize = messageQueueSize; }
    public int getMessageRetryLimit() { return messageRetryLimit; }
    public void setMessageRetryLimit(int messageRetryLimit) { this.messageRetryLimit = messageRetryLimit; }
    public String getQueueOverflowPolicy() { return queueOverflowPolicy; }
    public void setQueueOverflowPolicy(String queueOverflowPolicy) { this.queueOverflowPolicy = queueOverflowPolicy; }
    public int getStatusInterval() { return statusInterval; }
    public void setStatusInterval(int statusInterval) { this.statusInterval = statusInterval; }

    @Override
    public String toString() {
        return "MqttSettings{enabled=" + enabled + ", endpoint=" + endpoint() + ", username=" + username
                + ", tls=" + tls + ", topicPrefix=" + topicPrefix + ", qos=" + qos + "}";
    }
}
