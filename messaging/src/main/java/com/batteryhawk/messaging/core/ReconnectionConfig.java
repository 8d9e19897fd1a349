/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.batteryhawk.messaging.core;

import com.batteryhawk.common.exception.ConfigurationException;

import java.time.Duration;

/**
 * Reconnection, health-check and outbound-queue policy of the resilient client.
 *
 * @param maxRetries               retries after the first connect attempt (total attempts = maxRetries + 1)
 * @param initialRetryDelay        backoff delay before the first retry
 * @param maxRetryDelay            ceiling of the exponential backoff, before jitter
 * @param backoffMultiplier        growth factor per attempt
 * @param jitterFactor             upper bound of the random extra delay, as a fraction of the backoff
 * @param connectionTimeout        bound on a single transport connect
 * @param healthCheckInterval      period of the health-check loop
 * @param messageProcessorInterval period of the queue-flush loop
 * @param messageQueueSize         capacity of the outbound queue
 * @param messageRetryLimit        delivery retries a queued message gets before it is dropped
 * @param overflowPolicy           what a full queue does with a new message
 */
public record ReconnectionConfig(
        int maxRetries,
        Duration initialRetryDelay,
        Duration maxRetryDelay,
        double backoffMultiplier,
        double jitterFactor,
        Duration connectionTimeout,
        Duration healthCheckInterval,
        Duration messageProcessorInterval,
        int messageQueueSize,
        int messageRetryLimit,
        OverflowPolicy overflowPolicy) {

    /** Behaviour of {@link MessageQueue} when a message arrives at capacity. */
    public enum OverflowPolicy {
        /** Drop the oldest queued message to make room. */
        EVICT_OLDEST,
        /** Refuse the new message with a {@link com.batteryhawk.common.exception.QueueFullException}. */
        REJECT
    }

    public ReconnectionConfig {
        requireNonNegative("initial_retry_delay", initialRetryDelay);
        requireNonNegative("max_retry_delay", maxRetryDelay);
        requireNonNegative("connection_timeout", connectionTimeout);
        requireNonNegative("health_check_interval", healthCheckInterval);
        requireNonNegative("message_processor_interval", messageProcessorInterval);
        if (maxRetryDelay.compareTo(initialRetryDelay) < 0) {
            throw new ConfigurationException("max_retry_delay (" + maxRetryDelay
                    + ") must not be shorter than initial_retry_delay (" + initialRetryDelay + ")");
        }
        if (maxRetries < 0) throw new ConfigurationException("max_retries must be >= 0, got " + maxRetries);
        if (backoffMultiplier < 1.0) {
            throw new ConfigurationException("backoff_multiplier must be >= 1.0, got " + backoffMultiplier);
        }
        if (jitterFactor < 0.0) throw new ConfigurationException("jitter_factor must be >= 0, got " + jitterFactor);
        if (messageQueueSize < 1) {
            throw new ConfigurationException("message_queue_size must be >= 1, got " + messageQueueSize);
        }
        if (messageRetryLimit < 0) {
            throw new ConfigurationException("message_retry_limit must be >= 0, got " + messageRetryLimit);
        }
        if (overflowPolicy == null) overflowPolicy = OverflowPolicy.EVICT_OLDEST;
    }

    public static ReconnectionConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .maxRetries(maxRetries)
                .initialRetryDelay(initialRetryDelay)
                .maxRetryDelay(maxRetryDelay)
                .backoffMultiplier(backoffMultiplier)
                .jitterFactor(jitterFactor)
                .connectionTimeout(connectionTimeout)
                .healthCheckInterval(healthCheckInterval)
                .messageProcessorInterval(messageProcessorInterval)
                .messageQueueSize(messageQueueSize)
                .messageRetryLimit(messageRetryLimit)
                .overflowPolicy(overflowPolicy);
    }

    private static void requireNonNegative(String name, Duration value) {
        if (value == null || value.isNegative()) {
            throw new ConfigurationException(name + " must be a non-negative duration, got " + value);
        }
    }

    public static final class Builder {
        private int maxRetries = 10;
        private Duration initialRetryDelay = Duration.ofSeconds(1);
        private Duration maxRetryDelay = Duration.ofMinutes(5);
        private double backoffMultiplier = 2.0;
        private double jitterFactor = 0.1;
        private Duration connectionTimeout = Duration.ofSeconds(30);
        private Duration healthCheckInterval = Duration.ofSeconds(60);
        private Duration messageProcessorInterval = Duration.ofSeconds(5);
        private int messageQueueSize = 1000;
        private int messageRetryLimit = 3;
        private OverflowPolicy overflowPolicy = OverflowPolicy.EVICT_OLDEST;

        private Builder() {}

        public Builder maxRetries(int v) { this.maxRetries = v; return this; }
        public Builder initialRetryDelay(Duration v) { this.initialRetryDelay = v; return this; }
        public Builder maxRetryDelay(Duration v) { this.maxRetryDelay = v; return this; }
        public Builder backoffMultiplier(double v) { this.backoffMultiplier = v; return this; }
        public Builder jitterFactor(double v) { this.jitterFactor = v; return this; }
        public Builder connectionTimeout(Duration v) { this.connectionTimeout = v; return this; }
        public Builder healthCheckInterval(Duration v) { this.healthCheckInterval = v; return this; }
        public Builder messageProcessorInterval(Duration v) { this.messageProcessorInterval = v; return this; }
        public Builder messageQueueSize(int v) { this.messageQueueSize = v; return this; }
        public Builder messageRetryLimit(int v) { this.messageRetryLimit = v; return this; }
        public Builder overflowPolicy(OverflowPolicy v) { this.overflowPolicy = v; return this; }

        public ReconnectionConfig build() {
            return new ReconnectionConfig(maxRetries, initialRetryDelay, maxRetryDelay, backoffMultiplier,
                    jitterFactor, connectionTimeout, healthCheckInterval, messageProcessorInterval,
                    messageQueueSize, messageRetryLimit, overflowPolicy);
        }
    }
}
