/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.batteryhawk.messaging.core;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Read-only snapshot of the client's connection state and counters, taken atomically.
 */
public record ConnectionStats(
        @JsonProperty("connection_state") ConnectionState connectionState,
        @JsonProperty("total_connections") long totalConnections,
        @JsonProperty("total_disconnections") long totalDisconnections,
        @JsonProperty("total_reconnections") long totalReconnections,
        @JsonProperty("messages_published") long messagesPublished,
        @JsonProperty("messages_queued") long messagesQueued,
        @JsonProperty("messages_failed") long messagesFailed,
        @JsonProperty("consecutive_failures") int consecutiveFailures,
        @JsonProperty("queue_size") int queueSize,
        @JsonProperty("last_connection_attempt") Instant lastConnectionAttempt) {
}
