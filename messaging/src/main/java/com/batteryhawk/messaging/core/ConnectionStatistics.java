/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.batteryhawk.messaging.core;

import java.time.Instant;

/**
 * Mutable counters behind {@link ConnectionStats}. Every method runs under this object's
 * monitor, which {@link ConnectionManager} also holds while it changes the state, so that a
 * snapshot never mixes a new state with old counters.
 */
final class ConnectionStatistics {

    private long totalConnections;
    private long totalDisconnections;
    private long totalReconnections;
    private long messagesPublished;
    private long messagesQueued;
    private long messagesFailed;
    private int consecutiveFailures;
    private Instant lastConnectionAttempt;

    synchronized void connectionEstablished() {
        totalConnections++;
        consecutiveFailures = 0;
    }

    synchronized void connectionAttempted(Instant at) {
        lastConnectionAttempt = at;
    }

    synchronized void connectionFailed() {
        consecutiveFailures++;
    }

    synchronized void disconnected() {
        totalDisconnections++;
    }

    synchronized void reconnectionStarted() {
        totalReconnections++;
    }

    synchronized void messagePublished() {
        messagesPublished++;
    }

    synchronized void messageQueued() {
        messagesQueued++;
    }

    synchronized void messageFailed() {
        messagesFailed++;
    }

    synchronized int consecutiveFailures() {
        return consecutiveFailures;
    }

    synchronized ConnectionStats snapshot(ConnectionState state, int queueSize) {
        return new ConnectionStats(state, totalConnections, totalDisconnections, totalReconnections,
                messagesPublished, messagesQueued, messagesFailed, consecutiveFailures, queueSize,
                lastConnectionAttempt);
    }
}
