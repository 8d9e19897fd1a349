/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.batteryhawk.messaging.core;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An outbound message that could not be delivered immediately.
 *
 * <p>The payload is either UTF-8 text or a JSON-serializable map. The retry count is only
 * touched by the single active flush.</p>
 */
public final class QueuedMessage {

    private final String topic;
    private final Object payload;
    private final boolean retain;
    private final Instant enqueuedAt;
    private int retryCount;

    private QueuedMessage(String topic, Object payload, boolean retain, Instant enqueuedAt) {
        this.topic = Objects.requireNonNull(topic, "topic");
        this.payload = Objects.requireNonNull(payload, "payload");
        this.retain = retain;
        this.enqueuedAt = enqueuedAt;
    }

    public static QueuedMessage text(String topic, String payload, boolean retain) {
        return new QueuedMessage(topic, payload, retain, Instant.now());
    }

    /** The map is copied; later changes by the caller do not reach the queued message. */
    public static QueuedMessage json(String topic, Map<String, ?> payload, boolean retain) {
        return new QueuedMessage(topic, payload != null ? new LinkedHashMap<>(payload) : null, retain, Instant.now());
    }

    /** Relative topic; the namespace prefix is applied at delivery time. */
    public String topic() { return topic; }

    public Object payload() { return payload; }

    public boolean retain() { return retain; }

    public Instant enqueuedAt() { return enqueuedAt; }

    public int retryCount() { return retryCount; }

    /** Records one more failed delivery and returns the new count. */
    int incrementRetryCount() {
        return ++retryCount;
    }

    @Override
    public String toString() {
        return "QueuedMessage{topic='" + topic + "', retain=" + retain + ", retryCount=" + retryCount
                + ", enqueuedAt=" + enqueuedAt + "}";
    }
}
