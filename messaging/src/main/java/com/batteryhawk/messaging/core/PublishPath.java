/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.batteryhawk.messaging.core;

import com.batteryhawk.common.exception.BrokerConnectionException;
import com.batteryhawk.common.exception.PayloadSerializationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Outbound delivery and inbound dispatch.
 *
 * <p>A publish is delivered straight away while connected and falls back to the
 * {@link MessageQueue} otherwise. The queue is drained in FIFO order by {@link #flush()},
 * of which at most one runs at a time. A message whose delivery keeps failing is retried
 * up to {@code messageRetryLimit} times and then dropped.</p>
 *
 * <p>Subscriptions are remembered by their topic relative to the namespace prefix and are
 * re-issued on every new session. Inbound messages are handed to handlers on the
 * {@value BackgroundTaskSupervisor#INBOUND_DISPATCH} task, never on a transport thread.</p>
 */
public class PublishPath implements SessionCallbacks {

    private static final Logger log = LoggerFactory.getLogger(PublishPath.class);
    private static final long DISPATCH_POLL_MS = 500;

    private final ConnectionManager connection;
    private final MessageQueue queue;
    private final BackgroundTaskSupervisor supervisor;
    private final Map<String, MessageHandler> handlers = new ConcurrentHashMap<>();
    private final BlockingQueue<InboundMessage> inbound = new LinkedBlockingQueue<>();
    private final AtomicBoolean flushing = new AtomicBoolean(false);

    PublishPath(ConnectionManager connection, MessageQueue queue, BackgroundTaskSupervisor supervisor) {
        this.connection = connection;
        this.queue = queue;
        this.supervisor = supervisor;
    }

    // ─── Outbound ───────────────────────────────────────────────────

    /**
     * Deliver now if connected, otherwise queue.
     *
     * @throws PayloadSerializationException if the payload cannot be encoded; nothing is queued
     * @throws com.batteryhawk.common.exception.QueueFullException in reject mode when the queue is full
     */
    public void publish(QueuedMessage message) {
        byte[] body = PayloadCodec.encode(message);
        TransportHandle h = connection.activeHandle();
        if (h != null) {
            try {
                deliver(h, message, body);
                connection.recordPublished();
                log.debug("Published message to topic '{}'", message.topic());
                return;
            } catch (BrokerConnectionException e) {
                log.warn("Immediate publish to topic '{}' failed, queueing: {}", message.topic(), e.getMessage());
                onDeliveryFailure(h);
            }
        }
        enqueue(message);
    }

    private void enqueue(QueuedMessage message) {
        queue.enqueue(message);
        connection.recordQueued();
        log.debug("Queued message for topic '{}' (queue size {})", message.topic(), queue.size());
    }

    /**
     * Drain the queue while connected. Stops at the first connection failure so that
     * ordering is kept for the next attempt. A message is counted as failed when it runs out
     * of retries or when the queue filled up while it was in flight and it cannot go back.
     *
     * @return number of messages delivered by this call; 0 if another flush is running
     */
    public int flush() {
        if (!flushing.compareAndSet(false, true)) {
            log.debug("Flush already in progress");
            return 0;
        }
        int delivered = 0;
        int dropped = 0;
        try {
            int retryLimit = connection.reconnectionConfig().messageRetryLimit();
            while (true) {
                TransportHandle h = connection.activeHandle();
                if (h == null) {
                    break;
                }
                QueuedMessage message = queue.poll();
                if (message == null) {
                    break;
                }
                byte[] body;
                try {
                    body = PayloadCodec.encode(message);
                } catch (PayloadSerializationException e) {
                    log.error("Dropping queued message to topic '{}': {}", message.topic(), e.getMessage());
                    connection.recordFailed();
                    dropped++;
                    continue;
                }
                try {
                    deliver(h, message, body);
                    connection.recordPublished();
                    delivered++;
                } catch (BrokerConnectionException e) {
                    int retries = message.incrementRetryCount();
                    if (retries > retryLimit) {
                        log.error("Dropping message to topic '{}' after {} failed deliveries",
                                message.topic(), retries);
                        connection.recordFailed();
                        dropped++;
                    } else if (!queue.requeueAtHead(message)) {
                        log.warn("Queue refilled during flush, dropping oldest message to topic '{}'",
                                message.topic());
                        connection.recordFailed();
                        dropped++;
                    } else {
                        log.debug("Requeued message to topic '{}' (retry {}/{})", message.topic(), retries, retryLimit);
                    }
                    onDeliveryFailure(h);
                    break;
                }
            }
        } finally {
            flushing.set(false);
        }
        if (delivered > 0 || dropped > 0) {
            log.info("Processed {} queued message(s), {} dropped, {} remaining", delivered, dropped, queue.size());
        }
        return delivered;
    }

    private void deliver(TransportHandle h, QueuedMessage message, byte[] body) {
        MqttSettings s = connection.settings();
        try {
            h.publish(s.qualify(message.topic()), body, s.getQos(), message.retain());
        } catch (BrokerConnectionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new BrokerConnectionException("Publish to '" + message.topic() + "' failed: " + e.getMessage(), e);
        }
    }

    private void onDeliveryFailure(TransportHandle h) {
        if (!h.isUsable()) {
            connection.requestReconnection(h);
        }
    }

    // ─── Subscriptions ──────────────────────────────────────────────

    /**
     * Subscribe to a topic relative to the namespace prefix.
     *
     * @throws BrokerConnectionException if not connected or the broker refuses
     */
    public void subscribe(String topic, MessageHandler handler) {
        TransportHandle h = requireConnected("subscribe");
        MqttSettings s = connection.settings();
        String full = s.qualify(topic);
        h.subscribe(full, s.getQos());
        handlers.put(topic, handler);
        log.info("Subscribed to topic '{}' (QoS {})", full, s.getQos());
        supervisor.startInboundDispatch(this::dispatchLoop);
    }

    public void unsubscribe(String topic) {
        TransportHandle h = requireConnected("unsubscribe");
        String full = connection.settings().qualify(topic);
        h.unsubscribe(full);
        handlers.remove(topic);
        log.info("Unsubscribed from topic '{}'", full);
    }

    private TransportHandle requireConnected(String operation) {
        TransportHandle h = connection.activeHandle();
        if (h == null) {
            throw new BrokerConnectionException("Cannot " + operation + ": not connected to MQTT broker");
        }
        return h;
    }

    void restoreSubscriptions() {
        if (handlers.isEmpty()) {
            return;
        }
        TransportHandle h = connection.activeHandle();
        if (h == null) {
            return;
        }
        MqttSettings s = connection.settings();
        for (String topic : handlers.keySet()) {
            try {
                h.subscribe(s.qualify(topic), s.getQos());
            } catch (BrokerConnectionException e) {
                log.warn("Could not restore subscription to '{}': {}", topic, e.getMessage());
            }
        }
        log.info("Restored {} subscription(s)", handlers.size());
        supervisor.startInboundDispatch(this::dispatchLoop);
    }

    // ─── SessionCallbacks ───────────────────────────────────────────

    @Override
    public void onSessionEstablished() {
        restoreSubscriptions();
        flush();
    }

    @Override
    public void processQueue() {
        if (connection.isConnected() && !queue.isEmpty()) {
            flush();
        }
    }

    @Override
    public void onInboundMessage(String topic, byte[] payload) {
        inbound.offer(new InboundMessage(topic, new String(payload, StandardCharsets.UTF_8)));
    }

    // ─── Inbound dispatch ───────────────────────────────────────────

    private void dispatchLoop() {
        while (!Thread.currentThread().isInterrupted()) {
            InboundMessage message;
            try {
                message = inbound.poll(DISPATCH_POLL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (message != null) {
                dispatch(message);
            }
        }
        log.debug("Inbound dispatch stopped");
    }

    private void dispatch(InboundMessage message) {
        String relative = stripPrefix(message.topic());
        MessageHandler handler = handlers.get(relative);
        if (handler == null) {
            for (Map.Entry<String, MessageHandler> entry : handlers.entrySet()) {
                if (topicMatches(entry.getKey(), relative)) {
                    handler = entry.getValue();
                    break;
                }
            }
        }
        if (handler == null) {
            log.warn("No handler for inbound message on topic '{}'", message.topic());
            return;
        }
        try {
            handler.onMessage(relative, message.payload());
        } catch (RuntimeException e) {
            log.error("Message handler for topic '{}' failed", message.topic(), e);
        }
    }

    private String stripPrefix(String topic) {
        String prefix = connection.settings().getTopicPrefix() + "/";
        return topic.startsWith(prefix) ? topic.substring(prefix.length()) : topic;
    }

    /** MQTT filter matching with {@code +} (one level) and {@code #} (rest of the topic). */
    static boolean topicMatches(String filter, String topic) {
        String[] f = filter.split("/", -1);
        String[] t = topic.split("/", -1);
        for (int i = 0; i < f.length; i++) {
            if ("#".equals(f[i])) {
                return true;
            }
            if (i >= t.length) {
                return false;
            }
            if (!"+".equals(f[i]) && !f[i].equals(t[i])) {
                return false;
            }
        }
        return f.length == t.length;
    }

    private record InboundMessage(String topic, String payload) {}
}
