/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.batteryhawk.messaging.core;

import com.batteryhawk.common.exception.BrokerConnectionException;
import com.batteryhawk.common.exception.BrokerTimeoutException;
import com.batteryhawk.common.exception.PayloadSerializationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.IntStream;

import static com.batteryhawk.messaging.core.TestSupport.waitUntil;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ResilientMqttClient")
class ResilientMqttClientTest {

    private final FakeBrokerTransport transport = new FakeBrokerTransport();
    private final List<ConnectionState[]> transitions = new CopyOnWriteArrayList<>();
    private ResilientMqttClient client;

    private ResilientMqttClient newClient(MqttSettings settings) {
        client = new ResilientMqttClient(settings, transport, () -> 0.0);
        client.addStateListener((previous, current) -> transitions.add(new ConnectionState[]{previous, current}));
        return client;
    }

    private ResilientMqttClient connectedClient() {
        newClient(TestSupport.settings()).connect();
        awaitPostConnect();
        return client;
    }

    /** Let the one-shot post-connect flush finish so it cannot race the test's own flushes. */
    private void awaitPostConnect() {
        waitUntil(() -> client.supervisor().activeTasks().stream().noneMatch(n -> n.startsWith("post-connect")),
                "post-connect task to finish");
    }

    /** Run {@code body} on its own thread; a failure is kept in {@code error}. */
    private static Thread runAsync(String name, Runnable body, AtomicReference<Throwable> error) {
        Thread thread = new Thread(() -> {
            try {
                body.run();
            } catch (Throwable t) {
                error.set(t);
            }
        }, name);
        thread.start();
        return thread;
    }

    @AfterEach
    void tearDown() {
        if (client != null) {
            client.close();
        }
        assertThat(transitions).allSatisfy(t -> assertThat(t[0].canTransitionTo(t[1]))
                .as("transition %s -> %s", t[0], t[1]).isTrue());
    }

    @Nested
    @DisplayName("connect")
    class Connect {

        @Test
        @DisplayName("reaches CONNECTED and records the connection")
        void connects() {
            newClient(TestSupport.settings()).connect();

            ConnectionStats stats = client.getStats();
            assertThat(client.getConnectionState()).isEqualTo(ConnectionState.CONNECTED);
            assertThat(client.isConnected()).isTrue();
            assertThat(stats.totalConnections()).isEqualTo(1);
            assertThat(stats.consecutiveFailures()).isZero();
            assertThat(stats.lastConnectionAttempt()).isNotNull();
        }

        @Test
        @DisplayName("gives up after maxRetries + 1 attempts and moves to FAILED")
        void exhaustsRetries() {
            transport.reachable = false;
            newClient(TestSupport.settings());

            assertThatThrownBy(client::connect)
                    .isInstanceOf(BrokerConnectionException.class)
                    .hasMessageContaining("3 attempt(s)")
                    .hasFieldOrPropertyWithValue("endpoint", "broker.test:1883");
            assertThat(client.getConnectionState()).isEqualTo(ConnectionState.FAILED);
            assertThat(transport.connectCalls).hasValue(3);
            assertThat(client.getStats().consecutiveFailures()).isEqualTo(3);
        }

        @Test
        @DisplayName("a failed client connects again on an explicit connect")
        void connectAfterFailure() {
            transport.reachable = false;
            newClient(TestSupport.settings());
            assertThatThrownBy(client::connect).isInstanceOf(BrokerConnectionException.class);

            transport.reachable = true;
            client.connect();

            assertThat(client.getConnectionState()).isEqualTo(ConnectionState.CONNECTED);
            assertThat(client.getStats().consecutiveFailures()).isZero();
        }

        @Test
        @DisplayName("bounds every attempt by the connection timeout")
        void timesOut() {
            MqttSettings settings = TestSupport.settings();
            settings.setMaxRetries(0);
            settings.setConnectionTimeout(0.2);
            transport.connectDelay = Duration.ofSeconds(3);
            newClient(settings);

            long start = System.nanoTime();
            assertThatThrownBy(client::connect)
                    .isInstanceOf(BrokerConnectionException.class)
                    .hasCauseInstanceOf(BrokerTimeoutException.class);
            assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(2));
            assertThat(client.getConnectionState()).isEqualTo(ConnectionState.FAILED);
        }

        @Test
        @DisplayName("does nothing when MQTT is disabled")
        void disabled() {
            MqttSettings settings = TestSupport.settings();
            settings.setEnabled(false);
            newClient(settings).connect();

            assertThat(client.getConnectionState()).isEqualTo(ConnectionState.DISCONNECTED);
            assertThat(transport.connectCalls).hasValue(0);
        }

        @Test
        @DisplayName("a second connect while connected opens no new session")
        void connectWhileConnected() {
            connectedClient();
            client.connect();

            assertThat(transport.connectCalls).hasValue(1);
            assertThat(client.getStats().totalConnections()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("disconnect")
    class Disconnect {

        @Test
        @DisplayName("is idempotent and stops every background task")
        void idempotent() {
            connectedClient();

            client.disconnect();
            client.disconnect();

            assertThat(client.getConnectionState()).isEqualTo(ConnectionState.DISCONNECTED);
            assertThat(client.getStats().totalDisconnections()).isEqualTo(1);
            assertThat(client.supervisor().activeTasks()).isEmpty();
            assertThat(transport.current().closed).isTrue();
        }

        @Test
        @DisplayName("is harmless on a client that never connected")
        void neverConnected() {
            newClient(TestSupport.settings());

            assertThatCode(client::disconnect).doesNotThrowAnyException();
            assertThat(client.getStats().totalDisconnections()).isZero();
        }

        @Test
        @DisplayName("cancels a reconnection in progress for good")
        void cancelsReconnection() throws InterruptedException {
            connectedClient();
            transport.reachable = false;
            transport.dropConnection();
            waitUntil(() -> client.getConnectionState() == ConnectionState.RECONNECTING, "reconnecting");

            client.disconnect();

            assertThat(client.getConnectionState()).isEqualTo(ConnectionState.DISCONNECTED);
            assertThat(client.supervisor().activeTasks()).isEmpty();
            int calls = transport.connectCalls.get();
            Thread.sleep(400);
            assertThat(transport.connectCalls).hasValue(calls);
            assertThat(client.getConnectionState()).isEqualTo(ConnectionState.DISCONNECTED);
        }

        @Test
        @DisplayName("stops an initial connect that is still retrying")
        void cancelsInitialConnect() throws InterruptedException {
            transport.reachable = false;
            transport.connectDelay = Duration.ofMillis(300);
            newClient(TestSupport.settings());
            AtomicReference<Throwable> error = new AtomicReference<>();

            Thread connecting = runAsync("connect", client::connect, error);
            waitUntil(() -> transport.connectCalls.get() == 1, "first attempt to start");
            client.disconnect();
            connecting.join(5000);

            assertThat(connecting.isAlive()).isFalse();
            assertThat(error.get()).isNull();
            Thread.sleep(400);
            assertThat(transport.connectCalls).hasValue(1);
            assertThat(client.getConnectionState()).isEqualTo(ConnectionState.DISCONNECTED);
            assertThat(client.getStats().consecutiveFailures()).isZero();
        }

        @Test
        @DisplayName("a session opened by a connect from before the disconnect is discarded")
        void lateSessionFromCancelledConnectIsClosed() throws InterruptedException {
            transport.connectDelay = Duration.ofMillis(300);
            newClient(TestSupport.settings());
            AtomicReference<Throwable> error = new AtomicReference<>();

            Thread stale = runAsync("connect", client::connect, error);
            waitUntil(() -> transport.connectCalls.get() == 1, "first attempt to start");
            client.disconnect();
            transport.connectDelay = Duration.ZERO;
            client.connect();
            stale.join(5000);

            assertThat(stale.isAlive()).isFalse();
            assertThat(error.get()).isNull();
            assertThat(transport.handles).hasSize(2);
            assertThat(transport.handles).filteredOn(h -> !h.closed).singleElement()
                    .isSameAs(client.connectionManager().activeHandle());
            assertThat(client.getConnectionState()).isEqualTo(ConnectionState.CONNECTED);
            assertThat(client.getStats().totalConnections()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("publishing")
    class Publishing {

        @Test
        @DisplayName("delivers immediately under the topic prefix while connected")
        void immediate() {
            connectedClient();

            client.publish("device/AA/reading", Map.of("voltage", 12.6));
            client.publish("raw", "hello", true);

            assertThat(transport.published).extracting(FakeBrokerTransport.Published::topic)
                    .containsExactly("bh/device/AA/reading", "bh/raw");
            assertThat(transport.published.get(0).payload()).isEqualTo("{\"voltage\":12.6}");
            assertThat(transport.published.get(1).retain()).isTrue();
            assertThat(transport.published.get(1).qos()).isEqualTo(1);
            assertThat(client.getStats().messagesPublished()).isEqualTo(2);
        }

        @Test
        @DisplayName("queues while disconnected and delivers in FIFO order after connecting")
        void fifoUnderDisconnection() {
            newClient(TestSupport.settings());
            for (String p : List.of("m1", "m2", "m3")) {
                client.publish("t", p);
            }
            assertThat(client.getStats().queueSize()).isEqualTo(3);
            assertThat(client.getStats().messagesQueued()).isEqualTo(3);

            client.connect();

            waitUntil(() -> transport.published.size() == 3, "queued messages to be delivered");
            assertThat(transport.publishedPayloads()).containsExactly("m1", "m2", "m3");
            assertThat(client.getStats().queueSize()).isZero();
            assertThat(client.getStats().messagesPublished()).isEqualTo(3);
        }

        @Test
        @DisplayName("keeps only the newest messages when more arrive than the queue holds")
        void scenarioOverflow() {
            newClient(TestSupport.settings());
            IntStream.rangeClosed(1, 7).forEach(i -> client.publish("t", "m" + i));

            assertThat(client.queue().snapshot()).extracting(QueuedMessage::payload)
                    .containsExactly("m3", "m4", "m5", "m6", "m7");

            client.connect();

            waitUntil(() -> transport.published.size() == 5, "queued messages to be delivered");
            assertThat(transport.publishedPayloads()).containsExactly("m3", "m4", "m5", "m6", "m7");
        }

        @Test
        @DisplayName("drops a message exactly once after the retry limit")
        void scenarioRetryLimit() {
            connectedClient();
            transport.failPublishes = true;

            client.publish("t", "doomed");
            assertThat(client.getStats().queueSize()).isEqualTo(1);

            client.flush();
            client.flush();
            assertThat(client.queue().peek().retryCount()).isEqualTo(2);
            assertThat(client.getStats().messagesFailed()).isZero();

            client.flush();
            assertThat(client.getStats().queueSize()).isZero();
            assertThat(client.getStats().messagesFailed()).isEqualTo(1);

            client.flush();
            assertThat(client.getStats().messagesFailed()).isEqualTo(1);
            assertThat(transport.publishAttempts).hasValue(4);
            assertThat(transport.published).isEmpty();
            assertThat(client.getConnectionState()).isEqualTo(ConnectionState.CONNECTED);
            assertThat(client.getStats().totalReconnections()).isZero();
        }

        @Test
        @DisplayName("a message that eventually gets through is delivered once")
        void retryThenSuccess() {
            connectedClient();
            transport.failPublishes = true;
            client.publish("t", "late");
            client.flush();

            transport.failPublishes = false;
            assertThat(client.flush()).isEqualTo(1);

            assertThat(transport.publishedPayloads()).containsExactly("late");
            assertThat(client.getStats().messagesFailed()).isZero();
        }

        @Test
        @DisplayName("a flush stops at a head message that keeps failing")
        void flushStopsAtHead() {
            connectedClient();
            transport.failPublishes = true;
            for (String p : List.of("m1", "m2", "m3")) {
                client.publish("t", p);
            }
            transport.failPublishes = false;
            transport.rejectedPayloads.add("m1");
            int attempts = transport.publishAttempts.get();

            assertThat(client.flush()).isZero();

            assertThat(transport.publishAttempts).hasValue(attempts + 1);
            assertThat(client.queue().snapshot()).extracting(QueuedMessage::payload)
                    .containsExactly("m1", "m2", "m3");
            assertThat(client.queue().peek().retryCount()).isEqualTo(1);

            transport.rejectedPayloads.clear();
            assertThat(client.flush()).isEqualTo(3);
            assertThat(transport.publishedPayloads()).containsExactly("m1", "m2", "m3");
        }

        @Test
        @DisplayName("a queued message that no longer serializes is dropped and the flush goes on")
        void serializationFailureDuringFlush() {
            newClient(TestSupport.settings());
            Map<String, Object> inner = new HashMap<>();
            inner.put("ok", 1);
            client.publish("t", "m1");
            client.publish("t", Map.of("inner", inner));
            client.publish("t", "m3");
            inner.put("bad", new Object());

            client.connect();

            waitUntil(() -> transport.published.size() == 2, "remaining messages to be delivered");
            waitUntil(() -> client.getStats().queueSize() == 0, "queue to drain");
            assertThat(transport.publishedPayloads()).containsExactly("m1", "m3");
            assertThat(client.getStats().messagesFailed()).isEqualTo(1);
        }

        @Test
        @DisplayName("a message that cannot go back into a refilled queue counts as failed")
        void requeueIntoFullQueue() throws InterruptedException {
            connectedClient();
            transport.failPublishes = true;
            client.publish("t", "m1");
            CountDownLatch gate = new CountDownLatch(1);
            transport.publishGate.set(gate);
            AtomicReference<Throwable> error = new AtomicReference<>();

            Thread flushing = runAsync("flush", client::flush, error);
            waitUntil(() -> transport.publishAttempts.get() == 2, "flush to reach the broker");
            for (int i = 2; i <= 6; i++) {
                client.publish("t", "m" + i);
            }
            gate.countDown();
            flushing.join(5000);

            assertThat(error.get()).isNull();
            assertThat(client.getStats().messagesFailed()).isEqualTo(1);
            assertThat(client.queue().snapshot()).extracting(QueuedMessage::payload)
                    .containsExactly("m2", "m3", "m4", "m5", "m6");
        }

        @Test
        @DisplayName("rejects an unserializable payload without queueing it")
        void serializationError() {
            newClient(TestSupport.settings());

            assertThatThrownBy(() -> client.publish("t", Map.of("bad", new Object())))
                    .isInstanceOf(PayloadSerializationException.class)
                    .hasFieldOrPropertyWithValue("errorCode", "BH_PAYLOAD_SERIALIZATION");
            assertThat(client.getStats().queueSize()).isZero();
            assertThat(client.getStats().messagesQueued()).isZero();
        }

        @Test
        @DisplayName("the periodic processor drains the queue")
        void messageProcessor() {
            MqttSettings settings = TestSupport.settings();
            settings.setMessageProcessorInterval(0.1);
            newClient(settings).connect();
            awaitPostConnect();
            transport.failPublishes = true;
            client.publish("t", "later");

            transport.failPublishes = false;

            waitUntil(() -> transport.published.size() == 1, "processor to deliver the queued message");
            assertThat(client.getStats().queueSize()).isZero();
        }
    }

    @Nested
    @DisplayName("subscriptions")
    class Subscriptions {

        @Test
        @DisplayName("require a connection")
        void requireConnection() {
            newClient(TestSupport.settings());

            assertThatThrownBy(() -> client.subscribe("cmd", (t, p) -> { }))
                    .isInstanceOf(BrokerConnectionException.class);
        }

        @Test
        @DisplayName("dispatch inbound messages to the matching handler with the relative topic")
        void dispatch() {
            connectedClient();
            List<String> received = new CopyOnWriteArrayList<>();
            client.subscribe("commands/reset", (topic, payload) -> received.add(topic + "=" + payload));
            client.subscribe("device/+/cmd", (topic, payload) -> received.add(topic + "=" + payload));

            assertThat(transport.subscriptions).containsExactly("bh/commands/reset", "bh/device/+/cmd");

            transport.deliverInbound("bh/commands/reset", "now");
            transport.deliverInbound("bh/device/AA/cmd", "poll");

            waitUntil(() -> received.size() == 2, "handlers to run");
            assertThat(received).containsExactly("commands/reset=now", "device/AA/cmd=poll");
        }

        @Test
        @DisplayName("a failing handler does not stop dispatch")
        void handlerFailure() {
            connectedClient();
            List<String> received = new CopyOnWriteArrayList<>();
            client.subscribe("x", (topic, payload) -> {
                if (payload.equals("boom")) throw new IllegalStateException("boom");
                received.add(payload);
            });

            transport.deliverInbound("bh/x", "boom");
            transport.deliverInbound("bh/x", "ok");

            waitUntil(() -> received.contains("ok"), "second message to be handled");
        }

        @Test
        @DisplayName("unsubscribe stops delivery")
        void unsubscribe() {
            connectedClient();
            client.subscribe("x", (topic, payload) -> { });
            client.unsubscribe("x");

            assertThat(transport.subscriptions).isEmpty();
        }

        @Test
        @DisplayName("topic filters follow MQTT wildcard rules")
        void topicMatching() {
            assertThat(PublishPath.topicMatches("a/+/c", "a/b/c")).isTrue();
            assertThat(PublishPath.topicMatches("a/#", "a/b/c")).isTrue();
            assertThat(PublishPath.topicMatches("a/+", "a/b/c")).isFalse();
            assertThat(PublishPath.topicMatches("a/b", "a/b")).isTrue();
            assertThat(PublishPath.topicMatches("a/b/c", "a/b")).isFalse();
        }
    }

    @Nested
    @DisplayName("reconnection")
    class Reconnection {

        @Test
        @DisplayName("a lost session is re-established and subscriptions are restored")
        void recoversLostSession() {
            connectedClient();
            client.subscribe("cmd", (t, p) -> { });

            transport.dropConnection();

            waitUntil(() -> transport.handles.size() == 2
                    && client.getConnectionState() == ConnectionState.CONNECTED, "reconnection");
            waitUntil(() -> transport.subscriptions.size() == 2, "subscription to be restored");
            ConnectionStats stats = client.getStats();
            assertThat(stats.totalReconnections()).isEqualTo(1);
            assertThat(stats.totalConnections()).isEqualTo(2);
            assertThat(transport.handles.get(0).closed).isTrue();
        }

        @Test
        @DisplayName("messages published during an outage are delivered in order afterwards")
        void queuesDuringOutage() {
            connectedClient();
            transport.reachable = false;
            transport.dropConnection();
            waitUntil(() -> client.getConnectionState() == ConnectionState.RECONNECTING, "reconnecting");

            client.publish("t", "m1");
            client.publish("t", "m2");
            transport.reachable = true;

            waitUntil(() -> transport.published.size() == 2, "outage messages to be delivered");
            assertThat(transport.publishedPayloads()).containsExactly("m1", "m2");
        }

        @Test
        @DisplayName("ends in FAILED when the broker stays away")
        void exhaustion() {
            connectedClient();
            transport.reachable = false;

            transport.dropConnection();

            waitUntil(() -> client.getConnectionState() == ConnectionState.FAILED, Duration.ofSeconds(10), "FAILED");
            List<ConnectionState> path = new ArrayList<>();
            transitions.forEach(t -> path.add(t[1]));
            assertThat(path).containsSubsequence(ConnectionState.CONNECTED, ConnectionState.RECONNECTING,
                    ConnectionState.FAILED);
        }

        @Test
        @DisplayName("a late failure from a replaced session leaves the new session alone")
        void staleSessionFailureIgnored() throws InterruptedException {
            connectedClient();
            CountDownLatch gate = new CountDownLatch(1);
            transport.publishGate.set(gate);
            AtomicReference<Throwable> error = new AtomicReference<>();

            Thread publishing = runAsync("publish", () -> client.publish("t", "m1"), error);
            waitUntil(() -> transport.publishAttempts.get() == 1, "publish to reach the broker");
            transport.dropConnection();
            waitUntil(() -> transport.handles.size() == 2
                    && client.getConnectionState() == ConnectionState.CONNECTED, "reconnection");
            awaitPostConnect();
            gate.countDown();
            publishing.join(5000);
            Thread.sleep(300);

            assertThat(error.get()).isNull();
            assertThat(transport.handles).hasSize(2);
            assertThat(transport.handles.get(1).closed).isFalse();
            assertThat(client.getConnectionState()).isEqualTo(ConnectionState.CONNECTED);
            assertThat(client.getStats().totalReconnections()).isEqualTo(1);

            client.flush();
            waitUntil(() -> transport.published.size() == 1, "queued message to be delivered");
            assertThat(transport.publishedPayloads()).containsExactly("m1");
        }

        @Test
        @DisplayName("the health check notices a dead session")
        void healthCheck() {
            MqttSettings settings = TestSupport.settings();
            settings.setHealthCheckInterval(0.1);
            newClient(settings).connect();

            transport.current().usable = false;

            waitUntil(() -> transport.handles.size() == 2
                    && client.getConnectionState() == ConnectionState.CONNECTED, "health-check reconnection");
            assertThat(client.getStats().totalReconnections()).isEqualTo(1);
        }
    }
}
