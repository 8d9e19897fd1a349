/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.batteryhawk.messaging.core;

import com.batteryhawk.common.exception.BrokerConnectionException;
import com.batteryhawk.common.exception.BrokerTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.DoubleSupplier;

/**
 * Owns the broker session and the connection state machine.
 *
 * <p>State, the session handle and the statistics change together under the
 * {@link ConnectionStatistics} monitor. Listeners are notified after the monitor is released.
 * No lock is held while talking to the broker.</p>
 *
 * <p>Every connect and reconnection sequence is tied to the generation it started in. A
 * disconnect starts a new generation, so loops still running from before it end without
 * touching state or sessions.</p>
 *
 * <p>Connecting runs up to {@code maxRetries + 1} attempts with exponential backoff and
 * jitter between them. Every attempt is bounded by the connection timeout. Exhaustion moves
 * the state to {@link ConnectionState#FAILED}. A lost session is recovered by the background
 * reconnect task, which keeps the state at {@link ConnectionState#RECONNECTING} until it
 * succeeds or gives up.</p>
 */
public class ConnectionManager {

    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

    private final BrokerTransport transport;
    private final ShutdownSignal shutdown;
    private final BackgroundTaskSupervisor supervisor;
    private final DoubleSupplier jitterSource;
    private final ConnectionStatistics stats = new ConnectionStatistics();
    private final List<ConnectionStateListener> listeners = new CopyOnWriteArrayList<>();
    private final ExecutorService connectExecutor;

    private volatile MqttSettings settings;
    private volatile ReconnectionConfig reconnectionConfig;
    private volatile SessionCallbacks callbacks = NO_CALLBACKS;

    // guarded by stats
    private ConnectionState state = ConnectionState.DISCONNECTED;
    private TransportHandle handle;
    /** Bumped by every disconnect; an attempt loop from an older generation stops quietly. */
    private long generation;

    ConnectionManager(MqttSettings settings, BrokerTransport transport, ShutdownSignal shutdown,
                      BackgroundTaskSupervisor supervisor, DoubleSupplier jitterSource) {
        this.transport = transport;
        this.shutdown = shutdown;
        this.supervisor = supervisor;
        this.jitterSource = jitterSource;
        updateSettings(settings);
        AtomicInteger counter = new AtomicInteger();
        this.connectExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "mqtt-connect-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    void bind(SessionCallbacks callbacks) {
        this.callbacks = callbacks;
    }

    // ─── Lifecycle ──────────────────────────────────────────────────

    /**
     * Connect with retries. Returns once connected, when MQTT is disabled, or when a
     * connection is already established or in progress.
     *
     * @throws BrokerConnectionException once every attempt has failed; the state is then FAILED
     */
    public void connect() {
        MqttSettings current = settings;
        if (!current.isEnabled()) {
            log.info("MQTT is disabled, skipping connection");
            return;
        }
        ConnectionState previous;
        long gen;
        synchronized (stats) {
            previous = state;
            if (previous == ConnectionState.CONNECTED
                    || previous == ConnectionState.CONNECTING
                    || previous == ConnectionState.RECONNECTING) {
                log.warn("MQTT client already {}, ignoring connect request", previous.name().toLowerCase());
                return;
            }
            state = ConnectionState.CONNECTING;
            gen = generation;
        }
        notifyListeners(previous, ConnectionState.CONNECTING);
        log.info("Connecting to MQTT broker at {}", current.endpoint());
        try {
            if (!attemptLoop(ConnectionState.CONNECTING, gen)) {
                log.info("Connection attempt to {} cancelled", current.endpoint());
            }
        } catch (BrokerConnectionException e) {
            if (!transition(ConnectionState.CONNECTING, ConnectionState.FAILED, gen)) {
                log.info("Connection attempt to {} cancelled", current.endpoint());
                return;
            }
            log.error("Failed to connect to MQTT broker at {}: {}", current.endpoint(), e.getMessage());
            throw e;
        }
    }

    /**
     * Stop every background task, close the session and return to DISCONNECTED.
     * Safe to call repeatedly and from any state.
     */
    public void disconnect() {
        ConnectionState previous;
        synchronized (stats) {
            previous = state;
            if (previous == ConnectionState.DISCONNECTED && handle == null && !supervisor.hasActiveTasks()) {
                log.debug("MQTT client already disconnected");
                return;
            }
            shutdown.raise();
            generation++;
            state = ConnectionState.DISCONNECTED;
            if (previous == ConnectionState.CONNECTED) {
                stats.disconnected();
            }
        }
        log.info("Disconnecting from MQTT broker");
        if (previous != ConnectionState.DISCONNECTED) {
            notifyListeners(previous, ConnectionState.DISCONNECTED);
        }
        supervisor.cancelAll();
        closeHandle();
        shutdown.clear();
        log.info("Disconnected from MQTT broker");
    }

    /**
     * Start the background reconnection sequence. Only acts on a CONNECTED client that is
     * not shutting down; a second call while already reconnecting is ignored.
     */
    public void initiateReconnection() {
        initiateReconnection(null);
    }

    /**
     * Replace the session {@code failed}, or the current session when {@code failed} is null.
     * A failure reported for a session that has already been replaced is ignored.
     */
    void initiateReconnection(TransportHandle failed) {
        if (shutdown.isRaised()) {
            log.debug("Shutdown in progress, skipping reconnection");
            return;
        }
        long gen;
        synchronized (stats) {
            if (state == ConnectionState.RECONNECTING) {
                log.debug("Reconnection already in progress");
                return;
            }
            if (state != ConnectionState.CONNECTED) {
                log.debug("Reconnection not applicable in state {}", state);
                return;
            }
            if (failed != null && failed != handle) {
                log.debug("Ignoring failure of a replaced MQTT session");
                return;
            }
            state = ConnectionState.RECONNECTING;
            stats.reconnectionStarted();
            gen = generation;
        }
        notifyListeners(ConnectionState.CONNECTED, ConnectionState.RECONNECTING);
        log.info("Initiating MQTT reconnection");
        supervisor.restartReconnect(() -> reconnectSequence(gen));
    }

    /** Asynchronous form of {@link #initiateReconnection()}, safe to call from transport callbacks. */
    public void requestReconnection() {
        requestReconnection(null);
    }

    void requestReconnection(TransportHandle failed) {
        supervisor.spawn("reconnect-request", () -> initiateReconnection(failed));
    }

    /** Release the connect executor. The manager cannot connect afterwards. */
    void shutdownExecutor() {
        connectExecutor.shutdownNow();
    }

    // ─── Background task bodies ─────────────────────────────────────

    void checkHealth() {
        ConnectionState current;
        TransportHandle h;
        synchronized (stats) {
            current = state;
            h = handle;
        }
        if (current != ConnectionState.CONNECTED) {
            return;
        }
        if (h == null || !h.isUsable()) {
            log.warn("MQTT session is no longer usable, initiating reconnection");
            initiateReconnection(h);
            return;
        }
        log.debug("MQTT connection health check passed");
    }

    private void reconnectSequence(long gen) {
        ReconnectionConfig cfg = reconnectionConfig;
        RetryScheduler scheduler = new RetryScheduler(cfg, jitterSource);
        int rounds = Math.max(1, cfg.maxRetries());
        for (int round = 1; round <= rounds; round++) {
            if (!isCurrent(ConnectionState.RECONNECTING, gen) || Thread.currentThread().isInterrupted()) {
                log.info("Reconnection cancelled");
                return;
            }
            closeHandle();
            log.info("Reconnection round {}/{}", round, rounds);
            try {
                if (attemptLoop(ConnectionState.RECONNECTING, gen)) {
                    log.info("MQTT reconnection successful");
                }
                return;
            } catch (BrokerConnectionException e) {
                log.warn("Reconnection round {}/{} failed: {}", round, rounds, e.getMessage());
                if (round < rounds && pauseUnlessShutdown(scheduler.delay(round - 1))) {
                    return;
                }
            }
        }
        if (transition(ConnectionState.RECONNECTING, ConnectionState.FAILED, gen)) {
            log.error("MQTT reconnection failed after {} round(s)", rounds);
        }
    }

    // ─── Attempt loop ───────────────────────────────────────────────

    /**
     * Run connection attempts while the state stays at {@code active} within generation {@code gen}.
     *
     * @return {@code true} once connected, {@code false} if superseded by shutdown or disconnect
     * @throws BrokerConnectionException when all attempts failed
     */
    private boolean attemptLoop(ConnectionState active, long gen) {
        MqttSettings current = settings;
        ReconnectionConfig cfg = reconnectionConfig;
        RetryScheduler scheduler = new RetryScheduler(cfg, jitterSource);
        int attempts = cfg.maxRetries() + 1;
        BrokerConnectionException lastError = null;

        for (int attempt = 0; attempt < attempts; attempt++) {
            if (!isCurrent(active, gen)) {
                log.info("Connection attempts superseded, stopping");
                return false;
            }
            stats.connectionAttempted(Instant.now());
            TransportHandle opened;
            try {
                opened = openSession(current, cfg.connectionTimeout());
            } catch (BrokerConnectionException e) {
                if (!isCurrent(active, gen)) {
                    log.info("Connection attempt ended after disconnect: {}", e.getMessage());
                    return false;
                }
                lastError = e;
                stats.connectionFailed();
                if (attempt + 1 < attempts) {
                    Duration delay = scheduler.delay(attempt);
                    log.warn("MQTT connection attempt {}/{} failed: {}. Retrying in {} ms",
                            attempt + 1, attempts, e.getMessage(), delay.toMillis());
                    if (pauseUnlessShutdown(delay)) {
                        return abortOrThrow(current, active, gen);
                    }
                } else {
                    log.warn("MQTT connection attempt {}/{} failed: {}", attempt + 1, attempts, e.getMessage());
                }
                continue;
            }
            if (establish(active, gen, opened, current)) {
                return true;
            }
            log.info("Connection state changed while connecting, discarding new session");
            opened.close();
            return false;
        }
        if (!isCurrent(active, gen)) {
            return false;
        }
        throw new BrokerConnectionException("Failed to connect to MQTT broker after " + attempts
                + " attempt(s): " + (lastError != null ? lastError.getMessage() : "unknown error"),
                current.endpoint(), lastError);
    }

    /** Disconnect ends the loop quietly; a plain interrupt is reported as a failure. */
    private boolean abortOrThrow(MqttSettings current, ConnectionState active, long gen) {
        if (!isCurrent(active, gen)) {
            log.info("Disconnect requested during retry delay");
            return false;
        }
        throw new BrokerConnectionException("Interrupted while waiting to reconnect to " + current.endpoint(),
                current.endpoint(), null);
    }

    private TransportHandle openSession(MqttSettings current, Duration timeout) {
        AtomicBoolean abandoned = new AtomicBoolean();
        SessionListener listener = new SessionListener();
        Future<TransportHandle> future = connectExecutor.submit(() -> {
            TransportHandle opened = transport.connect(current, timeout, listener);
            listener.session = opened;
            if (abandoned.get()) {
                opened.close();
            }
            return opened;
        });
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            abandoned.set(true);
            future.cancel(true);
            throw new BrokerTimeoutException(current.endpoint(), timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof BrokerConnectionException bce) {
                throw bce;
            }
            throw new BrokerConnectionException("Failed to connect to MQTT broker at " + current.endpoint()
                    + ": " + cause.getMessage(), current.endpoint(), cause);
        } catch (InterruptedException e) {
            abandoned.set(true);
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new BrokerConnectionException("Interrupted while connecting to " + current.endpoint(),
                    current.endpoint(), e);
        }
    }

    private boolean establish(ConnectionState active, long gen, TransportHandle opened, MqttSettings current) {
        synchronized (stats) {
            if (state != active || generation != gen || shutdown.isRaised()) {
                return false;
            }
            state = ConnectionState.CONNECTED;
            handle = opened;
            stats.connectionEstablished();
        }
        notifyListeners(active, ConnectionState.CONNECTED);
        log.info("Successfully connected to MQTT broker at {}", current.endpoint());
        supervisor.startHealthCheck(() -> reconnectionConfig.healthCheckInterval(), this::checkHealth);
        supervisor.startMessageProcessor(() -> reconnectionConfig.messageProcessorInterval(),
                () -> callbacks.processQueue());
        supervisor.spawn("post-connect", () -> callbacks.onSessionEstablished());
        return true;
    }

    /** @return {@code true} if the wait was cut short by shutdown or interruption */
    private boolean pauseUnlessShutdown(Duration delay) {
        try {
            return shutdown.await(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    // ─── State helpers ──────────────────────────────────────────────

    private boolean transition(ConnectionState expected, ConnectionState next, long gen) {
        synchronized (stats) {
            if (state != expected || generation != gen) {
                return false;
            }
            if (!state.canTransitionTo(next)) {
                throw new IllegalStateException("Illegal connection state transition " + state + " -> " + next);
            }
            state = next;
        }
        notifyListeners(expected, next);
        return true;
    }

    private boolean isCurrent(ConnectionState active, long gen) {
        synchronized (stats) {
            return state == active && generation == gen && !shutdown.isRaised();
        }
    }

    private void closeHandle() {
        TransportHandle stale;
        synchronized (stats) {
            stale = handle;
            handle = null;
        }
        if (stale != null) {
            stale.close();
        }
    }

    private void notifyListeners(ConnectionState previous, ConnectionState current) {
        log.debug("Connection state {} -> {}", previous, current);
        for (ConnectionStateListener listener : listeners) {
            try {
                listener.onStateChanged(previous, current);
            } catch (RuntimeException e) {
                log.warn("Connection state listener failed", e);
            }
        }
    }

    // ─── Accessors ──────────────────────────────────────────────────

    public void addStateListener(ConnectionStateListener listener) {
        listeners.add(listener);
    }

    public void removeStateListener(ConnectionStateListener listener) {
        listeners.remove(listener);
    }

    public ConnectionState state() {
        synchronized (stats) {
            return state;
        }
    }

    public boolean isConnected() {
        return state() == ConnectionState.CONNECTED;
    }

    /** The live session handle, or {@code null} unless CONNECTED. */
    TransportHandle activeHandle() {
        synchronized (stats) {
            return state == ConnectionState.CONNECTED ? handle : null;
        }
    }

    public MqttSettings settings() {
        return settings;
    }

    public ReconnectionConfig reconnectionConfig() {
        return reconnectionConfig;
    }

    /** Swap in new settings; takes effect for the next attempt and the next loop tick. */
    void updateSettings(MqttSettings updated) {
        ReconnectionConfig cfg = updated.toReconnectionConfig();
        this.settings = updated;
        this.reconnectionConfig = cfg;
    }

    boolean isShuttingDown() {
        return shutdown.isRaised();
    }

    ConnectionStats snapshot(int queueSize) {
        synchronized (stats) {
            return stats.snapshot(state, queueSize);
        }
    }

    void recordPublished() {
        stats.messagePublished();
    }

    void recordQueued() {
        stats.messageQueued();
    }

    void recordFailed() {
        stats.messageFailed();
    }

    private static final SessionCallbacks NO_CALLBACKS = new SessionCallbacks() {
        @Override public void onSessionEstablished() {}
        @Override public void processQueue() {}
        @Override public void onInboundMessage(String topic, byte[] payload) {}
    };

    /** Callbacks of one session; a loss is reported against that session's handle. */
    private final class SessionListener implements TransportListener {
        private volatile TransportHandle session;

        @Override
        public void onMessage(String topic, byte[] payload) {
            callbacks.onInboundMessage(topic, payload);
        }

        @Override
        public void onConnectionLost(Throwable cause) {
            log.warn("MQTT connection lost: {}", cause != null ? cause.getMessage() : "unknown cause");
            TransportHandle lost = session;
            if (lost == null) {
                log.debug("Session was lost before it was established, leaving it to the attempt loop");
                return;
            }
            requestReconnection(lost);
        }
    }
}
