/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.batteryhawk.messaging.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Registry of the client's background tasks. Every task runs on its own named daemon
 * thread and is tracked until it ends, so {@link #cancelAll()} can interrupt and join
 * all of them and none leaks past a disconnect.
 *
 * <p>Long-running tasks:</p>
 * <ul>
 *   <li>{@value #HEALTH_CHECK}: periodic liveness check of the transport session</li>
 *   <li>{@value #MESSAGE_PROCESSOR}: periodic flush of the outbound queue</li>
 *   <li>{@value #RECONNECT}: the bounded reconnection sequence</li>
 *   <li>{@value #INBOUND_DISPATCH}: hands inbound messages to subscription handlers</li>
 * </ul>
 * One-shot tasks (post-connect flush, requested reconnections) are tracked the same way
 * under unique names.
 *
 * <p>A task body that throws a runtime exception is logged and ends; it never takes the
 * supervisor down. Interruption is the cancellation signal.</p>
 */
public class BackgroundTaskSupervisor {

    private static final Logger log = LoggerFactory.getLogger(BackgroundTaskSupervisor.class);

    public static final String HEALTH_CHECK = "health-check";
    public static final String MESSAGE_PROCESSOR = "message-processor";
    public static final String RECONNECT = "reconnect";
    public static final String INBOUND_DISPATCH = "inbound-dispatch";

    private static final Duration MIN_LOOP_PERIOD = Duration.ofMillis(50);
    private static final Duration JOIN_TIMEOUT = Duration.ofSeconds(10);

    private final Map<String, Thread> tasks = new ConcurrentHashMap<>();
    private final AtomicLong oneShotSequence = new AtomicLong();
    private final ShutdownSignal shutdown;
    private final String threadPrefix;

    BackgroundTaskSupervisor(ShutdownSignal shutdown, String threadPrefix) {
        this.shutdown = shutdown;
        this.threadPrefix = threadPrefix;
    }

    public void startHealthCheck(Supplier<Duration> interval, Runnable check) {
        startIfAbsent(HEALTH_CHECK, () -> periodic(HEALTH_CHECK, interval, check));
    }

    public void startMessageProcessor(Supplier<Duration> interval, Runnable processor) {
        startIfAbsent(MESSAGE_PROCESSOR, () -> periodic(MESSAGE_PROCESSOR, interval, processor));
    }

    public void startInboundDispatch(Runnable dispatchLoop) {
        startIfAbsent(INBOUND_DISPATCH, dispatchLoop);
    }

    /** Cancel any running reconnection sequence, wait for it, then start {@code sequence}. */
    public void restartReconnect(Runnable sequence) {
        cancel(RECONNECT);
        startIfAbsent(RECONNECT, sequence);
    }

    /** Run {@code body} once on a tracked thread named after {@code purpose}. */
    public void spawn(String purpose, Runnable body) {
        String name = purpose + "-" + oneShotSequence.incrementAndGet();
        Thread thread = newThread(name, body);
        tasks.put(name, thread);
        thread.start();
    }

    /**
     * Start a named task unless a live one with that name exists.
     *
     * @return {@code true} if a new thread was started
     */
    public boolean startIfAbsent(String name, Runnable body) {
        Thread[] started = new Thread[1];
        tasks.compute(name, (key, existing) -> {
            if (existing != null && existing.isAlive()) {
                return existing;
            }
            started[0] = newThread(name, body);
            return started[0];
        });
        if (started[0] == null) {
            return false;
        }
        started[0].start();
        log.debug("Started background task '{}'", name);
        return true;
    }

    /** Interrupt the named task and wait for it to finish. A task cannot cancel itself this way. */
    public void cancel(String name) {
        Thread thread = tasks.get(name);
        if (thread == null || thread == Thread.currentThread()) {
            return;
        }
        thread.interrupt();
        join(name, thread);
    }

    /** Interrupt every tracked task, then join each one. */
    public void cancelAll() {
        List<Map.Entry<String, Thread>> running = new ArrayList<>(tasks.entrySet());
        for (Map.Entry<String, Thread> entry : running) {
            if (entry.getValue() != Thread.currentThread()) {
                entry.getValue().interrupt();
            }
        }
        for (Map.Entry<String, Thread> entry : running) {
            if (entry.getValue() != Thread.currentThread()) {
                join(entry.getKey(), entry.getValue());
            }
        }
        log.debug("Cancelled {} background task(s)", running.size());
    }

    public boolean isRunning(String name) {
        Thread thread = tasks.get(name);
        return thread != null && thread.isAlive();
    }

    public Set<String> activeTasks() {
        Set<String> names = ConcurrentHashMap.newKeySet();
        tasks.forEach((name, thread) -> {
            if (thread.isAlive()) names.add(name);
        });
        return names;
    }

    public boolean hasActiveTasks() {
        return !activeTasks().isEmpty();
    }

    private void periodic(String name, Supplier<Duration> interval, Runnable body) {
        while (!shutdown.isRaised()) {
            try {
                Duration period = interval.get();
                if (shutdown.await(period.compareTo(MIN_LOOP_PERIOD) < 0 ? MIN_LOOP_PERIOD : period)) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            try {
                body.run();
            } catch (RuntimeException e) {
                log.error("Error in background task '{}'", name, e);
            }
        }
        log.debug("Background task '{}' stopped", name);
    }

    private Thread newThread(String name, Runnable body) {
        Thread thread = new Thread(() -> {
            try {
                body.run();
            } catch (RuntimeException e) {
                log.error("Background task '{}' failed", name, e);
            } finally {
                tasks.remove(name, Thread.currentThread());
            }
        }, threadPrefix + name);
        thread.setDaemon(true);
        return thread;
    }

    private void join(String name, Thread thread) {
        try {
            thread.join(JOIN_TIMEOUT.toMillis());
            if (thread.isAlive()) {
                log.warn("Background task '{}' did not stop within {} ms", name, JOIN_TIMEOUT.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for background task '{}' to stop", name);
        }
    }
}
