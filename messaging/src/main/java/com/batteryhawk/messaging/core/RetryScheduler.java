/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.batteryhawk.messaging.core;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with uniform jitter.
 *
 * <pre>
 *   base  = min(initialRetryDelay * backoffMultiplier^attempt, maxRetryDelay)
 *   delay = max(base + U[0, jitterFactor * base), 100 ms)
 * </pre>
 *
 * The result depends only on the policy, the attempt index and the random draw.
 */
public final class RetryScheduler {

    /** No retry ever sleeps for less than this. */
    public static final Duration MINIMUM_DELAY = Duration.ofMillis(100);

    private final ReconnectionConfig config;
    private final DoubleSupplier uniform;

    public RetryScheduler(ReconnectionConfig config) {
        this(config, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param uniform source of draws in {@code [0, 1)}
     */
    public RetryScheduler(ReconnectionConfig config, DoubleSupplier uniform) {
        this.config = config;
        this.uniform = uniform;
    }

    /** Delay to wait after failed attempt number {@code attempt} (zero-based). */
    public Duration delay(int attempt) {
        return computeDelay(config, attempt, uniform.getAsDouble());
    }

    static Duration computeDelay(ReconnectionConfig config, int attempt, double draw) {
        double maxMillis = config.maxRetryDelay().toMillis();
        double base = config.initialRetryDelay().toMillis() * Math.pow(config.backoffMultiplier(), Math.max(0, attempt));
        if (Double.isNaN(base) || base > maxMillis) {
            base = maxMillis;
        }
        double u = Math.min(Math.max(draw, 0.0), 1.0);
        double jittered = base + base * config.jitterFactor() * u;
        return Duration.ofMillis(Math.max((long) Math.floor(jittered), MINIMUM_DELAY.toMillis()));
    }
}
