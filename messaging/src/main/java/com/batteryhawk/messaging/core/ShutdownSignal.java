/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.batteryhawk.messaging.core;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Resettable one-shot flag that background loops and backoff sleeps wait on, so that
 * {@code disconnect()} can cut any wait short.
 */
final class ShutdownSignal {

    private volatile CountDownLatch latch = new CountDownLatch(1);

    void raise() {
        latch.countDown();
    }

    boolean isRaised() {
        return latch.getCount() == 0;
    }

    /** Re-arm after a completed shutdown so that a later connect works again. */
    synchronized void clear() {
        if (isRaised()) {
            latch = new CountDownLatch(1);
        }
    }

    /**
     * Sleep for {@code timeout} unless the signal is raised first.
     *
     * @return {@code true} if the signal was raised
     * @throws InterruptedException if the waiting task is cancelled
     */
    boolean await(Duration timeout) throws InterruptedException {
        return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }
}
