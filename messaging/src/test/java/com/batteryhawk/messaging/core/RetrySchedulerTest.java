/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.batteryhawk.messaging.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RetryScheduler")
class RetrySchedulerTest {

    private final ReconnectionConfig config = ReconnectionConfig.builder()
            .initialRetryDelay(Duration.ofSeconds(1))
            .maxRetryDelay(Duration.ofSeconds(30))
            .backoffMultiplier(2.0)
            .jitterFactor(0.1)
            .build();

    @Test
    @DisplayName("without jitter the delay doubles per attempt until the cap")
    void exponentialGrowthWithoutJitter() {
        RetryScheduler scheduler = new RetryScheduler(config, () -> 0.0);

        assertThat(scheduler.delay(0)).isEqualTo(Duration.ofSeconds(1));
        assertThat(scheduler.delay(1)).isEqualTo(Duration.ofSeconds(2));
        assertThat(scheduler.delay(2)).isEqualTo(Duration.ofSeconds(4));
        assertThat(scheduler.delay(4)).isEqualTo(Duration.ofSeconds(16));
        assertThat(scheduler.delay(5)).isEqualTo(Duration.ofSeconds(30));
        assertThat(scheduler.delay(50)).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    @DisplayName("jitter adds at most jitterFactor of the base delay")
    void jitterUpperBound() {
        RetryScheduler scheduler = new RetryScheduler(config, () -> 0.999999);

        assertThat(scheduler.delay(0)).isEqualTo(Duration.ofMillis(1099));
        assertThat(scheduler.delay(10)).isEqualTo(Duration.ofMillis(32999));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 3, 7, 12, 40, 1000})
    @DisplayName("delay always stays within [100 ms, max * (1 + jitter)]")
    void delayWithinBounds(int attempt) {
        Random random = new Random(attempt);
        RetryScheduler scheduler = new RetryScheduler(config, random::nextDouble);
        long upper = (long) Math.floor(config.maxRetryDelay().toMillis() * (1 + config.jitterFactor()));

        for (int i = 0; i < 200; i++) {
            assertThat(scheduler.delay(attempt).toMillis())
                    .isGreaterThanOrEqualTo(RetryScheduler.MINIMUM_DELAY.toMillis())
                    .isLessThanOrEqualTo(upper);
        }
    }

    @Test
    @DisplayName("tiny initial delays are raised to the 100 ms floor")
    void minimumDelayFloor() {
        ReconnectionConfig fast = config.toBuilder().initialRetryDelay(Duration.ZERO).build();

        assertThat(new RetryScheduler(fast, () -> 0.5).delay(0)).isEqualTo(RetryScheduler.MINIMUM_DELAY);
    }

    @Test
    @DisplayName("out-of-range random draws are clamped")
    void drawIsClamped() {
        assertThat(RetryScheduler.computeDelay(config, 0, 7.0)).isEqualTo(Duration.ofMillis(1100));
        assertThat(RetryScheduler.computeDelay(config, 0, -3.0)).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    @DisplayName("fractional jittered delays are truncated so they never pass the jitter bound")
    void fractionalDelayTruncated() {
        ReconnectionConfig odd = config.toBuilder().initialRetryDelay(Duration.ofMillis(1005)).build();

        Duration delay = RetryScheduler.computeDelay(odd, 0, 1.0);

        assertThat(delay).isEqualTo(Duration.ofMillis(1105));
        assertThat((double) delay.toMillis()).isLessThanOrEqualTo(1005 * (1 + odd.jitterFactor()));
    }
}
