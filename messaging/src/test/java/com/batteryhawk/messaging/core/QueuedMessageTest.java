/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.batteryhawk.messaging.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("QueuedMessage")
class QueuedMessageTest {

    @Test
    @DisplayName("a JSON message keeps the payload it was created with")
    void jsonPayloadIsCopied() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("voltage", 12.6);

        QueuedMessage message = QueuedMessage.json("device/AA/reading", payload, false);
        payload.put("voltage", 0.0);
        payload.put("extra", "x");

        assertThat(message.payload()).isEqualTo(Map.of("voltage", 12.6));
        assertThat(PayloadCodec.encode(message)).asString().isEqualTo("{\"voltage\":12.6}");
    }

    @Test
    @DisplayName("retry count starts at zero and only grows")
    void retryCount() {
        QueuedMessage message = QueuedMessage.text("t", "p", true);

        assertThat(message.retryCount()).isZero();
        assertThat(message.incrementRetryCount()).isEqualTo(1);
        assertThat(message.incrementRetryCount()).isEqualTo(2);
        assertThat(message.retain()).isTrue();
    }
}
