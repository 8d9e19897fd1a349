/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.batteryhawk.messaging.core;

import com.batteryhawk.common.exception.PayloadSerializationException;
import com.batteryhawk.common.util.JsonUtil;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.nio.charset.StandardCharsets;

/** Turns a queued payload into wire bytes: text as UTF-8, maps as compact JSON. */
final class PayloadCodec {

    private PayloadCodec() {}

    static byte[] encode(QueuedMessage message) {
        Object payload = message.payload();
        if (payload instanceof String text) {
            return text.getBytes(StandardCharsets.UTF_8);
        }
        try {
            return JsonUtil.toBytes(payload);
        } catch (JsonProcessingException e) {
            throw new PayloadSerializationException(message.topic(), e);
        }
    }
}
