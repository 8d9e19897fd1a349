/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.batteryhawk.common.exception;

/**
 * A message payload could not be converted to its wire format. Fails only that one message.
 */
public class PayloadSerializationException extends BatteryHawkException {
    public PayloadSerializationException(String topic, Throwable cause) {
        super("BH_PAYLOAD_SERIALIZATION",
              "Failed to serialize payload for topic '" + topic + "': " + cause.getMessage(), cause);
    }
}
