/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.batteryhawk.common.exception;

public class QueueFullException extends BatteryHawkException {
    public QueueFullException(String topic, int capacity) {
        super("BH_QUEUE_FULL",
              "Outbound queue is full (capacity " + capacity + "), rejected message for topic '" + topic + "'");
    }
}
