/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.batteryhawk.common.exception;

import java.time.Duration;

/**
 * A broker operation did not complete within its time bound. Retried like any connection failure.
 */
public class BrokerTimeoutException extends BrokerConnectionException {
    public BrokerTimeoutException(String endpoint, Duration timeout) {
        super("BH_BROKER_TIMEOUT",
              "Broker " + endpoint + " did not respond within " + timeout.toMillis() + " ms",
              endpoint, null);
    }
}
