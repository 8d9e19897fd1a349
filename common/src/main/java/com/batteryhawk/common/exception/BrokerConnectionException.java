/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.batteryhawk.common.exception;

/**
 * The broker session could not be established or was lost. Drives retry and backoff.
 */
public class BrokerConnectionException extends BatteryHawkException {
    private final String endpoint;

    public BrokerConnectionException(String message) {
        this(message, null, null);
    }

    public BrokerConnectionException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public BrokerConnectionException(String message, String endpoint, Throwable cause) {
        this("BH_BROKER_CONNECTION", message, endpoint, cause);
    }

    protected BrokerConnectionException(String errorCode, String message, String endpoint, Throwable cause) {
        super(errorCode, message, cause);
        this.endpoint = endpoint;
    }

    /** The {@code host:port} the failure refers to, or {@code null} when unknown. */
    public String getEndpoint() { return endpoint; }
}
