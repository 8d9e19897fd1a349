/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.batteryhawk.common.exception;

/**
 * Base exception for all Battery Hawk errors. Every subtype carries a stable error code
 * that is safe to log and to surface in status payloads.
 */
public class BatteryHawkException extends RuntimeException {
    private final String errorCode;

    public BatteryHawkException(String message) {
        super(message);
        this.errorCode = "BH_GENERIC";
    }

    public BatteryHawkException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public BatteryHawkException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() { return errorCode; }
}
