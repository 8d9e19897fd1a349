/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.batteryhawk.common.exception;

/**
 * Invalid or missing configuration. Never retried.
 */
public class ConfigurationException extends BatteryHawkException {
    public ConfigurationException(String message) {
        super("BH_CONFIG_INVALID", message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super("BH_CONFIG_INVALID", message, cause);
    }
}
