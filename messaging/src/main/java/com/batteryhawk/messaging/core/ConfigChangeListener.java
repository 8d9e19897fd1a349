/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.batteryhawk.messaging.core;

import java.util.Map;

/**
 * Callback for configuration section changes.
 */
@FunctionalInterface
public interface ConfigChangeListener {

    /**
     * @param section name of the changed section, e.g. {@code system}
     * @param values  the section's new effective contents
     */
    void onConfigChanged(String section, Map<String, Object> values);
}
