/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.batteryhawk.messaging.core;

import java.util.Map;

/**
 * Read access to named configuration sections plus change notification.
 */
public interface ConfigSource {

    /** Current contents of {@code section}; an empty map when the section is unknown. */
    Map<String, Object> getConfig(String section);

    void registerListener(ConfigChangeListener listener);
}
