/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.batteryhawk.messaging.core;

import java.util.EnumSet;
import java.util.Set;

/**
 * Connection lifecycle states for the broker session.
 *
 * <pre>
 *   DISCONNECTED --connect--------------&gt; CONNECTING
 *   CONNECTING   --success--------------&gt; CONNECTED
 *   CONNECTING   --retries exhausted----&gt; FAILED
 *   CONNECTED    --transport/health-----&gt; RECONNECTING
 *   RECONNECTING --success--------------&gt; CONNECTED
 *   RECONNECTING --retries exhausted----&gt; FAILED
 *   FAILED       --connect--------------&gt; CONNECTING
 *   any          --disconnect-----------&gt; DISCONNECTED
 * </pre>
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    RECONNECTING,
    FAILED;

    /** Whether moving from this state to {@code next} is a legal transition. */
    public boolean canTransitionTo(ConnectionState next) {
        return next == DISCONNECTED || successors().contains(next);
    }

    private Set<ConnectionState> successors() {
        return switch (this) {
            case DISCONNECTED, FAILED -> EnumSet.of(CONNECTING);
            case CONNECTING -> EnumSet.of(CONNECTED, FAILED);
            case CONNECTED -> EnumSet.of(RECONNECTING);
            case RECONNECTING -> EnumSet.of(CONNECTED, FAILED);
        };
    }
}
