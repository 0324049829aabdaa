package com.questrail.meshroute.observability;

import java.time.Instant;

/**
 * Transfer session lifecycle.
 */
public record SessionEvent(
    Instant timestamp,
    Kind kind,
    String deviceId,
    String detail
) {
    public enum Kind {
        STARTED,
        REUSED,
        UPGRADED,
        UPGRADE_FAILED,
        ENDED,
        EXPIRED
    }
}
