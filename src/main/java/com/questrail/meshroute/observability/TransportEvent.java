package com.questrail.meshroute.observability;

import java.time.Instant;

/**
 * Transport registry and lifecycle changes seen by the connection manager.
 *
 * @param transportId affected transport; for {@link Kind#STRATEGY_CHANGED}
 *                    this is null and {@code detail} names the strategy
 */
public record TransportEvent(
    Instant timestamp,
    Kind kind,
    String transportId,
    String detail
) {
    public enum Kind {
        REGISTERED,
        UNREGISTERED,
        INITIALIZED,
        INITIALIZATION_FAILED,
        DISPOSED,
        DISPOSAL_FAILED,
        STRATEGY_CHANGED,
        INBOUND_REBUILT
    }
}
