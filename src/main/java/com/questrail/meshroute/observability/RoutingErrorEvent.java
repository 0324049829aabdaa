package com.questrail.meshroute.observability;

import java.time.Instant;

/**
 * Error or anomaly inside the routing core. Never fatal: the core keeps
 * operating with a degraded transport set.
 */
public record RoutingErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
