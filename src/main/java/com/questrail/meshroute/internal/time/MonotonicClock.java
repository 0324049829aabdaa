package com.questrail.meshroute.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for routing deadlines.
 *
 * <h2>Binding invariant</h2>
 * Probe timeouts, send deadlines, the queue tick and session expiry are all
 * computed against this clock. Wall-clock time is reserved for values that
 * are anchored to real instants (message creation, metrics timestamps).
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Only
     * meaningful for elapsed time computations.
     */
    long nowNanos();
}
