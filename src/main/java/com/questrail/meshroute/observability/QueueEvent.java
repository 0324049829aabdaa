package com.questrail.meshroute.observability;

import java.time.Instant;

/**
 * Store-and-forward queue activity.
 *
 * @param messageId affected message; null for pass-level events
 * @param queueSize queue length after the event
 */
public record QueueEvent(
    Instant timestamp,
    Kind kind,
    String messageId,
    int queueSize
) {
    public enum Kind {
        ENQUEUED,
        /** Oldest entry evicted to admit a new one. */
        DROPPED_OVERFLOW,
        /** TTL elapsed; removed and never resent. */
        EXPIRED,
        RETRY_PASS_STARTED,
        REQUEUED,
        RETRY_DELIVERED
    }
}
