package com.questrail.meshroute.observability;

import java.time.Instant;

/**
 * Handling of a received message by the inbound dispatcher.
 *
 * @param deviceId origin device
 */
public record InboundEvent(
    Instant timestamp,
    Kind kind,
    String messageId,
    String deviceId,
    String detail
) {
    public enum Kind {
        RECEIVED,
        /** Request whose path lies outside the local API prefix. */
        IGNORED_NON_API,
        FORWARDED,
        FORWARD_FAILED,
        RESPONSE_SENT,
        /** No transport could reach the origin; responses are never queued. */
        RESPONSE_DROPPED,
        DM_DELIVERED,
        DM_REJECTED,
        /** Direct message without a signed event. */
        DM_DROPPED
    }
}
