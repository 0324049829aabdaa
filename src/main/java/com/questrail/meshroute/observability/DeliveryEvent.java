package com.questrail.meshroute.observability;

import java.time.Instant;

/**
 * Outbound routing step for one message.
 *
 * @param transportId transport involved; null for steps not tied to one
 * @param detail      human-readable context (error text, latency, ...); may be null
 */
public record DeliveryEvent(
    Instant timestamp,
    Kind kind,
    String messageId,
    String deviceId,
    String transportId,
    String detail
) {
    public enum Kind {
        /** A send started; carries the message kind as detail. */
        SENDING,
        /** A single transport is about to be tried. */
        ATTEMPT,
        DELIVERED,
        /** One transport failed or threw; the next one is tried. */
        TRANSPORT_FAILED,
        /** No transport was available or selected. */
        NO_ROUTE,
        ALL_FAILED,
        NOT_INITIALIZED
    }
}
