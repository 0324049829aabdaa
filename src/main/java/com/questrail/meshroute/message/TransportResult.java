package com.questrail.meshroute.message;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * TransportResult
 * =============================================================================
 * Outcome of a send attempt, either from one transport or from the connection
 * manager as a whole.
 *
 * <p>Exactly one {@link Outcome} holds:</p>
 * <ul>
 *   <li>{@link Outcome#DELIVERED}: a transport accepted the message. May carry
 *       a status code, a response payload, the transport id and the
 *       latency.</li>
 *   <li>{@link Outcome#QUEUED}: no transport delivered the message and it
 *       was accepted into the store-and-forward queue.</li>
 *   <li>{@link Outcome#FAILED}: carries an error text and, when known, the
 *       last transport tried.</li>
 * </ul>
 *
 * <p>{@link #isSuccess()} is true for both delivered and queued results.</p>
 */
public final class TransportResult {

    public enum Outcome { DELIVERED, QUEUED, FAILED }

    private final Outcome outcome;
    private final Integer statusCode;
    private final MessagePayload response;
    private final String transportUsed;
    private final Duration latency;
    private final String error;

    private TransportResult(Outcome outcome,
                            Integer statusCode,
                            MessagePayload response,
                            String transportUsed,
                            Duration latency,
                            String error) {
        this.outcome = outcome;
        this.statusCode = statusCode;
        this.response = response;
        this.transportUsed = transportUsed;
        this.latency = latency;
        this.error = error;
    }

    public static TransportResult delivered(String transportUsed) {
        return delivered(transportUsed, null, null, null);
    }

    public static TransportResult delivered(String transportUsed,
                                            Integer statusCode,
                                            MessagePayload response,
                                            Duration latency) {
        Objects.requireNonNull(transportUsed, "transportUsed");
        if (latency != null && latency.isNegative()) {
            throw new IllegalArgumentException("latency must be non-negative");
        }
        return new TransportResult(Outcome.DELIVERED, statusCode, response, transportUsed, latency, null);
    }

    public static TransportResult queued() {
        return new TransportResult(Outcome.QUEUED, null, null, null, null, null);
    }

    public static TransportResult failure(String error) {
        return failure(error, null, null);
    }

    public static TransportResult failure(String error, String lastTransport) {
        return failure(error, lastTransport, null);
    }

    public static TransportResult failure(String error, String lastTransport, Integer statusCode) {
        Objects.requireNonNull(error, "error");
        return new TransportResult(Outcome.FAILED, statusCode, null, lastTransport, null, error);
    }

    public Outcome outcome() {
        return outcome;
    }

    public boolean isSuccess() {
        return outcome != Outcome.FAILED;
    }

    public boolean isDelivered() {
        return outcome == Outcome.DELIVERED;
    }

    public boolean wasQueued() {
        return outcome == Outcome.QUEUED;
    }

    public boolean isFailure() {
        return outcome == Outcome.FAILED;
    }

    public Optional<Integer> statusCode() {
        return Optional.ofNullable(statusCode);
    }

    public Optional<MessagePayload> response() {
        return Optional.ofNullable(response);
    }

    /**
     * Delivering transport for a delivered result; last transport tried for a
     * failure, when known. Always empty for a queued result.
     */
    public Optional<String> transportUsed() {
        return Optional.ofNullable(transportUsed);
    }

    public Optional<Duration> latency() {
        return Optional.ofNullable(latency);
    }

    public Optional<String> error() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return switch (outcome) {
            case DELIVERED -> "TransportResult[DELIVERED via " + transportUsed
                    + (statusCode != null ? ", status=" + statusCode : "")
                    + (latency != null ? ", " + latency.toMillis() + "ms" : "") + "]";
            case QUEUED -> "TransportResult[QUEUED]";
            case FAILED -> "TransportResult[FAILED: " + error
                    + (transportUsed != null ? " (last=" + transportUsed + ")" : "") + "]";
        };
    }
}
