package com.questrail.meshroute.transport;

import com.questrail.meshroute.message.TransportResult;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * TransportMetrics
 * -----------------------------------------------------------------------------
 * Immutable rolling performance record of one transport, derived purely from
 * send outcomes. Each recorded send yields a new value.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>{@code totalFailed <= totalSent}</li>
 *   <li>{@code successRate == (totalSent - totalFailed) / totalSent} whenever
 *       {@code totalSent > 0}; {@code 1.0} before the first send</li>
 *   <li>{@code averageLatencyMs} is the mean over the sends that reported a
 *       latency ({@code latencySamples} of them)</li>
 * </ul>
 */
public record TransportMetrics(
        double averageLatencyMs,
        double successRate,
        long totalSent,
        long totalFailed,
        long latencySamples,
        Instant lastSuccess,
        Instant lastFailure
) {
    public TransportMetrics {
        if (totalSent < 0 || totalFailed < 0 || latencySamples < 0) {
            throw new IllegalArgumentException("counts must be non-negative");
        }
        if (totalFailed > totalSent) {
            throw new IllegalArgumentException("totalFailed must not exceed totalSent");
        }
        if (successRate < 0.0 || successRate > 1.0) {
            throw new IllegalArgumentException("successRate must be within [0, 1]");
        }
        if (averageLatencyMs < 0.0) {
            throw new IllegalArgumentException("averageLatencyMs must be non-negative");
        }
    }

    private static final TransportMetrics INITIAL = new TransportMetrics(0.0, 1.0, 0, 0, 0, null, null);

    public static TransportMetrics initial() {
        return INITIAL;
    }

    public TransportMetrics recordSuccess(Duration latency, Instant at) {
        Objects.requireNonNull(at, "at");
        long sent = totalSent + 1;
        double avg = averageLatencyMs;
        long samples = latencySamples;
        if (latency != null) {
            samples++;
            avg = averageLatencyMs + (latency.toNanos() / 1_000_000.0 - averageLatencyMs) / samples;
        }
        return new TransportMetrics(avg, rate(sent, totalFailed), sent, totalFailed, samples, at, lastFailure);
    }

    public TransportMetrics recordFailure(Instant at) {
        Objects.requireNonNull(at, "at");
        long sent = totalSent + 1;
        long failed = totalFailed + 1;
        return new TransportMetrics(averageLatencyMs, rate(sent, failed), sent, failed, latencySamples,
                lastSuccess, at);
    }

    /**
     * Folds one transport outcome into the metrics. A queued result is not a
     * send attempt and leaves the metrics unchanged.
     */
    public TransportMetrics record(TransportResult result, Instant at) {
        Objects.requireNonNull(result, "result");
        if (result.isDelivered()) {
            return recordSuccess(result.latency().orElse(null), at);
        }
        if (result.isFailure()) {
            return recordFailure(at);
        }
        return this;
    }

    private static double rate(long sent, long failed) {
        return sent == 0 ? 1.0 : (double) (sent - failed) / sent;
    }
}
