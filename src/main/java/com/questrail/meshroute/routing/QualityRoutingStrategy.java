package com.questrail.meshroute.routing;

import com.questrail.meshroute.internal.time.Timeouts;
import com.questrail.meshroute.message.MessageKind;
import com.questrail.meshroute.transport.Transport;
import com.questrail.meshroute.transport.TransportMetrics;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * QualityRoutingStrategy
 * =============================================================================
 * Orders usable transports by a weighted score, highest first:
 *
 * <pre>
 *   score = wLatency * (100 - min(avgLatencyMs / 10, 100))
 *         + wSuccess * (successRate * 100)
 *         + wQuality * quality(deviceId)
 * </pre>
 *
 * <p>Latency and success rate come from each transport's metrics. The
 * per-device quality is probed in parallel with a timeout; a timeout or
 * failure counts as {@value #DEFAULT_QUALITY}. Ties keep their input
 * order.</p>
 */
public final class QualityRoutingStrategy implements RoutingStrategy {

    public static final int DEFAULT_QUALITY = 50;
    public static final Duration DEFAULT_QUALITY_TIMEOUT = Duration.ofSeconds(1);

    private final Timeouts timeouts;
    private final QualityWeights weights;
    private final Duration qualityTimeout;

    public QualityRoutingStrategy(Timeouts timeouts) {
        this(timeouts, QualityWeights.defaults(), DEFAULT_QUALITY_TIMEOUT);
    }

    public QualityRoutingStrategy(Timeouts timeouts, QualityWeights weights, Duration qualityTimeout) {
        this.timeouts = Objects.requireNonNull(timeouts, "timeouts");
        this.weights = Objects.requireNonNull(weights, "weights");
        this.qualityTimeout = Objects.requireNonNull(qualityTimeout, "qualityTimeout");
    }

    public QualityWeights weights() {
        return weights;
    }

    @Override
    public CompletableFuture<List<Transport>> selectTransports(String deviceId,
                                                               MessageKind kind,
                                                               List<? extends Transport> available) {
        List<Transport> candidates = RoutingStrategy.usable(available);
        if (candidates.isEmpty()) {
            return CompletableFuture.completedFuture(candidates);
        }

        List<CompletableFuture<Integer>> probes = new ArrayList<>(candidates.size());
        for (Transport t : candidates) {
            probes.add(timeouts.orDefault(() -> t.quality(deviceId), qualityTimeout, DEFAULT_QUALITY));
        }

        return CompletableFuture.allOf(probes.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> {
                    Map<Transport, Double> scores = new IdentityHashMap<>();
                    for (int i = 0; i < candidates.size(); i++) {
                        Integer q = probes.get(i).join();
                        int quality = q == null ? DEFAULT_QUALITY : q;
                        scores.put(candidates.get(i), score(candidates.get(i).metrics(), quality));
                    }
                    List<Transport> ordered = new ArrayList<>(candidates);
                    ordered.sort(Comparator.comparingDouble((Transport t) -> scores.get(t)).reversed());
                    return ordered;
                });
    }

    /**
     * Weighted score of one transport; quality is clamped to 0..100.
     */
    public double score(TransportMetrics metrics, int quality) {
        double latencyScore = 100.0 - Math.min(metrics.averageLatencyMs() / 10.0, 100.0);
        double successScore = metrics.successRate() * 100.0;
        double qualityScore = Math.max(0, Math.min(100, quality));
        return weights.latency() * latencyScore
                + weights.success() * successScore
                + weights.quality() * qualityScore;
    }

    @Override
    public String name() {
        return "quality";
    }
}
