package com.questrail.meshroute.routing;

/**
 * Weights of the three quality-score components. Values are normalized by
 * their sum, so {@code (3, 4, 3)} and {@code (0.3, 0.4, 0.3)} are the same
 * policy.
 */
public record QualityWeights(double latency, double success, double quality) {

    public QualityWeights {
        if (!Double.isFinite(latency) || !Double.isFinite(success) || !Double.isFinite(quality)) {
            throw new IllegalArgumentException("weights must be finite");
        }
        if (latency < 0 || success < 0 || quality < 0) {
            throw new IllegalArgumentException("weights must be non-negative");
        }
        double sum = latency + success + quality;
        if (sum <= 0) {
            throw new IllegalArgumentException("at least one weight must be positive");
        }
        latency /= sum;
        success /= sum;
        quality /= sum;
    }

    public static QualityWeights defaults() {
        return new QualityWeights(0.3, 0.4, 0.3);
    }
}
