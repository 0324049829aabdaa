package com.questrail.meshroute.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings for transfer sessions.
 *
 * @param upgradeThresholdBytes expected burst size at or above which a session
 *                              tries to open an upgraded connection
 * @param defaultMaxDuration    lifetime used when a caller does not pass one
 */
public record TransferSessionConfig(
        long upgradeThresholdBytes,
        Duration defaultMaxDuration
) {
    public TransferSessionConfig {
        Objects.requireNonNull(defaultMaxDuration, "defaultMaxDuration");
        if (upgradeThresholdBytes < 0) {
            throw new IllegalArgumentException("upgradeThresholdBytes must be non-negative");
        }
        if (defaultMaxDuration.isNegative() || defaultMaxDuration.isZero()) {
            throw new IllegalArgumentException("defaultMaxDuration must be positive");
        }
    }

    /**
     * 10 KiB threshold, 5 minute lifetime.
     */
    public static TransferSessionConfig defaults() {
        return new TransferSessionConfig(10 * 1024, Duration.ofMinutes(5));
    }
}
