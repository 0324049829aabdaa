package com.questrail.meshroute.transport;

import java.util.Locale;
import java.util.Objects;

/**
 * Canonical form of device identifiers (callsigns): trimmed and upper-cased.
 * Registries and the transfer session registry key on this form, so lookups
 * are case-insensitive.
 */
public final class DeviceIds {

    private DeviceIds() {
    }

    public static String normalize(String deviceId) {
        Objects.requireNonNull(deviceId, "deviceId");
        String trimmed = deviceId.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("deviceId must not be blank");
        }
        return trimmed.toUpperCase(Locale.ROOT);
    }
}
