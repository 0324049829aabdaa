package com.questrail.meshroute.session;

import java.util.Objects;

/**
 * Handle of a persistent connection opened for a transfer session.
 *
 * @param deviceId normalized device id the connection points at
 * @param address  transport-specific address (e.g. a Bluetooth Classic MAC)
 */
public record UpgradedConnection(String deviceId, String address) {
    public UpgradedConnection {
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(address, "address");
    }
}
