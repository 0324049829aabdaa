package com.questrail.meshroute.session;

import java.util.concurrent.CompletableFuture;

/**
 * Port to the transport able to open upgraded, persistent connections (for
 * example a Bluetooth Classic link next to a BLE one).
 *
 * <p>Implementations live with the concrete transports; the session registry
 * only decides <em>when</em> to ask.</p>
 */
public interface UpgradeConnector {

    /** Whether the device is known to accept an upgraded connection. */
    boolean supportsUpgrade(String deviceId);

    /**
     * Opens the upgraded connection. Completing exceptionally (or with
     * {@code null}) leaves the session non-upgraded.
     */
    CompletableFuture<UpgradedConnection> connect(String deviceId);

    /** Closes a connection previously returned by {@link #connect}. */
    void release(UpgradedConnection connection);

    /** Connector for deployments without any upgrade-capable transport. */
    static UpgradeConnector none() {
        return NoUpgrade.INSTANCE;
    }

    enum NoUpgrade implements UpgradeConnector {
        INSTANCE;

        @Override
        public boolean supportsUpgrade(String deviceId) {
            return false;
        }

        @Override
        public CompletableFuture<UpgradedConnection> connect(String deviceId) {
            return CompletableFuture.failedFuture(new UnsupportedOperationException("no upgrade transport"));
        }

        @Override
        public void release(UpgradedConnection connection) {
        }
    }
}
