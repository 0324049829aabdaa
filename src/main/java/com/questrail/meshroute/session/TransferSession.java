package com.questrail.meshroute.session;

import com.questrail.meshroute.internal.time.Cancellable;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * TransferSession
 * =============================================================================
 * Short-lived declaration that a burst of traffic to one device is coming.
 * While it is active, transports may reuse its upgraded connection instead of
 * opening their own per request.
 *
 * <p>Created only by {@link TransferSessionRegistry#start}; ended by
 * {@link #end()} or by expiry after {@link #maxDuration()}, whichever comes
 * first. Ending releases the upgraded connection, if any.</p>
 */
public final class TransferSession {

    private final TransferSessionRegistry registry;
    private final String deviceId;
    private final long expectedTotalBytes;
    private final Duration maxDuration;
    private final Instant startedAt;
    private final CompletableFuture<TransferSession> ready = new CompletableFuture<>();

    private UpgradedConnection connection;
    private Cancellable expiry;
    private boolean ended;

    TransferSession(TransferSessionRegistry registry,
                    String deviceId,
                    long expectedTotalBytes,
                    Duration maxDuration,
                    Instant startedAt) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId");
        this.expectedTotalBytes = expectedTotalBytes;
        this.maxDuration = Objects.requireNonNull(maxDuration, "maxDuration");
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
    }

    /** Normalized device id. */
    public String deviceId() {
        return deviceId;
    }

    public long expectedTotalBytes() {
        return expectedTotalBytes;
    }

    public Duration maxDuration() {
        return maxDuration;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public synchronized boolean isUpgraded() {
        return connection != null;
    }

    public synchronized Optional<UpgradedConnection> connection() {
        return Optional.ofNullable(connection);
    }

    public synchronized boolean isActive() {
        return !ended;
    }

    /**
     * Ends the session. Idempotent.
     */
    public void end() {
        registry.end(this);
    }

    // -------------------------------------------------------------------------
    // Registry plumbing
    // -------------------------------------------------------------------------

    CompletableFuture<TransferSession> ready() {
        return ready;
    }

    synchronized void armExpiry(Cancellable expiry) {
        if (ended) {
            expiry.cancel();
        } else {
            this.expiry = expiry;
        }
    }

    /**
     * @return {@code false} if the session already ended; the caller then
     *         owns the connection and must release it
     */
    synchronized boolean attachConnection(UpgradedConnection connection) {
        if (ended) {
            return false;
        }
        this.connection = connection;
        return true;
    }

    /**
     * Marks the session ended. Exactly one caller sees {@code true}; only
     * that caller may then {@link #takeConnection() take the connection}.
     */
    synchronized boolean markEnded() {
        if (ended) {
            return false;
        }
        ended = true;
        if (expiry != null) {
            expiry.cancel();
            expiry = null;
        }
        return true;
    }

    /** Detaches the connection of an ended session for release. */
    synchronized Optional<UpgradedConnection> takeConnection() {
        UpgradedConnection released = connection;
        connection = null;
        return Optional.ofNullable(released);
    }

    @Override
    public String toString() {
        return "TransferSession[" + deviceId + ", expected=" + expectedTotalBytes
                + ", upgraded=" + isUpgraded() + ", active=" + isActive() + "]";
    }
}
