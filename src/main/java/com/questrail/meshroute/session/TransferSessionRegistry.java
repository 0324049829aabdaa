package com.questrail.meshroute.session;

import com.questrail.meshroute.config.TransferSessionConfig;
import com.questrail.meshroute.internal.time.MonotonicClock;
import com.questrail.meshroute.internal.time.MonotonicScheduler;
import com.questrail.meshroute.internal.time.WallClock;
import com.questrail.meshroute.observability.RoutingErrorEvent;
import com.questrail.meshroute.observability.RoutingObservabilitySink;
import com.questrail.meshroute.observability.SessionEvent;
import com.questrail.meshroute.transport.DeviceIds;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * TransferSessionRegistry
 * =============================================================================
 * Registry of active {@link TransferSession}s, keyed by normalized device id,
 * with at most one active session per device.
 *
 * <h2>Ownership</h2>
 * One instance is created by the composition root and handed to every
 * transport that wants to consult it. It is independent of the connection
 * manager.
 *
 * <h2>start()</h2>
 * <ul>
 *   <li>Idempotent: while a session for the device is active, {@code start}
 *       returns that same session. Concurrent first calls race on
 *       {@link ConcurrentMap#putIfAbsent}; the winner's session is returned
 *       to everybody.</li>
 *   <li>If the expected byte count reaches the configured threshold and the
 *       {@link UpgradeConnector} supports the device, an upgraded connection
 *       is attempted. Failure leaves a plain session. The upgrade is an
 *       optimization only.</li>
 *   <li>Expiry is armed for {@code maxDuration} and calls {@link #end}.</li>
 * </ul>
 */
public final class TransferSessionRegistry {

    private final TransferSessionConfig config;
    private final UpgradeConnector connector;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final WallClock wallClock;
    private final RoutingObservabilitySink sink;

    private final ConcurrentMap<String, TransferSession> sessions = new ConcurrentHashMap<>();

    public TransferSessionRegistry(TransferSessionConfig config,
                                   UpgradeConnector connector,
                                   MonotonicClock clock,
                                   MonotonicScheduler scheduler,
                                   WallClock wallClock,
                                   RoutingObservabilitySink sink) {
        this.config = Objects.requireNonNull(config, "config");
        this.connector = Objects.requireNonNull(connector, "connector");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public TransferSessionConfig config() {
        return config;
    }

    /**
     * Starts a session with the configured default lifetime.
     */
    public CompletableFuture<TransferSession> start(String deviceId, long expectedTotalBytes) {
        return start(deviceId, expectedTotalBytes, config.defaultMaxDuration());
    }

    /**
     * Starts (or reuses) the session for {@code deviceId}. The future completes
     * once the optional upgrade attempt has settled; it never completes
     * exceptionally because of a failed upgrade.
     */
    public CompletableFuture<TransferSession> start(String deviceId, long expectedTotalBytes, Duration maxDuration) {
        String key = DeviceIds.normalize(deviceId);
        Objects.requireNonNull(maxDuration, "maxDuration");
        if (expectedTotalBytes < 0) {
            throw new IllegalArgumentException("expectedTotalBytes must be non-negative");
        }
        if (maxDuration.isNegative() || maxDuration.isZero()) {
            throw new IllegalArgumentException("maxDuration must be positive");
        }

        TransferSession candidate = new TransferSession(this, key, expectedTotalBytes, maxDuration, wallClock.now());
        TransferSession existing = sessions.putIfAbsent(key, candidate);
        if (existing != null) {
            emit(SessionEvent.Kind.REUSED, key, null);
            return existing.ready();
        }

        emit(SessionEvent.Kind.STARTED, key, "expected=" + expectedTotalBytes + "B, maxDuration=" + maxDuration);
        candidate.armExpiry(scheduler.scheduleAfter(maxDuration, clock, () -> expire(candidate)));

        if (expectedTotalBytes >= config.upgradeThresholdBytes() && connector.supportsUpgrade(key)) {
            attemptUpgrade(candidate);
        } else {
            candidate.ready().complete(candidate);
        }
        return candidate.ready();
    }

    private void attemptUpgrade(TransferSession session) {
        CompletableFuture<UpgradedConnection> attempt;
        try {
            attempt = connector.connect(session.deviceId());
        } catch (RuntimeException e) {
            attempt = CompletableFuture.failedFuture(e);
        }

        attempt.whenComplete((connection, error) -> {
            if (error != null || connection == null) {
                emit(SessionEvent.Kind.UPGRADE_FAILED, session.deviceId(),
                        error != null ? String.valueOf(error.getMessage()) : "no connection returned");
            } else if (session.attachConnection(connection)) {
                emit(SessionEvent.Kind.UPGRADED, session.deviceId(), connection.address());
            } else {
                // Ended while connecting.
                release(connection);
            }
            session.ready().complete(session);
        });
    }

    /**
     * Ends the active session for {@code deviceId}.
     *
     * @return {@code true} if a session was ended
     */
    public boolean end(String deviceId) {
        TransferSession session = sessions.get(DeviceIds.normalize(deviceId));
        return session != null && end(session);
    }

    boolean end(TransferSession session) {
        return finish(session, SessionEvent.Kind.ENDED);
    }

    private void expire(TransferSession session) {
        finish(session, SessionEvent.Kind.EXPIRED);
    }

    private boolean finish(TransferSession session, SessionEvent.Kind kind) {
        if (!session.markEnded()) {
            return false;
        }
        sessions.remove(session.deviceId(), session);
        session.takeConnection().ifPresent(this::release);
        emit(kind, session.deviceId(), null);
        // A session ended before its upgrade settled still has to unblock start() callers.
        session.ready().complete(session);
        return true;
    }

    /**
     * Ends every active session, e.g. when an upgrade-capable transport is
     * disposed.
     */
    public void endAll() {
        List<TransferSession> snapshot = new ArrayList<>(sessions.values());
        for (TransferSession session : snapshot) {
            end(session);
        }
    }

    public Optional<TransferSession> session(String deviceId) {
        return Optional.ofNullable(sessions.get(DeviceIds.normalize(deviceId)));
    }

    public boolean hasActiveSession(String deviceId) {
        return sessions.containsKey(DeviceIds.normalize(deviceId));
    }

    public OptionalLong expectedBytes(String deviceId) {
        TransferSession s = sessions.get(DeviceIds.normalize(deviceId));
        return s == null ? OptionalLong.empty() : OptionalLong.of(s.expectedTotalBytes());
    }

    public boolean isUpgraded(String deviceId) {
        TransferSession s = sessions.get(DeviceIds.normalize(deviceId));
        return s != null && s.isUpgraded();
    }

    public Optional<String> connectionAddress(String deviceId) {
        return session(deviceId).flatMap(TransferSession::connection).map(UpgradedConnection::address);
    }

    /**
     * Whether a transport should route traffic for {@code deviceId} over the
     * session's upgraded connection.
     */
    public boolean shouldUseUpgraded(String deviceId) {
        return isUpgraded(deviceId);
    }

    public int activeCount() {
        return sessions.size();
    }

    private void release(UpgradedConnection connection) {
        try {
            connector.release(connection);
        } catch (RuntimeException e) {
            sink.onError(new RoutingErrorEvent(wallClock.now(),
                    "Failed to release upgraded connection to " + connection.deviceId(), e));
        }
    }

    private void emit(SessionEvent.Kind kind, String deviceId, String detail) {
        sink.onSession(new SessionEvent(wallClock.now(), kind, deviceId, detail));
    }
}
