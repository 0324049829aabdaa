package com.questrail.meshroute.transport;

import com.questrail.meshroute.message.TransportMessage;
import com.questrail.meshroute.message.TransportResult;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Transport
 * =============================================================================
 * Contract every communication channel (local network, short-range radio,
 * relay station, ...) implements so the connection manager can route over
 * it without knowing its wire protocol.
 *
 * <h2>Identity and ordering</h2>
 * {@link #id()} is a stable key, unique within one connection manager.
 * {@link #priority()} orders transports for the priority strategy; lower is
 * preferred (see {@link TransportPriority}).
 *
 * <h2>Availability vs. initialization</h2>
 * {@link #isAvailable()} says whether the channel exists on this platform at
 * all. {@link #isInitialized()} says whether {@link #initialize()} has
 * succeeded. The router only uses transports for which both hold. A
 * transport whose initialization failed stays registered and keeps
 * reporting {@code isInitialized() == false}.
 *
 * <h2>Timing obligations</h2>
 * <ul>
 *   <li>{@link #canReach(String)} must be quick, ideally answered from a
 *       cache. Callers bound it with their own timeout.</li>
 *   <li>{@link #send(TransportMessage, Duration)} must respect the timeout and
 *       complete with a failure result, not an exception, when it
 *       expires.</li>
 * </ul>
 *
 * <h2>Shared plumbing</h2>
 * Implementations are expected to compose a {@link TransportSupport} for the
 * initialized flag, metrics, inbound broadcast and device registry rather
 * than reimplementing them.
 */
public interface Transport
{
    String id();

    /** Human-readable label for status output. Defaults to {@link #id()}. */
    default String displayName() {
        return id();
    }

    int priority();

    boolean isAvailable();

    boolean isInitialized();

    /** Idempotent. A failed initialization completes exceptionally. */
    CompletableFuture<Void> initialize();

    /** Idempotent. Releases channel resources and closes {@link #inbound()}. */
    CompletableFuture<Void> dispose();

    CompletableFuture<Boolean> canReach(String deviceId);

    /**
     * Link quality towards a device, 0 (unusable) to 100 (excellent). Only the
     * quality routing strategy reads this.
     */
    CompletableFuture<Integer> quality(String deviceId);

    CompletableFuture<TransportResult> send(TransportMessage message, Duration timeout);

    /** Fire-and-forget send; no result contract. */
    void sendAsync(TransportMessage message);

    /** Messages received on this channel. */
    MessageStream inbound();

    TransportMetrics metrics();

    DeviceRegistry devices();
}
