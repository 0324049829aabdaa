package com.questrail.meshroute.transport;

import com.questrail.meshroute.internal.time.WallClock;
import com.questrail.meshroute.message.TransportMessage;
import com.questrail.meshroute.message.TransportResult;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * TransportSupport
 * =============================================================================
 * Shared state that concrete {@link Transport}s compose instead of
 * inheriting: the initialized flag, the metrics accumulator, the inbound
 * broadcast and the device registry.
 *
 * <pre>
 *   final class RelayTransport implements Transport {
 *       private final TransportSupport support = new TransportSupport("relay", clock);
 *
 *       public boolean isInitialized()      { return support.isInitialized(); }
 *       public TransportMetrics metrics()   { return support.metrics(); }
 *       public MessageStream inbound()      { return support.inbound(); }
 *       public DeviceRegistry devices()     { return support.devices(); }
 *       ...
 *   }
 * </pre>
 *
 * <p>Thread-safe. Metrics updates are atomic replacements of an immutable
 * {@link TransportMetrics} value.</p>
 */
public final class TransportSupport {

    private final String transportId;
    private final WallClock wallClock;
    private final AtomicBoolean initialized = new AtomicBoolean(false);
    private final AtomicReference<TransportMetrics> metrics = new AtomicReference<>(TransportMetrics.initial());
    private volatile MessageBroadcast inbound;
    private final DeviceRegistry devices;

    public TransportSupport(String transportId, WallClock wallClock) {
        this.transportId = Objects.requireNonNull(transportId, "transportId");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.inbound = new MessageBroadcast(transportId + "-inbound");
        this.devices = new DeviceRegistry(wallClock);
    }

    public String transportId() {
        return transportId;
    }

    public boolean isInitialized() {
        return initialized.get();
    }

    /**
     * Marks the transport initialized. After a {@link #dispose()} this also
     * opens a fresh inbound broadcast.
     *
     * @return {@code true} if the flag changed
     */
    public boolean markInitialized() {
        if (!initialized.compareAndSet(false, true)) {
            return false;
        }
        if (inbound.isClosed()) {
            inbound = new MessageBroadcast(transportId + "-inbound");
        }
        return true;
    }

    public TransportMetrics metrics() {
        return metrics.get();
    }

    /**
     * Folds a send outcome into the metrics and returns the result unchanged,
     * so transports can write {@code return support.recordResult(result);}.
     */
    public TransportResult recordResult(TransportResult result) {
        Objects.requireNonNull(result, "result");
        var now = wallClock.now();
        metrics.updateAndGet(m -> m.record(result, now));
        return result;
    }

    public MessageStream inbound() {
        return inbound;
    }

    /**
     * Publishes a received message, stamping it with this transport's id.
     */
    public void emitInbound(TransportMessage message) {
        Objects.requireNonNull(message, "message");
        inbound.publish(message.toBuilder().receivedVia(transportId).build());
    }

    public DeviceRegistry devices() {
        return devices;
    }

    /**
     * Closes the inbound broadcast, forgets all devices and clears the
     * initialized flag. Metrics are kept for post-mortem status output.
     */
    public void dispose() {
        initialized.set(false);
        inbound.close();
        devices.clear();
    }
}
