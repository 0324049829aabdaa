package com.questrail.meshroute.transport;

import com.questrail.meshroute.internal.time.WallClock;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * DeviceRegistry
 * -----------------------------------------------------------------------------
 * Per-transport map from normalized callsign to {@link DeviceEntry}. A
 * transport records devices as it hears from them and consults the registry
 * at send or reachability time.
 *
 * <p>Keys are normalized with {@link DeviceIds#normalize(String)}, so
 * {@code "x1abcd"} and {@code " X1ABCD "} name the same device.</p>
 *
 * <p>Thread-safe.</p>
 */
public final class DeviceRegistry {

    /**
     * Notified when a transport learns that a device became reachable or
     * unreachable through it.
     */
    @FunctionalInterface
    public interface ReachabilityListener {
        void onReachabilityChanged(String callsign, boolean reachable);
    }

    private final WallClock wallClock;
    private final ConcurrentMap<String, DeviceEntry> devices = new ConcurrentHashMap<>();
    private final List<ReachabilityListener> listeners = new CopyOnWriteArrayList<>();

    public DeviceRegistry(WallClock wallClock) {
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    /**
     * Records (or refreshes) a device, stamping it with the current time.
     * A {@code null} address keeps the previously known address.
     */
    public DeviceEntry register(String callsign, String address, Map<String, String> metadata) {
        String key = DeviceIds.normalize(callsign);
        return devices.compute(key, (k, previous) -> {
            String effectiveAddress = address != null
                    ? address
                    : previous != null ? previous.address() : null;
            return new DeviceEntry(k, effectiveAddress, metadata, wallClock.now());
        });
    }

    public DeviceEntry register(String callsign, String address) {
        return register(callsign, address, Map.of());
    }

    public Optional<DeviceEntry> lookup(String callsign) {
        return Optional.ofNullable(devices.get(DeviceIds.normalize(callsign)));
    }

    public boolean contains(String callsign) {
        return devices.containsKey(DeviceIds.normalize(callsign));
    }

    public Optional<DeviceEntry> remove(String callsign) {
        return Optional.ofNullable(devices.remove(DeviceIds.normalize(callsign)));
    }

    /** Snapshot of all known devices. */
    public List<DeviceEntry> all() {
        return List.copyOf(devices.values());
    }

    public int size() {
        return devices.size();
    }

    public void clear() {
        devices.clear();
    }

    public void addReachabilityListener(ReachabilityListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeReachabilityListener(ReachabilityListener listener) {
        listeners.remove(listener);
    }

    /**
     * Reports a reachability change for a device. Unreachable devices stay in
     * the registry; only their listeners are told.
     */
    public void reachabilityChanged(String callsign, boolean reachable) {
        String key = DeviceIds.normalize(callsign);
        for (ReachabilityListener l : listeners) {
            l.onReachabilityChanged(key, reachable);
        }
    }
}
