package com.questrail.meshroute.transport;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Last-known whereabouts of a device as seen by one transport.
 *
 * @param callsign normalized device id (see {@link DeviceIds})
 * @param address  transport-specific address (IP:port, MAC, relay URL); may be null
 * @param metadata free-form attributes recorded by the transport
 * @param lastSeen when the transport last heard from the device
 */
public record DeviceEntry(
        String callsign,
        String address,
        Map<String, String> metadata,
        Instant lastSeen
) {
    public DeviceEntry {
        Objects.requireNonNull(callsign, "callsign");
        Objects.requireNonNull(lastSeen, "lastSeen");
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public Optional<String> addressOpt() {
        return Optional.ofNullable(address);
    }
}
