package com.questrail.meshroute.observability;

import java.util.List;

/**
 * Point-in-time snapshot of a connection manager, for status output.
 */
public record ConnectionStatus(
    boolean initialized,
    String routingStrategy,
    List<TransportStatus> transports,
    int queueSize
) {
    public ConnectionStatus {
        transports = List.copyOf(transports);
    }

    public record TransportStatus(
        String id,
        String displayName,
        int priority,
        boolean available,
        boolean initialized,
        double successRate,
        double averageLatencyMs
    ) {
    }
}
