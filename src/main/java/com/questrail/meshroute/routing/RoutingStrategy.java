package com.questrail.meshroute.routing;

import com.questrail.meshroute.message.MessageKind;
import com.questrail.meshroute.transport.Transport;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * RoutingStrategy
 * =============================================================================
 * Policy that orders and filters the transports worth trying for one message.
 *
 * <h2>Purity</h2>
 * A strategy is a function of (device id, message kind, candidate transports)
 * to an ordered transport list. It may read availability, metrics and probe
 * results but must never change transport state. The connection manager
 * tries the returned transports strictly in order.
 *
 * <p>Strategies may probe transports concurrently (reachability, quality);
 * the send attempts themselves are never parallel.</p>
 */
public interface RoutingStrategy
{
    /**
     * @param deviceId  target device
     * @param kind      message kind
     * @param available candidate transports in registry order
     * @return transports to try, most preferred first; never {@code null}
     */
    CompletableFuture<List<Transport>> selectTransports(String deviceId,
                                                        MessageKind kind,
                                                        List<? extends Transport> available);

    /** Short name for status output and logs. */
    default String name() {
        return getClass().getSimpleName();
    }

    /**
     * The candidates that are both available on this platform and
     * initialized, in their original order.
     */
    static List<Transport> usable(List<? extends Transport> transports) {
        return transports.stream()
                .filter(t -> t.isAvailable() && t.isInitialized())
                .collect(Collectors.toList());
    }
}
