package com.questrail.meshroute.routing;

import com.questrail.meshroute.message.MessageKind;
import com.questrail.meshroute.transport.Transport;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Caller-defined transport order with fallback.
 *
 * <p>Emits the usable transports named in {@code order}, in that order,
 * followed by every other usable transport in registry order. Ids that are
 * unknown or not usable are skipped.</p>
 */
public final class FailoverRoutingStrategy implements RoutingStrategy {

    private final List<String> order;

    public FailoverRoutingStrategy(List<String> order) {
        Objects.requireNonNull(order, "order");
        this.order = List.copyOf(order);
    }

    public List<String> order() {
        return order;
    }

    @Override
    public CompletableFuture<List<Transport>> selectTransports(String deviceId,
                                                               MessageKind kind,
                                                               List<? extends Transport> available) {
        List<Transport> usable = RoutingStrategy.usable(available);
        Map<String, Transport> byId = new HashMap<>();
        for (Transport t : usable) {
            byId.putIfAbsent(t.id(), t);
        }

        List<Transport> result = new ArrayList<>(usable.size());
        Set<String> emitted = new HashSet<>();
        for (String id : order) {
            Transport t = byId.get(id);
            if (t != null && emitted.add(id)) {
                result.add(t);
            }
        }
        for (Transport t : usable) {
            if (emitted.add(t.id())) {
                result.add(t);
            }
        }
        return CompletableFuture.completedFuture(result);
    }

    @Override
    public String name() {
        return "failover" + order;
    }
}
