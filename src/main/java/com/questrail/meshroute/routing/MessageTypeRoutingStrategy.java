package com.questrail.meshroute.routing;

import com.questrail.meshroute.message.MessageKind;
import com.questrail.meshroute.transport.Transport;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Dispatch table from {@link MessageKind} to a delegate strategy, with a
 * fallback for unmapped kinds. Adds no filtering of its own.
 */
public final class MessageTypeRoutingStrategy implements RoutingStrategy {

    private final Map<MessageKind, RoutingStrategy> routes;
    private final RoutingStrategy fallback;

    public MessageTypeRoutingStrategy(Map<MessageKind, ? extends RoutingStrategy> routes, RoutingStrategy fallback) {
        Objects.requireNonNull(routes, "routes");
        this.fallback = Objects.requireNonNull(fallback, "fallback");
        EnumMap<MessageKind, RoutingStrategy> copy = new EnumMap<>(MessageKind.class);
        routes.forEach((k, v) -> copy.put(Objects.requireNonNull(k, "kind"), Objects.requireNonNull(v, "strategy")));
        this.routes = Collections.unmodifiableMap(copy);
    }

    /** Delegate used for {@code kind}. */
    public RoutingStrategy strategyFor(MessageKind kind) {
        return routes.getOrDefault(kind, fallback);
    }

    @Override
    public CompletableFuture<List<Transport>> selectTransports(String deviceId,
                                                               MessageKind kind,
                                                               List<? extends Transport> available) {
        return strategyFor(kind).selectTransports(deviceId, kind, available);
    }

    @Override
    public String name() {
        return "message-type" + routes.keySet() + "/" + fallback.name();
    }
}
