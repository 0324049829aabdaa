package com.questrail.meshroute.routing;

import com.questrail.meshroute.internal.time.Timeouts;
import com.questrail.meshroute.message.MessageKind;
import com.questrail.meshroute.transport.Transport;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * PriorityRoutingStrategy
 * =============================================================================
 * Default strategy: usable transports sorted by ascending
 * {@link Transport#priority()}, ties keeping their input order.
 *
 * <h2>Reachability filter</h2>
 * With {@code filterUnreachable} set, every candidate is probed with
 * {@link Transport#canReach(String)} in parallel, each probe bounded by the
 * probe timeout (timeout or failure counts as unreachable), and only
 * reachable transports are kept.
 *
 * <p>If <em>no</em> candidate proves reachable, the unfiltered candidates are
 * returned instead. Callers then still get real, informative send failures,
 * and an empty list means exactly "zero usable transports". Consequently the
 * filter does not guarantee filtering when every probe fails.</p>
 */
public final class PriorityRoutingStrategy implements RoutingStrategy {

    public static final Duration DEFAULT_PROBE_TIMEOUT = Duration.ofSeconds(2);

    private static final Comparator<Transport> BY_PRIORITY = Comparator.comparingInt(Transport::priority);

    private final Timeouts timeouts;
    private final boolean filterUnreachable;
    private final Duration probeTimeout;

    public PriorityRoutingStrategy(Timeouts timeouts) {
        this(timeouts, true, DEFAULT_PROBE_TIMEOUT);
    }

    public PriorityRoutingStrategy(Timeouts timeouts, boolean filterUnreachable, Duration probeTimeout) {
        this.timeouts = Objects.requireNonNull(timeouts, "timeouts");
        this.filterUnreachable = filterUnreachable;
        this.probeTimeout = Objects.requireNonNull(probeTimeout, "probeTimeout");
        if (probeTimeout.isNegative()) {
            throw new IllegalArgumentException("probeTimeout must be non-negative");
        }
    }

    public boolean filterUnreachable() {
        return filterUnreachable;
    }

    public Duration probeTimeout() {
        return probeTimeout;
    }

    @Override
    public CompletableFuture<List<Transport>> selectTransports(String deviceId,
                                                               MessageKind kind,
                                                               List<? extends Transport> available) {
        List<Transport> candidates = RoutingStrategy.usable(available);
        if (!filterUnreachable || candidates.isEmpty()) {
            return CompletableFuture.completedFuture(sorted(candidates));
        }

        List<CompletableFuture<Boolean>> probes = new ArrayList<>(candidates.size());
        for (Transport t : candidates) {
            probes.add(timeouts.orDefault(() -> t.canReach(deviceId), probeTimeout, Boolean.FALSE));
        }

        return CompletableFuture.allOf(probes.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> {
                    List<Transport> reachable = new ArrayList<>();
                    for (int i = 0; i < candidates.size(); i++) {
                        if (Boolean.TRUE.equals(probes.get(i).join())) {
                            reachable.add(candidates.get(i));
                        }
                    }
                    return sorted(reachable.isEmpty() ? candidates : reachable);
                });
    }

    private static List<Transport> sorted(List<Transport> transports) {
        List<Transport> copy = new ArrayList<>(transports);
        copy.sort(BY_PRIORITY); // List.sort is stable
        return copy;
    }

    @Override
    public String name() {
        return "priority";
    }
}
