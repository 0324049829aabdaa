package com.questrail.meshroute.manager;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.meshroute.config.ConnectionManagerConfig;
import com.questrail.meshroute.internal.time.Cancellable;
import com.questrail.meshroute.internal.time.MonotonicScheduler;
import com.questrail.meshroute.internal.time.Timeouts;
import com.questrail.meshroute.internal.time.WallClock;
import com.questrail.meshroute.local.LocalApiClient;
import com.questrail.meshroute.message.MessagePayload;
import com.questrail.meshroute.message.TransportMessage;
import com.questrail.meshroute.message.TransportResult;
import com.questrail.meshroute.observability.ConnectionStatus;
import com.questrail.meshroute.observability.DeliveryEvent;
import com.questrail.meshroute.observability.QueueEvent;
import com.questrail.meshroute.observability.RoutingErrorEvent;
import com.questrail.meshroute.observability.RoutingObservabilitySink;
import com.questrail.meshroute.observability.TransportEvent;
import com.questrail.meshroute.routing.PriorityRoutingStrategy;
import com.questrail.meshroute.routing.RoutingStrategy;
import com.questrail.meshroute.transport.MessageBroadcast;
import com.questrail.meshroute.transport.MessageStream;
import com.questrail.meshroute.transport.Subscription;
import com.questrail.meshroute.transport.Transport;
import com.questrail.meshroute.transport.TransportMetrics;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;

/**
 * ConnectionManager
 * =============================================================================
 * Routes {@link TransportMessage}s over a set of registered {@link Transport}s.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Registry of transports, in registration order, keyed by
 *       {@link Transport#id()}.</li>
 *   <li>The active {@link RoutingStrategy}, replaceable at runtime
 *       (default: {@link PriorityRoutingStrategy}).</li>
 *   <li>{@link #send} and its builders {@link #apiRequest}, {@link #sendDM}
 *       and {@link #sendChat}.</li>
 *   <li>The store-and-forward queue and its periodic tick.</li>
 *   <li>The merged inbound stream: every inbound message is handed to the
 *       {@link InboundDispatcher} and then re-published on
 *       {@link #incomingMessages()}, whatever the dispatcher did with it.</li>
 * </ul>
 *
 * <h2>send()</h2>
 * <ol>
 *   <li>Not initialized: immediate failure.</li>
 *   <li>The effective strategy orders the available and initialized
 *       transports; excluded ids are removed.</li>
 *   <li>Empty list: queued if {@code queueIfOffline}, otherwise a no-route
 *       failure.</li>
 *   <li>Transports are tried strictly one after another. The first success
 *       is returned. A failure, a timeout or an exception moves on to the
 *       next transport.</li>
 *   <li>All failed: queued if {@code queueIfOffline}, otherwise an
 *       all-failed failure naming the last transport.</li>
 * </ol>
 * The returned futures never complete exceptionally because of transport
 * misbehaviour.
 *
 * <h2>Queue processing</h2>
 * Every {@link ConnectionManagerConfig#queueProcessInterval()} expired
 * entries are dropped and the rest retried once. A retry sends a copy with
 * {@code queueIfOffline} cleared; a message that fails again and has not
 * expired goes back into the queue once. Retry passes are serialized.
 *
 * <h2>Thread-safety</h2>
 * Safe for use from any thread. The registry is a copy-on-write map, the
 * queue is internally synchronized and the strategy reference is volatile.
 * No lock is held across a transport call.
 */
public final class ConnectionManager {

    private final ConnectionManagerConfig config;
    private final Timeouts timeouts;
    private final MonotonicScheduler tickScheduler;
    private final WallClock wallClock;
    private final RoutingObservabilitySink sink;
    private final InboundDispatcher dispatcher;
    private final BoundedMessageQueue queue;

    private final Object lock = new Object();

    private volatile Map<String, Transport> transports = Map.of();
    private volatile RoutingStrategy strategy;
    private volatile boolean initialized;
    private volatile MessageBroadcast incoming = new MessageBroadcast("connection-manager-incoming");

    // Guarded by lock
    private CompletableFuture<Void> initializing;
    private Cancellable tick;
    private long generation;
    private List<Subscription> upstream = List.of();
    private CompletableFuture<Void> retryChain = CompletableFuture.completedFuture(null);

    public ConnectionManager(ConnectionManagerConfig config,
                             Timeouts timeouts,
                             MonotonicScheduler tickScheduler,
                             WallClock wallClock,
                             LocalApiClient localApi,
                             RoutingObservabilitySink sink) {
        this.config = Objects.requireNonNull(config, "config");
        this.timeouts = Objects.requireNonNull(timeouts, "timeouts");
        this.tickScheduler = Objects.requireNonNull(tickScheduler, "tickScheduler");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.queue = new BoundedMessageQueue(config.queueCapacity());
        this.strategy = new PriorityRoutingStrategy(timeouts, true, config.reachabilityTimeout());
        this.dispatcher = new InboundDispatcher(config, Objects.requireNonNull(localApi, "localApi"),
                timeouts, this::transports, wallClock, sink);
    }

    public ConnectionManagerConfig config() {
        return config;
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    public boolean isInitialized() {
        return initialized;
    }

    /**
     * Initializes every registered transport, one after another, then builds
     * the merged inbound stream and arms the queue tick. A transport whose
     * initialization fails stays registered. Idempotent.
     */
    public CompletableFuture<Void> initialize() {
        CompletableFuture<Void> done;
        List<Transport> snapshot;
        synchronized (lock) {
            if (initialized) {
                return CompletableFuture.completedFuture(null);
            }
            if (initializing != null) {
                return initializing;
            }
            done = new CompletableFuture<>();
            initializing = done;
            snapshot = List.copyOf(transports.values());
        }

        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (Transport t : snapshot) {
            chain = chain.thenCompose(v -> initializeTransport(t));
        }
        chain.thenCompose(v -> completeInitialization(done, snapshot))
                .whenComplete((v, e) -> done.complete(null));
        return done;
    }

    /**
     * Flips the manager to initialized and initializes the transports that
     * were registered after {@code snapshot} was taken. Registrations that
     * come later see {@code initialized} and initialize themselves.
     */
    private CompletableFuture<Void> completeInitialization(CompletableFuture<Void> attempt,
                                                           List<Transport> snapshot) {
        List<Transport> late = new ArrayList<>();
        synchronized (lock) {
            if (initializing != attempt) {
                // Disposed while initializing.
                return CompletableFuture.completedFuture(null);
            }
            initializing = null;
            initialized = true;
            long gen = ++generation;
            tick = scheduleTick(gen);
            for (Transport t : transports.values()) {
                if (!snapshot.contains(t) && !t.isInitialized()) {
                    late.add(t);
                }
            }
        }

        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (Transport t : late) {
            chain = chain.thenCompose(v -> initializeTransport(t));
        }
        return chain.thenRun(() -> {
            rebuildInbound();
            emitTransport(TransportEvent.Kind.INITIALIZED, null, transports.size() + " transports");
        });
    }

    private CompletableFuture<Void> initializeTransport(Transport t) {
        CompletableFuture<Void> f;
        try {
            f = Objects.requireNonNull(t.initialize(), "initialize() returned null");
        } catch (RuntimeException e) {
            f = CompletableFuture.failedFuture(e);
        }
        return f.handle((v, e) -> {
            if (e == null) {
                emitTransport(TransportEvent.Kind.INITIALIZED, t.id(), null);
            } else {
                emitTransport(TransportEvent.Kind.INITIALIZATION_FAILED, t.id(), String.valueOf(unwrap(e)));
            }
            return null;
        });
    }

    /**
     * Stops the queue tick, waits for an in-flight retry pass, disposes every
     * transport (errors are reported, not propagated), closes the merged and
     * external streams and clears the registry and the queue.
     *
     * <p>Afterwards the manager can be initialized again. Subscriptions made
     * through {@link #incomingMessages()} before disposal are dropped.</p>
     */
    public CompletableFuture<Void> dispose() {
        CompletableFuture<Void> pendingRetry;
        List<Transport> snapshot;
        synchronized (lock) {
            if (tick != null) {
                tick.cancel();
                tick = null;
            }
            generation++;
            initialized = false;
            initializing = null;
            pendingRetry = retryChain;
            snapshot = List.copyOf(transports.values());
        }

        return pendingRetry
                .thenCompose(v -> disposeAll(snapshot))
                .thenRun(() -> {
                    synchronized (lock) {
                        cancelUpstream();
                        transports = Map.of();
                    }
                    MessageBroadcast closed = incoming;
                    incoming = new MessageBroadcast("connection-manager-incoming");
                    closed.close();
                    queue.clear();
                });
    }

    private CompletableFuture<Void> disposeAll(List<Transport> snapshot) {
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (Transport t : snapshot) {
            chain = chain.thenCompose(v -> disposeTransport(t));
        }
        return chain;
    }

    private CompletableFuture<Void> disposeTransport(Transport t) {
        CompletableFuture<Void> f;
        try {
            f = Objects.requireNonNull(t.dispose(), "dispose() returned null");
        } catch (RuntimeException e) {
            f = CompletableFuture.failedFuture(e);
        }
        return f.handle((v, e) -> {
            if (e == null) {
                emitTransport(TransportEvent.Kind.DISPOSED, t.id(), null);
            } else {
                emitTransport(TransportEvent.Kind.DISPOSAL_FAILED, t.id(), String.valueOf(unwrap(e)));
            }
            return null;
        });
    }

    // =========================================================================
    // Registry
    // =========================================================================

    /**
     * Adds a transport. If the manager is already initialized the transport
     * is initialized too, and the returned future completes once that has
     * settled (successfully or not). A transport added while
     * {@link #initialize()} is running is initialized at its end, and the
     * returned future is the pending initialization.
     *
     * @throws IllegalArgumentException if a transport with the same id is
     *                                  already registered
     */
    public CompletableFuture<Void> registerTransport(Transport transport) {
        Objects.requireNonNull(transport, "transport");
        boolean initializeNow;
        CompletableFuture<Void> pendingInit;
        synchronized (lock) {
            if (transports.containsKey(transport.id())) {
                throw new IllegalArgumentException("Transport already registered: " + transport.id());
            }
            Map<String, Transport> next = new LinkedHashMap<>(transports);
            next.put(transport.id(), transport);
            transports = Collections.unmodifiableMap(next);
            initializeNow = initialized && !transport.isInitialized();
            pendingInit = initializing;
        }
        emitTransport(TransportEvent.Kind.REGISTERED, transport.id(),
                "priority=" + transport.priority() + ", available=" + transport.isAvailable());
        rebuildInbound();

        if (pendingInit != null) {
            return pendingInit;
        }
        if (!initializeNow) {
            return CompletableFuture.completedFuture(null);
        }
        return initializeTransport(transport).thenRun(this::rebuildInbound);
    }

    /**
     * Removes and disposes a transport.
     *
     * @return {@code true} once disposed, {@code false} if no such transport
     */
    public CompletableFuture<Boolean> unregisterTransport(String transportId) {
        Objects.requireNonNull(transportId, "transportId");
        Transport removed;
        synchronized (lock) {
            removed = transports.get(transportId);
            if (removed == null) {
                return CompletableFuture.completedFuture(false);
            }
            Map<String, Transport> next = new LinkedHashMap<>(transports);
            next.remove(transportId);
            transports = Collections.unmodifiableMap(next);
        }
        rebuildInbound();
        emitTransport(TransportEvent.Kind.UNREGISTERED, transportId, null);
        return disposeTransport(removed).thenApply(v -> true);
    }

    public Optional<Transport> transport(String id) {
        return Optional.ofNullable(transports.get(id));
    }

    /** All registered transports, in registration order. */
    public List<Transport> transports() {
        return List.copyOf(transports.values());
    }

    /** Registered transports that exist on this platform. */
    public List<Transport> availableTransports() {
        return transports.values().stream()
                .filter(Transport::isAvailable)
                .collect(Collectors.toList());
    }

    public RoutingStrategy routingStrategy() {
        return strategy;
    }

    public void setRoutingStrategy(RoutingStrategy strategy) {
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        emitTransport(TransportEvent.Kind.STRATEGY_CHANGED, null, strategy.name());
    }

    // =========================================================================
    // Sending
    // =========================================================================

    public CompletableFuture<TransportResult> send(TransportMessage message) {
        return send(message, null, Set.of());
    }

    /**
     * @param strategyOverride strategy for this call only; {@code null} uses
     *                         the active one
     * @param excludeIds       transport ids never to try for this call
     */
    public CompletableFuture<TransportResult> send(TransportMessage message,
                                                   RoutingStrategy strategyOverride,
                                                   Set<String> excludeIds) {
        Objects.requireNonNull(message, "message");
        if (!initialized) {
            emitDelivery(DeliveryEvent.Kind.NOT_INITIALIZED, message, null, "ConnectionManager not initialized");
            return CompletableFuture.completedFuture(TransportResult.failure("ConnectionManager not initialized"));
        }

        Set<String> excluded = excludeIds == null ? Set.of() : excludeIds;
        RoutingStrategy effective = strategyOverride != null ? strategyOverride : strategy;
        emitDelivery(DeliveryEvent.Kind.SENDING, message, null, message.kind().name());

        CompletableFuture<List<Transport>> selection;
        try {
            selection = Objects.requireNonNull(
                    effective.selectTransports(message.deviceId(), message.kind(), RoutingStrategy.usable(transports())),
                    "selectTransports returned null");
        } catch (RuntimeException e) {
            selection = CompletableFuture.failedFuture(e);
        }

        return selection
                .exceptionally(e -> {
                    sink.onError(new RoutingErrorEvent(wallClock.now(),
                            "Routing strategy " + effective.name() + " failed for " + message.id(), unwrap(e)));
                    return List.of();
                })
                .thenCompose(selected -> {
                    List<Transport> toTry = selected.stream()
                            .filter(t -> !excluded.contains(t.id()))
                            .collect(Collectors.toList());
                    if (toTry.isEmpty()) {
                        if (message.queueIfOffline()) {
                            return CompletableFuture.completedFuture(enqueue(message));
                        }
                        String error = "No transport available for " + message.deviceId();
                        emitDelivery(DeliveryEvent.Kind.NO_ROUTE, message, null, error);
                        return CompletableFuture.completedFuture(TransportResult.failure(error));
                    }
                    return attempt(message, toTry.iterator(), null);
                });
    }

    private CompletableFuture<TransportResult> attempt(TransportMessage message,
                                                       Iterator<Transport> remaining,
                                                       String lastTransport) {
        if (!remaining.hasNext()) {
            if (message.queueIfOffline()) {
                return CompletableFuture.completedFuture(enqueue(message));
            }
            String error = "All transports failed for " + message.deviceId();
            emitDelivery(DeliveryEvent.Kind.ALL_FAILED, message, lastTransport, error);
            return CompletableFuture.completedFuture(TransportResult.failure(error, lastTransport));
        }

        Transport t = remaining.next();
        Duration timeout = config.sendTimeout();
        emitDelivery(DeliveryEvent.Kind.ATTEMPT, message, t.id(), null);

        return timeouts.orElse(
                        () -> t.send(message, timeout),
                        timeout,
                        () -> TransportResult.failure("Send timed out after " + timeout.toMillis() + "ms", t.id()),
                        e -> TransportResult.failure("Exception: " + unwrap(e), t.id()))
                .thenCompose(result -> {
                    if (result != null && result.isSuccess()) {
                        emitDelivery(DeliveryEvent.Kind.DELIVERED, message, t.id(),
                                result.latency().map(l -> l.toMillis() + "ms").orElse("?ms"));
                        return CompletableFuture.completedFuture(result);
                    }
                    String error = result == null ? "null result" : result.error().orElse("unknown error");
                    emitDelivery(DeliveryEvent.Kind.TRANSPORT_FAILED, message, t.id(), error);
                    return attempt(message, remaining, t.id());
                });
    }

    /**
     * Request to the remote device's local API.
     */
    public CompletableFuture<TransportResult> apiRequest(String deviceId,
                                                         String method,
                                                         String path,
                                                         Map<String, String> headers,
                                                         MessagePayload body,
                                                         boolean queueIfOffline) {
        return apiRequest(deviceId, method, path, headers, body, queueIfOffline, null, Set.of());
    }

    public CompletableFuture<TransportResult> apiRequest(String deviceId,
                                                         String method,
                                                         String path,
                                                         Map<String, String> headers,
                                                         MessagePayload body,
                                                         boolean queueIfOffline,
                                                         RoutingStrategy strategyOverride,
                                                         Set<String> excludeIds) {
        TransportMessage message = TransportMessage.apiRequest(deviceId, method, path, headers, body, queueIfOffline);
        return send(stamped(message), strategyOverride, excludeIds);
    }

    /**
     * Direct message carrying a pre-signed event.
     *
     * @param ttl optional lifetime in the store-and-forward queue
     */
    public CompletableFuture<TransportResult> sendDM(String deviceId,
                                                     JsonNode signedEvent,
                                                     boolean queueIfOffline,
                                                     Duration ttl) {
        return send(stamped(TransportMessage.directMessage(deviceId, signedEvent, queueIfOffline, ttl)));
    }

    public CompletableFuture<TransportResult> sendChat(String deviceId,
                                                       String roomId,
                                                       JsonNode signedEvent,
                                                       boolean queueIfOffline) {
        return send(stamped(TransportMessage.roomMessage(deviceId, roomId, signedEvent, queueIfOffline)));
    }

    // TTL expiry is judged against wallClock, so creation time must come from it too.
    private TransportMessage stamped(TransportMessage message) {
        return message.toBuilder().createdAt(wallClock.now()).build();
    }

    // =========================================================================
    // Reachability
    // =========================================================================

    /**
     * Probes the available transports one by one, each bounded by the
     * reachability timeout, and stops at the first that can reach the
     * device. A probe that fails or times out counts as unreachable. Before
     * {@link #initialize()} nothing is probed and the answer is {@code false}.
     */
    public CompletableFuture<Boolean> isReachable(String deviceId) {
        Objects.requireNonNull(deviceId, "deviceId");
        if (!initialized) {
            return CompletableFuture.completedFuture(false);
        }
        return firstReachable(deviceId, availableTransports().iterator());
    }

    private CompletableFuture<Boolean> firstReachable(String deviceId, Iterator<Transport> remaining) {
        if (!remaining.hasNext()) {
            return CompletableFuture.completedFuture(false);
        }
        Transport t = remaining.next();
        return probe(t, deviceId).thenCompose(reachable ->
                reachable ? CompletableFuture.completedFuture(true) : firstReachable(deviceId, remaining));
    }

    /**
     * Ids of every available transport that can reach the device, in
     * registration order. Empty before {@link #initialize()}.
     */
    public CompletableFuture<List<String>> reachableTransportIds(String deviceId) {
        Objects.requireNonNull(deviceId, "deviceId");
        if (!initialized) {
            return CompletableFuture.completedFuture(List.of());
        }
        List<String> reachable = Collections.synchronizedList(new ArrayList<>());
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (Transport t : availableTransports()) {
            chain = chain.thenCompose(v -> probe(t, deviceId).thenAccept(ok -> {
                if (ok) {
                    reachable.add(t.id());
                }
            }));
        }
        return chain.thenApply(v -> List.copyOf(reachable));
    }

    private CompletableFuture<Boolean> probe(Transport t, String deviceId) {
        return timeouts.orDefault(() -> t.canReach(deviceId), config.reachabilityTimeout(), Boolean.FALSE)
                .thenApply(Boolean.TRUE::equals);
    }

    // =========================================================================
    // Inbound
    // =========================================================================

    /**
     * Every message received by any available, initialized transport. The
     * stream stays valid across {@link #dispose()}/{@link #initialize()},
     * although subscriptions made before a disposal are dropped by it.
     */
    public MessageStream incomingMessages() {
        return subscriber -> incoming.subscribe(subscriber);
    }

    private void rebuildInbound() {
        int streams;
        synchronized (lock) {
            cancelUpstream();
            List<Subscription> subscriptions = new ArrayList<>();
            for (Transport t : transports.values()) {
                if (t.isAvailable() && t.isInitialized()) {
                    subscriptions.add(t.inbound().subscribe(this::onInbound));
                }
            }
            upstream = List.copyOf(subscriptions);
            streams = upstream.size();
        }
        emitTransport(TransportEvent.Kind.INBOUND_REBUILT, null, streams + " streams");
    }

    private void cancelUpstream() {
        for (Subscription s : upstream) {
            s.cancel();
        }
        upstream = List.of();
    }

    private void onInbound(TransportMessage message) {
        dispatcher.dispatch(message);
        incoming.publish(message);
    }

    // =========================================================================
    // Store-and-forward
    // =========================================================================

    private TransportResult enqueue(TransportMessage message) {
        List<TransportMessage> evicted = queue.offer(message);
        int size = queue.size();
        for (TransportMessage dropped : evicted) {
            emitQueue(QueueEvent.Kind.DROPPED_OVERFLOW, dropped.id(), size);
        }
        emitQueue(QueueEvent.Kind.ENQUEUED, message.id(), size);
        return TransportResult.queued();
    }

    /** Queued messages, oldest first. */
    public List<TransportMessage> pendingMessages() {
        return queue.snapshot();
    }

    public int pendingCount() {
        return queue.size();
    }

    /**
     * Tries every queued message once. Expired messages are dropped without
     * a send. The returned future completes when the pass is over; passes
     * requested while one is running run after it.
     */
    public CompletableFuture<Void> retryPending() {
        CompletableFuture<Void> next = new CompletableFuture<>();
        CompletableFuture<Void> previous;
        synchronized (lock) {
            previous = retryChain;
            retryChain = next;
        }
        previous.thenCompose(v -> retryPass()).whenComplete((v, e) -> {
            if (e != null) {
                sink.onError(new RoutingErrorEvent(wallClock.now(), "Retry pass failed", unwrap(e)));
            }
            next.complete(null);
        });
        return next;
    }

    private CompletableFuture<Void> retryPass() {
        List<TransportMessage> pending = queue.drain();
        if (pending.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        emitQueue(QueueEvent.Kind.RETRY_PASS_STARTED, null, pending.size());

        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (TransportMessage m : pending) {
            chain = chain.thenCompose(v -> retryOne(m));
        }
        return chain;
    }

    private CompletableFuture<Void> retryOne(TransportMessage message) {
        if (message.isExpired(wallClock.now())) {
            emitQueue(QueueEvent.Kind.EXPIRED, message.id(), queue.size());
            return CompletableFuture.completedFuture(null);
        }

        TransportMessage attempt = message.toBuilder().queueIfOffline(false).build();
        return send(attempt).thenAccept(result -> {
            if (result.isSuccess()) {
                emitQueue(QueueEvent.Kind.RETRY_DELIVERED, message.id(), queue.size());
            } else if (!result.wasQueued() && !message.isExpired(wallClock.now())) {
                List<TransportMessage> evicted = queue.offer(message);
                int size = queue.size();
                for (TransportMessage dropped : evicted) {
                    emitQueue(QueueEvent.Kind.DROPPED_OVERFLOW, dropped.id(), size);
                }
                emitQueue(QueueEvent.Kind.REQUEUED, message.id(), size);
            } else {
                emitQueue(QueueEvent.Kind.EXPIRED, message.id(), queue.size());
            }
        });
    }

    /**
     * One queue tick: drops expired messages, then retries the rest if any
     * remain.
     */
    public CompletableFuture<Void> processQueue() {
        List<TransportMessage> expired = queue.removeExpired(wallClock.now());
        for (TransportMessage m : expired) {
            emitQueue(QueueEvent.Kind.EXPIRED, m.id(), queue.size());
        }
        if (queue.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        return retryPending();
    }

    private Cancellable scheduleTick(long gen) {
        return tickScheduler.scheduleAfter(config.queueProcessInterval(), timeouts.clock(), () -> onTick(gen));
    }

    private void onTick(long gen) {
        synchronized (lock) {
            if (gen != generation || !initialized) {
                return;
            }
            tick = scheduleTick(gen);
        }
        processQueue();
    }

    // =========================================================================
    // Status
    // =========================================================================

    /** Metrics of every registered transport, keyed by id, in registration order. */
    public Map<String, TransportMetrics> allMetrics() {
        Map<String, TransportMetrics> metrics = new LinkedHashMap<>();
        for (Transport t : transports.values()) {
            metrics.put(t.id(), t.metrics());
        }
        return Collections.unmodifiableMap(metrics);
    }

    public ConnectionStatus status() {
        List<ConnectionStatus.TransportStatus> rows = new ArrayList<>();
        for (Transport t : transports.values()) {
            TransportMetrics m = t.metrics();
            rows.add(new ConnectionStatus.TransportStatus(t.id(), t.displayName(), t.priority(),
                    t.isAvailable(), t.isInitialized(), m.successRate(), m.averageLatencyMs()));
        }
        return new ConnectionStatus(initialized, strategy.name(), rows, queue.size());
    }

    /** Reports {@link #status()} through the observability sink. */
    public void logStatus() {
        sink.onStatus(status());
    }

    // =========================================================================

    private void emitDelivery(DeliveryEvent.Kind kind, TransportMessage message, String transportId, String detail) {
        sink.onDelivery(new DeliveryEvent(wallClock.now(), kind, message.id(), message.deviceId(), transportId, detail));
    }

    private void emitQueue(QueueEvent.Kind kind, String messageId, int size) {
        sink.onQueue(new QueueEvent(wallClock.now(), kind, messageId, size));
    }

    private void emitTransport(TransportEvent.Kind kind, String transportId, String detail) {
        sink.onTransport(new TransportEvent(wallClock.now(), kind, transportId, detail));
    }

    private static Throwable unwrap(Throwable e) {
        return e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
    }
}
