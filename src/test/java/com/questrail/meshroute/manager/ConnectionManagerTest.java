package com.questrail.meshroute.manager;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.meshroute.config.ConnectionManagerConfig;
import com.questrail.meshroute.internal.time.Timeouts;
import com.questrail.meshroute.local.LocalApiRequest;
import com.questrail.meshroute.local.LocalApiResponse;
import com.questrail.meshroute.message.MessageKind;
import com.questrail.meshroute.message.MessagePayload;
import com.questrail.meshroute.message.TransportMessage;
import com.questrail.meshroute.message.TransportResult;
import com.questrail.meshroute.observability.ConnectionStatus;
import com.questrail.meshroute.observability.DeliveryEvent;
import com.questrail.meshroute.observability.QueueEvent;
import com.questrail.meshroute.observability.RecordingObservabilitySink;
import com.questrail.meshroute.observability.TransportEvent;
import com.questrail.meshroute.routing.FailoverRoutingStrategy;
import com.questrail.meshroute.time.DeterministicScheduler;
import com.questrail.meshroute.time.ManualMonotonicClock;
import com.questrail.meshroute.time.ManualWallClock;
import com.questrail.meshroute.transport.FakeTransport;
import com.questrail.meshroute.transport.Transport;
import com.questrail.meshroute.util.Jsons;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ConnectionManagerTest
 * -----------------------------------------------------------------------------
 * Drives the manager with a manual clock, a deterministic scheduler and
 * scripted transports, so every future completes on the test thread unless a
 * test deliberately leaves one hanging.
 */
class ConnectionManagerTest {

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private ManualWallClock wallClock;
    private RecordingObservabilitySink sink;
    private List<LocalApiRequest> localCalls;
    private ConnectionManager manager;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        wallClock = new ManualWallClock();
        sink = new RecordingObservabilitySink();
        localCalls = new CopyOnWriteArrayList<>();
        manager = newManager(ConnectionManagerConfig.defaults());
    }

    private ConnectionManager newManager(ConnectionManagerConfig config) {
        return new ConnectionManager(
                config,
                new Timeouts(clock, scheduler),
                scheduler,
                wallClock,
                request -> {
                    localCalls.add(request);
                    return CompletableFuture.completedFuture(new LocalApiResponse(200, "{\"ok\":true}"));
                },
                sink);
    }

    private FakeTransport transport(String id, int priority) {
        return new FakeTransport(id, priority, wallClock);
    }

    private static TransportMessage message(String deviceId, boolean queueIfOffline) {
        return TransportMessage.builder(deviceId, MessageKind.REQUEST)
                .method("GET")
                .path("/api/status")
                .queueIfOffline(queueIfOffline)
                .build();
    }

    private void advance(Duration d) {
        clock.advance(d);
        scheduler.runDueTasks();
    }

    // =========================================================================
    // send()
    // =========================================================================

    @Test
    void sendBeforeInitializeFailsFast() {
        FakeTransport lan = transport("lan", 10);
        manager.registerTransport(lan);

        TransportResult result = manager.send(message("X1", true)).join();

        assertTrue(result.isFailure());
        assertTrue(result.error().orElseThrow().contains("not initialized"));
        assertTrue(lan.sentMessages().isEmpty());
        assertEquals(0, manager.pendingCount(), "not-initialized is never queued");
    }

    @Test
    void queueIfOfflineWithNoTransportsQueuesExactlyOne() {
        manager.initialize().join();

        TransportResult result = manager.send(message("X1", true)).join();

        assertTrue(result.wasQueued());
        assertTrue(result.isSuccess());
        assertEquals(1, manager.pendingCount());
    }

    @Test
    void noTransportsWithoutQueueingIsNoRouteFailure() {
        manager.initialize().join();

        TransportResult result = manager.send(message("X1", false)).join();

        assertTrue(result.isFailure());
        assertEquals(0, manager.pendingCount());
        assertTrue(sink.eventsOfType(DeliveryEvent.class).stream()
                .anyMatch(e -> e.kind() == DeliveryEvent.Kind.NO_ROUTE));
    }

    @Test
    void firstFailureFallsThroughToSecondTransportWithoutRetry() {
        FakeTransport a = transport("a", 10).alwaysFail("link down");
        FakeTransport b = transport("b", 20);
        manager.registerTransport(a);
        manager.registerTransport(b);
        manager.initialize().join();

        TransportResult result = manager.send(message("X", false)).join();

        assertTrue(result.isDelivered());
        assertEquals("b", result.transportUsed().orElseThrow());
        assertEquals(1, a.sentMessages().size(), "a is tried exactly once");
        assertEquals(1, b.sentMessages().size());
    }

    @Test
    void firstSuccessStopsTheSequence() {
        FakeTransport a = transport("a", 10);
        FakeTransport b = transport("b", 20);
        manager.registerTransport(a);
        manager.registerTransport(b);
        manager.initialize().join();

        TransportResult result = manager.send(message("X", false)).join();

        assertEquals("a", result.transportUsed().orElseThrow());
        assertTrue(b.sentMessages().isEmpty());
    }

    @Test
    void throwingTransportIsTreatedAsFailure() {
        FakeTransport a = transport("a", 10).throwOnSend(new IllegalStateException("driver crashed"));
        FakeTransport b = transport("b", 20);
        manager.registerTransport(a);
        manager.registerTransport(b);
        manager.initialize().join();

        TransportResult result = manager.send(message("X", false)).join();

        assertEquals("b", result.transportUsed().orElseThrow());
        assertTrue(sink.eventsOfType(DeliveryEvent.class).stream()
                .anyMatch(e -> e.kind() == DeliveryEvent.Kind.TRANSPORT_FAILED
                        && "a".equals(e.transportId())
                        && e.detail().contains("driver crashed")));
    }

    @Test
    void allFailedNamesLastTransport() {
        manager.registerTransport(transport("a", 10).alwaysFail("x"));
        manager.registerTransport(transport("b", 20).alwaysFail("y"));
        manager.initialize().join();

        TransportResult result = manager.send(message("X", false)).join();

        assertTrue(result.isFailure());
        assertTrue(result.error().orElseThrow().contains("All transports failed"));
        assertEquals("b", result.transportUsed().orElseThrow());
    }

    @Test
    void allFailedWithQueueIfOfflineIsQueued() {
        manager.registerTransport(transport("a", 10).alwaysFail("x"));
        manager.initialize().join();

        TransportResult result = manager.send(message("X", true)).join();

        assertTrue(result.wasQueued());
        assertEquals(1, manager.pendingCount());
    }

    @Test
    void excludedTransportsAreNeverTried() {
        FakeTransport a = transport("a", 10);
        FakeTransport b = transport("b", 20);
        manager.registerTransport(a);
        manager.registerTransport(b);
        manager.initialize().join();

        TransportResult result = manager.send(message("X", false), null, Set.of("a")).join();

        assertEquals("b", result.transportUsed().orElseThrow());
        assertTrue(a.sentMessages().isEmpty());
    }

    @Test
    void excludingEverythingBehavesLikeNoRoute() {
        manager.registerTransport(transport("a", 10));
        manager.initialize().join();

        assertTrue(manager.send(message("X", true), null, Set.of("a")).join().wasQueued());
    }

    @Test
    void strategyOverrideAppliesToOneCall() {
        FakeTransport a = transport("a", 10);
        FakeTransport b = transport("b", 20);
        manager.registerTransport(a);
        manager.registerTransport(b);
        manager.initialize().join();

        TransportResult viaOverride = manager.send(message("X", false),
                new FailoverRoutingStrategy(List.of("b")), Set.of()).join();
        TransportResult viaDefault = manager.send(message("X", false)).join();

        assertEquals("b", viaOverride.transportUsed().orElseThrow());
        assertEquals("a", viaDefault.transportUsed().orElseThrow());
    }

    @Test
    void hangingSendTimesOutAndMovesOn() {
        manager = newManager(ConnectionManagerConfig.builder().withSendTimeout(Duration.ofSeconds(5)).build());
        FakeTransport slow = transport("slow", 10).onSend(m -> new CompletableFuture<>());
        FakeTransport fast = transport("fast", 20);
        manager.registerTransport(slow);
        manager.registerTransport(fast);
        manager.initialize().join();

        CompletableFuture<TransportResult> pending = manager.send(message("X", false));
        assertFalse(pending.isDone());
        assertTrue(fast.sentMessages().isEmpty(), "no parallel attempt while the first is in flight");

        advance(Duration.ofSeconds(5));

        assertEquals("fast", pending.join().transportUsed().orElseThrow());
    }

    @Test
    void uninitializedTransportIsNotUsed() {
        FakeTransport broken = transport("broken", 10).failInitialize(new IllegalStateException("no radio"));
        FakeTransport relay = transport("relay", 30);
        manager.registerTransport(broken);
        manager.registerTransport(relay);

        manager.initialize().join();

        assertTrue(manager.isInitialized());
        assertTrue(manager.transport("broken").isPresent(), "stays registered");
        assertFalse(broken.isInitialized());
        assertEquals("relay", manager.send(message("X", false)).join().transportUsed().orElseThrow());
        assertTrue(sink.eventsOfType(TransportEvent.class).stream()
                .anyMatch(e -> e.kind() == TransportEvent.Kind.INITIALIZATION_FAILED && "broken".equals(e.transportId())));
    }

    @Test
    void convenienceBuildersDelegateToSend() {
        FakeTransport lan = transport("lan", 10);
        manager.registerTransport(lan);
        manager.initialize().join();
        JsonNode event = Jsons.parse("{\"id\":\"e1\"}");

        manager.apiRequest("X1", "POST", "/api/echo", Map.of(), MessagePayload.of("hi"), false).join();
        manager.sendDM("X1", event, false, Duration.ofHours(1)).join();
        manager.sendChat("X1", "room-7", event, false).join();

        List<MessageKind> kinds = lan.sentMessages().stream().map(TransportMessage::kind).collect(Collectors.toList());
        assertEquals(List.of(MessageKind.REQUEST, MessageKind.DIRECT_MESSAGE, MessageKind.ROOM_MESSAGE), kinds);
        assertEquals("room-7", lan.sentMessages().get(2).path());
    }

    // =========================================================================
    // Store-and-forward
    // =========================================================================

    @Test
    void overflowDropsExactlyTheOldest() {
        manager.initialize().join();
        List<TransportMessage> sent = new ArrayList<>();
        for (int i = 0; i < 1001; i++) {
            TransportMessage m = message("X", true);
            sent.add(m);
            manager.send(m).join();
        }

        List<TransportMessage> pending = manager.pendingMessages();
        assertEquals(1000, pending.size());
        assertEquals(sent.subList(1, 1001), pending);
        assertEquals(1, sink.queueKinds().stream().filter(k -> k == QueueEvent.Kind.DROPPED_OVERFLOW).count());
    }

    @Test
    void expiredMessageIsNeverResent() {
        manager.initialize().join();
        TransportMessage expiring = TransportMessage.builder("X", MessageKind.DIRECT_MESSAGE)
                .signedEvent(Jsons.object())
                .queueIfOffline(true)
                .createdAt(wallClock.now())
                .ttl(Duration.ofMinutes(1))
                .build();
        manager.send(expiring).join();

        FakeTransport lan = transport("lan", 10);
        manager.registerTransport(lan).join();
        wallClock.advance(Duration.ofMinutes(2));

        manager.retryPending().join();

        assertTrue(lan.sentMessages().isEmpty());
        assertEquals(0, manager.pendingCount());
        assertTrue(sink.queueKinds().contains(QueueEvent.Kind.EXPIRED));
    }

    @Test
    void directMessageTtlRunsOnTheManagerWallClock() {
        manager.initialize().join();
        manager.sendDM("X", Jsons.object(), true, Duration.ofMinutes(1)).join();

        TransportMessage queued = manager.pendingMessages().get(0);
        assertEquals(wallClock.now(), queued.createdAt());

        FakeTransport lan = transport("lan", 10);
        manager.registerTransport(lan).join();
        wallClock.advance(Duration.ofMinutes(2));
        manager.retryPending().join();

        assertTrue(lan.sentMessages().isEmpty());
        assertEquals(0, manager.pendingCount());
        assertTrue(sink.queueKinds().contains(QueueEvent.Kind.EXPIRED));
    }

    @Test
    void retryDeliversQueuedMessageWithQueueingCleared() {
        manager.initialize().join();
        TransportMessage queued = message("X", true);
        manager.send(queued).join();

        FakeTransport lan = transport("lan", 10);
        manager.registerTransport(lan).join();
        manager.retryPending().join();

        assertEquals(0, manager.pendingCount());
        assertEquals(1, lan.sentMessages().size());
        TransportMessage retried = lan.sentMessages().get(0);
        assertEquals(queued.id(), retried.id());
        assertFalse(retried.queueIfOffline());
        assertTrue(sink.queueKinds().contains(QueueEvent.Kind.RETRY_DELIVERED));
    }

    @Test
    void perpetualFailureIsRequeuedOncePerPassAndNeverDuplicated() {
        FakeTransport lan = transport("lan", 10).alwaysFail("offline");
        manager.registerTransport(lan);
        manager.initialize().join();
        TransportMessage m = message("X", true);
        manager.send(m).join();

        for (int pass = 1; pass <= 3; pass++) {
            manager.retryPending().join();
            assertEquals(List.of(m), manager.pendingMessages(), "pass " + pass);
        }
        // one original attempt plus one per pass
        assertEquals(4, lan.sentMessages().size());
    }

    @Test
    void queueTickDropsExpiredThenRetriesRest() {
        manager.initialize().join();
        TransportMessage expiring = TransportMessage.builder("X", MessageKind.SYNC)
                .queueIfOffline(true)
                .createdAt(wallClock.now())
                .ttl(Duration.ofSeconds(10))
                .build();
        TransportMessage durable = message("X", true);
        manager.send(expiring).join();
        manager.send(durable).join();

        FakeTransport lan = transport("lan", 10);
        manager.registerTransport(lan).join();
        wallClock.advance(Duration.ofMinutes(1));

        advance(Duration.ofSeconds(30));

        assertEquals(0, manager.pendingCount());
        assertEquals(List.of(durable.id()),
                lan.sentMessages().stream().map(TransportMessage::id).collect(Collectors.toList()));
    }

    @Test
    void queueTickRepeatsEveryInterval() {
        FakeTransport lan = transport("lan", 10).alwaysFail("offline");
        manager.registerTransport(lan);
        manager.initialize().join();
        manager.send(message("X", true)).join();

        advance(Duration.ofSeconds(30));
        advance(Duration.ofSeconds(30));

        assertEquals(3, lan.sentMessages().size());
        assertEquals(1, manager.pendingCount());
    }

    @Test
    void disposeStopsTheTick() {
        FakeTransport lan = transport("lan", 10).alwaysFail("offline");
        manager.registerTransport(lan);
        manager.initialize().join();

        manager.dispose().join();
        advance(Duration.ofMinutes(5));

        assertEquals(0, scheduler.pendingCount());
    }

    // =========================================================================
    // Reachability
    // =========================================================================

    @Test
    void isReachableStopsAtFirstReachableTransport() {
        FakeTransport a = transport("a", 10);
        FakeTransport b = transport("b", 20).reaches("x1");
        FakeTransport c = transport("c", 30).reaches("x1");
        manager.registerTransport(a);
        manager.registerTransport(b);
        manager.registerTransport(c);
        manager.initialize().join();

        assertTrue(manager.isReachable("X1").join());
        assertEquals(0, c.canReachCalls());
    }

    @Test
    void reachableTransportIdsSkipsFailuresAndTimeouts() {
        manager.registerTransport(transport("hang", 10).onCanReach(d -> new CompletableFuture<>()));
        manager.registerTransport(transport("boom", 15).onCanReach(d -> {
            throw new IllegalStateException("probe crashed");
        }));
        manager.registerTransport(transport("lan", 20).reachAll(true));
        manager.registerTransport(transport("off", 25).reachAll(true).available(false));
        manager.initialize().join();

        CompletableFuture<List<String>> ids = manager.reachableTransportIds("X1");
        assertFalse(ids.isDone());
        advance(Duration.ofSeconds(2));

        assertEquals(List.of("lan"), ids.join());
    }

    @Test
    void nobodyReachableIsFalse() {
        manager.registerTransport(transport("a", 10));
        manager.initialize().join();

        assertFalse(manager.isReachable("X1").join());
    }

    @Test
    void reachabilityBeforeInitializeAsksNoTransport() {
        FakeTransport lan = transport("lan", 10).reachAll(true);
        manager.registerTransport(lan);

        assertFalse(manager.isReachable("X1").join());
        assertEquals(List.of(), manager.reachableTransportIds("X1").join());
        assertEquals(0, lan.canReachCalls());

        manager.initialize().join();
        assertTrue(manager.isReachable("X1").join());
    }

    // =========================================================================
    // Inbound
    // =========================================================================

    @Test
    void inboundFromEveryTransportReachesExternalSubscribers() {
        FakeTransport lan = transport("lan", 10);
        FakeTransport ble = transport("ble", 20);
        manager.registerTransport(lan);
        manager.registerTransport(ble);
        manager.initialize().join();
        List<TransportMessage> received = new ArrayList<>();
        manager.incomingMessages().subscribe(received::add);

        lan.receive(TransportMessage.builder("PEER", MessageKind.HELLO).build());
        ble.receive(TransportMessage.builder("PEER", MessageKind.SYNC).build());

        assertEquals(List.of("lan", "ble"),
                received.stream().map(TransportMessage::receivedVia).collect(Collectors.toList()));
    }

    @Test
    void apiRequestIsForwardedAndNonApiRequestIgnoredButBothPublished() {
        FakeTransport lan = transport("lan", 10).reaches("PEER");
        manager.registerTransport(lan);
        manager.initialize().join();
        List<TransportMessage> received = new ArrayList<>();
        manager.incomingMessages().subscribe(received::add);

        lan.receive(TransportMessage.apiRequest("PEER", "GET", "/status", Map.of(), null, false));
        lan.receive(TransportMessage.apiRequest("PEER", "GET", "/api/status", Map.of(), null, false));

        assertEquals(2, received.size());
        assertEquals(List.of("/api/status"),
                localCalls.stream().map(LocalApiRequest::path).collect(Collectors.toList()));
        assertEquals(1, lan.asyncMessages().size());
        assertEquals(MessageKind.RESPONSE, lan.asyncMessages().get(0).kind());
    }

    @Test
    void transportRegisteredAfterInitializeIsInitializedAndMerged() {
        manager.initialize().join();
        FakeTransport late = transport("late", 10);
        List<TransportMessage> received = new ArrayList<>();
        manager.incomingMessages().subscribe(received::add);

        manager.registerTransport(late).join();
        late.receive(TransportMessage.builder("PEER", MessageKind.HELLO).build());

        assertTrue(late.isInitialized());
        assertEquals(1, received.size());
    }

    @Test
    void transportRegisteredWhileInitializingIsInitializedAndMerged() {
        CompletableFuture<Void> gate = new CompletableFuture<>();
        FakeTransport slow = transport("slow", 10).gateInitialize(gate);
        manager.registerTransport(slow);
        List<TransportMessage> received = new ArrayList<>();
        manager.incomingMessages().subscribe(received::add);

        CompletableFuture<Void> init = manager.initialize();
        FakeTransport lan = transport("lan", 20);
        CompletableFuture<Void> registered = manager.registerTransport(lan);
        assertFalse(init.isDone());
        assertFalse(registered.isDone());

        gate.complete(null);
        init.join();
        registered.join();

        assertTrue(lan.isInitialized());
        assertEquals(1, lan.initializeCalls());
        TransportResult result = manager.send(message("X", false), null, Set.of("slow")).join();
        assertEquals("lan", result.transportUsed().orElseThrow());
        lan.receive(TransportMessage.builder("PEER", MessageKind.HELLO).build());
        assertEquals(1, received.size());
    }

    @Test
    void unregisterDisposesAndDetachesInbound() {
        FakeTransport lan = transport("lan", 10);
        manager.registerTransport(lan);
        manager.initialize().join();
        List<TransportMessage> received = new ArrayList<>();
        manager.incomingMessages().subscribe(received::add);

        assertTrue(manager.unregisterTransport("lan").join());
        lan.receive(TransportMessage.builder("PEER", MessageKind.HELLO).build());

        assertEquals(1, lan.disposeCalls());
        assertTrue(received.isEmpty());
        assertTrue(manager.transports().isEmpty());
        assertFalse(manager.unregisterTransport("lan").join());
    }

    @Test
    void duplicateTransportIdIsRejected() {
        manager.registerTransport(transport("lan", 10));

        assertThrows(IllegalArgumentException.class, () -> manager.registerTransport(transport("lan", 20)));
    }

    // =========================================================================
    // Lifecycle and status
    // =========================================================================

    @Test
    void initializeIsIdempotent() {
        FakeTransport lan = transport("lan", 10);
        manager.registerTransport(lan);

        manager.initialize().join();
        manager.initialize().join();

        assertEquals(1, lan.initializeCalls());
    }

    @Test
    void disposeCleansUpAndAllowsReinitialization() {
        FakeTransport good = transport("good", 10).alwaysFail("offline");
        FakeTransport bad = transport("bad", 20).failDispose(new IllegalStateException("stuck")).alwaysFail("offline");
        manager.registerTransport(good);
        manager.registerTransport(bad);
        manager.initialize().join();
        manager.send(message("X", true)).join();
        List<TransportMessage> received = new ArrayList<>();
        manager.incomingMessages().subscribe(received::add);

        manager.dispose().join();

        assertFalse(manager.isInitialized());
        assertTrue(manager.transports().isEmpty());
        assertEquals(0, manager.pendingCount());
        assertEquals(1, good.disposeCalls());
        assertEquals(1, bad.disposeCalls());
        assertTrue(sink.eventsOfType(TransportEvent.class).stream()
                .anyMatch(e -> e.kind() == TransportEvent.Kind.DISPOSAL_FAILED));

        FakeTransport fresh = transport("fresh", 10);
        manager.registerTransport(fresh);
        manager.initialize().join();
        List<TransportMessage> afterRestart = new ArrayList<>();
        manager.incomingMessages().subscribe(afterRestart::add);
        fresh.receive(TransportMessage.builder("PEER", MessageKind.HELLO).build());

        assertTrue(manager.isInitialized());
        assertTrue(received.isEmpty());
        assertEquals(1, afterRestart.size());
    }

    @Test
    void statusReflectsTransportsAndQueue() {
        FakeTransport lan = transport("lan", 10);
        manager.registerTransport(lan);
        manager.registerTransport(transport("relay", 30).available(false));
        manager.initialize().join();
        manager.send(message("X", false)).join();

        ConnectionStatus status = manager.status();

        assertTrue(status.initialized());
        assertEquals("priority", status.routingStrategy());
        assertEquals(2, status.transports().size());
        assertEquals("lan", status.transports().get(0).id());
        assertFalse(status.transports().get(1).available());
        assertEquals(1, manager.allMetrics().get("lan").totalSent());
        assertEquals(List.of("lan"),
                manager.availableTransports().stream().map(Transport::id).collect(Collectors.toList()));

        manager.logStatus();
        assertTrue(sink.hasEventOfType(ConnectionStatus.class));
    }

    @Test
    void replacingStrategyIsReported() {
        manager.setRoutingStrategy(new FailoverRoutingStrategy(List.of("relay")));

        assertEquals("failover[relay]", manager.routingStrategy().name());
        assertTrue(sink.eventsOfType(TransportEvent.class).stream()
                .anyMatch(e -> e.kind() == TransportEvent.Kind.STRATEGY_CHANGED));
    }
}
