package com.questrail.meshroute.session;

import com.questrail.meshroute.config.TransferSessionConfig;
import com.questrail.meshroute.observability.RecordingObservabilitySink;
import com.questrail.meshroute.observability.SessionEvent;
import com.questrail.meshroute.time.DeterministicScheduler;
import com.questrail.meshroute.time.ManualMonotonicClock;
import com.questrail.meshroute.time.ManualWallClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TransferSessionRegistryTest {

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private RecordingObservabilitySink sink;
    private ScriptedConnector connector;
    private TransferSessionRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        sink = new RecordingObservabilitySink();
        connector = new ScriptedConnector();
        registry = new TransferSessionRegistry(
                TransferSessionConfig.defaults(), connector, clock, scheduler, new ManualWallClock(), sink);
    }

    @Test
    void secondStartReturnsSameSession() {
        TransferSession first = registry.start("X1", 100).join();
        TransferSession second = registry.start("x1 ", 999_999).join();

        assertSame(first, second);
        assertEquals(100, second.expectedTotalBytes(), "reuse keeps the original session");
        assertEquals(1, registry.activeCount());
        assertEquals(List.of(SessionEvent.Kind.STARTED, SessionEvent.Kind.REUSED), sink.sessionKinds());
    }

    @Test
    void endedSessionIsReplacedByNewOne() {
        TransferSession first = registry.start("X1", 100).join();

        assertTrue(registry.end("X1"));
        TransferSession second = registry.start("X1", 100).join();

        assertNotSame(first, second);
        assertFalse(first.isActive());
        assertTrue(second.isActive());
        assertFalse(registry.end("NOBODY"));
    }

    @Test
    void lookupsAreCaseInsensitive() {
        registry.start("ab1cd", 2048).join();

        assertTrue(registry.hasActiveSession("AB1CD"));
        assertEquals(2048, registry.expectedBytes(" Ab1Cd ").getAsLong());
        assertTrue(registry.expectedBytes("OTHER").isEmpty());
    }

    @Test
    void smallTransferIsNotUpgraded() {
        connector.supported = true;

        TransferSession session = registry.start("X1", 10 * 1024 - 1).join();

        assertFalse(session.isUpgraded());
        assertEquals(0, connector.connectCalls.size());
        assertFalse(registry.shouldUseUpgraded("X1"));
    }

    @Test
    void largeTransferUpgradesAtThreshold() {
        connector.supported = true;

        TransferSession session = registry.start("X1", 10 * 1024).join();

        assertTrue(session.isUpgraded());
        assertEquals(List.of("X1"), connector.connectCalls);
        assertEquals("10.0.0.7:7000", registry.connectionAddress("X1").orElseThrow());
        assertTrue(registry.shouldUseUpgraded("x1"));
        assertTrue(sink.sessionKinds().contains(SessionEvent.Kind.UPGRADED));
    }

    @Test
    void unsupportedDeviceIsNeverUpgraded() {
        TransferSession session = registry.start("X1", 1_000_000).join();

        assertFalse(session.isUpgraded());
        assertTrue(connector.connectCalls.isEmpty());
    }

    @Test
    void failedUpgradeLeavesPlainSession() {
        connector.supported = true;
        connector.result = () -> CompletableFuture.failedFuture(new IllegalStateException("wifi busy"));

        TransferSession session = registry.start("X1", 50_000).join();

        assertTrue(session.isActive());
        assertFalse(session.isUpgraded());
        assertTrue(sink.sessionKinds().contains(SessionEvent.Kind.UPGRADE_FAILED));
    }

    @Test
    void startCompletesOnlyAfterUpgradeSettles() {
        connector.supported = true;
        CompletableFuture<UpgradedConnection> pending = new CompletableFuture<>();
        connector.result = () -> pending;

        CompletableFuture<TransferSession> started = registry.start("X1", 50_000);
        assertFalse(started.isDone());

        pending.complete(new UpgradedConnection("X1", "10.0.0.7:7000"));

        assertTrue(started.join().isUpgraded());
    }

    @Test
    void connectionArrivingAfterEndIsReleased() {
        connector.supported = true;
        CompletableFuture<UpgradedConnection> pending = new CompletableFuture<>();
        connector.result = () -> pending;
        CompletableFuture<TransferSession> started = registry.start("X1", 50_000);

        registry.end("X1");
        assertTrue(started.isDone(), "ending unblocks waiting callers");
        UpgradedConnection late = new UpgradedConnection("X1", "10.0.0.7:7000");
        pending.complete(late);

        assertEquals(List.of(late), connector.released);
        assertFalse(started.join().isUpgraded());
    }

    @Test
    void sessionExpiresAfterMaxDuration() {
        connector.supported = true;
        TransferSession session = registry.start("X1", 50_000, Duration.ofSeconds(30)).join();

        clock.advance(Duration.ofSeconds(29));
        scheduler.runDueTasks();
        assertTrue(session.isActive());

        clock.advance(Duration.ofSeconds(1));
        scheduler.runDueTasks();

        assertFalse(session.isActive());
        assertFalse(registry.hasActiveSession("X1"));
        assertEquals(1, connector.released.size());
        assertTrue(sink.sessionKinds().contains(SessionEvent.Kind.EXPIRED));
    }

    @Test
    void manualEndCancelsExpiry() {
        TransferSession session = registry.start("X1", 10).join();

        session.end();
        TransferSession next = registry.start("X1", 10).join();
        clock.advance(Duration.ofMinutes(5));
        scheduler.runDueTasks();

        // only the second session's own timer may end it
        assertFalse(next.isActive());
        assertEquals(1, sink.sessionKinds().stream().filter(k -> k == SessionEvent.Kind.EXPIRED).count());
    }

    @Test
    void expiryAfterManualEndIsSilent() {
        TransferSession session = registry.start("X1", 10, Duration.ofSeconds(30)).join();

        assertTrue(registry.end("X1"));
        assertFalse(registry.end(session));
        session.end();
        clock.advance(Duration.ofSeconds(30));
        scheduler.runDueTasks();

        assertEquals(List.of(SessionEvent.Kind.STARTED, SessionEvent.Kind.ENDED), sink.sessionKinds());
    }

    @Test
    void concurrentEndsEmitOneEventAndOneRelease() throws Exception {
        connector.supported = true;
        ExecutorService pool = Executors.newFixedThreadPool(2);
        int rounds = 200;
        try {
            for (int i = 0; i < rounds; i++) {
                TransferSession session = registry.start("X1", 50_000).join();
                CountDownLatch go = new CountDownLatch(1);
                Future<Boolean> a = pool.submit(() -> {
                    go.await();
                    return registry.end(session);
                });
                Future<Boolean> b = pool.submit(() -> {
                    go.await();
                    return registry.end(session);
                });
                go.countDown();

                assertTrue(a.get(5, TimeUnit.SECONDS) ^ b.get(5, TimeUnit.SECONDS), "exactly one caller ends it");
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(rounds, sink.sessionKinds().stream().filter(k -> k == SessionEvent.Kind.ENDED).count());
        assertEquals(rounds, connector.released.size());
    }

    @Test
    void endAllReleasesEveryConnection() {
        connector.supported = true;
        registry.start("A", 50_000).join();
        registry.start("B", 50_000).join();
        registry.start("C", 10).join();

        registry.endAll();

        assertEquals(0, registry.activeCount());
        assertEquals(2, connector.released.size());
    }

    @Test
    void releaseFailureIsReportedNotThrown() {
        connector.supported = true;
        connector.failRelease = true;
        registry.start("X1", 50_000).join();

        assertTrue(registry.end("X1"));
        assertTrue(sink.hasEventOfType(com.questrail.meshroute.observability.RoutingErrorEvent.class));
    }

    @Test
    void invalidArgumentsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> registry.start("X1", -1));
        assertThrows(IllegalArgumentException.class, () -> registry.start("X1", 10, Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> registry.start("  ", 10));
        assertEquals(0, registry.activeCount());
    }

    private static final class ScriptedConnector implements UpgradeConnector {
        volatile boolean supported;
        volatile boolean failRelease;
        volatile java.util.function.Supplier<CompletableFuture<UpgradedConnection>> result =
                () -> CompletableFuture.completedFuture(new UpgradedConnection("X1", "10.0.0.7:7000"));
        final List<String> connectCalls = new CopyOnWriteArrayList<>();
        final List<UpgradedConnection> released = new CopyOnWriteArrayList<>();

        @Override
        public boolean supportsUpgrade(String deviceId) {
            return supported;
        }

        @Override
        public CompletableFuture<UpgradedConnection> connect(String deviceId) {
            connectCalls.add(deviceId);
            return result.get();
        }

        @Override
        public void release(UpgradedConnection connection) {
            if (failRelease) {
                throw new IllegalStateException("socket already closed");
            }
            released.add(connection);
        }
    }
}
