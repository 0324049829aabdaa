package com.questrail.meshroute.runtime;

import com.questrail.meshroute.config.ConnectionManagerConfig;
import com.questrail.meshroute.config.TransferSessionConfig;
import com.questrail.meshroute.internal.time.HashedWheelScheduler;
import com.questrail.meshroute.internal.time.MonotonicClock;
import com.questrail.meshroute.internal.time.MonotonicScheduler;
import com.questrail.meshroute.internal.time.ScheduledExecutorScheduler;
import com.questrail.meshroute.internal.time.SystemMonotonicClock;
import com.questrail.meshroute.internal.time.SystemWallClock;
import com.questrail.meshroute.internal.time.Timeouts;
import com.questrail.meshroute.local.HttpLocalApiClient;
import com.questrail.meshroute.local.LocalApiClient;
import com.questrail.meshroute.manager.ConnectionManager;
import com.questrail.meshroute.observability.NullObservabilitySink;
import com.questrail.meshroute.observability.RoutingErrorEvent;
import com.questrail.meshroute.observability.RoutingObservabilitySink;
import com.questrail.meshroute.session.TransferSessionRegistry;
import com.questrail.meshroute.session.UpgradeConnector;
import com.questrail.meshroute.transport.Transport;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * MeshRouteRuntime
 * =============================================================================
 * Composition root and lifecycle owner for a production routing stack.
 *
 * <p>Wires the system clocks, a single-threaded scheduled executor for the
 * queue tick and session expiry, a timer wheel for per-call deadlines, the
 * loopback client, the transfer session registry and the connection
 * manager. Transports handed to the builder are registered before
 * {@link #start()}.</p>
 */
public final class MeshRouteRuntime {
    private static final long STOP_GRACE_SECONDS = 5;

    private final ConnectionManager connectionManager;
    private final TransferSessionRegistry sessions;
    private final Timeouts timeouts;
    private final ScheduledExecutorService schedulerExecutor;
    private final HashedWheelScheduler deadlineScheduler;
    private final RoutingObservabilitySink observabilitySink;

    private MeshRouteRuntime(ConnectionManager connectionManager,
                             TransferSessionRegistry sessions,
                             Timeouts timeouts,
                             ScheduledExecutorService schedulerExecutor,
                             HashedWheelScheduler deadlineScheduler,
                             RoutingObservabilitySink observabilitySink) {
        this.connectionManager = connectionManager;
        this.sessions = sessions;
        this.timeouts = timeouts;
        this.schedulerExecutor = schedulerExecutor;
        this.deadlineScheduler = deadlineScheduler;
        this.observabilitySink = observabilitySink;
    }

    /** Initializes the connection manager and, through it, every transport. */
    public CompletableFuture<Void> start() {
        return connectionManager.initialize();
    }

    /**
     * Disposes the connection manager, ends every transfer session and shuts
     * the schedulers down. Waits at most five seconds for the disposal.
     */
    public void stop() {
        try {
            connectionManager.dispose().get(STOP_GRACE_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            observabilitySink.onError(new RoutingErrorEvent(SystemWallClock.INSTANCE.now(),
                    "Connection manager disposal did not complete cleanly", e));
        }

        sessions.endAll();
        deadlineScheduler.stop();

        schedulerExecutor.shutdown();
        try {
            if (!schedulerExecutor.awaitTermination(STOP_GRACE_SECONDS, TimeUnit.SECONDS)) {
                schedulerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            schedulerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public ConnectionManager connectionManager() {
        return connectionManager;
    }

    public TransferSessionRegistry sessions() {
        return sessions;
    }

    /** Deadline helper, for building routing strategies against this runtime. */
    public Timeouts timeouts() {
        return timeouts;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ConnectionManagerConfig config = ConnectionManagerConfig.defaults();
        private TransferSessionConfig sessionConfig = TransferSessionConfig.defaults();
        private RoutingObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private LocalApiClient localApiClient;
        private UpgradeConnector upgradeConnector = UpgradeConnector.none();
        private final List<Transport> transports = new ArrayList<>();

        public Builder withConfig(ConnectionManagerConfig config) {
            this.config = config;
            return this;
        }

        public Builder withSessionConfig(TransferSessionConfig config) {
            this.sessionConfig = config;
            return this;
        }

        public Builder withObservabilitySink(RoutingObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /** Overrides the default HTTP client against {@code localhost:localApiPort}. */
        public Builder withLocalApiClient(LocalApiClient client) {
            this.localApiClient = client;
            return this;
        }

        public Builder withUpgradeConnector(UpgradeConnector connector) {
            this.upgradeConnector = connector;
            return this;
        }

        public Builder withTransport(Transport transport) {
            this.transports.add(Objects.requireNonNull(transport, "transport"));
            return this;
        }

        public MeshRouteRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(sessionConfig, "sessionConfig");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(upgradeConnector, "upgradeConnector");

            // 1. Clocks and schedulers
            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            ScheduledExecutorService schedulerExec = Executors.newScheduledThreadPool(1);
            MonotonicScheduler scheduler = new ScheduledExecutorScheduler(schedulerExec, clock);
            HashedWheelScheduler wheel = new HashedWheelScheduler(clock);
            Timeouts timeouts = new Timeouts(clock, wheel);

            // 2. Local boundary
            LocalApiClient localApi = localApiClient != null
                    ? localApiClient
                    : new HttpLocalApiClient(config.localApiPort());

            // 3. Sessions
            TransferSessionRegistry sessions = new TransferSessionRegistry(
                    sessionConfig,
                    upgradeConnector,
                    clock,
                    scheduler,
                    SystemWallClock.INSTANCE,
                    observabilitySink
            );

            // 4. Manager and transports
            ConnectionManager manager = new ConnectionManager(
                    config,
                    timeouts,
                    scheduler,
                    SystemWallClock.INSTANCE,
                    localApi,
                    observabilitySink
            );
            for (Transport t : transports) {
                manager.registerTransport(t);
            }

            return new MeshRouteRuntime(manager, sessions, timeouts, schedulerExec, wheel, observabilitySink);
        }
    }
}
