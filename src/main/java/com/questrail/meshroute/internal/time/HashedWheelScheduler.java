package com.questrail.meshroute.internal.time;

import io.netty.util.HashedWheelTimer;
import io.netty.util.Timeout;
import io.netty.util.concurrent.DefaultThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * HashedWheelScheduler
 * =============================================================================
 * {@link MonotonicScheduler} backed by Netty's {@link HashedWheelTimer}.
 *
 * <p>The routing core arms a great many short deadlines (one per
 * reachability probe, quality probe and transport send) and cancels almost
 * all of them because the guarded call finishes first. A timer wheel keeps
 * both operations O(1). Precision is bounded by the tick duration, which is
 * fine for second-scale probe timeouts.</p>
 *
 * <h2>Netty containment rule</h2>
 * Netty types do not escape this class; callers only see
 * {@link Cancellable}.
 *
 * <p>This class owns its timer thread; call {@link #stop()} on shutdown.</p>
 */
public final class HashedWheelScheduler implements MonotonicScheduler, AutoCloseable {

    private final HashedWheelTimer timer;
    private final MonotonicClock clock;

    public HashedWheelScheduler(MonotonicClock clock) {
        this(clock, Duration.ofMillis(10));
    }

    public HashedWheelScheduler(MonotonicClock clock, Duration tick) {
        this.clock = Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(tick, "tick");
        if (tick.isZero() || tick.isNegative()) {
            throw new IllegalArgumentException("tick must be > 0");
        }
        this.timer = new HashedWheelTimer(
                new DefaultThreadFactory("meshroute-timeouts", true),
                tick.toNanos(),
                TimeUnit.NANOSECONDS);
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());
        Timeout timeout = timer.newTimeout(t -> task.run(), delayNanos, TimeUnit.NANOSECONDS);
        return timeout::cancel;
    }

    /**
     * Stops the wheel thread. Pending deadlines are discarded.
     */
    public void stop() {
        timer.stop();
    }

    @Override
    public void close() {
        stop();
    }
}
