package com.questrail.meshroute.internal.time;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Timeouts
 * =============================================================================
 * Bounds an asynchronous call by a deadline that resolves to a fallback value.
 *
 * <p>Every externally bounded operation in the routing core (reachability
 * probe, quality probe, transport send, loopback call) goes through here. An
 * expired deadline never surfaces as an exception: the returned future
 * completes with the fallback and the original call is left to finish on
 * its own, its result discarded. An exceptional completion of the guarded
 * call also resolves to the fallback.</p>
 *
 * <p>The deadline is armed on a {@link MonotonicScheduler} and cancelled as
 * soon as the guarded call completes.</p>
 */
public final class Timeouts {

    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;

    public Timeouts(MonotonicClock clock, MonotonicScheduler scheduler) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    public MonotonicClock clock() {
        return clock;
    }

    public MonotonicScheduler scheduler() {
        return scheduler;
    }

    /**
     * Returns a future that completes with the call's value, or with
     * {@code fallback} if the call fails or the timeout elapses first.
     */
    public <T> CompletableFuture<T> orDefault(Supplier<? extends CompletionStage<T>> call,
                                              Duration timeout,
                                              T fallback) {
        return orElse(call, timeout, () -> fallback, e -> fallback);
    }

    /**
     * Variant of {@link #orDefault} that computes the fallback lazily and
     * distinguishes a timeout from a failure.
     *
     * @param call      the guarded call; a call that throws synchronously is
     *                  treated as a failure
     * @param timeout   deadline, measured on the monotonic clock
     * @param onTimeout value used when the deadline elapses
     * @param onFailure value used when the call completes exceptionally
     */
    public <T> CompletableFuture<T> orElse(Supplier<? extends CompletionStage<T>> call,
                                           Duration timeout,
                                           Supplier<? extends T> onTimeout,
                                           Function<Throwable, ? extends T> onFailure) {
        Objects.requireNonNull(call, "call");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(onTimeout, "onTimeout");
        Objects.requireNonNull(onFailure, "onFailure");

        CompletableFuture<T> result = new CompletableFuture<>();

        CompletionStage<T> stage;
        try {
            stage = Objects.requireNonNull(call.get(), "call returned null");
        } catch (RuntimeException e) {
            result.complete(onFailure.apply(e));
            return result;
        }

        Cancellable deadline = scheduler.scheduleAfter(timeout, clock,
                () -> result.complete(onTimeout.get()));

        stage.whenComplete((value, error) -> {
            deadline.cancel();
            if (error != null) {
                result.complete(onFailure.apply(error));
            } else {
                result.complete(value);
            }
        });
        return result;
    }
}
