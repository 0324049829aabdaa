package com.questrail.meshroute.transport;

/**
 * Handle returned by {@link MessageStream#subscribe}. Cancelling is
 * idempotent.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    void cancel();

    @Override
    default void close() {
        cancel();
    }
}
