package com.questrail.meshroute.transport;

import com.questrail.meshroute.message.TransportMessage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * MessageBroadcast
 * -----------------------------------------------------------------------------
 * Unbounded, multi-subscriber {@link MessageStream} that a producer publishes
 * into.
 *
 * <ul>
 *   <li>Subscribers are invoked synchronously on the publishing thread, in
 *       subscription order.</li>
 *   <li>A subscriber that throws is logged and skipped; the remaining
 *       subscribers still receive the element.</li>
 *   <li>After {@link #close()} all subscribers are dropped and further
 *       publishes and subscriptions are no-ops.</li>
 * </ul>
 */
public final class MessageBroadcast implements MessageStream {
    private static final Logger log = LoggerFactory.getLogger(MessageBroadcast.class);

    private final String name;
    private final List<Consumer<? super TransportMessage>> subscribers = new CopyOnWriteArrayList<>();
    private volatile boolean closed;

    public MessageBroadcast(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public Subscription subscribe(Consumer<? super TransportMessage> subscriber) {
        Objects.requireNonNull(subscriber, "subscriber");
        if (closed) {
            return () -> { };
        }
        // Wrap so the same consumer can subscribe twice and cancel independently.
        Consumer<? super TransportMessage> entry = subscriber::accept;
        subscribers.add(entry);
        return () -> subscribers.remove(entry);
    }

    /**
     * Delivers {@code message} to every current subscriber.
     *
     * @return {@code false} if the broadcast is closed
     */
    public boolean publish(TransportMessage message) {
        Objects.requireNonNull(message, "message");
        if (closed) {
            return false;
        }
        for (Consumer<? super TransportMessage> s : subscribers) {
            try {
                s.accept(message);
            } catch (RuntimeException e) {
                log.warn("{}: subscriber failed on message {}", name, message.id(), e);
            }
        }
        return true;
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    public boolean isClosed() {
        return closed;
    }

    public void close() {
        closed = true;
        subscribers.clear();
    }
}
