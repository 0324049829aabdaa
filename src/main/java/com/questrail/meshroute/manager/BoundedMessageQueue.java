package com.questrail.meshroute.manager;

import com.questrail.meshroute.message.TransportMessage;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * BoundedMessageQueue
 * -----------------------------------------------------------------------------
 * Store-and-forward FIFO with a fixed capacity. Admitting a message into a
 * full queue evicts the oldest entries first.
 *
 * <p>All methods are synchronized on the queue; none of them call out.</p>
 */
public final class BoundedMessageQueue {

    private final int capacity;
    private final ArrayDeque<TransportMessage> entries = new ArrayDeque<>();

    public BoundedMessageQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Appends {@code message}.
     *
     * @return the entries evicted to make room, oldest first; usually empty
     */
    public synchronized List<TransportMessage> offer(TransportMessage message) {
        Objects.requireNonNull(message, "message");
        List<TransportMessage> evicted = List.of();
        while (entries.size() >= capacity) {
            if (evicted.isEmpty()) {
                evicted = new ArrayList<>(1);
            }
            evicted.add(entries.pollFirst());
        }
        entries.addLast(message);
        return evicted;
    }

    /**
     * Removes every message expired at {@code now}.
     *
     * @return the removed messages, in queue order
     */
    public synchronized List<TransportMessage> removeExpired(Instant now) {
        List<TransportMessage> removed = new ArrayList<>();
        Iterator<TransportMessage> it = entries.iterator();
        while (it.hasNext()) {
            TransportMessage m = it.next();
            if (m.isExpired(now)) {
                it.remove();
                removed.add(m);
            }
        }
        return removed;
    }

    /** Empties the queue and returns its former contents, oldest first. */
    public synchronized List<TransportMessage> drain() {
        List<TransportMessage> all = new ArrayList<>(entries);
        entries.clear();
        return all;
    }

    public synchronized List<TransportMessage> snapshot() {
        return List.copyOf(entries);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized boolean isEmpty() {
        return entries.isEmpty();
    }

    public synchronized void clear() {
        entries.clear();
    }
}
