package com.questrail.meshroute.message;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Generates time-ordered message ids of the form
 * {@code <epochMillis>-<sequence>}.
 *
 * <p>The sequence is process-wide, so two ids created in the same
 * millisecond by concurrent callers still differ.</p>
 */
public final class MessageIds {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private MessageIds() {
    }

    public static String next() {
        return System.currentTimeMillis() + "-" + SEQUENCE.incrementAndGet();
    }
}
