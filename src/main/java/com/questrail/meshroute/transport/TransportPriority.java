package com.questrail.meshroute.transport;

/**
 * Suggested priority bands for {@link Transport#priority()}. Lower values
 * are preferred by the priority routing strategy.
 */
public final class TransportPriority {

    /** Local-network request/response. */
    public static final int LOCAL_NETWORK = 10;

    /** Short-range offline radio. */
    public static final int SHORT_RANGE_OFFLINE = 20;

    /** Long-range offline radio. */
    public static final int LONG_RANGE_OFFLINE = 25;

    /** Relay through an internet station. */
    public static final int RELAY = 30;

    private TransportPriority() {
    }
}
