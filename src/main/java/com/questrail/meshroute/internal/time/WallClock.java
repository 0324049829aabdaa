package com.questrail.meshroute.internal.time;

import java.time.Instant;

/**
 * Wall-clock source for message creation stamps, TTL checks, device
 * last-seen values and observability timestamps.
 */
@FunctionalInterface
public interface WallClock
{
    Instant now();
}
