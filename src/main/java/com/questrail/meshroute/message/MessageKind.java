package com.questrail.meshroute.message;

/**
 * Kind of a {@link TransportMessage}. Routing strategies may dispatch on it
 * and the inbound dispatcher forwards {@link #REQUEST} and
 * {@link #DIRECT_MESSAGE} to the local application.
 */
public enum MessageKind {
    /** HTTP-style API request (method, path, headers, body). */
    REQUEST,
    /** Reply to a {@link #REQUEST}. */
    RESPONSE,
    /** Signed one-to-one message. */
    DIRECT_MESSAGE,
    /** Signed message addressed to a room; the room id travels in the path. */
    ROOM_MESSAGE,
    SYNC,
    HELLO,
    HEARTBEAT
}
