package com.questrail.meshroute.transport;

import com.questrail.meshroute.message.TransportMessage;

import java.util.function.Consumer;

/**
 * Subscribable stream of inbound {@link TransportMessage}s.
 *
 * <p>Broadcast semantics: every active subscriber receives every element
 * published after it subscribed. Nothing is buffered for late
 * subscribers.</p>
 */
public interface MessageStream {

    Subscription subscribe(Consumer<? super TransportMessage> subscriber);
}
