package com.questrail.meshroute.observability;

/**
 * Receives observability events from the routing core.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks may arrive on any thread that completes a transport future,
 * a scheduler thread, or the caller's thread. Implementations must be
 * thread-safe and must not block.</p>
 */
public interface RoutingObservabilitySink {

    void onDelivery(DeliveryEvent event);

    void onQueue(QueueEvent event);

    void onTransport(TransportEvent event);

    void onInbound(InboundEvent event);

    void onSession(SessionEvent event);

    /**
     * Called for a status snapshot requested via
     * {@code ConnectionManager.logStatus()}.
     */
    void onStatus(ConnectionStatus status);

    void onError(RoutingErrorEvent event);
}
