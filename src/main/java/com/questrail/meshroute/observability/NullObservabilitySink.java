package com.questrail.meshroute.observability;

/**
 * No-op implementation of RoutingObservabilitySink.
 */
public final class NullObservabilitySink implements RoutingObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onDelivery(DeliveryEvent event) {}

    @Override
    public void onQueue(QueueEvent event) {}

    @Override
    public void onTransport(TransportEvent event) {}

    @Override
    public void onInbound(InboundEvent event) {}

    @Override
    public void onSession(SessionEvent event) {}

    @Override
    public void onStatus(ConnectionStatus status) {}

    @Override
    public void onError(RoutingErrorEvent event) {}
}
