package com.questrail.meshroute.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of RoutingObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jRoutingObservabilitySink implements RoutingObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jRoutingObservabilitySink.class);

    @Override
    public void onDelivery(DeliveryEvent event) {
        switch (event.kind()) {
            case SENDING -> log.debug("Sending {} {} to {}", event.detail(), event.messageId(), event.deviceId());
            case ATTEMPT -> log.debug("Trying {} for {}", event.transportId(), event.messageId());
            case DELIVERED -> log.info("Delivered {} to {} via {} ({})",
                event.messageId(), event.deviceId(), event.transportId(), event.detail());
            case TRANSPORT_FAILED -> log.info("Transport {} failed for {}: {}",
                event.transportId(), event.messageId(), event.detail());
            case NO_ROUTE, ALL_FAILED, NOT_INITIALIZED -> log.warn("Message {} to {} not delivered: {}",
                event.messageId(), event.deviceId(), event.detail());
        }
    }

    @Override
    public void onQueue(QueueEvent event) {
        switch (event.kind()) {
            case DROPPED_OVERFLOW -> log.warn("Queue full, dropped {} (size {})", event.messageId(), event.queueSize());
            case EXPIRED -> log.info("Dropped expired message {} (size {})", event.messageId(), event.queueSize());
            case RETRY_PASS_STARTED -> log.info("Retrying {} queued messages", event.queueSize());
            default -> log.debug("Queue {} {} (size {})", event.kind(), event.messageId(), event.queueSize());
        }
    }

    @Override
    public void onTransport(TransportEvent event) {
        switch (event.kind()) {
            case INITIALIZATION_FAILED, DISPOSAL_FAILED -> log.warn("Transport {} {}: {}",
                event.transportId(), event.kind(), event.detail());
            case STRATEGY_CHANGED -> log.info("Routing strategy set to {}", event.detail());
            case INBOUND_REBUILT -> log.debug("Inbound stream rebuilt: {}", event.detail());
            default -> {
                if (event.transportId() == null) {
                    log.info("ConnectionManager {} {}", event.kind(), event.detail() != null ? event.detail() : "");
                } else {
                    log.info("Transport {} {} {}", event.transportId(), event.kind(),
                        event.detail() != null ? event.detail() : "");
                }
            }
        }
    }

    @Override
    public void onInbound(InboundEvent event) {
        switch (event.kind()) {
            case RECEIVED -> log.debug("Received {} from {}", event.messageId(), event.deviceId());
            case FORWARD_FAILED, DM_REJECTED, RESPONSE_DROPPED -> log.warn("Inbound {} from {} {}: {}",
                event.messageId(), event.deviceId(), event.kind(), event.detail());
            default -> log.info("Inbound {} from {} {}: {}",
                event.messageId(), event.deviceId(), event.kind(), event.detail());
        }
    }

    @Override
    public void onSession(SessionEvent event) {
        if (event.kind() == SessionEvent.Kind.UPGRADE_FAILED) {
            log.warn("Transfer session {} {}: {}", event.deviceId(), event.kind(), event.detail());
        } else {
            log.info("Transfer session {} {} {}", event.deviceId(), event.kind(),
                event.detail() != null ? event.detail() : "");
        }
    }

    @Override
    public void onStatus(ConnectionStatus status) {
        log.info("ConnectionManager status: initialized={}, strategy={}, transports={}, queue={}",
            status.initialized(), status.routingStrategy(), status.transports().size(), status.queueSize());
        for (ConnectionStatus.TransportStatus t : status.transports()) {
            log.info("  - {} ({}): available={}, initialized={}, priority={}, successRate={}, avgLatencyMs={}",
                t.id(), t.displayName(), t.available(), t.initialized(), t.priority(),
                String.format("%.2f", t.successRate()), String.format("%.1f", t.averageLatencyMs()));
        }
    }

    @Override
    public void onError(RoutingErrorEvent event) {
        log.error("Routing error: {}", event.message(), event.cause());
    }
}
