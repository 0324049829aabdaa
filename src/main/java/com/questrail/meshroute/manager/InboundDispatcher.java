package com.questrail.meshroute.manager;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.meshroute.config.ConnectionManagerConfig;
import com.questrail.meshroute.internal.time.Timeouts;
import com.questrail.meshroute.internal.time.WallClock;
import com.questrail.meshroute.local.LocalApiClient;
import com.questrail.meshroute.local.LocalApiRequest;
import com.questrail.meshroute.local.LocalApiResponse;
import com.questrail.meshroute.message.MessageKind;
import com.questrail.meshroute.message.MessagePayload;
import com.questrail.meshroute.message.TransportMessage;
import com.questrail.meshroute.observability.InboundEvent;
import com.questrail.meshroute.observability.RoutingErrorEvent;
import com.questrail.meshroute.observability.RoutingObservabilitySink;
import com.questrail.meshroute.transport.Transport;
import com.questrail.meshroute.util.Jsons;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * InboundDispatcher
 * =============================================================================
 * Hands selected inbound messages to the local application server.
 *
 * <h2>Requests</h2>
 * A {@link MessageKind#REQUEST} whose path starts with the configured API
 * prefix is replayed against the local server. Its status and body travel
 * back to the origin as a {@link MessageKind#RESPONSE} with id
 * {@code response-<requestId>} and payload
 * <pre>
 *   {"type": "api_response", "id": "&lt;requestId&gt;", "statusCode": 200, "body": "..."}
 * </pre>
 * The response goes out via {@link Transport#sendAsync} on the first
 * available transport that can reach the origin. If none can, it is
 * dropped; responses are never queued. Requests outside the prefix are
 * ignored.
 *
 * <h2>Direct messages</h2>
 * The signed event is POSTed to {@code /api/chat/{senderId}/messages} as
 * {@code {"event": ...}}. 200 and 201 count as delivered.
 *
 * <p>Every other kind is left to external subscribers.</p>
 *
 * <p>A failed or timed-out loopback call becomes a 500 response with body
 * {@code {"error": "..."}}. The future returned by {@link #dispatch} never
 * completes exceptionally.</p>
 */
public final class InboundDispatcher {

    static final String RESPONSE_ID_PREFIX = "response-";

    private final ConnectionManagerConfig config;
    private final LocalApiClient localApi;
    private final Timeouts timeouts;
    private final Supplier<List<Transport>> transports;
    private final WallClock wallClock;
    private final RoutingObservabilitySink sink;

    /**
     * @param transports current transports in registry order, read afresh
     *                   for every response
     */
    public InboundDispatcher(ConnectionManagerConfig config,
                             LocalApiClient localApi,
                             Timeouts timeouts,
                             Supplier<List<Transport>> transports,
                             WallClock wallClock,
                             RoutingObservabilitySink sink) {
        this.config = Objects.requireNonNull(config, "config");
        this.localApi = Objects.requireNonNull(localApi, "localApi");
        this.timeouts = Objects.requireNonNull(timeouts, "timeouts");
        this.transports = Objects.requireNonNull(transports, "transports");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public CompletableFuture<Void> dispatch(TransportMessage message) {
        Objects.requireNonNull(message, "message");
        emit(InboundEvent.Kind.RECEIVED, message, message.kind().name());

        CompletableFuture<Void> handled;
        switch (message.kind()) {
            case REQUEST:
                handled = handleRequest(message);
                break;
            case DIRECT_MESSAGE:
                handled = handleDirectMessage(message);
                break;
            default:
                handled = CompletableFuture.completedFuture(null);
                break;
        }
        return handled.exceptionally(e -> {
            sink.onError(new RoutingErrorEvent(wallClock.now(),
                    "Inbound dispatch failed for " + message.id(), unwrap(e)));
            return null;
        });
    }

    // -------------------------------------------------------------------------
    // Requests
    // -------------------------------------------------------------------------

    private CompletableFuture<Void> handleRequest(TransportMessage request) {
        String path = request.path();
        if (path == null || !path.startsWith(config.apiPrefix())) {
            emit(InboundEvent.Kind.IGNORED_NON_API, request, path);
            return CompletableFuture.completedFuture(null);
        }

        LocalApiRequest call = new LocalApiRequest(
                request.method(), path, request.headers(), request.payload(), config.loopbackTimeout());

        return callLocal(call, request)
                .thenCompose(response -> sendResponse(request, response));
    }

    private CompletableFuture<LocalApiResponse> callLocal(LocalApiRequest call, TransportMessage origin) {
        AtomicReference<String> failure = new AtomicReference<>();
        return timeouts.orElse(
                () -> localApi.call(call),
                config.loopbackTimeout(),
                () -> {
                    failure.set("Loopback call timed out after " + config.loopbackTimeout().toMillis() + "ms");
                    return LocalApiResponse.error(failure.get());
                },
                e -> {
                    failure.set(String.valueOf(unwrap(e)));
                    return LocalApiResponse.error(failure.get());
                })
                .thenApply(response -> {
                    if (failure.get() != null) {
                        emit(InboundEvent.Kind.FORWARD_FAILED, origin, call.path() + ": " + failure.get());
                    } else {
                        emit(InboundEvent.Kind.FORWARDED, origin,
                                call.method() + " " + call.path() + " -> " + response.statusCode());
                    }
                    return response;
                });
    }

    private CompletableFuture<Void> sendResponse(TransportMessage request, LocalApiResponse response) {
        ObjectNode envelope = Jsons.object()
                .put("type", "api_response")
                .put("id", request.id())
                .put("statusCode", response.statusCode())
                .put("body", response.body());

        TransportMessage reply = TransportMessage.builder(request.deviceId(), MessageKind.RESPONSE)
                .id(RESPONSE_ID_PREFIX + request.id())
                .payload(MessagePayload.of(envelope))
                .createdAt(wallClock.now())
                .build();

        List<Transport> candidates = transports.get();
        return sendViaFirstReachable(reply, candidates.iterator());
    }

    private CompletableFuture<Void> sendViaFirstReachable(TransportMessage reply, Iterator<Transport> candidates) {
        while (candidates.hasNext()) {
            Transport t = candidates.next();
            if (!t.isAvailable()) {
                continue;
            }
            return timeouts.orDefault(() -> t.canReach(reply.deviceId()), config.reachabilityTimeout(), Boolean.FALSE)
                    .thenCompose(reachable -> {
                        if (!Boolean.TRUE.equals(reachable)) {
                            return sendViaFirstReachable(reply, candidates);
                        }
                        try {
                            t.sendAsync(reply);
                        } catch (RuntimeException e) {
                            sink.onError(new RoutingErrorEvent(wallClock.now(),
                                    "Error sending response via " + t.id(), e));
                            return sendViaFirstReachable(reply, candidates);
                        }
                        emit(InboundEvent.Kind.RESPONSE_SENT, reply, t.id());
                        return CompletableFuture.completedFuture(null);
                    });
        }
        emit(InboundEvent.Kind.RESPONSE_DROPPED, reply, "no transport can reach " + reply.deviceId());
        return CompletableFuture.completedFuture(null);
    }

    // -------------------------------------------------------------------------
    // Direct messages
    // -------------------------------------------------------------------------

    private CompletableFuture<Void> handleDirectMessage(TransportMessage dm) {
        if (dm.signedEvent() == null) {
            emit(InboundEvent.Kind.DM_DROPPED, dm, "missing signed event");
            return CompletableFuture.completedFuture(null);
        }

        ObjectNode body = Jsons.object();
        body.set("event", dm.signedEvent());

        LocalApiRequest call = new LocalApiRequest(
                "POST",
                chatPath(dm.deviceId()),
                Map.of("Content-Type", "application/json"),
                MessagePayload.of(body),
                config.loopbackTimeout());

        return callLocal(call, dm).thenAccept(response -> {
            int status = response.statusCode();
            if (status == 200 || status == 201) {
                emit(InboundEvent.Kind.DM_DELIVERED, dm, call.path());
            } else {
                emit(InboundEvent.Kind.DM_REJECTED, dm, "status " + status + ": " + response.body());
            }
        });
    }

    String chatPath(String senderId) {
        return config.apiPrefix() + "chat/" + senderId + "/messages";
    }

    // -------------------------------------------------------------------------

    private void emit(InboundEvent.Kind kind, TransportMessage message, String detail) {
        sink.onInbound(new InboundEvent(wallClock.now(), kind, message.id(), message.deviceId(), detail));
    }

    private static Throwable unwrap(Throwable e) {
        return e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
    }
}
