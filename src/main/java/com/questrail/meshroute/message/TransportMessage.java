package com.questrail.meshroute.message;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * TransportMessage
 * =============================================================================
 * Channel-agnostic envelope exchanged between the connection manager and
 * every transport.
 *
 * <h2>Direction</h2>
 * For outbound messages {@link #deviceId()} names the target device. For
 * inbound messages it names the origin, and {@link #receivedVia()} holds the
 * id of the transport the message arrived on. {@code receivedVia} is never
 * set on outbound messages.
 *
 * <h2>Immutability</h2>
 * Instances are immutable. {@link #toBuilder()} is the only way to derive a
 * modified copy, and the copy keeps this message's id unless the builder is
 * told otherwise.
 *
 * <p>The payload and signed event are opaque: the routing core carries them
 * without validating their shape.</p>
 */
public record TransportMessage(
        String id,
        String deviceId,
        MessageKind kind,
        String method,
        String path,
        Map<String, String> headers,
        MessagePayload payload,
        JsonNode signedEvent,
        boolean queueIfOffline,
        Duration ttl,
        Instant createdAt,
        int priority,
        String receivedVia
) {
    public TransportMessage {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(createdAt, "createdAt");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        if (ttl != null && ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be non-negative");
        }
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public Optional<String> methodOpt() {
        return Optional.ofNullable(method);
    }

    public Optional<String> pathOpt() {
        return Optional.ofNullable(path);
    }

    public Optional<MessagePayload> payloadOpt() {
        return Optional.ofNullable(payload);
    }

    public Optional<JsonNode> signedEventOpt() {
        return Optional.ofNullable(signedEvent);
    }

    public Optional<Duration> ttlOpt() {
        return Optional.ofNullable(ttl);
    }

    public Optional<String> receivedViaOpt() {
        return Optional.ofNullable(receivedVia);
    }

    public boolean isInbound() {
        return receivedVia != null;
    }

    /**
     * A message expires once {@code createdAt + ttl} lies before {@code now}.
     * Messages without a TTL never expire.
     */
    public boolean isExpired(Instant now) {
        Objects.requireNonNull(now, "now");
        return ttl != null && createdAt.plus(ttl).isBefore(now);
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static Builder builder(String deviceId, MessageKind kind) {
        return new Builder(deviceId, kind);
    }

    // -------------------------------------------------------------------------
    // Factories
    // -------------------------------------------------------------------------

    /**
     * HTTP-style request to the remote device's local API.
     */
    public static TransportMessage apiRequest(String deviceId,
                                              String method,
                                              String path,
                                              Map<String, String> headers,
                                              MessagePayload body,
                                              boolean queueIfOffline) {
        return builder(deviceId, MessageKind.REQUEST)
                .method(method)
                .path(path)
                .headers(headers)
                .payload(body)
                .queueIfOffline(queueIfOffline)
                .build();
    }

    /**
     * One-to-one message carrying a pre-signed event.
     */
    public static TransportMessage directMessage(String deviceId,
                                                 JsonNode signedEvent,
                                                 boolean queueIfOffline,
                                                 Duration ttl) {
        return builder(deviceId, MessageKind.DIRECT_MESSAGE)
                .signedEvent(Objects.requireNonNull(signedEvent, "signedEvent"))
                .queueIfOffline(queueIfOffline)
                .ttl(ttl)
                .build();
    }

    /**
     * Room message carrying a pre-signed event; the room id travels in
     * {@link #path()}.
     */
    public static TransportMessage roomMessage(String deviceId,
                                               String roomId,
                                               JsonNode signedEvent,
                                               boolean queueIfOffline) {
        return builder(deviceId, MessageKind.ROOM_MESSAGE)
                .path(Objects.requireNonNull(roomId, "roomId"))
                .signedEvent(Objects.requireNonNull(signedEvent, "signedEvent"))
                .queueIfOffline(queueIfOffline)
                .build();
    }

    public static final class Builder {
        private String id;
        private String deviceId;
        private MessageKind kind;
        private String method;
        private String path;
        private Map<String, String> headers;
        private MessagePayload payload;
        private JsonNode signedEvent;
        private boolean queueIfOffline;
        private Duration ttl;
        private Instant createdAt;
        private int priority;
        private String receivedVia;

        private Builder(String deviceId, MessageKind kind) {
            this.deviceId = deviceId;
            this.kind = kind;
        }

        private Builder(TransportMessage m) {
            this.id = m.id;
            this.deviceId = m.deviceId;
            this.kind = m.kind;
            this.method = m.method;
            this.path = m.path;
            this.headers = m.headers;
            this.payload = m.payload;
            this.signedEvent = m.signedEvent;
            this.queueIfOffline = m.queueIfOffline;
            this.ttl = m.ttl;
            this.createdAt = m.createdAt;
            this.priority = m.priority;
            this.receivedVia = m.receivedVia;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder deviceId(String deviceId) {
            this.deviceId = deviceId;
            return this;
        }

        public Builder kind(MessageKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            this.headers = headers;
            return this;
        }

        public Builder payload(MessagePayload payload) {
            this.payload = payload;
            return this;
        }

        public Builder signedEvent(JsonNode signedEvent) {
            this.signedEvent = signedEvent;
            return this;
        }

        public Builder queueIfOffline(boolean queueIfOffline) {
            this.queueIfOffline = queueIfOffline;
            return this;
        }

        public Builder ttl(Duration ttl) {
            this.ttl = ttl;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder receivedVia(String transportId) {
            this.receivedVia = transportId;
            return this;
        }

        public TransportMessage build() {
            return new TransportMessage(
                    id != null ? id : MessageIds.next(),
                    deviceId,
                    kind,
                    method,
                    path,
                    headers,
                    payload,
                    signedEvent,
                    queueIfOffline,
                    ttl,
                    createdAt != null ? createdAt : Instant.now(),
                    priority,
                    receivedVia
            );
        }
    }
}
