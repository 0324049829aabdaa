package com.questrail.meshroute.message;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.meshroute.util.Jsons;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * MessagePayload
 * -----------------------------------------------------------------------------
 * Opaque message body. The routing core never validates its shape; it only
 * needs to know whether the body is binary, text or structured so the
 * loopback forwarder can choose a body encoding and a default
 * {@code Content-Type}.
 */
public sealed interface MessagePayload
        permits MessagePayload.Binary, MessagePayload.Text, MessagePayload.Structured
{
    /** Body bytes as they go on an HTTP request. */
    byte[] toBytes();

    /** Body rendered as text (UTF-8 for binary, JSON for structured). */
    String asText();

    static MessagePayload of(byte[] bytes) {
        return new Binary(bytes);
    }

    static MessagePayload of(String text) {
        return new Text(text);
    }

    static MessagePayload of(JsonNode json) {
        return new Structured(json);
    }

    /** Raw bytes. Defensive copies are taken on the way in and out. */
    final class Binary implements MessagePayload {
        private final byte[] bytes;

        public Binary(byte[] bytes) {
            this.bytes = Objects.requireNonNull(bytes, "bytes").clone();
        }

        public byte[] bytes() {
            return bytes.clone();
        }

        public int length() {
            return bytes.length;
        }

        @Override
        public byte[] toBytes() {
            return bytes.clone();
        }

        @Override
        public String asText() {
            return new String(bytes, StandardCharsets.UTF_8);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Binary other && Arrays.equals(bytes, other.bytes);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(bytes);
        }

        @Override
        public String toString() {
            return "Binary[" + bytes.length + " bytes]";
        }
    }

    record Text(String text) implements MessagePayload {
        public Text {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public byte[] toBytes() {
            return text.getBytes(StandardCharsets.UTF_8);
        }

        @Override
        public String asText() {
            return text;
        }
    }

    record Structured(JsonNode json) implements MessagePayload {
        public Structured {
            Objects.requireNonNull(json, "json");
        }

        @Override
        public byte[] toBytes() {
            return asText().getBytes(StandardCharsets.UTF_8);
        }

        @Override
        public String asText() {
            return Jsons.toJson(json);
        }
    }
}
