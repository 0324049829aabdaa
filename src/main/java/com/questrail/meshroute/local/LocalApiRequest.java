package com.questrail.meshroute.local;

import com.questrail.meshroute.message.MessagePayload;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Call against the local application server.
 *
 * @param method  GET, POST, PUT or DELETE; anything else is sent as GET
 * @param path    absolute path, starting with {@code /}
 * @param headers request headers as received
 * @param body    optional body; never sent for GET or DELETE
 * @param timeout bound on the whole call
 */
public record LocalApiRequest(
        String method,
        String path,
        Map<String, String> headers,
        MessagePayload body,
        Duration timeout
) {
    public LocalApiRequest {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(timeout, "timeout");
        if (!path.startsWith("/")) {
            throw new IllegalArgumentException("path must start with '/': " + path);
        }
        method = normalizeMethod(method);
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public Optional<MessagePayload> bodyOpt() {
        return Optional.ofNullable(body);
    }

    /** Whether the method carries a request body. */
    public boolean sendsBody() {
        return body != null && ("POST".equals(method) || "PUT".equals(method));
    }

    /**
     * Content-Type to send: the caller's own header if present (matched
     * case-insensitively), otherwise octet-stream for binary bodies and
     * JSON for everything else.
     */
    public String contentType() {
        for (Map.Entry<String, String> e : headers.entrySet()) {
            if ("content-type".equalsIgnoreCase(e.getKey())) {
                return e.getValue();
            }
        }
        return body instanceof MessagePayload.Binary ? "application/octet-stream" : "application/json";
    }

    static String normalizeMethod(String method) {
        if (method == null) {
            return "GET";
        }
        String upper = method.trim().toUpperCase(Locale.ROOT);
        switch (upper) {
            case "GET":
            case "POST":
            case "PUT":
            case "DELETE":
                return upper;
            default:
                return "GET";
        }
    }
}
