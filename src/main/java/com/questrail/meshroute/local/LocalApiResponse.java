package com.questrail.meshroute.local;

import com.questrail.meshroute.util.Jsons;

import java.util.Objects;

/**
 * Status code and body text returned by the local application server.
 */
public record LocalApiResponse(int statusCode, String body) {
    public LocalApiResponse {
        Objects.requireNonNull(body, "body");
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    /**
     * Synthetic 500 used when the call itself failed or timed out. The body
     * is {@code {"error": "<text>"}}.
     */
    public static LocalApiResponse error(String message) {
        return new LocalApiResponse(500,
                Jsons.toJson(Jsons.object().put("error", String.valueOf(message))));
    }
}
