package com.questrail.meshroute.local;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * HttpLocalApiClient
 * =============================================================================
 * {@link LocalApiClient} backed by {@link HttpClient}, calling
 * {@code http://localhost:{port}{path}}.
 *
 * <ul>
 *   <li>Headers the JDK client manages itself (Host, Connection,
 *       Content-Length, Expect, Upgrade) are not forwarded.</li>
 *   <li>Content-Type is set on every request, bodyless ones included: the
 *       caller's value when it sent one, otherwise
 *       {@link LocalApiRequest#contentType()}'s default.</li>
 *   <li>The request timeout is the per-request {@link LocalApiRequest#timeout()};
 *       expiry completes the future exceptionally with
 *       {@link java.net.http.HttpTimeoutException}.</li>
 * </ul>
 */
public final class HttpLocalApiClient implements LocalApiClient {

    private static final Set<String> RESTRICTED_HEADERS =
            Set.of("host", "connection", "content-length", "expect", "upgrade");

    private final HttpClient client;
    private final String baseUrl;

    public HttpLocalApiClient(int port) {
        this(port, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .version(HttpClient.Version.HTTP_1_1)
                .build());
    }

    public HttpLocalApiClient(int port, HttpClient client) {
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port must be 1-65535");
        }
        this.client = Objects.requireNonNull(client, "client");
        this.baseUrl = "http://localhost:" + port;
    }

    public String baseUrl() {
        return baseUrl;
    }

    @Override
    public CompletableFuture<LocalApiResponse> call(LocalApiRequest request) {
        Objects.requireNonNull(request, "request");

        HttpRequest.BodyPublisher publisher = request.sendsBody()
                ? HttpRequest.BodyPublishers.ofByteArray(request.body().toBytes())
                : HttpRequest.BodyPublishers.noBody();

        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(baseUrl + request.path()))
                .timeout(request.timeout())
                .method(request.method(), publisher);

        for (Map.Entry<String, String> header : request.headers().entrySet()) {
            String name = header.getKey().toLowerCase(Locale.ROOT);
            // Content-Type goes out once, below.
            if (!RESTRICTED_HEADERS.contains(name) && !"content-type".equals(name)) {
                builder.header(header.getKey(), header.getValue());
            }
        }
        builder.header("Content-Type", request.contentType());

        return client.sendAsync(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8))
                .thenApply(response -> new LocalApiResponse(response.statusCode(),
                        response.body() == null ? "" : response.body()));
    }
}
