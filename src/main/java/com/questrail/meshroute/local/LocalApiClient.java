package com.questrail.meshroute.local;

import java.util.concurrent.CompletableFuture;

/**
 * Port to the local application server that inbound requests and direct
 * messages are forwarded to.
 *
 * <p>The returned future may complete exceptionally; callers convert
 * failures into {@link LocalApiResponse#error(String)}.</p>
 */
@FunctionalInterface
public interface LocalApiClient {

    CompletableFuture<LocalApiResponse> call(LocalApiRequest request);
}
