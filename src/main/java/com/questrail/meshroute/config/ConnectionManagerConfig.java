package com.questrail.meshroute.config;

import java.time.Duration;
import java.util.Objects;

/**
 * ConnectionManagerConfig
 * -----------------------------------------------------------------------------
 * Operational settings of the connection manager.
 *
 * <h2>Parameters</h2>
 * <ul>
 *   <li><b>localApiPort</b>: port of the local application server that
 *       inbound requests are forwarded to ({@code http://localhost:port}).</li>
 *   <li><b>apiPrefix</b>: only inbound requests whose path starts with this
 *       prefix are forwarded.</li>
 *   <li><b>queueCapacity</b>: store-and-forward bound; overflow evicts the
 *       oldest entry.</li>
 *   <li><b>queueProcessInterval</b>: period of the queue tick that drops
 *       expired messages and retries the rest.</li>
 *   <li><b>reachabilityTimeout</b>: bound on each {@code canReach} probe made
 *       by the manager itself.</li>
 *   <li><b>sendTimeout</b>: bound on each single-transport send attempt.</li>
 *   <li><b>loopbackTimeout</b>: bound on each call to the local
 *       application server.</li>
 * </ul>
 */
public record ConnectionManagerConfig(
        int localApiPort,
        String apiPrefix,
        int queueCapacity,
        Duration queueProcessInterval,
        Duration reachabilityTimeout,
        Duration sendTimeout,
        Duration loopbackTimeout
) {
    public static final int DEFAULT_LOCAL_API_PORT = 45678;

    public ConnectionManagerConfig {
        Objects.requireNonNull(apiPrefix, "apiPrefix");
        Objects.requireNonNull(queueProcessInterval, "queueProcessInterval");
        Objects.requireNonNull(reachabilityTimeout, "reachabilityTimeout");
        Objects.requireNonNull(sendTimeout, "sendTimeout");
        Objects.requireNonNull(loopbackTimeout, "loopbackTimeout");

        if (localApiPort < 1 || localApiPort > 65535) {
            throw new IllegalArgumentException("localApiPort must be 1-65535");
        }
        if (!apiPrefix.startsWith("/")) {
            throw new IllegalArgumentException("apiPrefix must start with '/'");
        }
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be positive");
        }
        if (queueProcessInterval.isNegative() || queueProcessInterval.isZero()) {
            throw new IllegalArgumentException("queueProcessInterval must be positive");
        }
        if (reachabilityTimeout.isNegative()) {
            throw new IllegalArgumentException("reachabilityTimeout must be non-negative");
        }
        if (sendTimeout.isNegative()) {
            throw new IllegalArgumentException("sendTimeout must be non-negative");
        }
        if (loopbackTimeout.isNegative()) {
            throw new IllegalArgumentException("loopbackTimeout must be non-negative");
        }
    }

    /**
     * Defaults:
     * <ul>
     *   <li>localApiPort: 45678</li>
     *   <li>apiPrefix: {@code /api/}</li>
     *   <li>queueCapacity: 1000</li>
     *   <li>queueProcessInterval: 30s</li>
     *   <li>reachabilityTimeout: 2s</li>
     *   <li>sendTimeout: 30s</li>
     *   <li>loopbackTimeout: 25s</li>
     * </ul>
     */
    public static ConnectionManagerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int localApiPort = DEFAULT_LOCAL_API_PORT;
        private String apiPrefix = "/api/";
        private int queueCapacity = 1000;
        private Duration queueProcessInterval = Duration.ofSeconds(30);
        private Duration reachabilityTimeout = Duration.ofSeconds(2);
        private Duration sendTimeout = Duration.ofSeconds(30);
        private Duration loopbackTimeout = Duration.ofSeconds(25);

        public Builder withLocalApiPort(int port) {
            this.localApiPort = port;
            return this;
        }

        public Builder withApiPrefix(String prefix) {
            this.apiPrefix = prefix;
            return this;
        }

        public Builder withQueueCapacity(int capacity) {
            this.queueCapacity = capacity;
            return this;
        }

        public Builder withQueueProcessInterval(Duration interval) {
            this.queueProcessInterval = interval;
            return this;
        }

        public Builder withReachabilityTimeout(Duration timeout) {
            this.reachabilityTimeout = timeout;
            return this;
        }

        public Builder withSendTimeout(Duration timeout) {
            this.sendTimeout = timeout;
            return this;
        }

        public Builder withLoopbackTimeout(Duration timeout) {
            this.loopbackTimeout = timeout;
            return this;
        }

        public ConnectionManagerConfig build() {
            return new ConnectionManagerConfig(localApiPort, apiPrefix, queueCapacity,
                    queueProcessInterval, reachabilityTimeout, sendTimeout, loopbackTimeout);
        }
    }
}
