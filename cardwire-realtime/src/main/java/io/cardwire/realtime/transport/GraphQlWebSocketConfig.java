// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.realtime.transport;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

import io.netty.channel.EventLoopGroup;
import org.jspecify.annotations.Nullable;

/**
 * Configuration for {@link GraphQlWebSocketTransport}.
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * GraphQlWebSocketConfig config = GraphQlWebSocketConfig.builder("wss://realtime.example.com/graphql")
 *         .authorization(Map.of("Authorization", idToken, "host", "api.example.com"))
 *         .connectTimeout(Duration.ofSeconds(5))
 *         .build();
 *
 * GraphQlWebSocketTransport transport = GraphQlWebSocketTransport.create(config);
 * }</pre>
 *
 * @param url            the WebSocket URL (ws:// or wss://)
 * @param connectTimeout bound on connecting, the WebSocket handshake and the
 *                       {@code connection_ack}
 * @param ioThreads      number of Netty I/O threads when no event loop group is supplied
 * @param eventLoopGroup NIO event loop group to share; the caller shuts it down
 * @param maxFrameSize   maximum inbound WebSocket frame size in bytes. Default: 64KB.
 *                       Maximum: 16MB.
 * @param authorization  headers sent as the {@code authorization} extension of every
 *                       subscription request
 */
public record GraphQlWebSocketConfig(
        String url,
        Duration connectTimeout,
        int ioThreads,
        @Nullable EventLoopGroup eventLoopGroup,
        int maxFrameSize,
        Map<String, String> authorization) {

    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final int DEFAULT_IO_THREADS = 1;
    private static final int DEFAULT_MAX_FRAME_SIZE = 64 * 1024;    // 64KB
    private static final int MAX_FRAME_SIZE_LIMIT = 16 * 1024 * 1024; // 16MB

    /**
     * Compact constructor with validation and defaults.
     */
    public GraphQlWebSocketConfig {
        validateUrl(url);

        if (connectTimeout == null)
            connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        if (ioThreads <= 0)
            ioThreads = DEFAULT_IO_THREADS;
        if (maxFrameSize <= 0)
            maxFrameSize = DEFAULT_MAX_FRAME_SIZE;
        authorization = authorization == null ? Map.of() : Map.copyOf(authorization);

        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive, got: " + connectTimeout);
        }
        if (maxFrameSize > MAX_FRAME_SIZE_LIMIT) {
            throw new IllegalArgumentException(
                    "maxFrameSize (" + maxFrameSize + ") exceeds maximum allowed (" + MAX_FRAME_SIZE_LIMIT + " bytes / 16MB)");
        }
    }

    private static void validateUrl(final String url) {
        Objects.requireNonNull(url, "url");
        final URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid URL: " + url, e);
        }
        final String scheme = uri.getScheme();
        if (scheme == null || !("ws".equalsIgnoreCase(scheme) || "wss".equalsIgnoreCase(scheme))) {
            throw new IllegalArgumentException("URL must use ws or wss, got: " + url);
        }
        if (uri.getHost() == null || uri.getHost().isBlank()) {
            throw new IllegalArgumentException("URL must have a host, got: " + url);
        }
    }

    /**
     * Creates a configuration with all defaults and no authorization headers.
     *
     * @param url the WebSocket URL
     * @return a new GraphQlWebSocketConfig with default settings
     */
    public static GraphQlWebSocketConfig withDefaults(String url) {
        return new GraphQlWebSocketConfig(url, null, 0, null, 0, null);
    }

    /**
     * Creates a builder for constructing a GraphQlWebSocketConfig.
     *
     * @param url the WebSocket URL
     * @return a new builder
     */
    public static Builder builder(String url) {
        return new Builder(url);
    }

    /**
     * Builder for {@link GraphQlWebSocketConfig}.
     */
    public static final class Builder {
        private final String url;
        private Duration connectTimeout = null;
        private int ioThreads = 0;
        private EventLoopGroup eventLoopGroup = null;
        private int maxFrameSize = 0;
        private Map<String, String> authorization = null;

        private Builder(String url) {
            this.url = Objects.requireNonNull(url, "url");
        }

        /**
         * Sets the connection timeout. Default: 10 seconds.
         */
        public Builder connectTimeout(Duration timeout) {
            this.connectTimeout = timeout;
            return this;
        }

        /**
         * Sets the number of Netty I/O threads. Default: 1.
         * Ignored if eventLoopGroup is provided.
         */
        public Builder ioThreads(int ioThreads) {
            this.ioThreads = ioThreads;
            return this;
        }

        /**
         * Sets a custom Netty NIO EventLoopGroup.
         * When set, ioThreads is ignored.
         * The caller is responsible for shutting down this group.
         */
        public Builder eventLoopGroup(EventLoopGroup group) {
            this.eventLoopGroup = group;
            return this;
        }

        /**
         * Sets the maximum inbound WebSocket frame size.
         * Default: 64KB. Maximum: 16MB.
         *
         * @param bytes the maximum frame size in bytes
         */
        public Builder maxFrameSize(int bytes) {
            this.maxFrameSize = bytes;
            return this;
        }

        /**
         * Sets the authorization headers sent with every subscription request.
         */
        public Builder authorization(Map<String, String> headers) {
            this.authorization = headers;
            return this;
        }

        public GraphQlWebSocketConfig build() {
            return new GraphQlWebSocketConfig(url, connectTimeout, ioThreads, eventLoopGroup, maxFrameSize, authorization);
        }
    }
}
