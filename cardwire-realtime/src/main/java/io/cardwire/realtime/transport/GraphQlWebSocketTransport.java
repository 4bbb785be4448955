// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.realtime.transport;

import java.net.URI;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.PooledByteBufAllocator;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.ChannelPromise;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketHandshakeException;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.cardwire.core.error.TransportException;

/**
 * {@link SubscriptionTransport} speaking the GraphQL-over-WebSocket subscription
 * protocol ({@code graphql-ws} subprotocol) over a single shared Netty connection.
 *
 * <p>
 * The connection is opened lazily by the first {@link #open} call and shared by
 * every subscription. If it is lost, every live subscription fails and the next
 * {@link #open} connects again. The transport never retries on its own.
 *
 * <p><b>Thread Safety:</b> This class is thread-safe. Listener callbacks run on
 * the Netty I/O thread.
 */
public final class GraphQlWebSocketTransport implements SubscriptionTransport, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GraphQlWebSocketTransport.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** WebSocket subprotocol negotiated during the handshake. */
    static final String SUBPROTOCOL = "graphql-ws";

    private static final String SEALED_TRANSACTION_FIELDS = """
            id owner version createdAtEpochMs updatedAtEpochMs algorithm keyId cardId sequenceId type \
            transactedAtEpochMs settledAtEpochMs \
            billedAmount { currency amount } transactedAmount { currency amount } \
            description declineReason \
            detail { virtualCardAmount { currency amount } markup { percent flat minCharge } \
            markupAmount { currency amount } fundingSourceAmount { currency amount } \
            fundingSourceId description state transactedAtEpochMs settledAtEpochMs }""";

    private static final String FUNDING_SOURCE_FIELDS = """
            id owner version createdAtEpochMs updatedAtEpochMs state flags currency \
            ... on CreditCardFundingSource { type last4 network } \
            ... on BankAccountFundingSource { type bankName: institutionName }""";

    private final GraphQlWebSocketConfig config;
    private final URI uri;
    private final EventLoopGroup group;
    /** True if we created the EventLoopGroup internally and are responsible for shutting it down. */
    private final boolean ownsEventLoopGroup;

    private final Object connectLock = new Object();
    private final AtomicReference<@Nullable Connection> connection = new AtomicReference<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private GraphQlWebSocketTransport(final GraphQlWebSocketConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.uri = URI.create(config.url());

        if (config.eventLoopGroup() != null) {
            this.group = config.eventLoopGroup();
            this.ownsEventLoopGroup = false;
        } else {
            ThreadFactory threadFactory = r -> {
                Thread t = new Thread(r, "cardwire-netty-io");
                t.setDaemon(true);
                return t;
            };
            this.group = new NioEventLoopGroup(config.ioThreads(), threadFactory);
            this.ownsEventLoopGroup = true;
        }
    }

    /**
     * Creates a transport. No connection is made until the first subscription is opened.
     *
     * @param config the transport configuration
     * @return a new transport
     */
    public static GraphQlWebSocketTransport create(final GraphQlWebSocketConfig config) {
        return new GraphQlWebSocketTransport(config);
    }

    /**
     * Sends a {@code start} request for the topic, connecting first if needed.
     * The returned handle sends {@code stop} when cancelled.
     *
     * @throws TransportException if the transport is closed, the connection cannot be
     *                            established within the connect timeout, or the request
     *                            cannot be written
     */
    @Override
    public UpstreamHandle open(final Topic topic, final TransportListener listener) {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(listener, "listener");
        final Connection current = activeConnection();
        final String id = current.session().start(document(topic.kind()), Map.of("owner", topic.owner()), listener);
        log.debug("Started {} subscription {}", topic.kind(), id);
        return new SubscriptionHandle(current.session(), id);
    }

    /**
     * @return true while a connection is open
     */
    public boolean isConnected() {
        final Connection current = connection.get();
        return current != null && current.channel().isActive();
    }

    static String document(final TopicKind kind) {
        return switch (kind) {
            case FUNDING_SOURCE_UPDATE -> "subscription OnFundingSourceUpdate($owner: ID!) { "
                    + "onFundingSourceUpdate(owner: $owner) { " + FUNDING_SOURCE_FIELDS + " } }";
            case TRANSACTION_UPDATE -> "subscription OnTransactionUpdate($owner: ID!) { "
                    + "onTransactionUpdate(owner: $owner) { " + SEALED_TRANSACTION_FIELDS + " } }";
            case TRANSACTION_DELETE -> "subscription OnTransactionDelete($owner: ID!) { "
                    + "onTransactionDelete(owner: $owner) { " + SEALED_TRANSACTION_FIELDS + " } }";
        };
    }

    private Connection activeConnection() {
        Connection current = connection.get();
        if (current != null && current.channel().isActive()) {
            return current;
        }
        synchronized (connectLock) {
            if (closed.get()) {
                throw new TransportException("GraphQlWebSocketTransport is closed");
            }
            current = connection.get();
            if (current != null && current.channel().isActive()) {
                return current;
            }
            current = connect();
            connection.set(current);
            if (closed.get()) {
                connection.set(null);
                closeQuietly(current.channel());
                throw new TransportException("GraphQlWebSocketTransport is closed");
            }
            return current;
        }
    }

    private Connection connect() {
        final boolean secure = "wss".equalsIgnoreCase(uri.getScheme());
        final int port = uri.getPort() == -1 ? (secure ? 443 : 80) : uri.getPort();
        final long timeoutMs = config.connectTimeout().toMillis();

        Channel channel = null;
        try {
            final SslContext sslContext = secure ? SslContextBuilder.forClient().build() : null;

            // A fresh handler per connection: the handshaker and its promise are tied to one channel
            final ConnectionHandler handler = new ConnectionHandler(
                    WebSocketClientHandshakerFactory.newHandshaker(
                            uri, WebSocketVersion.V13, SUBPROTOCOL, false, new DefaultHttpHeaders(),
                            config.maxFrameSize()));

            Bootstrap b = new Bootstrap();
            b.group(group)
                    .channel(NioSocketChannel.class)
                    .option(ChannelOption.TCP_NODELAY, true)
                    .option(ChannelOption.SO_KEEPALIVE, true)
                    .option(ChannelOption.ALLOCATOR, PooledByteBufAllocator.DEFAULT)
                    .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(timeoutMs, Integer.MAX_VALUE))
                    .handler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ChannelPipeline p = ch.pipeline();
                            if (sslContext != null) {
                                p.addLast(sslContext.newHandler(ch.alloc(), uri.getHost(), port));
                            }
                            p.addLast(new HttpClientCodec());
                            p.addLast(new HttpObjectAggregator(8192));
                            p.addLast(handler);
                        }
                    });

            channel = b.connect(uri.getHost(), port).sync().channel();
            final ChannelFuture handshake = handler.handshakeFuture();
            if (!handshake.await(timeoutMs, TimeUnit.MILLISECONDS)) {
                throw new TransportException("WebSocket handshake with " + uri + " timed out");
            }
            if (!handshake.isSuccess()) {
                throw new TransportException("WebSocket handshake with " + uri + " failed", handshake.cause());
            }

            handler.session().init();
            handler.session().acknowledged().get(timeoutMs, TimeUnit.MILLISECONDS);
            log.info("Connected to {}", uri);
            return new Connection(channel, handler.session());
        } catch (TransportException e) {
            closeQuietly(channel);
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            closeQuietly(channel);
            throw new TransportException("Interrupted while connecting to " + uri, e);
        } catch (ExecutionException e) {
            closeQuietly(channel);
            throw new TransportException("Connection to " + uri + " was not acknowledged", e.getCause());
        } catch (TimeoutException e) {
            closeQuietly(channel);
            throw new TransportException("Timed out waiting for connection_ack from " + uri, e);
        } catch (Exception e) {
            closeQuietly(channel);
            throw new TransportException("Failed to connect to " + uri, e);
        }
    }

    private void connectionLost(final GraphQlWsSession session, final Throwable cause) {
        final Connection current = connection.get();
        if (current != null && current.session() == session) {
            connection.compareAndSet(current, null);
        }
        if (!closed.get() && session.liveSubscriptions() > 0) {
            log.warn("Connection to {} lost, failing {} subscriptions", uri, session.liveSubscriptions());
        }
        session.failAll(cause);
    }

    private static void closeQuietly(final @Nullable Channel channel) {
        if (channel != null && channel.isOpen()) {
            channel.close();
        }
    }

    /**
     * Fails every live subscription, closes the connection and, if the transport
     * created it, shuts down the event loop group. Calling this more than once has no
     * further effect.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        final Connection current = connection.getAndSet(null);
        if (current != null) {
            current.session().failAll(new TransportException("GraphQlWebSocketTransport is shutting down"));
            try {
                current.channel().close().sync();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while closing channel", e);
            } catch (Exception e) {
                log.warn("Error closing channel", e);
            }
        }

        // Only shutdown the EventLoopGroup if we created it internally
        if (ownsEventLoopGroup) {
            try {
                group.shutdownGracefully(0, 5, TimeUnit.SECONDS).sync();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while shutting down EventLoopGroup", e);
            } catch (Exception e) {
                log.warn("Error shutting down EventLoopGroup", e);
            }
        }
    }

    private record Connection(Channel channel, GraphQlWsSession session) {
    }

    /**
     * Upstream handle of one subscription on a connection.
     */
    private static final class SubscriptionHandle implements UpstreamHandle {
        private final GraphQlWsSession session;
        private final String id;
        private final AtomicBoolean cancelled = new AtomicBoolean(false);

        SubscriptionHandle(final GraphQlWsSession session, final String id) {
            this.session = session;
            this.id = id;
        }

        @Override
        public void cancel() {
            if (!cancelled.compareAndSet(false, true)) {
                return;
            }
            try {
                session.stop(id);
            } catch (TransportException e) {
                log.warn("Could not send stop for subscription {}: {}", id, e.getMessage());
            }
        }

        @Override
        public boolean isCancelled() {
            return cancelled.get();
        }
    }

    private final class ConnectionHandler extends SimpleChannelInboundHandler<Object> {
        private final WebSocketClientHandshaker handshaker;
        private final GraphQlWsSession session;
        private ChannelPromise handshakeFuture;
        private volatile @Nullable Channel channel;

        ConnectionHandler(final WebSocketClientHandshaker handshaker) {
            this.handshaker = handshaker;
            this.session = new GraphQlWsSession(MAPPER, this::write, config.authorization());
        }

        GraphQlWsSession session() {
            return session;
        }

        ChannelFuture handshakeFuture() {
            return handshakeFuture;
        }

        @Override
        public void handlerAdded(ChannelHandlerContext ctx) {
            handshakeFuture = ctx.newPromise();
        }

        @Override
        public void channelActive(ChannelHandlerContext ctx) {
            channel = ctx.channel();
            handshaker.handshake(ctx.channel());
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            if (!handshakeFuture.isDone()) {
                handshakeFuture.setFailure(new TransportException("Connection closed during handshake"));
            }
            connectionLost(session, new TransportException("Connection to " + uri + " lost"));
        }

        @Override
        public void channelRead0(ChannelHandlerContext ctx, Object msg) {
            Channel ch = ctx.channel();
            if (!handshaker.isHandshakeComplete()) {
                if (msg instanceof FullHttpResponse response) {
                    try {
                        handshaker.finishHandshake(ch, response);
                        handshakeFuture.setSuccess();
                    } catch (WebSocketHandshakeException e) {
                        handshakeFuture.setFailure(e);
                    }
                }
                return;
            }

            if (msg instanceof FullHttpResponse response) {
                throw new IllegalStateException(
                        "Unexpected FullHttpResponse (status=" + response.status() + ")");
            }

            if (msg instanceof WebSocketFrame frame) {
                if (frame instanceof TextWebSocketFrame textFrame) {
                    session.onFrame(textFrame.text());
                } else if (frame instanceof PingWebSocketFrame) {
                    ch.writeAndFlush(new PongWebSocketFrame(frame.content().retain()));
                } else if (frame instanceof CloseWebSocketFrame) {
                    ch.close();
                }
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            log.error("Channel exception", cause);
            if (!handshakeFuture.isDone()) {
                handshakeFuture.setFailure(cause);
            }
            ctx.close();
        }

        private void write(final String text) {
            final Channel ch = channel;
            if (ch == null || !ch.isActive()) {
                throw new TransportException("WebSocket channel is not active");
            }
            ch.writeAndFlush(new TextWebSocketFrame(text));
        }
    }
}
