// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.realtime;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.cardwire.core.DebugLogger;
import io.cardwire.realtime.TopicRegistry.OpenTicket;
import io.cardwire.realtime.transport.SubscriptionTransport;
import io.cardwire.realtime.transport.Topic;
import io.cardwire.realtime.transport.UpstreamHandle;

/**
 * Makes sure a topic with subscribers has exactly one upstream subscription,
 * held for the owner of the latest subscribe call.
 *
 * <p>
 * The open call runs outside the registry lock. Callers that find an open call
 * already in flight wait for it to return and then check again, so concurrent
 * first subscribers issue a single open.
 */
final class ConnectionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ConnectionCoordinator.class);

    private final SubscriptionTransport transport;
    private final SignalDispatcher dispatcher;
    private final SubscriptionMetrics metrics;

    ConnectionCoordinator(
            final SubscriptionTransport transport,
            final SignalDispatcher dispatcher,
            final SubscriptionMetrics metrics) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Opens the topic's upstream subscription if it has none. Returns once the
     * open call made by this or a concurrent caller has returned. Failures are
     * reported to subscribers asynchronously as DISCONNECTED.
     */
    void ensureConnected(final TopicRegistry<?> registry, final Topic topic) {
        while (true) {
            final OpenTicket ticket = registry.beginOpen(topic.owner());
            switch (ticket.action()) {
                case OPEN -> {
                    open(registry, topic, ticket);
                    return;
                }
                case AWAIT -> ticket.future().join();
                case NONE -> {
                    return;
                }
            }
        }
    }

    private void open(final TopicRegistry<?> registry, final Topic topic, final OpenTicket ticket) {
        DebugLogger.logSubscription("[OPEN] kind=%s generation=%d", topic.kind(), ticket.generation());
        UpstreamHandle handle = null;
        try {
            handle = transport.open(topic, new SignalingListener(topic.kind(), ticket.generation(), dispatcher));
            metrics.onUpstreamOpened(topic.kind());
        } catch (RuntimeException e) {
            log.error("Failed to open {} subscription", topic.kind(), e);
            dispatcher.publish(new TopicSignal.Failed(topic.kind(), ticket.generation(), e));
        } finally {
            registry.completeOpen(ticket, handle);
        }
    }
}
