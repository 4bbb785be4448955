// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.realtime;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.cardwire.core.DebugLogger;
import io.cardwire.realtime.Subscriber.ConnectionState;
import io.cardwire.realtime.transport.TopicKind;

/**
 * Applies topic signals: connects, delivers events to and disconnects a topic's subscribers.
 *
 * <p>
 * A completed or failed stream disconnects its topic: every subscriber is told
 * DISCONNECTED once and removed, and the upstream subscription is released.
 * Nothing reconnects automatically; subscribing again opens a fresh upstream
 * subscription.
 */
final class TopicLifecycle {

    private static final Logger log = LoggerFactory.getLogger(TopicLifecycle.class);

    private final Map<TopicKind, Route<?>> routes = new EnumMap<>(TopicKind.class);
    private final SubscriptionMetrics metrics;

    TopicLifecycle(final SubscriptionMetrics metrics) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    <S extends Subscriber> void register(final TopicRegistry<S> registry, final EventFanout<?, S> fanout) {
        routes.put(registry.kind(), new Route<>(registry, fanout));
    }

    void handle(final TopicSignal signal) {
        final Route<?> route = routes.get(signal.kind());
        if (route == null) {
            log.warn("No route for {} signal", signal.kind());
            return;
        }
        if (signal instanceof TopicSignal.Established) {
            onEstablished(route.registry(), signal.generation());
        } else if (signal instanceof TopicSignal.Event event) {
            onEvent(route, event);
        } else if (signal instanceof TopicSignal.Completed) {
            DebugLogger.logSubscription("[COMPLETED] kind=%s generation=%d", signal.kind(), signal.generation());
            onDisconnected(route.registry(), signal.generation());
        } else if (signal instanceof TopicSignal.Failed failed) {
            log.error("{} subscription error", signal.kind(), failed.cause());
            onDisconnected(route.registry(), signal.generation());
        } else if (signal instanceof TopicSignal.Removed removed) {
            notifyConnectionState(signal.kind(), removed.subscribers(), ConnectionState.DISCONNECTED);
        }
    }

    /**
     * Tells subscribers about a connection state change. A subscriber that throws
     * is logged and does not stop the others from being told.
     */
    private void notifyConnectionState(
            final TopicKind kind, final Map<String, ? extends Subscriber> subscribers, final ConnectionState state) {
        metrics.onConnectionStateChanged(kind, state);
        for (Map.Entry<String, ? extends Subscriber> entry : subscribers.entrySet()) {
            try {
                entry.getValue().connectionStatusChanged(state);
            } catch (RuntimeException e) {
                log.error("Subscriber {} failed handling {} for {}", entry.getKey(), state, kind, e);
                metrics.onSubscriberFailure(kind, e);
            }
        }
    }

    private void onEstablished(final TopicRegistry<?> registry, final long generation) {
        final Map<String, ? extends Subscriber> toNotify = registry.markEstablished(generation);
        if (toNotify == null) {
            stale(registry.kind(), "established", generation);
            return;
        }
        DebugLogger.logSubscription("[ESTABLISHED] kind=%s generation=%d subscribers=%d",
                registry.kind(), generation, toNotify.size());
        if (!toNotify.isEmpty()) {
            notifyConnectionState(registry.kind(), toNotify, ConnectionState.CONNECTED);
        }
    }

    private <S extends Subscriber> void onEvent(final Route<S> route, final TopicSignal.Event event) {
        if (!route.registry().isCurrent(event.generation())) {
            stale(event.kind(), "event", event.generation());
            return;
        }
        route.fanout().onEvent(route.registry(), event.payload());
    }

    private void onDisconnected(final TopicRegistry<?> registry, final long generation) {
        final Map<String, ? extends Subscriber> removed = registry.disconnect(generation);
        if (removed == null) {
            stale(registry.kind(), "disconnect", generation);
            return;
        }
        notifyConnectionState(registry.kind(), removed, ConnectionState.DISCONNECTED);
    }

    private void stale(final TopicKind kind, final String what, final long generation) {
        DebugLogger.logSubscription("[STALE] kind=%s signal=%s generation=%d", kind, what, generation);
        metrics.onStaleSignal(kind);
    }

    private record Route<S extends Subscriber>(TopicRegistry<S> registry, EventFanout<?, S> fanout) {
    }
}
