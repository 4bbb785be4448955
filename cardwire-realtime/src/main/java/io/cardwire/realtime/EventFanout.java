// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.realtime;

import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.cardwire.core.DebugLogger;
import io.cardwire.core.error.UnsealException;
import io.cardwire.realtime.transport.TopicKind;

/**
 * Delivers one topic's server events to its subscribers.
 *
 * <p>
 * An event whose record is absent or malformed is dropped. An event whose
 * record cannot be unsealed is logged and dropped; the topic stays connected.
 * Every subscriber in the snapshot taken for the event is called, even if an
 * earlier one throws.
 *
 * @param <T> the entity delivered to subscribers
 * @param <S> the kind of subscriber
 */
abstract class EventFanout<T, S extends Subscriber> {

    private static final Logger log = LoggerFactory.getLogger(EventFanout.class);

    protected final ObjectMapper mapper;
    private final SubscriptionMetrics metrics;

    EventFanout(final ObjectMapper mapper, final SubscriptionMetrics metrics) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Converts the changed record carried by an event into an entity.
     *
     * @throws UnsealException         if the record cannot be unsealed
     * @throws JsonProcessingException if the record does not bind to its wire type
     */
    protected abstract T convert(JsonNode record) throws JsonProcessingException;

    /** Hands an entity to one subscriber. */
    protected abstract void deliver(S subscriber, T entity);

    final void onEvent(final TopicRegistry<S> registry, final JsonNode payload) {
        final TopicKind kind = registry.kind();
        final JsonNode record = payload.path("data").path(kind.dataField());
        if (!record.isObject()) {
            DebugLogger.logSubscription("[EVENT-DISCARDED] kind=%s reason=no %s record", kind, kind.dataField());
            metrics.onEventDiscarded(kind);
            return;
        }

        final Map<String, S> subscribers = registry.currentSubscribers();
        if (subscribers.isEmpty()) {
            return;
        }

        final T entity;
        try {
            entity = convert(record);
        } catch (UnsealException e) {
            log.warn("Dropping {} event that could not be unsealed", kind, e);
            metrics.onUnsealFailure(kind);
            return;
        } catch (JsonProcessingException | NullPointerException | IllegalArgumentException e) {
            log.debug("Dropping malformed {} event: {}", kind, e.getMessage());
            metrics.onEventDiscarded(kind);
            return;
        }

        for (Map.Entry<String, S> entry : subscribers.entrySet()) {
            try {
                deliver(entry.getValue(), entity);
            } catch (RuntimeException e) {
                log.error("Subscriber {} failed handling {} event", entry.getKey(), kind, e);
                metrics.onSubscriberFailure(kind, e);
            }
        }
        metrics.onEventDelivered(kind, subscribers.size());
    }
}
