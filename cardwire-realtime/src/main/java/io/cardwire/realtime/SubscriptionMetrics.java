// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.realtime;

import io.cardwire.realtime.Subscriber.ConnectionState;
import io.cardwire.realtime.transport.TopicKind;

/**
 * Interface for collecting metrics from the subscription layer.
 *
 * <p>
 * Implementations can bridge to Micrometer, Prometheus or any other monitoring
 * solution. By default a no-op implementation is used ({@link #noop()}).
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * SubscriptionService service = SubscriptionService.builder()
 *         .transport(transport)
 *         .identityProvider(identity)
 *         .unsealer(unsealer)
 *         .metrics(new MyMicrometerMetrics(meterRegistry))
 *         .build();
 * }</pre>
 *
 * <p>
 * <strong>Thread Safety:</strong> Implementations must be thread-safe as
 * methods are called from caller threads, the dispatcher thread and transport
 * threads concurrently.
 */
public interface SubscriptionMetrics {

    /**
     * Called when an upstream subscription is opened for a topic.
     *
     * @param kind the topic's change stream
     */
    default void onUpstreamOpened(TopicKind kind) {
    }

    /**
     * Called when an upstream subscription is cancelled because its topic has
     * no subscribers left or its stream disconnected.
     *
     * @param kind the topic's change stream
     */
    default void onUpstreamCancelled(TopicKind kind) {
    }

    /**
     * Called when a topic's connection state changes.
     *
     * @param kind  the topic's change stream
     * @param state the new state
     */
    default void onConnectionStateChanged(TopicKind kind, ConnectionState state) {
    }

    /**
     * Called after an event has been delivered to the topic's subscribers.
     *
     * @param kind        the topic's change stream
     * @param subscribers number of subscribers the event was delivered to
     */
    default void onEventDelivered(TopicKind kind, int subscribers) {
    }

    /**
     * Called when an event is dropped because its payload is absent or malformed.
     *
     * @param kind the topic's change stream
     */
    default void onEventDiscarded(TopicKind kind) {
    }

    /**
     * Called when an event is dropped because its record could not be unsealed.
     *
     * @param kind the topic's change stream
     */
    default void onUnsealFailure(TopicKind kind) {
    }

    /**
     * Called when a subscriber callback throws.
     *
     * @param kind  the topic's change stream
     * @param error what the subscriber threw
     */
    default void onSubscriberFailure(TopicKind kind, Throwable error) {
    }

    /**
     * Called when a signal from a superseded upstream subscription is ignored.
     *
     * @param kind the topic's change stream
     */
    default void onStaleSignal(TopicKind kind) {
    }

    /**
     * Called when the signal ring buffer is nearing saturation (less than 10% remaining).
     *
     * @param remainingCapacity the number of free slots
     * @param bufferSize        the total ring buffer size
     */
    default void onRingBufferSaturation(long remainingCapacity, int bufferSize) {
    }

    /**
     * Returns a no-op metrics implementation that does nothing.
     *
     * @return a no-op SubscriptionMetrics instance
     */
    static SubscriptionMetrics noop() {
        return NoopMetrics.INSTANCE;
    }
}

/**
 * Internal no-op implementation of SubscriptionMetrics.
 */
enum NoopMetrics implements SubscriptionMetrics {
    INSTANCE
}
