// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.realtime;

import java.util.function.Consumer;

/**
 * Channel that carries topic signals from transport threads to the signal handler.
 *
 * <p>
 * Signals are handed to the handler one at a time in publication order.
 * Signals published before {@link #close()} are still handed over; signals
 * published after it are dropped.
 */
interface SignalDispatcher extends AutoCloseable {

    void publish(TopicSignal signal);

    @Override
    void close();

    static SignalDispatcher create(
            final SubscriptionConfig config, final Consumer<TopicSignal> handler, final SubscriptionMetrics metrics) {
        return switch (config.dispatchMode()) {
            case RING_BUFFER -> new RingBufferSignalDispatcher(
                    config.ringBufferSize(), config.waitStrategy(), handler, metrics);
            case INLINE -> new InlineSignalDispatcher(handler);
        };
    }
}
