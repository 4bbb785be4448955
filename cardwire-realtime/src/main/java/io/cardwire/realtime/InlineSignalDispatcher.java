// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.realtime;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the signal handler on the publishing thread.
 */
final class InlineSignalDispatcher implements SignalDispatcher {

    private static final Logger log = LoggerFactory.getLogger(InlineSignalDispatcher.class);

    private final Consumer<TopicSignal> handler;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    InlineSignalDispatcher(final Consumer<TopicSignal> handler) {
        this.handler = Objects.requireNonNull(handler, "handler");
    }

    @Override
    public void publish(final TopicSignal signal) {
        if (closed.get()) {
            log.debug("Dropping {} signal for {}, dispatcher closed", signal.getClass().getSimpleName(), signal.kind());
            return;
        }
        try {
            handler.accept(signal);
        } catch (RuntimeException e) {
            log.error("Error handling {} signal for {}", signal.getClass().getSimpleName(), signal.kind(), e);
        }
    }

    @Override
    public void close() {
        closed.set(true);
    }
}
