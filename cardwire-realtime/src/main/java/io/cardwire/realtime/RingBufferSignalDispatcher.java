// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.realtime;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventTranslatorOneArg;
import com.lmax.disruptor.LiteBlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.cardwire.realtime.SubscriptionConfig.WaitStrategyType;

/**
 * Signal channel backed by an LMAX Disruptor ring buffer with a single consumer thread.
 *
 * <p>
 * Transport threads publish; the daemon {@code cardwire-dispatcher} thread runs
 * the handler, so every subscriber callback runs on that thread in publication
 * order. Publishing blocks while the ring buffer is full.
 *
 * <p>
 * Closing drains the signals already published, then stops the thread.
 */
final class RingBufferSignalDispatcher implements SignalDispatcher {

    private static final Logger log = LoggerFactory.getLogger(RingBufferSignalDispatcher.class);

    private static final long DRAIN_TIMEOUT_SECONDS = 5;

    private static final EventTranslatorOneArg<SignalEvent, TopicSignal> TRANSLATOR =
            (event, sequence, signal) -> event.signal = signal;

    private final Consumer<TopicSignal> handler;
    private final SubscriptionMetrics metrics;
    private final Disruptor<SignalEvent> disruptor;
    private final RingBuffer<SignalEvent> ringBuffer;
    private final int bufferSize;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile @Nullable Thread dispatcherThread;
    private volatile boolean haltWhenDrained;

    RingBufferSignalDispatcher(
            final int bufferSize,
            final WaitStrategyType waitStrategyType,
            final Consumer<TopicSignal> handler,
            final SubscriptionMetrics metrics) {
        this.handler = Objects.requireNonNull(handler, "handler");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.bufferSize = bufferSize;

        WaitStrategy waitStrategy = switch (waitStrategyType) {
            case BLOCKING -> new BlockingWaitStrategy();
            case LITE_BLOCKING -> new LiteBlockingWaitStrategy();
            case YIELDING -> new YieldingWaitStrategy();
        };

        ThreadFactory threadFactory = r -> {
            Thread t = new Thread(r, "cardwire-dispatcher");
            t.setDaemon(true);
            dispatcherThread = t;
            return t;
        };

        this.disruptor = new Disruptor<>(
                SignalEvent::new,
                bufferSize,
                threadFactory,
                ProducerType.MULTI,
                waitStrategy);

        this.disruptor.handleEventsWith(this::handleEvent);
        this.ringBuffer = disruptor.start();
    }

    @Override
    public void publish(final TopicSignal signal) {
        if (closed.get()) {
            log.debug("Dropping {} signal for {}, dispatcher closed", signal.getClass().getSimpleName(), signal.kind());
            return;
        }
        ringBuffer.publishEvent(TRANSLATOR, signal);

        long remaining = ringBuffer.remainingCapacity();
        if (remaining < bufferSize / 10) {
            metrics.onRingBufferSaturation(remaining, bufferSize);
        }
    }

    private void handleEvent(final SignalEvent event, final long sequence, final boolean endOfBatch) {
        final TopicSignal signal = event.signal;
        // Clear before handling so the slot does not pin the payload once it is reused
        event.clear();
        if (signal != null) {
            try {
                handler.accept(signal);
            } catch (RuntimeException e) {
                log.error("Error handling {} signal for {}", signal.getClass().getSimpleName(), signal.kind(), e);
            }
        }
        if (endOfBatch && haltWhenDrained && sequence == ringBuffer.getCursor()) {
            disruptor.halt();
        }
    }

    /**
     * Stops accepting signals, waits for the published ones to be handled and
     * stops the dispatcher thread. Called from the dispatcher thread itself, it
     * returns at once and the thread stops after the last published signal.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (Thread.currentThread() == dispatcherThread) {
            haltWhenDrained = true;
            return;
        }
        try {
            disruptor.shutdown(DRAIN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            log.warn("Dispatcher did not drain within {}s, discarding remaining signals", DRAIN_TIMEOUT_SECONDS);
            disruptor.halt();
        } catch (RuntimeException e) {
            log.warn("Error shutting down Disruptor", e);
        }
    }

    /**
     * Mutable ring buffer slot.
     */
    static final class SignalEvent {
        @Nullable TopicSignal signal;

        void clear() {
            signal = null;
        }
    }
}
