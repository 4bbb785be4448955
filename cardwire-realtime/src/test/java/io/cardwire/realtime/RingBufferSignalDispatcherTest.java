// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.realtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import io.cardwire.realtime.SubscriptionConfig.WaitStrategyType;
import io.cardwire.realtime.transport.TopicKind;

class RingBufferSignalDispatcherTest {

    private static final TopicKind KIND = TopicKind.FUNDING_SOURCE_UPDATE;

    @ParameterizedTest
    @EnumSource(WaitStrategyType.class)
    void deliversSignalsInPublicationOrder(WaitStrategyType waitStrategy) throws Exception {
        int count = 1000;
        List<Long> seen = new CopyOnWriteArrayList<>();
        CountDownLatch done = new CountDownLatch(count);
        RingBufferSignalDispatcher dispatcher = new RingBufferSignalDispatcher(64, waitStrategy, signal -> {
            seen.add(signal.generation());
            done.countDown();
        }, SubscriptionMetrics.noop());
        try {
            for (long i = 0; i < count; i++) {
                dispatcher.publish(new TopicSignal.Established(KIND, i));
            }
            assertTrue(done.await(10, TimeUnit.SECONDS));
        } finally {
            dispatcher.close();
        }

        List<Long> expected = new ArrayList<>();
        for (long i = 0; i < count; i++) {
            expected.add(i);
        }
        assertEquals(expected, seen);
    }

    @Test
    void handlerRunsOnDispatcherThread() throws Exception {
        Set<String> threads = ConcurrentHashMap.newKeySet();
        CountDownLatch done = new CountDownLatch(1);
        RingBufferSignalDispatcher dispatcher = new RingBufferSignalDispatcher(16, WaitStrategyType.BLOCKING, signal -> {
            threads.add(Thread.currentThread().getName());
            done.countDown();
        }, SubscriptionMetrics.noop());
        try {
            dispatcher.publish(new TopicSignal.Completed(KIND, 1));
            assertTrue(done.await(5, TimeUnit.SECONDS));
        } finally {
            dispatcher.close();
        }

        assertEquals(Set.of("cardwire-dispatcher"), threads);
    }

    @Test
    void handlerFailureDoesNotStopDispatching() throws Exception {
        CountDownLatch done = new CountDownLatch(1);
        RingBufferSignalDispatcher dispatcher = new RingBufferSignalDispatcher(16, WaitStrategyType.BLOCKING, signal -> {
            if (signal.generation() == 1) {
                throw new IllegalStateException("boom");
            }
            done.countDown();
        }, SubscriptionMetrics.noop());
        try {
            dispatcher.publish(new TopicSignal.Established(KIND, 1));
            dispatcher.publish(new TopicSignal.Established(KIND, 2));

            assertTrue(done.await(5, TimeUnit.SECONDS));
        } finally {
            dispatcher.close();
        }
    }

    @Test
    void signalsPublishedAfterCloseAreDropped() throws Exception {
        List<TopicSignal> seen = new CopyOnWriteArrayList<>();
        RingBufferSignalDispatcher dispatcher = new RingBufferSignalDispatcher(
                16, WaitStrategyType.BLOCKING, seen::add, SubscriptionMetrics.noop());

        dispatcher.close();
        dispatcher.close();
        dispatcher.publish(new TopicSignal.Established(KIND, 1));

        Thread.sleep(100);
        assertTrue(seen.isEmpty());
    }

    @Test
    void signalsPublishedBeforeCloseAreDelivered() throws Exception {
        List<Long> seen = new CopyOnWriteArrayList<>();
        CountDownLatch release = new CountDownLatch(1);
        RingBufferSignalDispatcher dispatcher = new RingBufferSignalDispatcher(16, WaitStrategyType.BLOCKING, signal -> {
            if (signal.generation() == 1) {
                await(release);
            }
            seen.add(signal.generation());
        }, SubscriptionMetrics.noop());

        dispatcher.publish(new TopicSignal.Established(KIND, 1));
        dispatcher.publish(new TopicSignal.Established(KIND, 2));
        dispatcher.publish(new TopicSignal.Completed(KIND, 3));
        release.countDown();
        dispatcher.close();

        assertEquals(List.of(1L, 2L, 3L), seen);
    }

    @Test
    void closeFromHandlerReturnsWithoutWaiting() throws Exception {
        List<Long> seen = new CopyOnWriteArrayList<>();
        CountDownLatch closed = new CountDownLatch(1);
        AtomicReference<RingBufferSignalDispatcher> self = new AtomicReference<>();
        RingBufferSignalDispatcher dispatcher = new RingBufferSignalDispatcher(16, WaitStrategyType.BLOCKING, signal -> {
            seen.add(signal.generation());
            self.get().close();
            closed.countDown();
        }, SubscriptionMetrics.noop());
        self.set(dispatcher);

        dispatcher.publish(new TopicSignal.Established(KIND, 1));
        assertTrue(closed.await(5, TimeUnit.SECONDS));
        dispatcher.publish(new TopicSignal.Established(KIND, 2));

        Thread.sleep(100);
        assertEquals(List.of(1L), seen);
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
