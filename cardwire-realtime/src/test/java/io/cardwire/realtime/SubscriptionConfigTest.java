// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.realtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import io.cardwire.realtime.SubscriptionConfig.DispatchMode;
import io.cardwire.realtime.SubscriptionConfig.WaitStrategyType;

class SubscriptionConfigTest {

    @Test
    void defaultsUseBlockingRingBuffer() {
        SubscriptionConfig config = SubscriptionConfig.defaults();

        assertEquals(DispatchMode.RING_BUFFER, config.dispatchMode());
        assertEquals(1024, config.ringBufferSize());
        assertEquals(WaitStrategyType.BLOCKING, config.waitStrategy());
    }

    @Test
    void builderOverridesDefaults() {
        SubscriptionConfig config = SubscriptionConfig.builder()
                .dispatchMode(DispatchMode.INLINE)
                .ringBufferSize(2048)
                .waitStrategy(WaitStrategyType.YIELDING)
                .build();

        assertEquals(DispatchMode.INLINE, config.dispatchMode());
        assertEquals(2048, config.ringBufferSize());
        assertEquals(WaitStrategyType.YIELDING, config.waitStrategy());
    }

    @ParameterizedTest
    @ValueSource(ints = {3, 100, 1000, 1025})
    void rejectsRingBufferSizeThatIsNotPowerOfTwo(int size) {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> SubscriptionConfig.builder().ringBufferSize(size).build());

        assertTrue(ex.getMessage().contains("power of 2"));
    }

    @Test
    void createsDispatcherForMode() {
        try (SignalDispatcher inline = SignalDispatcher.create(
                SubscriptionConfig.builder().dispatchMode(DispatchMode.INLINE).build(),
                signal -> {
                }, SubscriptionMetrics.noop());
                SignalDispatcher ringBuffer = SignalDispatcher.create(
                        SubscriptionConfig.builder().ringBufferSize(16).build(),
                        signal -> {
                        }, SubscriptionMetrics.noop())) {
            assertTrue(inline instanceof InlineSignalDispatcher);
            assertTrue(ringBuffer instanceof RingBufferSignalDispatcher);
        }
    }
}
