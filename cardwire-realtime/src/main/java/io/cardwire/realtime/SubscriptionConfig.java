// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.realtime;

/**
 * Configuration for {@link SubscriptionService}.
 *
 * <p>
 * Transport callbacks are turned into signals and handed to a dispatcher that
 * runs subscriber callbacks. The default dispatcher is an LMAX Disruptor ring
 * buffer drained by one daemon thread, which keeps slow subscribers off the
 * transport's I/O thread. {@link DispatchMode#INLINE} runs subscriber
 * callbacks on the thread that delivered the transport callback.
 *
 * <pre>{@code
 * SubscriptionConfig config = SubscriptionConfig.builder()
 *         .ringBufferSize(2048)
 *         .waitStrategy(WaitStrategyType.LITE_BLOCKING)
 *         .build();
 * }</pre>
 *
 * @param dispatchMode   how signals reach subscribers
 * @param ringBufferSize Disruptor ring buffer size (must be a power of 2)
 * @param waitStrategy   Disruptor wait strategy for the dispatcher thread
 */
public record SubscriptionConfig(
        DispatchMode dispatchMode,
        int ringBufferSize,
        WaitStrategyType waitStrategy) {

    /**
     * How signals are dispatched to subscribers.
     */
    public enum DispatchMode {
        /** One dispatcher thread drains a Disruptor ring buffer. */
        RING_BUFFER,
        /** Subscribers are called on the transport thread. Intended for tests and simple tools. */
        INLINE
    }

    /**
     * Disruptor wait strategy types.
     */
    public enum WaitStrategyType {
        /** Parks the dispatcher thread immediately. Lowest CPU usage. */
        BLOCKING,
        /** Spins briefly before parking. */
        LITE_BLOCKING,
        /** Busy-spins with yields. Lowest latency, one core kept busy. */
        YIELDING
    }

    private static final int DEFAULT_RING_SIZE = 1024;

    /**
     * Compact constructor with validation and defaults.
     */
    public SubscriptionConfig {
        if (dispatchMode == null)
            dispatchMode = DispatchMode.RING_BUFFER;
        if (ringBufferSize <= 0)
            ringBufferSize = DEFAULT_RING_SIZE;
        if (waitStrategy == null)
            waitStrategy = WaitStrategyType.BLOCKING;

        if ((ringBufferSize & (ringBufferSize - 1)) != 0) {
            throw new IllegalArgumentException(
                    "ringBufferSize must be a power of 2, got: " + ringBufferSize
                            + ", try: " + Integer.highestOneBit(ringBufferSize) * 2);
        }
    }

    /**
     * Creates a configuration with all defaults.
     *
     * @return a ring buffer configuration with 1024 slots and a blocking wait strategy
     */
    public static SubscriptionConfig defaults() {
        return new SubscriptionConfig(null, 0, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link SubscriptionConfig}.
     */
    public static final class Builder {
        private DispatchMode dispatchMode = null;
        private int ringBufferSize = 0;
        private WaitStrategyType waitStrategy = null;

        private Builder() {
        }

        /**
         * Sets the dispatch mode. Default: RING_BUFFER.
         */
        public Builder dispatchMode(DispatchMode dispatchMode) {
            this.dispatchMode = dispatchMode;
            return this;
        }

        /**
         * Sets the Disruptor ring buffer size.
         * Must be a power of 2. Default: 1024.
         */
        public Builder ringBufferSize(int ringBufferSize) {
            this.ringBufferSize = ringBufferSize;
            return this;
        }

        /**
         * Sets the Disruptor wait strategy. Default: BLOCKING.
         */
        public Builder waitStrategy(WaitStrategyType waitStrategy) {
            this.waitStrategy = waitStrategy;
            return this;
        }

        public SubscriptionConfig build() {
            return new SubscriptionConfig(dispatchMode, ringBufferSize, waitStrategy);
        }
    }
}
