// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.realtime.transport;

/**
 * A live upstream subscription returned by {@link SubscriptionTransport#open}.
 */
public interface UpstreamHandle {

    /**
     * Stops the upstream subscription. Calling this more than once has no further effect.
     */
    void cancel();

    /**
     * @return true once {@link #cancel()} has been called
     */
    boolean isCancelled();
}
