// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.realtime.transport;

import io.cardwire.core.error.TransportException;

/**
 * Opens upstream subscriptions to the server's change streams.
 *
 * <p>
 * Implementations must be thread-safe. {@link #open} may block until the
 * subscription request has been sent, but must not wait for the server to
 * acknowledge it: acceptance is reported through
 * {@link TransportListener#onEstablished()}.
 */
public interface SubscriptionTransport {

    /**
     * Opens a subscription to a topic.
     *
     * @param topic    the change stream and owner to observe
     * @param listener receives the subscription's lifecycle and events
     * @return a handle that stops the subscription
     * @throws TransportException if the request could not be sent
     */
    UpstreamHandle open(Topic topic, TransportListener listener);
}
