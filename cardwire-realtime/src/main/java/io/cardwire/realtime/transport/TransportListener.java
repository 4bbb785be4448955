// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.realtime.transport;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Receives the lifecycle of one upstream subscription.
 *
 * <p>
 * Callbacks may arrive on a transport I/O thread and must return quickly. After
 * {@link #onCompleted()} or {@link #onFailure(Throwable)} no further callbacks
 * are made for the subscription.
 */
public interface TransportListener {

    /** The server accepted the subscription. */
    void onEstablished();

    /**
     * The server pushed an event.
     *
     * @param payload the event payload, an object with a {@code data} member
     */
    void onEvent(JsonNode payload);

    /** The server ended the subscription. */
    void onCompleted();

    /**
     * The subscription failed or its connection was lost.
     *
     * @param cause what went wrong
     */
    void onFailure(Throwable cause);
}
