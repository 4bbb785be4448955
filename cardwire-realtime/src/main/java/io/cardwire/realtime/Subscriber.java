// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.realtime;

/**
 * Base capability of every subscriber: being told when its stream connects or disconnects.
 */
public interface Subscriber {

    /**
     * Connection state of a subscription.
     */
    enum ConnectionState {
        /** Connected and receiving updates. */
        CONNECTED,
        /**
         * Disconnected and not receiving updates. A disconnected subscriber has
         * been unsubscribed and must subscribe again to receive further updates.
         */
        DISCONNECTED
    }

    /**
     * Notifies the subscriber that the connection state of its stream changed.
     *
     * @param state the new state
     */
    void connectionStatusChanged(ConnectionState state);
}
