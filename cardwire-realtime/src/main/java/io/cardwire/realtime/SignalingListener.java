// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.realtime;

import com.fasterxml.jackson.databind.JsonNode;

import io.cardwire.realtime.transport.TopicKind;
import io.cardwire.realtime.transport.TransportListener;

/**
 * Turns the callbacks of one upstream subscription into signals stamped with its generation.
 */
final class SignalingListener implements TransportListener {

    private final TopicKind kind;
    private final long generation;
    private final SignalDispatcher dispatcher;

    SignalingListener(final TopicKind kind, final long generation, final SignalDispatcher dispatcher) {
        this.kind = kind;
        this.generation = generation;
        this.dispatcher = dispatcher;
    }

    @Override
    public void onEstablished() {
        dispatcher.publish(new TopicSignal.Established(kind, generation));
    }

    @Override
    public void onEvent(final JsonNode payload) {
        dispatcher.publish(new TopicSignal.Event(kind, generation, payload));
    }

    @Override
    public void onCompleted() {
        dispatcher.publish(new TopicSignal.Completed(kind, generation));
    }

    @Override
    public void onFailure(final Throwable cause) {
        dispatcher.publish(new TopicSignal.Failed(kind, generation, cause));
    }
}
