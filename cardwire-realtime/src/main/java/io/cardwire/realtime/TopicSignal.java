// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.realtime;

import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

import io.cardwire.realtime.transport.TopicKind;

/**
 * A transport callback turned into a value that can travel through the signal channel.
 *
 * <p>
 * Each signal carries the generation of the upstream subscription that produced
 * it so that signals from a cancelled or replaced subscription can be ignored.
 */
sealed interface TopicSignal
        permits TopicSignal.Established, TopicSignal.Event, TopicSignal.Completed, TopicSignal.Failed,
        TopicSignal.Removed {

    TopicKind kind();

    long generation();

    record Established(TopicKind kind, long generation) implements TopicSignal {
    }

    record Event(TopicKind kind, long generation, JsonNode payload) implements TopicSignal {
    }

    record Completed(TopicKind kind, long generation) implements TopicSignal {
    }

    record Failed(TopicKind kind, long generation, Throwable cause) implements TopicSignal {
    }

    /**
     * Subscribers removed by the caller, to be told DISCONNECTED after any event
     * already queued for them.
     */
    record Removed(TopicKind kind, Map<String, ? extends Subscriber> subscribers) implements TopicSignal {

        /** Removal is not tied to an upstream subscription. */
        @Override
        public long generation() {
            return -1;
        }
    }
}
