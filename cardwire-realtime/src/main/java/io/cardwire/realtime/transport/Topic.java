// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.realtime.transport;

import java.util.Objects;

/**
 * A change stream scoped to one owner. At most one upstream subscription exists per topic.
 *
 * @param kind  the change stream
 * @param owner subject of the user whose records are observed
 */
public record Topic(TopicKind kind, String owner) {

    public Topic {
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(owner, "owner cannot be null");
    }
}
