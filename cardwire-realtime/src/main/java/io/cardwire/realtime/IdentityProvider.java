// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.realtime;

import java.util.Optional;

/**
 * Supplies the subject of the signed-in user. Subscriptions are scoped to it.
 */
@FunctionalInterface
public interface IdentityProvider {

    /**
     * @return the current user's subject, or empty when nobody is signed in
     */
    Optional<String> currentSubject();
}
