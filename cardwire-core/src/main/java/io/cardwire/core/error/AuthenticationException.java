// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.core.error;

/**
 * Thrown when an operation needs the signed-in user's subject and none is available.
 */
public final class AuthenticationException extends CardwireException {

    public AuthenticationException(final String message) {
        super(message);
    }

    public AuthenticationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
