// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.core.error;

import java.util.List;

import org.jspecify.annotations.Nullable;

/**
 * Exception raised when a streaming connection cannot be established, is lost,
 * or reports a protocol-level error for a subscription.
 *
 * <p>
 * When the server rejects a single subscription the error messages it returned
 * are available through {@link #serverErrors()}.
 */
public final class TransportException extends CardwireException {

    private final List<String> serverErrors;
    private final @Nullable String subscriptionId;

    public TransportException(final String message) {
        this(message, null, List.of(), null);
    }

    public TransportException(final String message, final Throwable cause) {
        this(message, null, List.of(), cause);
    }

    public TransportException(
            final String message,
            final @Nullable String subscriptionId,
            final List<String> serverErrors,
            final @Nullable Throwable cause) {
        super(augmentMessage(message, subscriptionId), cause);
        this.subscriptionId = subscriptionId;
        this.serverErrors = List.copyOf(serverErrors);
    }

    public List<String> serverErrors() {
        return serverErrors;
    }

    public @Nullable String subscriptionId() {
        return subscriptionId;
    }

    public boolean isUnauthorized() {
        for (String error : serverErrors) {
            String lower = error.toLowerCase();
            if (lower.contains("unauthorized") || lower.contains("not authorized")) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "TransportException{"
                + "message="
                + getMessage()
                + ", subscriptionId="
                + subscriptionId
                + ", serverErrors="
                + serverErrors
                + "}";
    }

    private static String augmentMessage(final String message, final @Nullable String subscriptionId) {
        if (subscriptionId == null || message == null || message.isBlank()) {
            return message;
        }
        return "[subscriptionId=" + subscriptionId + "] " + message;
    }
}
