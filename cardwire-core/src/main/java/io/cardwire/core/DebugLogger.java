// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized opt-in debug logger.
 *
 * <p>Messages use {@link String#formatted(Object...)} placeholders and always pass
 * through {@link LogSanitizer} before they reach SLF4J.
 */
@InternalApi
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("io.cardwire.debug");

    private DebugLogger() {
    }

    public static void logSubscription(final String message, final Object... args) {
        if (!CardwireDebug.isSubscriptionLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    public static void logTransport(final String message, final Object... args) {
        if (!CardwireDebug.isTransportLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    /**
     * Generic log method (respects global enabled check).
     */
    public static void log(final String message, final Object... args) {
        if (!CardwireDebug.isEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        LOG.info(LogSanitizer.sanitize(formatted));
    }
}
