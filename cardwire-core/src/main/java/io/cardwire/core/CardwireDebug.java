// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.core;

import java.util.Properties;

/**
 * Global toggle for enabling verbose debug logging across Cardwire modules.
 *
 * <p>The initial state is read from the system properties {@code cardwire.debug}
 * (both categories), {@code cardwire.debug.subscription} and
 * {@code cardwire.debug.transport}.
 *
 * <p>Thread safety: The individual boolean fields are volatile, ensuring visibility
 * across threads. The compound check in {@link #isEnabled()} reads them non-atomically,
 * which is fine for best-effort logging.
 */
public final class CardwireDebug {

    private static volatile boolean subscriptionLogging = false;
    private static volatile boolean transportLogging = false;

    static final String ENABLED_PROPERTY = "cardwire.debug";
    static final String SUBSCRIPTION_PROPERTY = "cardwire.debug.subscription";
    static final String TRANSPORT_PROPERTY = "cardwire.debug.transport";

    static {
        applyProperties(System.getProperties());
    }

    private CardwireDebug() {
    }

    /**
     * Applies the debug properties that are present; absent ones leave the current state.
     */
    static void applyProperties(final Properties properties) {
        final String enabled = properties.getProperty(ENABLED_PROPERTY);
        if (enabled != null) {
            setEnabled(Boolean.parseBoolean(enabled));
        }
        final String subscription = properties.getProperty(SUBSCRIPTION_PROPERTY);
        if (subscription != null) {
            setSubscriptionLogging(Boolean.parseBoolean(subscription));
        }
        final String transport = properties.getProperty(TRANSPORT_PROPERTY);
        if (transport != null) {
            setTransportLogging(Boolean.parseBoolean(transport));
        }
    }

    /**
     * Checks if any debug logging is enabled.
     *
     * @return true if either subscription or transport logging is enabled
     */
    public static boolean isEnabled() {
        return subscriptionLogging || transportLogging;
    }

    public static void setEnabled(final boolean enabled) {
        subscriptionLogging = enabled;
        transportLogging = enabled;
    }

    public static void setSubscriptionLogging(final boolean enabled) {
        subscriptionLogging = enabled;
    }

    public static boolean isSubscriptionLoggingEnabled() {
        return subscriptionLogging;
    }

    public static void setTransportLogging(final boolean enabled) {
        transportLogging = enabled;
    }

    public static boolean isTransportLoggingEnabled() {
        return transportLogging;
    }
}
