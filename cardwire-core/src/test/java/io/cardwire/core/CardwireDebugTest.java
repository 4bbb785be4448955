// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.core;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Properties;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class CardwireDebugTest {

    @AfterEach
    void tearDown() {
        CardwireDebug.setEnabled(false);
    }

    @Test
    void debugPropertyEnablesBothCategories() {
        Properties properties = new Properties();
        properties.setProperty(CardwireDebug.ENABLED_PROPERTY, "true");

        CardwireDebug.applyProperties(properties);

        assertTrue(CardwireDebug.isSubscriptionLoggingEnabled());
        assertTrue(CardwireDebug.isTransportLoggingEnabled());
    }

    @Test
    void categoryPropertyOverridesGlobalOne() {
        Properties properties = new Properties();
        properties.setProperty(CardwireDebug.ENABLED_PROPERTY, "true");
        properties.setProperty(CardwireDebug.TRANSPORT_PROPERTY, "false");

        CardwireDebug.applyProperties(properties);

        assertTrue(CardwireDebug.isSubscriptionLoggingEnabled());
        assertFalse(CardwireDebug.isTransportLoggingEnabled());
        assertTrue(CardwireDebug.isEnabled());
    }

    @Test
    void absentPropertiesKeepCurrentState() {
        CardwireDebug.setTransportLogging(true);

        CardwireDebug.applyProperties(new Properties());

        assertTrue(CardwireDebug.isTransportLoggingEnabled());
        assertFalse(CardwireDebug.isSubscriptionLoggingEnabled());
    }
}
