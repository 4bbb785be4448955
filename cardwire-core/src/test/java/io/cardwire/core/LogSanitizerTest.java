// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogSanitizerTest {

    @Test
    void sanitizesAuthorizationHeader() {
        String input = "{\"type\":\"start\",\"payload\":{\"extensions\":{\"authorization\":"
                + "{\"Authorization\":\"eyJhbGciOiJSUzI1NiJ9.secret\"}}}}";
        String sanitized = LogSanitizer.sanitize(input);

        assertFalse(sanitized.contains("eyJhbGciOiJSUzI1NiJ9"));
        assertTrue(sanitized.contains("\"Authorization\":\"***[REDACTED]***\""));
    }

    @Test
    void sanitizesApiKey() {
        String input = "{\"x-api-key\":\"da2-abcdefghijklmnop\"}";

        assertEquals("{\"x-api-key\":\"***[REDACTED]***\"}", LogSanitizer.sanitize(input));
    }

    @Test
    void sanitizesKeyId() {
        String input = "{\"id\":\"txn-1\",\"keyId\":\"device-key-42\"}";

        assertEquals("{\"id\":\"txn-1\",\"keyId\":\"***[REDACTED]***\"}", LogSanitizer.sanitize(input));
    }

    @Test
    void truncatesToExactMaxLength() {
        String sanitized = LogSanitizer.sanitize("x".repeat(3000));

        assertEquals(2000, sanitized.length());
        assertEquals("x".repeat(1986) + "...(truncated)", sanitized);
    }

    @Test
    void doesNotTruncateAtExactLimit() {
        String exactLimit = "y".repeat(2000);

        assertEquals(exactLimit, LogSanitizer.sanitize(exactLimit));
    }

    @Test
    void handlesNull() {
        assertEquals("null", LogSanitizer.sanitize(null));
    }

    @Test
    void leavesSafeDataUntouched() {
        String input = "{\"type\":\"ka\"}";
        assertEquals(input, LogSanitizer.sanitize(input));
    }
}
