// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogSanitizerTest {

    @Test
    void redactsRawTransactionPayload() {
        final String sanitized = LogSanitizer.sanitize("{\"raw\":\"0xf85481\"}");

        assertEquals("{\"raw\":\"0x***[REDACTED]***\"}", sanitized);
    }

    @Test
    void redactsPrivateKeyWithWhitespace() {
        final String sanitized = LogSanitizer.sanitize("{\"privateKey\" : \"0xabc\", \"to\":\"0x1\"}");

        assertFalse(sanitized.contains("0xabc"));
        assertTrue(sanitized.contains("\"to\":\"0x1\""));
    }

    @Test
    void truncatesLongOutput() {
        final String sanitized = LogSanitizer.sanitize("a".repeat(5000));

        assertEquals(2000, sanitized.length());
        assertTrue(sanitized.endsWith("...(truncated)"));
    }

    @Test
    void nullBecomesLiteral() {
        assertEquals("null", LogSanitizer.sanitize(null));
    }
}
