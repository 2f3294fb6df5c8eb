// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core.types;

import java.util.regex.Pattern;

/**
 * Compiled patterns for fixed-length {@code 0x} hex strings.
 *
 * @since 0.1.0
 */
public final class HexValidator {
    private HexValidator() {}

    /**
     * Creates a pattern matching {@code 0x} followed by exactly {@code byteLength * 2}
     * hex characters.
     *
     * @param byteLength the exact number of bytes the hex string must represent
     * @return a compiled pattern
     */
    public static Pattern fixedLength(int byteLength) {
        int hexChars = byteLength * 2;
        return Pattern.compile("^0x[0-9a-fA-F]{" + hexChars + "}$");
    }
}
