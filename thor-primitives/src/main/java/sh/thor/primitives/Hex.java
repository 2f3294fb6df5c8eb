// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.primitives;

import java.util.Arrays;

/**
 * Hex encoding and decoding with optional {@code 0x} prefixes.
 *
 * <p>Encoding always produces lowercase output. Decoding accepts either case and
 * an optional {@code 0x}/{@code 0X} prefix.
 *
 * @since 0.1.0
 */
public final class Hex {
    private static final char[] HEX_CHARS = "0123456789abcdef".toCharArray();
    private static final int[] NIBBLE_LOOKUP = new int[128];

    static {
        Arrays.fill(NIBBLE_LOOKUP, -1);

        for (int i = 0; i <= 9; i++) {
            NIBBLE_LOOKUP['0' + i] = i;
        }

        for (int i = 0; i < 6; i++) {
            NIBBLE_LOOKUP['a' + i] = 10 + i;
            NIBBLE_LOOKUP['A' + i] = 10 + i;
        }
    }

    private Hex() {
        // Utility class
    }

    /**
     * Converts a hex string, with or without {@code 0x} prefix, into bytes.
     *
     * @param hexString the string to decode
     * @return the decoded bytes
     * @throws IllegalArgumentException if the input is null, has an odd number of
     *                                  characters, or contains invalid hex
     */
    public static byte[] decode(final String hexString) {
        if (hexString == null) {
            throw new IllegalArgumentException("hex string cannot be null");
        }

        final int start = hasPrefix(hexString) ? 2 : 0;
        final int hexLength = hexString.length() - start;

        if (hexLength == 0) {
            return new byte[0];
        }

        if ((hexLength & 1) == 1) {
            throw new IllegalArgumentException("hex string must have even length: " + hexString);
        }

        final int len = hexLength / 2;
        final byte[] result = new byte[len];

        for (int i = 0; i < len; i++) {
            final int high = toNibble(hexString.charAt(start + i * 2), hexString);
            final int low = toNibble(hexString.charAt(start + i * 2 + 1), hexString);
            result[i] = (byte) ((high << 4) | low);
        }

        return result;
    }

    /**
     * Converts a byte array into a lowercase hex string with a {@code 0x} prefix.
     *
     * @param bytes the bytes to encode
     * @return hex string with {@code 0x} prefix
     * @throws IllegalArgumentException if {@code bytes} is {@code null}
     */
    public static String encode(final byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }
        final char[] chars = new char[2 + bytes.length * 2];
        chars[0] = '0';
        chars[1] = 'x';
        writeHex(bytes, chars, 2);
        return new String(chars);
    }

    /**
     * Converts a byte array into a lowercase hex string without a {@code 0x} prefix.
     *
     * @param bytes the bytes to encode
     * @return hex string without {@code 0x} prefix
     * @throws IllegalArgumentException if {@code bytes} is {@code null}
     */
    public static String encodeNoPrefix(final byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }
        final char[] chars = new char[bytes.length * 2];
        writeHex(bytes, chars, 0);
        return new String(chars);
    }

    /**
     * Formats a single byte value (0x00-0xFF) as {@code 0xNN}.
     *
     * @param value the byte value (0-255)
     * @return four-character hex string, e.g. {@code 0x51}
     * @throws IllegalArgumentException if {@code value} is outside 0-255
     */
    public static String encodeByte(final int value) {
        if (value < 0 || value > 0xFF) {
            throw new IllegalArgumentException("byte value must be in range 0-255: " + value);
        }
        return new String(new char[] {'0', 'x', HEX_CHARS[(value >>> 4) & 0x0F], HEX_CHARS[value & 0x0F]});
    }

    /**
     * Removes a {@code 0x} prefix if present.
     *
     * @param hexString the string to clean
     * @return the string without a {@code 0x} prefix
     * @throws IllegalArgumentException if {@code hexString} is {@code null}
     */
    public static String cleanPrefix(final String hexString) {
        if (hexString == null) {
            throw new IllegalArgumentException("hex string cannot be null");
        }
        return hasPrefix(hexString) ? hexString.substring(2) : hexString;
    }

    /**
     * Returns {@code true} if the string starts with {@code 0x} (case-insensitive).
     *
     * @param hexString the string to check
     * @return {@code true} when the prefix is present
     */
    public static boolean hasPrefix(final String hexString) {
        return hexString != null
                && hexString.length() >= 2
                && hexString.charAt(0) == '0'
                && (hexString.charAt(1) == 'x' || hexString.charAt(1) == 'X');
    }

    /**
     * Returns {@code true} if every character after an optional prefix is a hex digit.
     * Length parity is not checked.
     *
     * @param hexString the string to check
     * @return {@code true} for hex-only content
     */
    public static boolean isHexDigits(final String hexString) {
        if (hexString == null) {
            return false;
        }
        final int start = hasPrefix(hexString) ? 2 : 0;
        for (int i = start; i < hexString.length(); i++) {
            final char c = hexString.charAt(i);
            if (c >= NIBBLE_LOOKUP.length || NIBBLE_LOOKUP[c] == -1) {
                return false;
            }
        }
        return true;
    }

    private static void writeHex(final byte[] bytes, final char[] dest, final int offset) {
        for (int i = 0; i < bytes.length; i++) {
            final int v = bytes[i] & 0xFF;
            dest[offset + i * 2] = HEX_CHARS[v >>> 4];
            dest[offset + i * 2 + 1] = HEX_CHARS[v & 0x0F];
        }
    }

    private static int toNibble(final char c, final String originalInput) {
        if (c >= NIBBLE_LOOKUP.length || NIBBLE_LOOKUP[c] == -1) {
            throw new IllegalArgumentException("invalid hex character in: " + originalInput);
        }
        return NIBBLE_LOOKUP[c];
    }
}
