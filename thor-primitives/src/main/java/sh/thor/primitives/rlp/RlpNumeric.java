// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.primitives.rlp;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

/**
 * Minimal big-endian conversions for unsigned integers.
 */
public final class RlpNumeric {

    private RlpNumeric() {
        // Utility class
    }

    /**
     * Strips the sign byte and leading zeros; zero becomes the empty array.
     *
     * @param value a non-negative value
     * @return minimal big-endian bytes
     * @throws IllegalArgumentException if {@code value} is negative
     */
    public static byte[] toMinimalBytes(final BigInteger value) {
        Objects.requireNonNull(value, "value cannot be null");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("RLP numeric values must be non-negative");
        }
        if (value.signum() == 0) {
            return new byte[0];
        }
        final byte[] raw = value.toByteArray();
        if (raw[0] == 0) {
            return Arrays.copyOfRange(raw, 1, raw.length);
        }
        return raw;
    }

    /**
     * @param value a non-negative value
     * @return minimal big-endian bytes
     */
    public static byte[] toMinimalBytes(final long value) {
        if (value < 0) {
            throw new IllegalArgumentException("RLP numeric values must be non-negative");
        }
        if (value == 0) {
            return new byte[0];
        }
        final int size = (64 - Long.numberOfLeadingZeros(value) + 7) >>> 3;
        final byte[] result = new byte[size];
        long tmp = value;
        for (int i = size - 1; i >= 0; i--) {
            result[i] = (byte) tmp;
            tmp >>>= 8;
        }
        return result;
    }

    /**
     * Removes leading zero bytes, keeping at least {@code keep} trailing bytes.
     *
     * @param bytes the input
     * @param keep  minimum length of the result (capped at the input length)
     * @return a trimmed copy
     */
    public static byte[] stripLeadingZeros(final byte[] bytes, final int keep) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        final int limit = Math.max(0, bytes.length - keep);
        int start = 0;
        while (start < limit && bytes[start] == 0) {
            start++;
        }
        return Arrays.copyOfRange(bytes, start, bytes.length);
    }

    /**
     * Left-pads with zero bytes up to {@code length}.
     *
     * @param bytes  the input
     * @param length the target length
     * @return a padded copy
     * @throws IllegalArgumentException if the input is already longer than {@code length}
     */
    public static byte[] leftPad(final byte[] bytes, final int length) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        if (bytes.length > length) {
            throw new IllegalArgumentException(
                    "cannot pad " + bytes.length + " bytes to " + length);
        }
        final byte[] result = new byte[length];
        System.arraycopy(bytes, 0, result, length - bytes.length, bytes.length);
        return result;
    }
}
