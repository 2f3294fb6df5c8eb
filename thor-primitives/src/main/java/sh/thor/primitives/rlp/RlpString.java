// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.primitives.rlp;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

import sh.thor.primitives.Hex;

/**
 * RLP byte-string node.
 *
 * <p>Numeric factories produce the minimal big-endian form, so zero becomes the
 * empty string rather than a single {@code 0x00} byte.
 */
public final class RlpString implements RlpItem {

    /** Shared empty string, encodes as {@code 0x80}. */
    public static final RlpString EMPTY = new RlpString(new byte[0]);

    private final byte[] bytes;

    RlpString(final byte[] bytes) {
        this.bytes = Objects.requireNonNull(bytes, "bytes cannot be null");
    }

    /**
     * Wraps a copy of the given bytes.
     *
     * @param bytes the raw value
     * @return the node
     */
    public static RlpString of(final byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        return new RlpString(Arrays.copyOf(bytes, bytes.length));
    }

    /**
     * Wraps the bytes of a hex string, with or without {@code 0x} prefix.
     *
     * @param hex the hex text
     * @return the node
     */
    public static RlpString of(final String hex) {
        return new RlpString(Hex.decode(hex));
    }

    /**
     * Minimal big-endian encoding of a non-negative long.
     *
     * @param value the value
     * @return the node
     * @throws IllegalArgumentException if {@code value} is negative
     */
    public static RlpString of(final long value) {
        if (value < 0) {
            throw new IllegalArgumentException("RLP numeric values must be non-negative");
        }
        return new RlpString(RlpNumeric.toMinimalBytes(value));
    }

    /**
     * Minimal big-endian encoding of a non-negative {@link BigInteger}.
     *
     * @param value the value
     * @return the node
     * @throws IllegalArgumentException if {@code value} is negative
     */
    public static RlpString of(final BigInteger value) {
        return new RlpString(RlpNumeric.toMinimalBytes(value));
    }

    /**
     * @return a copy of the raw (pre-RLP) bytes
     */
    public byte[] bytes() {
        return Arrays.copyOf(bytes, bytes.length);
    }

    public int length() {
        return bytes.length;
    }

    public boolean isEmpty() {
        return bytes.length == 0;
    }

    /**
     * Interprets the content as an unsigned big-endian integer; the empty string is zero.
     *
     * @return the value
     */
    public BigInteger asBigInteger() {
        return bytes.length == 0 ? BigInteger.ZERO : new BigInteger(1, bytes);
    }

    @Override
    public byte[] encode() {
        return Rlp.encodeString(bytes);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RlpString other)) {
            return false;
        }
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "RlpString[" + Hex.encode(bytes) + "]";
    }
}
