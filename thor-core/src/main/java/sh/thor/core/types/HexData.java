// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core.types;

import java.util.Arrays;
import java.util.Objects;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonValue;

import sh.thor.primitives.Hex;

/**
 * Immutable arbitrary-length byte data with a {@code 0x} hex representation.
 *
 * <p>
 * Used for clause data, block references and signatures. Instances built from
 * bytes keep the raw array and render hex lazily; instances built from text are
 * validated eagerly.
 *
 * <pre>{@code
 * HexData empty = HexData.EMPTY;
 * HexData data = new HexData("0x1234abcd");
 * HexData fromBytes = HexData.fromBytes(new byte[] {0x12, 0x34});
 * }</pre>
 */
public final class HexData {
    private static final Pattern HEX = Pattern.compile("^0x([0-9a-fA-F]{2})*$");

    /** Zero-length data, {@code 0x}. */
    public static final HexData EMPTY = new HexData(new byte[0]);

    private final byte[] raw;
    private volatile String value;

    /**
     * Creates data from a {@code 0x}-prefixed, even-length hex string.
     *
     * @param value the hex text
     * @throws IllegalArgumentException if the text is not valid hex data
     */
    public HexData(final String value) {
        Objects.requireNonNull(value, "hex");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid hex data: " + value);
        }
        this.raw = Hex.decode(value);
    }

    private HexData(final byte[] raw) {
        this.raw = raw;
    }

    /**
     * Wraps a copy of the given bytes.
     *
     * @param bytes the byte array, or null/empty for {@link #EMPTY}
     * @return the data
     */
    public static HexData fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return EMPTY;
        }
        return new HexData(bytes.clone());
    }

    public static HexData of(final String value) {
        return new HexData(value);
    }

    /**
     * @return lowercase hex with {@code 0x} prefix
     */
    @JsonValue
    public String value() {
        String v = value;
        if (v == null) {
            v = Hex.encode(raw);
            value = v;
        }
        return v;
    }

    public int byteLength() {
        return raw.length;
    }

    public boolean isEmpty() {
        return raw.length == 0;
    }

    /**
     * @return a copy of the bytes
     */
    public byte[] toBytes() {
        return raw.clone();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HexData other)) {
            return false;
        }
        return Arrays.equals(raw, other.raw);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(raw);
    }

    @Override
    public String toString() {
        return value();
    }
}
