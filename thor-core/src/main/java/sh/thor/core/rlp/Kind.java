// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core.rlp;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import sh.thor.core.error.RlpCodecException;
import sh.thor.core.types.HexData;
import sh.thor.primitives.Hex;
import sh.thor.primitives.rlp.RlpNumeric;

/**
 * Field kind: how one field of a {@link Profile} maps to and from its RLP form.
 *
 * <p>
 * Scalar kinds turn a single value into an RLP byte string and back. Composite
 * kinds ({@link Array}, {@link Struct}) describe nested lists and are walked by
 * {@link Profiler}. Every scalar kind validates before transforming; a value of
 * the wrong shape raises {@link RlpCodecException} naming the field path and is
 * never coerced.
 *
 * <h2>Accepted values</h2>
 * <table border="1">
 * <tr><th>Kind</th><th>Encode accepts</th><th>Decode yields</th></tr>
 * <tr><td>{@link Numeric}</td><td>{@code Integer}, {@code Long}, {@code BigInteger}, {@code 0x} hex text</td><td>{@code BigInteger}</td></tr>
 * <tr><td>{@link Buffer}</td><td>{@code byte[]}, {@link HexData}</td><td>{@code byte[]}</td></tr>
 * <tr><td>{@link HexBlob} and fixed variants</td><td>{@code 0x} hex text, {@code byte[]}, {@link HexData}</td><td>{@code byte[]}</td></tr>
 * <tr><td>{@link Array}</td><td>{@code List}</td><td>{@code List}</td></tr>
 * <tr><td>{@link Struct}</td><td>{@code Map<String, ?>}</td><td>ordered {@code Map<String, Object>}</td></tr>
 * </table>
 *
 * @since 0.1.0
 */
public sealed interface Kind permits Kind.Scalar, Kind.Array, Kind.Struct {

    /**
     * Kind of a single byte-string field.
     */
    sealed interface Scalar extends Kind
            permits Numeric, Buffer, HexBlob, FixedHexBlob, OptionalFixedHexBlob, CompactFixedHexBlob {

        /**
         * @param value the field value
         * @param path  dotted field path for error messages
         * @return the raw bytes to place in an RLP string
         * @throws RlpCodecException if the value is malformed
         */
        byte[] encode(Object value, String path);

        /**
         * @param bytes the raw content of an RLP string
         * @param path  dotted field path for error messages
         * @return the decoded value
         * @throws RlpCodecException if the bytes violate the kind's constraints
         */
        Object decode(byte[] bytes, String path);
    }

    static Numeric numeric(final int maxBytes) {
        return new Numeric(maxBytes);
    }

    static Buffer buffer() {
        return Buffer.INSTANCE;
    }

    static HexBlob hexBlob() {
        return HexBlob.INSTANCE;
    }

    static FixedHexBlob fixedHexBlob(final int bytes) {
        return new FixedHexBlob(bytes);
    }

    static OptionalFixedHexBlob optionalFixedHexBlob(final int bytes) {
        return new OptionalFixedHexBlob(bytes);
    }

    static CompactFixedHexBlob compactFixedHexBlob(final int bytes) {
        return new CompactFixedHexBlob(bytes);
    }

    static Array array(final Kind item) {
        return new Array(item);
    }

    static Struct struct(final Profile... fields) {
        return new Struct(Arrays.asList(fields));
    }

    /**
     * Unsigned integer stored as minimal big-endian bytes. Zero is the empty string.
     *
     * @param maxBytes upper bound on the encoded length
     */
    record Numeric(int maxBytes) implements Scalar {

        public Numeric {
            if (maxBytes <= 0) {
                throw new IllegalArgumentException("maxBytes must be positive, got " + maxBytes);
            }
        }

        @Override
        public byte[] encode(final Object value, final String path) {
            final BigInteger number = toBigInteger(value, path);
            final byte[] bytes = RlpNumeric.toMinimalBytes(number);
            if (bytes.length > maxBytes) {
                throw new RlpCodecException(
                        "Numeric value exceeds max_bytes (" + maxBytes + ") in " + path, path);
            }
            return bytes;
        }

        @Override
        public BigInteger decode(final byte[] bytes, final String path) {
            if (bytes.length > maxBytes) {
                throw new RlpCodecException("Buffer exceeds max_bytes (" + maxBytes + ") in " + path, path);
            }
            if (bytes.length > 0 && bytes[0] == 0) {
                throw new RlpCodecException("Leading zero byte in numeric value in " + path, path);
            }
            return bytes.length == 0 ? BigInteger.ZERO : new BigInteger(1, bytes);
        }

        private static BigInteger toBigInteger(final Object value, final String path) {
            final BigInteger number;
            if (value instanceof BigInteger big) {
                number = big;
            } else if (value instanceof Long || value instanceof Integer
                    || value instanceof Short || value instanceof Byte) {
                number = BigInteger.valueOf(((Number) value).longValue());
            } else if (value instanceof String text) {
                final String digits = Hex.cleanPrefix(text);
                if (!Hex.hasPrefix(text) || digits.isEmpty() || !Hex.isHexDigits(text)) {
                    throw new RlpCodecException(
                            "Invalid numeric data in " + path + ": " + Profiler.describe(value), path);
                }
                number = new BigInteger(digits, 16);
            } else {
                throw new RlpCodecException(
                        "Expected numeric value in " + path + ", got: " + Profiler.describe(value), path);
            }
            if (number.signum() < 0) {
                throw new RlpCodecException(
                        "Invalid numeric data in " + path + ": " + Profiler.describe(value), path);
            }
            return number;
        }
    }

    /**
     * Raw bytes passed through unchanged (signatures, reserved entries).
     */
    record Buffer() implements Scalar {
        static final Buffer INSTANCE = new Buffer();

        @Override
        public byte[] encode(final Object value, final String path) {
            if (value instanceof byte[] bytes) {
                return bytes.clone();
            }
            if (value instanceof HexData data) {
                return data.toBytes();
            }
            throw new RlpCodecException(
                    "Expected binary buffer in " + path + ", got: " + Profiler.describe(value), path);
        }

        @Override
        public byte[] decode(final byte[] bytes, final String path) {
            return bytes.clone();
        }
    }

    /**
     * Variable-length data given as {@code 0x} hex text or bytes.
     */
    record HexBlob() implements Scalar {
        static final HexBlob INSTANCE = new HexBlob();

        @Override
        public byte[] encode(final Object value, final String path) {
            return toBytes(value, path);
        }

        @Override
        public byte[] decode(final byte[] bytes, final String path) {
            return bytes.clone();
        }

        static byte[] toBytes(final Object value, final String path) {
            if (value instanceof byte[] bytes) {
                return bytes.clone();
            }
            if (value instanceof HexData data) {
                return data.toBytes();
            }
            if (!(value instanceof String text)) {
                throw new RlpCodecException(
                        "Expected hex blob string in " + path + ", got: " + Profiler.describe(value), path);
            }
            if (!text.startsWith("0x")) {
                throw new RlpCodecException("Hex blob must start with 0x in " + path, path);
            }
            if ((text.length() & 1) == 1) {
                throw new RlpCodecException("Hex blob must have even length in " + path, path);
            }
            if (!Hex.isHexDigits(text)) {
                throw new RlpCodecException("Invalid hex encoding in " + path, path);
            }
            return Hex.decode(text);
        }
    }

    /**
     * Hex data of an exact length (addresses are 20 bytes, hashes 32).
     *
     * @param bytes required length
     */
    record FixedHexBlob(int bytes) implements Scalar {

        public FixedHexBlob {
            requirePositive(bytes);
        }

        @Override
        public byte[] encode(final Object value, final String path) {
            final byte[] raw = HexBlob.toBytes(value, path);
            requireLength(raw, bytes, path);
            return raw;
        }

        @Override
        public byte[] decode(final byte[] raw, final String path) {
            requireLength(raw, bytes, path);
            return raw.clone();
        }
    }

    /**
     * Like {@link FixedHexBlob}, but {@code null}, {@code ""}, {@code "0x"} and empty
     * bytes all stand for "absent" and encode as the empty string.
     *
     * @param bytes required length when present
     */
    record OptionalFixedHexBlob(int bytes) implements Scalar {

        public OptionalFixedHexBlob {
            requirePositive(bytes);
        }

        @Override
        public byte[] encode(final Object value, final String path) {
            if (isAbsent(value)) {
                return new byte[0];
            }
            final byte[] raw = HexBlob.toBytes(value, path);
            requireLength(raw, bytes, path);
            return raw;
        }

        @Override
        public byte[] decode(final byte[] raw, final String path) {
            if (raw.length == 0) {
                return new byte[0];
            }
            requireLength(raw, bytes, path);
            return raw.clone();
        }

        private static boolean isAbsent(final Object value) {
            if (value == null) {
                return true;
            }
            if (value instanceof String text) {
                return text.isEmpty() || text.equals("0x");
            }
            if (value instanceof byte[] raw) {
                return raw.length == 0;
            }
            return value instanceof HexData data && data.isEmpty();
        }
    }

    /**
     * Fixed-length data whose leading zero bytes are dropped on the wire (at least
     * one byte is kept) and restored on decode. {@code 0x00000000aabbccdd} travels
     * as {@code aabbccdd}.
     *
     * @param bytes in-memory length
     */
    record CompactFixedHexBlob(int bytes) implements Scalar {

        public CompactFixedHexBlob {
            requirePositive(bytes);
        }

        @Override
        public byte[] encode(final Object value, final String path) {
            final byte[] raw = HexBlob.toBytes(value, path);
            requireLength(raw, bytes, path);
            return RlpNumeric.stripLeadingZeros(raw, 1);
        }

        @Override
        public byte[] decode(final byte[] raw, final String path) {
            if (raw.length > bytes) {
                throw new RlpCodecException(
                        "Expected at most " + bytes + " bytes in " + path + ", got " + raw.length, path);
            }
            if (raw.length == 0) {
                throw new RlpCodecException("Empty compact value in " + path, path);
            }
            if (raw.length > 1 && raw[0] == 0) {
                throw new RlpCodecException("Leading zero byte in compact value in " + path, path);
            }
            return RlpNumeric.leftPad(raw, bytes);
        }
    }

    /**
     * Homogeneous list; each element uses {@code item}.
     *
     * @param item element kind
     */
    record Array(Kind item) implements Kind {
        public Array {
            Objects.requireNonNull(item, "item");
        }
    }

    /**
     * Fixed-arity record. Fields are matched by position only, so the order of
     * {@code fields} is the wire contract.
     *
     * @param fields field profiles in wire order
     */
    record Struct(List<Profile> fields) implements Kind {
        public Struct {
            fields = List.copyOf(fields);
        }

        public int arity() {
            return fields.size();
        }
    }

    private static void requirePositive(final int bytes) {
        if (bytes <= 0) {
            throw new IllegalArgumentException("bytes must be positive, got " + bytes);
        }
    }

    private static void requireLength(final byte[] raw, final int expected, final String path) {
        if (raw.length != expected) {
            throw new RlpCodecException(
                    "Expected " + expected + " bytes in " + path + ", got " + raw.length, path);
        }
    }
}
