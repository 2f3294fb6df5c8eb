// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.primitives.rlp;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Recursive Length Prefix (RLP) serialization of byte strings and nested lists.
 *
 * <p>Decoding is strict: trailing bytes, truncated payloads, non-minimal length
 * prefixes and single bytes below {@code 0x80} wrapped in a string header are all
 * rejected with {@link IllegalArgumentException}.
 *
 * @see <a href="https://ethereum.org/en/developers/docs/data-structures-and-encoding/rlp/">RLP</a>
 */
public final class Rlp {

    private static final int SHORT_LIMIT = 55;

    private Rlp() {
        // Utility class
    }

    /**
     * Encodes the provided item.
     *
     * @param item the item to encode
     * @return encoded bytes
     */
    public static byte[] encode(final RlpItem item) {
        Objects.requireNonNull(item, "item cannot be null");
        return item.encode();
    }

    /**
     * Encodes a byte string.
     *
     * @param bytes the raw bytes
     * @return encoded bytes
     */
    public static byte[] encodeString(final byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes cannot be null");

        final int length = bytes.length;

        // a single byte below 0x80 is its own encoding
        if (length == 1 && (bytes[0] & 0xFF) <= 0x7F) {
            return new byte[] {bytes[0]};
        }

        if (length <= SHORT_LIMIT) {
            final byte[] result = new byte[1 + length];
            result[0] = (byte) (0x80 + length);
            System.arraycopy(bytes, 0, result, 1, length);
            return result;
        }

        final int lengthSize = lengthSize(length);
        final byte[] result = new byte[1 + lengthSize + length];
        result[0] = (byte) (0xB7 + lengthSize);
        writeLength(result, 1, length, lengthSize);
        System.arraycopy(bytes, 0, result, 1 + lengthSize, length);
        return result;
    }

    /**
     * Encodes a list of items.
     *
     * @param items the items to encode
     * @return encoded bytes
     */
    public static byte[] encodeList(final List<RlpItem> items) {
        Objects.requireNonNull(items, "items cannot be null");

        final int itemCount = items.size();
        if (itemCount == 0) {
            return new byte[] {(byte) 0xC0};
        }

        final byte[][] encodedItems = new byte[itemCount][];
        int payloadSize = 0;
        for (int i = 0; i < itemCount; i++) {
            final RlpItem item = Objects.requireNonNull(items.get(i), "items cannot contain null values");
            encodedItems[i] = item.encode();
            payloadSize += encodedItems[i].length;
        }

        final int headerSize;
        final byte[] result;
        if (payloadSize <= SHORT_LIMIT) {
            headerSize = 1;
            result = new byte[1 + payloadSize];
            result[0] = (byte) (0xC0 + payloadSize);
        } else {
            final int lengthSize = lengthSize(payloadSize);
            headerSize = 1 + lengthSize;
            result = new byte[headerSize + payloadSize];
            result[0] = (byte) (0xF7 + lengthSize);
            writeLength(result, 1, payloadSize, lengthSize);
        }

        int offset = headerSize;
        for (final byte[] encoded : encodedItems) {
            System.arraycopy(encoded, 0, result, offset, encoded.length);
            offset += encoded.length;
        }
        return result;
    }

    /**
     * Decodes a complete RLP payload.
     *
     * @param encoded the encoded bytes
     * @return decoded node tree
     * @throws IllegalArgumentException on malformed input or trailing bytes
     */
    public static RlpItem decode(final byte[] encoded) {
        Objects.requireNonNull(encoded, "encoded cannot be null");
        final DecodeResult result = decode(encoded, 0);
        if (result.consumed != encoded.length) {
            throw new IllegalArgumentException("RLP data has trailing bytes");
        }
        return result.item;
    }

    /**
     * Decodes a payload whose root must be a list.
     *
     * @param encoded the encoded bytes
     * @return the root list's items
     * @throws IllegalArgumentException if the root is not a list
     */
    public static List<RlpItem> decodeList(final byte[] encoded) {
        final RlpItem item = decode(encoded);
        if (item instanceof RlpList list) {
            return list.items();
        }
        throw new IllegalArgumentException("RLP data is not a list");
    }

    private static DecodeResult decode(final byte[] data, final int offset) {
        if (offset >= data.length) {
            throw new IllegalArgumentException("Invalid RLP data: offset beyond end");
        }

        final int prefix = data[offset] & 0xFF;

        if (prefix <= 0x7F) {
            return new DecodeResult(new RlpString(new byte[] {(byte) prefix}), 1);
        }
        if (prefix <= 0xB7) {
            final int length = prefix - 0x80;
            final DecodeResult result = decodeString(data, offset, length, 1);
            if (length == 1 && (data[offset + 1] & 0xFF) <= 0x7F) {
                throw new IllegalArgumentException("Non-canonical single byte string");
            }
            return result;
        }
        if (prefix <= 0xBF) {
            final int lengthOfLength = prefix - 0xB7;
            final int length = readLongLength(data, offset, lengthOfLength, "string");
            return decodeString(data, offset, length, 1 + lengthOfLength);
        }
        if (prefix <= 0xF7) {
            return decodeList(data, offset, prefix - 0xC0, 1);
        }
        final int lengthOfLength = prefix - 0xF7;
        final int length = readLongLength(data, offset, lengthOfLength, "list");
        return decodeList(data, offset, length, 1 + lengthOfLength);
    }

    private static DecodeResult decodeString(
            final byte[] data, final int offset, final int length, final int headerSize) {
        final int start = offset + headerSize;
        if (length < 0 || start + length > data.length || start + length < start) {
            throw new IllegalArgumentException("Invalid RLP string length");
        }
        final byte[] value = new byte[length];
        System.arraycopy(data, start, value, 0, length);
        return new DecodeResult(new RlpString(value), headerSize + length);
    }

    private static DecodeResult decodeList(
            final byte[] data, final int offset, final int length, final int headerSize) {
        final int start = offset + headerSize;
        final int end = start + length;
        if (length < 0 || end > data.length || end < start) {
            throw new IllegalArgumentException("Invalid RLP list length");
        }

        final List<RlpItem> items = new ArrayList<>(Math.max(1, Math.min(16, length)));
        int current = start;
        while (current < end) {
            final DecodeResult child = decode(data, current);
            items.add(child.item);
            current += child.consumed;
        }
        if (current != end) {
            throw new IllegalArgumentException("RLP list length mismatch");
        }
        return new DecodeResult(new RlpList(items), headerSize + length);
    }

    private static int readLongLength(
            final byte[] data, final int offset, final int lengthOfLength, final String what) {
        final int start = offset + 1;
        if (start + lengthOfLength > data.length) {
            throw new IllegalArgumentException("Invalid RLP long " + what + " length");
        }
        if (lengthOfLength < 1 || lengthOfLength > 4) {
            throw new IllegalArgumentException("Invalid length-of-length: " + lengthOfLength);
        }
        if ((data[start] & 0xFF) == 0) {
            throw new IllegalArgumentException("Length has leading zeros");
        }
        long length = 0;
        for (int i = 0; i < lengthOfLength; i++) {
            length = (length << 8) | (data[start + i] & 0xFF);
        }
        if (length > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("RLP " + what + " too large");
        }
        if (length <= SHORT_LIMIT) {
            throw new IllegalArgumentException("Non-minimal length encoding for " + what);
        }
        return (int) length;
    }

    private static int lengthSize(final int value) {
        if (value < 0x100) {
            return 1;
        }
        if (value < 0x10000) {
            return 2;
        }
        if (value < 0x1000000) {
            return 3;
        }
        return 4;
    }

    private static void writeLength(final byte[] buffer, final int offset, final int value, final int size) {
        for (int i = 0; i < size; i++) {
            buffer[offset + i] = (byte) (value >>> (8 * (size - 1 - i)));
        }
    }

    private record DecodeResult(RlpItem item, int consumed) {
    }
}
