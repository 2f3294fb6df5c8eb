// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core.rlp;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import sh.thor.core.error.RlpCodecException;
import sh.thor.primitives.Hex;
import sh.thor.primitives.rlp.Rlp;
import sh.thor.primitives.rlp.RlpItem;
import sh.thor.primitives.rlp.RlpList;
import sh.thor.primitives.rlp.RlpString;

/**
 * Schema-driven RLP codec: walks a {@link Profile} tree to turn plain values
 * ({@code Map}, {@code List}, numbers, bytes) into RLP and back.
 *
 * <p>
 * Encoding packs the value into an {@link RlpItem} tree and serializes it.
 * Decoding parses the bytes and unpacks the tree against the same profile.
 * Every failure is an {@link RlpCodecException} whose path names the offending
 * field, e.g. {@code transaction.clauses[0].to}.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * Profile point = Profile.of("point", Kind.struct(
 *         Profile.of("x", Kind.numeric(8)),
 *         Profile.of("y", Kind.numeric(8))));
 *
 * byte[] rlp = Profiler.encode(Map.of("x", 1, "y", 2), point);
 * Map<?, ?> decoded = (Map<?, ?>) Profiler.decode(rlp, point);
 * }</pre>
 *
 * @since 0.1.0
 */
public final class Profiler {

    private static final int DESCRIBE_LIMIT = 64;

    private Profiler() {
        // Utility class
    }

    /**
     * Encodes {@code value} as described by {@code profile}.
     *
     * @param value   plain value tree
     * @param profile layout
     * @return RLP bytes
     * @throws RlpCodecException if the value does not fit the profile
     */
    public static byte[] encode(final Object value, final Profile profile) {
        return Rlp.encode(pack(value, profile));
    }

    /**
     * Decodes RLP bytes as described by {@code profile}.
     *
     * @param encoded RLP bytes
     * @param profile layout
     * @return plain value tree
     * @throws RlpCodecException on malformed RLP or a layout mismatch
     */
    public static Object decode(final byte[] encoded, final Profile profile) {
        Objects.requireNonNull(encoded, "encoded");
        final RlpItem item;
        try {
            item = Rlp.decode(encoded);
        } catch (IllegalArgumentException e) {
            throw new RlpCodecException("RLP decode error: " + e.getMessage(), profile.name(), e);
        }
        return unpack(item, profile);
    }

    public static RlpItem pack(final Object value, final Profile profile) {
        Objects.requireNonNull(profile, "profile");
        return pack(value, profile.kind(), profile.name());
    }

    public static Object unpack(final RlpItem item, final Profile profile) {
        Objects.requireNonNull(item, "item");
        Objects.requireNonNull(profile, "profile");
        return unpack(item, profile.kind(), profile.name());
    }

    private static RlpItem pack(final Object value, final Kind kind, final String path) {
        if (kind instanceof Kind.Scalar scalar) {
            return RlpString.of(scalar.encode(value, path));
        }
        if (kind instanceof Kind.Array array) {
            if (!(value instanceof Collection<?> values)) {
                throw new RlpCodecException("Expected array in " + path + ", got: " + describe(value), path);
            }
            final List<RlpItem> items = new ArrayList<>(values.size());
            int index = 0;
            for (final Object element : values) {
                items.add(pack(element, array.item(), childPath(path, "[" + index + "]")));
                index++;
            }
            return RlpList.of(items);
        }
        final Kind.Struct struct = (Kind.Struct) kind;
        if (!(value instanceof Map<?, ?> map)) {
            throw new RlpCodecException("Expected map in " + path + ", got: " + describe(value), path);
        }
        final List<RlpItem> items = new ArrayList<>(struct.arity());
        for (final Profile field : struct.fields()) {
            items.add(pack(map.get(field.name()), field.kind(), childPath(path, field.name())));
        }
        return RlpList.of(items);
    }

    private static Object unpack(final RlpItem item, final Kind kind, final String path) {
        if (kind instanceof Kind.Scalar scalar) {
            if (!(item instanceof RlpString string)) {
                throw new RlpCodecException(
                        "Type mismatch in " + path + ": expected byte string, got list", path);
            }
            return scalar.decode(string.bytes(), path);
        }
        if (kind instanceof Kind.Array array) {
            if (!(item instanceof RlpList list)) {
                throw new RlpCodecException("Expected array in " + path + ", got byte string", path);
            }
            final List<Object> values = new ArrayList<>(list.size());
            for (int i = 0; i < list.size(); i++) {
                values.add(unpack(list.get(i), array.item(), childPath(path, "[" + i + "]")));
            }
            return values;
        }
        final Kind.Struct struct = (Kind.Struct) kind;
        if (!(item instanceof RlpList list)) {
            throw new RlpCodecException(
                    "Type mismatch in " + path + ": expected list, got byte string", path);
        }
        if (list.size() != struct.arity()) {
            throw new RlpCodecException(
                    "Structure field count mismatch in " + path + ": expected " + struct.arity()
                            + ", got " + list.size(),
                    path);
        }
        final Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < struct.arity(); i++) {
            final Profile field = struct.fields().get(i);
            values.put(field.name(), unpack(list.get(i), field.kind(), childPath(path, field.name())));
        }
        return values;
    }

    static String childPath(final String parent, final String name) {
        if (parent == null || parent.isEmpty()) {
            return name;
        }
        return name.startsWith("[") ? parent + name : parent + "." + name;
    }

    static String describe(final Object value) {
        final String text;
        if (value instanceof byte[] bytes) {
            text = Hex.encode(bytes);
        } else {
            text = String.valueOf(value);
        }
        return text.length() > DESCRIBE_LIMIT ? text.substring(0, DESCRIBE_LIMIT) + "..." : text;
    }
}
