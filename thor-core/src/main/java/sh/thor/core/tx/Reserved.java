// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core.tx;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import sh.thor.core.error.RlpCodecException;
import sh.thor.core.types.HexData;
import sh.thor.primitives.rlp.RlpNumeric;

/**
 * The transaction's reserved field: a feature bitmask followed by entries kept
 * for future use.
 *
 * <p>Bit 0 enables VIP-191 fee delegation, where a second party (the gas payer)
 * co-signs and pays for gas. With no features and no unused entries the field
 * encodes as an empty list.
 *
 * @param featureBits 32-bit unsigned feature mask
 * @param unused      trailing entries, carried through unchanged
 */
public record Reserved(long featureBits, List<HexData> unused) {

    /** VIP-191 designated gas payer. */
    public static final long FEE_DELEGATION = 0x01L;

    public static final Reserved EMPTY = new Reserved(0L, List.of());

    private static final long MAX_FEATURES = 0xFFFF_FFFFL;

    public Reserved {
        if (featureBits < 0 || featureBits > MAX_FEATURES) {
            throw new IllegalArgumentException("features must fit in 32 bits, got: " + featureBits);
        }
        unused = List.copyOf(Objects.requireNonNull(unused, "unused cannot be null"));
    }

    public static Reserved of(final long featureBits) {
        return featureBits == 0 ? EMPTY : new Reserved(featureBits, List.of());
    }

    public Reserved withFeeDelegation() {
        return new Reserved(featureBits | FEE_DELEGATION, unused);
    }

    public Reserved withoutFeeDelegation() {
        return new Reserved(featureBits & ~FEE_DELEGATION, unused);
    }

    public boolean isFeeDelegationEnabled() {
        return (featureBits & FEE_DELEGATION) != 0;
    }

    /**
     * @return names of the enabled known features, e.g. {@code ["fee_delegation"]}
     */
    public List<String> features() {
        final List<String> names = new ArrayList<>(1);
        if (isFeeDelegationEnabled()) {
            names.add("fee_delegation");
        }
        return List.copyOf(names);
    }

    public boolean isEmpty() {
        return featureBits == 0 && unused.isEmpty();
    }

    /**
     * Trailing empty entries are trimmed, so the result always decodes back.
     *
     * @return the list form written to the wire
     */
    public List<byte[]> toRlpList() {
        final List<byte[]> items = new ArrayList<>(1 + unused.size());
        items.add(RlpNumeric.toMinimalBytes(featureBits));
        for (final HexData entry : unused) {
            items.add(entry.toBytes());
        }
        while (!items.isEmpty() && items.get(items.size() - 1).length == 0) {
            items.remove(items.size() - 1);
        }
        return items;
    }

    /**
     * @param items the decoded list
     * @return the reserved field
     * @throws RlpCodecException if the feature mask is wider than 4 bytes or has a
     *         leading zero, or if the list ends with an empty entry
     */
    public static Reserved fromRlpList(final List<byte[]> items) {
        if (items.isEmpty()) {
            return EMPTY;
        }
        final int last = items.size() - 1;
        if (items.get(last).length == 0) {
            final String path = "transaction.reserved[" + last + "]";
            throw new RlpCodecException("Trailing empty entry in " + path, path);
        }
        final byte[] features = items.get(0);
        if (features.length > 4) {
            throw new RlpCodecException(
                    "Buffer exceeds max_bytes (4) in transaction.reserved[0]", "transaction.reserved[0]");
        }
        if (features.length > 0 && features[0] == 0) {
            throw new RlpCodecException(
                    "Leading zero byte in transaction.reserved[0]", "transaction.reserved[0]");
        }
        final long bits = features.length == 0 ? 0L : new BigInteger(1, features).longValue();
        final List<HexData> rest = new ArrayList<>(items.size() - 1);
        for (int i = 1; i < items.size(); i++) {
            rest.add(HexData.fromBytes(items.get(i)));
        }
        return new Reserved(bits, rest);
    }
}
