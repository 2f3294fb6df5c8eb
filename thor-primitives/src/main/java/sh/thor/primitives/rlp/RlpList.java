// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.primitives.rlp;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * RLP list node.
 *
 * @param items the child nodes, in wire order
 */
public record RlpList(List<RlpItem> items) implements RlpItem {

    public RlpList {
        Objects.requireNonNull(items, "items cannot be null");
        // List.copyOf rejects null elements
        items = List.copyOf(items);
    }

    public static RlpList of(final RlpItem... items) {
        return new RlpList(Arrays.asList(items));
    }

    public static RlpList of(final List<RlpItem> items) {
        return new RlpList(items);
    }

    public int size() {
        return items.size();
    }

    public RlpItem get(final int index) {
        return items.get(index);
    }

    @Override
    public byte[] encode() {
        return Rlp.encodeList(items);
    }
}
