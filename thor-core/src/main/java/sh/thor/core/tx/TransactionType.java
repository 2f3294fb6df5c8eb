// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core.tx;

import org.jspecify.annotations.Nullable;

/**
 * Transaction pricing variant and its envelope prefix.
 */
public enum TransactionType {
    /** Gas price coefficient; bare RLP list. */
    LEGACY(null),
    /** Priority fee and fee cap; prefixed by {@code 0x51}. */
    DYNAMIC_FEE((byte) 0x51);

    private final @Nullable Byte prefix;

    TransactionType(final @Nullable Byte prefix) {
        this.prefix = prefix;
    }

    /**
     * @return the envelope byte, or {@code null} for legacy
     */
    public @Nullable Byte prefix() {
        return prefix;
    }
}
