// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core.chain;

import java.util.Arrays;
import java.util.Objects;

import sh.thor.core.types.Hash;

/**
 * Supplies the 8-byte block reference a transaction is anchored to: the first
 * 8 bytes of a recent block id. A transaction is only valid in blocks after the
 * referenced one.
 */
@FunctionalInterface
public interface BlockRefProvider {

    int LENGTH = 8;

    /**
     * @return 8 bytes
     */
    byte[] blockRef();

    /**
     * @param blockId a block id
     * @return a provider that always yields the first 8 bytes of {@code blockId}
     */
    static BlockRefProvider of(final Hash blockId) {
        Objects.requireNonNull(blockId, "blockId cannot be null");
        final byte[] ref = Arrays.copyOf(blockId.toBytes(), LENGTH);
        return ref::clone;
    }

    /**
     * @param blockRef exactly 8 bytes
     * @return a provider that always yields {@code blockRef}
     * @throws IllegalArgumentException if the length is not 8
     */
    static BlockRefProvider fixed(final byte[] blockRef) {
        Objects.requireNonNull(blockRef, "blockRef cannot be null");
        if (blockRef.length != LENGTH) {
            throw new IllegalArgumentException("blockRef must be 8 bytes, got " + blockRef.length);
        }
        final byte[] ref = blockRef.clone();
        return ref::clone;
    }
}
