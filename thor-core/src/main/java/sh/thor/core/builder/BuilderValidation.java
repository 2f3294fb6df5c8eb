// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core.builder;

import java.math.BigInteger;
import java.util.List;

import sh.thor.core.chain.BlockRefProvider;
import sh.thor.core.chain.NonceGenerator;
import sh.thor.core.tx.Clause;
import sh.thor.core.tx.IntrinsicGas;
import sh.thor.core.types.HexData;

/**
 * Shared resolution and validation for transaction builders.
 */
final class BuilderValidation {

    private BuilderValidation() {
        // Utility class
    }

    static int resolveChainTag(final Integer chainTag) {
        if (chainTag == null) {
            throw new TxBuilderException("Chain tag is required: set chainTag or network");
        }
        return chainTag;
    }

    /**
     * A fixed block reference wins over the provider.
     */
    static HexData resolveBlockRef(final HexData blockRef, final BlockRefProvider provider) {
        if (blockRef != null) {
            return blockRef;
        }
        if (provider == null) {
            throw new TxBuilderException("Block reference is required: set blockRef or blockRefProvider");
        }
        final byte[] ref;
        try {
            ref = provider.blockRef();
        } catch (RuntimeException e) {
            throw new TxBuilderException("Block reference provider failed: " + e.getMessage(), e);
        }
        if (ref == null || ref.length != BlockRefProvider.LENGTH) {
            throw new TxBuilderException("Block reference provider must return 8 bytes, got "
                    + (ref == null ? "null" : ref.length));
        }
        return HexData.fromBytes(ref);
    }

    static void validateExpiration(final long expiration) {
        if (expiration <= 0) {
            throw new TxBuilderException("Expiration must be positive, got " + expiration);
        }
    }

    static BigInteger resolveNonce(final BigInteger nonce, final NonceGenerator generator) {
        if (nonce != null) {
            return nonce;
        }
        return (generator != null ? generator : NonceGenerator.secureRandom()).next();
    }

    static long resolveGas(final Long gas, final List<Clause> clauses) {
        return gas != null ? gas : IntrinsicGas.calculate(clauses);
    }

    static void validateFees(final BigInteger maxPriorityFeePerGas, final BigInteger maxFeePerGas) {
        if (maxPriorityFeePerGas.compareTo(maxFeePerGas) > 0) {
            throw new TxBuilderException("maxPriorityFeePerGas (" + maxPriorityFeePerGas
                    + ") cannot exceed maxFeePerGas (" + maxFeePerGas + ")");
        }
    }
}
