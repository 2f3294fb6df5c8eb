// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core.chain;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Values the transaction builders fall back to when a field is not set.
 *
 * @param expiration           blocks until expiry, must be positive
 * @param gasPriceCoef         legacy gas price coefficient (0-255)
 * @param maxPriorityFeePerGas dynamic-fee tip
 * @param maxFeePerGas         dynamic-fee cap
 */
public record TransactionDefaults(
        long expiration, int gasPriceCoef, BigInteger maxPriorityFeePerGas, BigInteger maxFeePerGas) {

    public static final TransactionDefaults STANDARD = new TransactionDefaults(
            32L, 0, BigInteger.valueOf(400_000L), BigInteger.valueOf(400_000L));

    public TransactionDefaults {
        if (expiration <= 0 || expiration > 0xFFFF_FFFFL) {
            throw new IllegalArgumentException("expiration must be in range 1-4294967295, got: " + expiration);
        }
        if (gasPriceCoef < 0 || gasPriceCoef > 0xFF) {
            throw new IllegalArgumentException("gasPriceCoef must be in range 0-255, got: " + gasPriceCoef);
        }
        Objects.requireNonNull(maxPriorityFeePerGas, "maxPriorityFeePerGas cannot be null");
        Objects.requireNonNull(maxFeePerGas, "maxFeePerGas cannot be null");
        if (maxPriorityFeePerGas.signum() < 0 || maxFeePerGas.signum() < 0) {
            throw new IllegalArgumentException("fee defaults must be non-negative");
        }
    }

    public TransactionDefaults withExpiration(final long value) {
        return new TransactionDefaults(value, gasPriceCoef, maxPriorityFeePerGas, maxFeePerGas);
    }

    public TransactionDefaults withGasPriceCoef(final int value) {
        return new TransactionDefaults(expiration, value, maxPriorityFeePerGas, maxFeePerGas);
    }

    public TransactionDefaults withFees(final BigInteger priorityFee, final BigInteger feeCap) {
        return new TransactionDefaults(expiration, gasPriceCoef, priorityFee, feeCap);
    }
}
