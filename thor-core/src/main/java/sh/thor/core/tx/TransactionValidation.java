// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core.tx;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.thor.core.error.InvalidSignatureException;
import sh.thor.core.types.HexData;

/**
 * Field checks shared by the transaction records.
 */
final class TransactionValidation {

    static final int BLOCK_REF_LENGTH = 8;
    static final long MAX_EXPIRATION = 0xFFFF_FFFFL;

    private TransactionValidation() {
        // Utility class
    }

    static void requireByte(final int value, final String name) {
        if (value < 0 || value > 0xFF) {
            throw new IllegalArgumentException(name + " must be in range 0-255, got: " + value);
        }
    }

    static void requireCommon(
            final int chainTag,
            final HexData blockRef,
            final long expiration,
            final List<Clause> clauses,
            final long gas,
            final BigInteger nonce,
            final Reserved reserved) {
        requireByte(chainTag, "chainTag");
        Objects.requireNonNull(blockRef, "blockRef cannot be null");
        if (blockRef.byteLength() != BLOCK_REF_LENGTH) {
            throw new IllegalArgumentException("blockRef must be 8 bytes, got " + blockRef.byteLength());
        }
        if (expiration < 0 || expiration > MAX_EXPIRATION) {
            throw new IllegalArgumentException("expiration must fit in 4 bytes, got: " + expiration);
        }
        Objects.requireNonNull(clauses, "clauses cannot be null");
        if (gas < 0) {
            throw new IllegalArgumentException("gas must be non-negative, got: " + gas);
        }
        requireUnsigned(nonce, 8, "nonce");
        Objects.requireNonNull(reserved, "reserved cannot be null");
    }

    static void requireUnsigned(final BigInteger value, final int maxBytes, final String name) {
        Objects.requireNonNull(value, name + " cannot be null");
        if (value.signum() < 0) {
            throw new IllegalArgumentException(name + " must be non-negative, got: " + value);
        }
        if (value.bitLength() > maxBytes * 8) {
            throw new IllegalArgumentException(name + " exceeds " + maxBytes + " bytes: " + value);
        }
    }

    static void requireSignatureLength(final @Nullable HexData signature) {
        if (signature == null) {
            return;
        }
        final int length = signature.byteLength();
        if (length != SignatureEngine.SINGLE_LENGTH && length != SignatureEngine.DELEGATED_LENGTH) {
            throw new InvalidSignatureException(
                    "Signature must be 65 or 130 bytes, got " + length);
        }
    }
}
