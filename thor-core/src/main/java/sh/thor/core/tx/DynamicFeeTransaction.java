// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core.tx;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.thor.core.types.Address;
import sh.thor.core.types.Hash;
import sh.thor.core.types.HexData;

/**
 * Dynamic-fee transaction (type {@code 0x51}) priced by a priority fee and a fee cap.
 *
 * <p>Wire layout: {@code 0x51 || rlp([chainTag, blockRef, expiration, clauses,
 * maxPriorityFeePerGas, maxFeePerGas, gas, dependsOn, nonce, reserved])}, plus
 * {@code signature} when signed.
 *
 * @param chainTag             network chain tag (0-255)
 * @param blockRef             8-byte block reference
 * @param expiration           validity window in blocks
 * @param clauses              actions, executed in order
 * @param maxPriorityFeePerGas tip per gas, at most 32 bytes
 * @param maxFeePerGas         fee cap per gas, at most 32 bytes
 * @param gas                  gas limit
 * @param dependsOn            id of a transaction that must be executed first, or null
 * @param nonce                8-byte nonce
 * @param reserved             feature flags
 * @param signature            65 or 130 bytes, null when unsigned
 * @param origin               recovered sender, null when unsigned
 * @param delegator            recovered gas payer, null unless delegated and co-signed
 * @param id                   transaction id, null when unsigned
 */
public record DynamicFeeTransaction(
        int chainTag,
        HexData blockRef,
        long expiration,
        List<Clause> clauses,
        BigInteger maxPriorityFeePerGas,
        BigInteger maxFeePerGas,
        long gas,
        @Nullable Hash dependsOn,
        BigInteger nonce,
        Reserved reserved,
        @Nullable HexData signature,
        @Nullable Address origin,
        @Nullable Address delegator,
        @Nullable Hash id) implements Transaction {

    static final int MAX_FEE_BYTES = 32;

    /**
     * @throws IllegalArgumentException if a field is out of range
     * @throws sh.thor.core.error.InvalidSignatureException if the signature is not 65 or 130 bytes
     */
    public DynamicFeeTransaction {
        reserved = reserved == null ? Reserved.EMPTY : reserved;
        TransactionValidation.requireCommon(chainTag, blockRef, expiration, clauses, gas, nonce, reserved);
        TransactionValidation.requireUnsigned(maxPriorityFeePerGas, MAX_FEE_BYTES, "maxPriorityFeePerGas");
        TransactionValidation.requireUnsigned(maxFeePerGas, MAX_FEE_BYTES, "maxFeePerGas");
        TransactionValidation.requireSignatureLength(signature);
        clauses = List.copyOf(clauses);
    }

    /**
     * Creates an unsigned dynamic-fee transaction.
     */
    public static DynamicFeeTransaction unsigned(
            final int chainTag,
            final HexData blockRef,
            final long expiration,
            final List<Clause> clauses,
            final BigInteger maxPriorityFeePerGas,
            final BigInteger maxFeePerGas,
            final long gas,
            final @Nullable Hash dependsOn,
            final BigInteger nonce,
            final Reserved reserved) {
        return new DynamicFeeTransaction(chainTag, blockRef, expiration, clauses, maxPriorityFeePerGas,
                maxFeePerGas, gas, dependsOn, nonce, reserved, null, null, null, null);
    }

    @Override
    public TransactionType type() {
        return TransactionType.DYNAMIC_FEE;
    }

    @Override
    public DynamicFeeTransaction withClauses(final List<Clause> newClauses) {
        Objects.requireNonNull(newClauses, "clauses cannot be null");
        return unsigned(chainTag, blockRef, expiration, newClauses, maxPriorityFeePerGas, maxFeePerGas,
                gas, dependsOn, nonce, reserved);
    }

    @Override
    public DynamicFeeTransaction withGas(final long newGas) {
        return unsigned(chainTag, blockRef, expiration, clauses, maxPriorityFeePerGas, maxFeePerGas,
                newGas, dependsOn, nonce, reserved);
    }

    @Override
    public DynamicFeeTransaction withReserved(final Reserved newReserved) {
        Objects.requireNonNull(newReserved, "reserved cannot be null");
        return unsigned(chainTag, blockRef, expiration, clauses, maxPriorityFeePerGas, maxFeePerGas,
                gas, dependsOn, nonce, newReserved);
    }

    @Override
    public DynamicFeeTransaction withSignature(
            final HexData newSignature,
            final Address newOrigin,
            final @Nullable Address newDelegator,
            final Hash newId) {
        Objects.requireNonNull(newSignature, "signature cannot be null");
        Objects.requireNonNull(newOrigin, "origin cannot be null");
        Objects.requireNonNull(newId, "id cannot be null");
        return new DynamicFeeTransaction(chainTag, blockRef, expiration, clauses, maxPriorityFeePerGas,
                maxFeePerGas, gas, dependsOn, nonce, reserved, newSignature, newOrigin, newDelegator, newId);
    }

    @Override
    public DynamicFeeTransaction unsigned() {
        return unsigned(chainTag, blockRef, expiration, clauses, maxPriorityFeePerGas, maxFeePerGas,
                gas, dependsOn, nonce, reserved);
    }
}
