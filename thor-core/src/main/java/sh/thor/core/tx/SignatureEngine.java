// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core.tx;

import java.util.Arrays;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.thor.core.crypto.Blake2b256;
import sh.thor.core.crypto.PrivateKey;
import sh.thor.core.crypto.Signature;
import sh.thor.core.error.InvalidSignatureException;
import sh.thor.core.types.Address;
import sh.thor.core.types.Hash;
import sh.thor.core.types.HexData;

/**
 * Signing hashes, transaction ids and signer recovery, including the VIP-191
 * two-party signature.
 *
 * <ul>
 * <li>{@code signingHash = blake2b256(unsignedRlp)}; for dynamic-fee transactions
 * the hashed bytes include the {@code 0x51} prefix</li>
 * <li>{@code delegatorHash = blake2b256(signingHash || origin)}; the gas payer signs this</li>
 * <li>{@code id = blake2b256(signingHash || origin)}</li>
 * </ul>
 *
 * <p>A 65-byte signature yields the origin. A 130-byte signature is the sender's
 * 65 bytes followed by the gas payer's 65 bytes and yields both. Recovery never
 * falls back to a placeholder address: every failure is an
 * {@link InvalidSignatureException}.
 */
public final class SignatureEngine {

    public static final int SINGLE_LENGTH = Signature.LENGTH;
    public static final int DELEGATED_LENGTH = 2 * Signature.LENGTH;

    private SignatureEngine() {
        // Utility class
    }

    /**
     * @param tx signed or unsigned; the signature is ignored
     * @return the 32-byte hash the sender signs
     */
    public static byte[] signingHash(final Transaction tx) {
        Objects.requireNonNull(tx, "tx cannot be null");
        return Blake2b256.hash(TransactionCodec.encodeUnsigned(tx));
    }

    /**
     * @param tx     the transaction
     * @param origin the sender
     * @return the 32-byte hash the gas payer signs
     */
    public static byte[] delegatorSigningHash(final Transaction tx, final Address origin) {
        Objects.requireNonNull(origin, "origin cannot be null");
        return Blake2b256.hash(signingHash(tx), origin.toBytes());
    }

    /**
     * @param signingHash the transaction's signing hash
     * @param origin      the sender
     * @return the transaction id
     */
    public static Hash id(final byte[] signingHash, final Address origin) {
        Objects.requireNonNull(signingHash, "signingHash cannot be null");
        Objects.requireNonNull(origin, "origin cannot be null");
        return Hash.fromBytes(Blake2b256.hash(signingHash, origin.toBytes()));
    }

    /**
     * Recovers the signers of a signed transaction.
     *
     * @param tx a transaction carrying a 65- or 130-byte signature
     * @return origin, delegator (null for 65 bytes) and id
     * @throws InvalidSignatureException if unsigned, of the wrong length, or not recoverable
     */
    public static Recovered recover(final Transaction tx) {
        Objects.requireNonNull(tx, "tx cannot be null");
        return recover(tx, tx.signature());
    }

    /**
     * Recovers the signers of {@code signature} over the body of {@code tx}.
     *
     * @param tx        the transaction; its own signature is ignored
     * @param signature 65 or 130 bytes
     * @return origin, delegator (null for 65 bytes) and id
     * @throws InvalidSignatureException if missing, of the wrong length, or not recoverable
     */
    public static Recovered recover(final Transaction tx, final @Nullable HexData signature) {
        Objects.requireNonNull(tx, "tx cannot be null");
        if (signature == null) {
            throw new InvalidSignatureException("Transaction is not signed");
        }
        final byte[] raw = signature.toBytes();
        if (raw.length != SINGLE_LENGTH && raw.length != DELEGATED_LENGTH) {
            throw new InvalidSignatureException("Signature must be 65 or 130 bytes, got " + raw.length);
        }

        final byte[] hash = signingHash(tx);
        final Address origin = recoverSigner(hash, Arrays.copyOfRange(raw, 0, SINGLE_LENGTH), "origin");
        Address delegator = null;
        if (raw.length == DELEGATED_LENGTH) {
            final byte[] delegatorHash = Blake2b256.hash(hash, origin.toBytes());
            delegator = recoverSigner(
                    delegatorHash, Arrays.copyOfRange(raw, SINGLE_LENGTH, DELEGATED_LENGTH), "delegator");
        }
        return new Recovered(origin, delegator, id(hash, origin));
    }

    /**
     * Runs {@link #recover(Transaction)} and attaches the result.
     *
     * @param tx a signed transaction
     * @return the same transaction with origin, delegator and id set
     */
    public static Transaction attachIdentity(final Transaction tx) {
        return attach(tx, tx.signature());
    }

    /**
     * Attaches {@code signature} to {@code tx} together with the identities it recovers to.
     *
     * @param tx        the transaction; any existing signature is replaced
     * @param signature 65 or 130 bytes
     * @return the signed copy
     * @throws InvalidSignatureException if the signature cannot be recovered
     */
    public static Transaction attach(final Transaction tx, final @Nullable HexData signature) {
        final Recovered recovered = recover(tx, signature);
        return tx.withSignature(signature, recovered.origin(), recovered.delegator(), recovered.id());
    }

    private static Address recoverSigner(final byte[] hash, final byte[] signature, final String role) {
        try {
            return PrivateKey.recoverAddress(hash, Signature.fromBytes(signature));
        } catch (IllegalArgumentException e) {
            throw new InvalidSignatureException("Failed to recover " + role + " from signature", e);
        }
    }

    /**
     * Identities recovered from a signature.
     *
     * @param origin    the sender
     * @param delegator the gas payer, or null
     * @param id        the transaction id
     */
    public record Recovered(Address origin, @Nullable Address delegator, Hash id) {
    }
}
