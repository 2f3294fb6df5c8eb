// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core.tx;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import sh.thor.core.DebugLogger;
import sh.thor.core.LogFormatter;
import sh.thor.core.builder.DynamicFeeBuilder;
import sh.thor.core.builder.LegacyBuilder;
import sh.thor.core.builder.TxBuilder;
import sh.thor.core.builder.TxBuilderException;
import sh.thor.core.crypto.Signature;
import sh.thor.core.crypto.Signer;
import sh.thor.core.error.InvalidSignatureException;
import sh.thor.core.types.Address;
import sh.thor.core.types.HexData;

/**
 * Entry point for creating, encoding, decoding and signing transactions.
 *
 * <h2>Single signer</h2>
 *
 * <pre>{@code
 * Transaction tx = Transactions.legacy()
 *         .network(Networks.TESTNET)
 *         .blockRef(blockRef)
 *         .clause(Clause.transfer(recipient, BigInteger.TEN))
 *         .build();
 * Transaction signed = Transactions.sign(tx, new PrivateKeySigner(senderKey));
 * byte[] raw = Transactions.encode(signed, true);
 * }</pre>
 *
 * <h2>Fee delegation (VIP-191)</h2>
 *
 * <pre>{@code
 * Transaction tx = Transactions.legacy()...feeDelegation(true).build();
 * Transaction signed = Transactions.sign(tx, sender, gasPayer);
 * signed.delegator(); // gasPayer.address()
 * }</pre>
 *
 * <p>When the gas payer signs remotely, send it {@link #delegatorSigningHash} and
 * pass its answer to {@link #coSign(Transaction, Signature)}.
 */
public final class Transactions {

    private Transactions() {
        // Utility class
    }

    public static LegacyBuilder legacy() {
        return TxBuilder.legacy();
    }

    public static DynamicFeeBuilder dynamicFee() {
        return TxBuilder.dynamicFee();
    }

    /**
     * Appends a clause and resets the gas limit to the new intrinsic gas. Any
     * signature is dropped.
     *
     * @param tx     the transaction
     * @param clause the clause to append
     * @return the updated copy
     */
    public static Transaction appendClause(final Transaction tx, final Clause clause) {
        Objects.requireNonNull(tx, "tx cannot be null");
        Objects.requireNonNull(clause, "clause cannot be null");
        final List<Clause> clauses = new ArrayList<>(tx.clauses());
        clauses.add(clause);
        return tx.withClauses(clauses).withGas(IntrinsicGas.calculate(clauses));
    }

    public static byte[] encode(final Transaction tx, final boolean includeSignature) {
        return TransactionCodec.encode(tx, includeSignature);
    }

    /**
     * Decodes wire bytes and, for signed transactions, recovers origin,
     * delegator and id.
     *
     * @param raw wire bytes
     * @return the fully populated transaction
     * @throws sh.thor.core.error.RlpCodecException if the bytes are not a transaction
     * @throws InvalidSignatureException if the signature cannot be recovered
     */
    public static Transaction cast(final byte[] raw) {
        final Transaction tx = TransactionCodec.decode(raw);
        return tx.isSigned() ? SignatureEngine.attachIdentity(tx) : tx;
    }

    public static byte[] signingHash(final Transaction tx) {
        return SignatureEngine.signingHash(tx);
    }

    public static byte[] delegatorSigningHash(final Transaction tx, final Address origin) {
        return SignatureEngine.delegatorSigningHash(tx, origin);
    }

    /**
     * Signs as the sender. For a fee-delegated transaction the result still
     * needs {@link #coSign}.
     *
     * @param tx     the transaction; an existing signature is replaced
     * @param sender the sender
     * @return the signed copy with origin and id set
     */
    public static Transaction sign(final Transaction tx, final Signer sender) {
        Objects.requireNonNull(tx, "tx cannot be null");
        Objects.requireNonNull(sender, "sender cannot be null");
        final Signature signature = sender.sign(SignatureEngine.signingHash(tx));
        final Transaction signed = SignatureEngine.attach(tx, HexData.fromBytes(signature.toBytes()));
        if (!signed.origin().equals(sender.address())) {
            throw new InvalidSignatureException(
                    "Recovered origin " + signed.origin() + " does not match signer " + sender.address());
        }
        logSigned(signed);
        return signed;
    }

    /**
     * Signs as sender and gas payer in one step.
     *
     * @throws TxBuilderException if fee delegation is not enabled
     */
    public static Transaction sign(final Transaction tx, final Signer sender, final Signer gasPayer) {
        requireDelegated(tx);
        return coSign(sign(tx, sender), gasPayer);
    }

    /**
     * Adds the gas payer's signature to a transaction signed by its sender.
     *
     * @param tx       fee-delegated, carrying a 65-byte sender signature
     * @param gasPayer the gas payer
     * @return the copy with a 130-byte signature and delegator set
     * @throws TxBuilderException if fee delegation is off or the sender has not signed
     */
    public static Transaction coSign(final Transaction tx, final Signer gasPayer) {
        Objects.requireNonNull(gasPayer, "gasPayer cannot be null");
        final Address origin = requireSenderSigned(tx);
        return coSign(tx, gasPayer.sign(SignatureEngine.delegatorSigningHash(tx, origin)));
    }

    /**
     * Adds a gas payer signature produced elsewhere over
     * {@link #delegatorSigningHash(Transaction, Address)}.
     *
     * @throws TxBuilderException if fee delegation is off or the sender has not signed
     * @throws InvalidSignatureException if the combined signature cannot be recovered
     */
    public static Transaction coSign(final Transaction tx, final Signature gasPayerSignature) {
        Objects.requireNonNull(gasPayerSignature, "gasPayerSignature cannot be null");
        requireSenderSigned(tx);
        final byte[] senderSig = tx.signature().toBytes();
        final byte[] payerSig = gasPayerSignature.toBytes();
        final byte[] combined = new byte[SignatureEngine.DELEGATED_LENGTH];
        System.arraycopy(senderSig, 0, combined, 0, SignatureEngine.SINGLE_LENGTH);
        System.arraycopy(payerSig, 0, combined, SignatureEngine.SINGLE_LENGTH, SignatureEngine.SINGLE_LENGTH);

        final Transaction signed = SignatureEngine.attach(tx, HexData.fromBytes(combined));
        logSigned(signed);
        return signed;
    }

    private static Address requireSenderSigned(final Transaction tx) {
        requireDelegated(tx);
        final HexData signature = tx.signature();
        if (signature == null) {
            throw new TxBuilderException("Transaction must be signed by origin before co-signing");
        }
        if (signature.byteLength() != SignatureEngine.SINGLE_LENGTH) {
            throw new TxBuilderException(
                    "Co-signing requires a 65-byte origin signature, got " + signature.byteLength());
        }
        return tx.origin() != null ? tx.origin() : SignatureEngine.recover(tx).origin();
    }

    private static void requireDelegated(final Transaction tx) {
        Objects.requireNonNull(tx, "tx cannot be null");
        if (!tx.isDelegated()) {
            throw new TxBuilderException("Fee delegation is not enabled in the reserved field");
        }
    }

    private static void logSigned(final Transaction tx) {
        DebugLogger.logTx(LogFormatter.formatTxSign(
                String.valueOf(tx.id()),
                String.valueOf(tx.origin()),
                tx.delegator() == null ? null : tx.delegator().toString()));
    }
}
