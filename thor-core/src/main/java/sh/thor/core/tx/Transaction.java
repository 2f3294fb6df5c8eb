// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core.tx;

import java.math.BigInteger;
import java.util.List;

import org.jspecify.annotations.Nullable;

import sh.thor.core.types.Address;
import sh.thor.core.types.Hash;
import sh.thor.core.types.HexData;

/**
 * A Thor transaction: either {@link LegacyTransaction} (gas price coefficient) or
 * {@link DynamicFeeTransaction} (priority fee and fee cap).
 *
 * <p>
 * Transactions are immutable. Every wither returns a copy; a wither that changes
 * the signed body ({@code withClauses}, {@code withGas}, {@code withReserved})
 * drops the signature and the recovered identities, which would no longer match.
 *
 * <p>
 * The derived fields {@link #origin()}, {@link #delegator()} and {@link #id()}
 * are set together with the signature by {@link SignatureEngine} and are
 * {@code null} on unsigned transactions.
 *
 * @see Transactions
 */
public sealed interface Transaction permits LegacyTransaction, DynamicFeeTransaction {

    TransactionType type();

    int chainTag();

    /** First 8 bytes of the referenced block id. */
    HexData blockRef();

    /** Number of blocks after {@link #blockRef()} during which the transaction is valid. */
    long expiration();

    List<Clause> clauses();

    long gas();

    @Nullable Hash dependsOn();

    BigInteger nonce();

    Reserved reserved();

    /** 65 bytes when signed by the sender alone, 130 with a gas payer. */
    @Nullable HexData signature();

    @Nullable Address origin();

    @Nullable Address delegator();

    @Nullable Hash id();

    default boolean isSigned() {
        return signature() != null;
    }

    default boolean isDelegated() {
        return reserved().isFeeDelegationEnabled();
    }

    Transaction withClauses(List<Clause> clauses);

    Transaction withGas(long gas);

    Transaction withReserved(Reserved reserved);

    /**
     * Attaches a signature and the identities recovered from it.
     *
     * @param signature 65 or 130 bytes
     * @param origin    recovered sender
     * @param delegator recovered gas payer, or null
     * @param id        transaction id
     * @return the signed copy
     */
    Transaction withSignature(HexData signature, Address origin, @Nullable Address delegator, Hash id);

    /**
     * @return a copy without signature, origin, delegator and id
     */
    Transaction unsigned();
}
