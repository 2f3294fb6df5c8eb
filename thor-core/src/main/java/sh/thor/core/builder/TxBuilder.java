// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core.builder;

import java.math.BigInteger;
import java.util.List;

import sh.thor.core.chain.BlockRefProvider;
import sh.thor.core.chain.Network;
import sh.thor.core.chain.NonceGenerator;
import sh.thor.core.chain.TransactionDefaults;
import sh.thor.core.tx.Clause;
import sh.thor.core.tx.Reserved;
import sh.thor.core.tx.Transaction;
import sh.thor.core.types.Hash;
import sh.thor.core.types.HexData;

/**
 * Fluent builder for unsigned Thor transactions.
 *
 * <p>This sealed interface supports two transaction types:
 * <ul>
 *   <li>{@link LegacyBuilder} - gas price coefficient</li>
 *   <li>{@link DynamicFeeBuilder} - priority fee and fee cap</li>
 * </ul>
 * Each builder exposes only its own pricing setters.
 *
 * <p>Unset fields fall back to {@link TransactionDefaults}; the nonce comes from
 * the {@link NonceGenerator} (secure random by default) and the gas limit from
 * the clauses' intrinsic gas.
 *
 * <p><strong>Example:</strong>
 * <pre>{@code
 * LegacyTransaction tx = TxBuilder.legacy()
 *     .network(Networks.TESTNET)
 *     .blockRefProvider(BlockRefProvider.of(bestBlockId))
 *     .clause(Clause.transfer(recipient, BigInteger.TEN))
 *     .build();
 * }</pre>
 *
 * @param <T> the concrete builder type for fluent chaining
 */
public sealed interface TxBuilder<T extends TxBuilder<T>> permits LegacyBuilder, DynamicFeeBuilder {

    /**
     * Takes the chain tag from a network preset. An explicit {@link #chainTag(int)} wins.
     */
    T network(Network network);

    T chainTag(int chainTag);

    /**
     * Sets a fixed 8-byte block reference. Takes precedence over {@link #blockRefProvider}.
     */
    T blockRef(HexData blockRef);

    T blockRefProvider(BlockRefProvider provider);

    T expiration(long expiration);

    /**
     * Appends a clause.
     */
    T clause(Clause clause);

    /**
     * Appends clauses in order.
     */
    T clauses(List<Clause> clauses);

    /**
     * Sets the gas limit. Defaults to the intrinsic gas of the clauses.
     */
    T gas(long gas);

    T dependsOn(Hash dependsOn);

    T nonce(BigInteger nonce);

    T nonceGenerator(NonceGenerator generator);

    T reserved(Reserved reserved);

    /**
     * Toggles VIP-191 fee delegation in the reserved field.
     */
    T feeDelegation(boolean enabled);

    T defaults(TransactionDefaults defaults);

    /**
     * Builds the unsigned transaction.
     *
     * @throws TxBuilderException if the chain tag or block reference is missing, or options conflict
     * @throws IllegalArgumentException if a field is out of range
     */
    Transaction build();

    static LegacyBuilder legacy() {
        return new LegacyBuilder();
    }

    static DynamicFeeBuilder dynamicFee() {
        return new DynamicFeeBuilder();
    }
}
