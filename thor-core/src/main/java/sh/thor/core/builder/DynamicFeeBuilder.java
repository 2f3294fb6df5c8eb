// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core.builder;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import sh.thor.core.DebugLogger;
import sh.thor.core.LogFormatter;
import sh.thor.core.chain.BlockRefProvider;
import sh.thor.core.chain.Network;
import sh.thor.core.chain.NonceGenerator;
import sh.thor.core.chain.TransactionDefaults;
import sh.thor.core.tx.Clause;
import sh.thor.core.tx.DynamicFeeTransaction;
import sh.thor.core.tx.Reserved;
import sh.thor.core.types.Hash;
import sh.thor.core.types.HexData;

/**
 * Builder for dynamic-fee (type {@code 0x51}) transactions.
 *
 * <p>The sender pays at most {@code maxFeePerGas} per unit of gas, of which up to
 * {@code maxPriorityFeePerGas} goes to the block proposer.
 *
 * <p><strong>Example:</strong>
 * <pre>{@code
 * DynamicFeeTransaction tx = TxBuilder.dynamicFee()
 *     .network(Networks.TESTNET)
 *     .blockRef(HexData.of("0x00000000aabbccdd"))
 *     .clause(Clause.transfer(recipient, BigInteger.TEN))
 *     .maxPriorityFeePerGas(BigInteger.valueOf(10_000_000_000L))
 *     .maxFeePerGas(BigInteger.valueOf(20_000_000_000L))
 *     .build();
 * }</pre>
 *
 * @see TxBuilder#dynamicFee()
 */
public final class DynamicFeeBuilder implements TxBuilder<DynamicFeeBuilder> {
    private Integer chainTag;
    private Integer networkChainTag;
    private HexData blockRef;
    private BlockRefProvider blockRefProvider;
    private Long expiration;
    private final List<Clause> clauses = new ArrayList<>();
    private Long gas;
    private Hash dependsOn;
    private BigInteger nonce;
    private NonceGenerator nonceGenerator;
    private Reserved reserved = Reserved.EMPTY;
    private TransactionDefaults defaults = TransactionDefaults.STANDARD;
    private BigInteger maxPriorityFeePerGas;
    private BigInteger maxFeePerGas;

    @Override
    public DynamicFeeBuilder network(final Network network) {
        this.networkChainTag = Objects.requireNonNull(network, "network cannot be null").chainTag();
        return this;
    }

    @Override
    public DynamicFeeBuilder chainTag(final int chainTag) {
        this.chainTag = chainTag;
        return this;
    }

    @Override
    public DynamicFeeBuilder blockRef(final HexData blockRef) {
        this.blockRef = blockRef;
        return this;
    }

    @Override
    public DynamicFeeBuilder blockRefProvider(final BlockRefProvider provider) {
        this.blockRefProvider = provider;
        return this;
    }

    @Override
    public DynamicFeeBuilder expiration(final long expiration) {
        this.expiration = expiration;
        return this;
    }

    @Override
    public DynamicFeeBuilder clause(final Clause clause) {
        clauses.add(Objects.requireNonNull(clause, "clause cannot be null"));
        return this;
    }

    @Override
    public DynamicFeeBuilder clauses(final List<Clause> clauses) {
        for (final Clause clause : Objects.requireNonNull(clauses, "clauses cannot be null")) {
            clause(clause);
        }
        return this;
    }

    @Override
    public DynamicFeeBuilder gas(final long gas) {
        this.gas = gas;
        return this;
    }

    @Override
    public DynamicFeeBuilder dependsOn(final Hash dependsOn) {
        this.dependsOn = dependsOn;
        return this;
    }

    @Override
    public DynamicFeeBuilder nonce(final BigInteger nonce) {
        this.nonce = nonce;
        return this;
    }

    @Override
    public DynamicFeeBuilder nonceGenerator(final NonceGenerator generator) {
        this.nonceGenerator = generator;
        return this;
    }

    @Override
    public DynamicFeeBuilder reserved(final Reserved reserved) {
        this.reserved = Objects.requireNonNull(reserved, "reserved cannot be null");
        return this;
    }

    @Override
    public DynamicFeeBuilder feeDelegation(final boolean enabled) {
        this.reserved = enabled ? reserved.withFeeDelegation() : reserved.withoutFeeDelegation();
        return this;
    }

    @Override
    public DynamicFeeBuilder defaults(final TransactionDefaults defaults) {
        this.defaults = Objects.requireNonNull(defaults, "defaults cannot be null");
        return this;
    }

    /**
     * Sets the tip per unit of gas.
     *
     * @param maxPriorityFeePerGas the priority fee in wei
     * @return this builder for chaining
     */
    public DynamicFeeBuilder maxPriorityFeePerGas(final BigInteger maxPriorityFeePerGas) {
        this.maxPriorityFeePerGas = maxPriorityFeePerGas;
        return this;
    }

    /**
     * Sets the cap on the total fee per unit of gas.
     *
     * @param maxFeePerGas the fee cap in wei
     * @return this builder for chaining
     */
    public DynamicFeeBuilder maxFeePerGas(final BigInteger maxFeePerGas) {
        this.maxFeePerGas = maxFeePerGas;
        return this;
    }

    @Override
    public DynamicFeeTransaction build() {
        final int tag = BuilderValidation.resolveChainTag(chainTag != null ? chainTag : networkChainTag);
        final long exp = expiration != null ? expiration : defaults.expiration();
        BuilderValidation.validateExpiration(exp);
        final HexData ref = BuilderValidation.resolveBlockRef(blockRef, blockRefProvider);
        final BigInteger priorityFee = maxPriorityFeePerGas != null
                ? maxPriorityFeePerGas
                : defaults.maxPriorityFeePerGas();
        final BigInteger feeCap = maxFeePerGas != null ? maxFeePerGas : defaults.maxFeePerGas();
        BuilderValidation.validateFees(priorityFee, feeCap);

        final DynamicFeeTransaction tx = DynamicFeeTransaction.unsigned(
                tag,
                ref,
                exp,
                clauses,
                priorityFee,
                feeCap,
                BuilderValidation.resolveGas(gas, clauses),
                dependsOn,
                BuilderValidation.resolveNonce(nonce, nonceGenerator),
                reserved);
        DebugLogger.logTx(LogFormatter.formatTxBuild(
                tx.type().name(), tx.chainTag(), tx.clauses().size(), tx.gas(), tx.isDelegated()));
        return tx;
    }
}
