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
import sh.thor.core.tx.LegacyTransaction;
import sh.thor.core.tx.Reserved;
import sh.thor.core.types.Hash;
import sh.thor.core.types.HexData;

/**
 * Builder for legacy transactions priced by a gas price coefficient.
 *
 * <p>The effective gas price is {@code baseGasPrice * (1 + gasPriceCoef / 255)};
 * a higher coefficient buys priority.
 *
 * <p><strong>Example:</strong>
 * <pre>{@code
 * LegacyTransaction tx = TxBuilder.legacy()
 *     .chainTag(0x27)
 *     .blockRef(HexData.of("0x00000000aabbccdd"))
 *     .clause(Clause.transfer(recipient, BigInteger.TEN))
 *     .gasPriceCoef(128)
 *     .build();
 * }</pre>
 *
 * @see TxBuilder#legacy()
 */
public final class LegacyBuilder implements TxBuilder<LegacyBuilder> {
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
    private Integer gasPriceCoef;

    @Override
    public LegacyBuilder network(final Network network) {
        this.networkChainTag = Objects.requireNonNull(network, "network cannot be null").chainTag();
        return this;
    }

    @Override
    public LegacyBuilder chainTag(final int chainTag) {
        this.chainTag = chainTag;
        return this;
    }

    @Override
    public LegacyBuilder blockRef(final HexData blockRef) {
        this.blockRef = blockRef;
        return this;
    }

    @Override
    public LegacyBuilder blockRefProvider(final BlockRefProvider provider) {
        this.blockRefProvider = provider;
        return this;
    }

    @Override
    public LegacyBuilder expiration(final long expiration) {
        this.expiration = expiration;
        return this;
    }

    @Override
    public LegacyBuilder clause(final Clause clause) {
        clauses.add(Objects.requireNonNull(clause, "clause cannot be null"));
        return this;
    }

    @Override
    public LegacyBuilder clauses(final List<Clause> clauses) {
        for (final Clause clause : Objects.requireNonNull(clauses, "clauses cannot be null")) {
            clause(clause);
        }
        return this;
    }

    @Override
    public LegacyBuilder gas(final long gas) {
        this.gas = gas;
        return this;
    }

    @Override
    public LegacyBuilder dependsOn(final Hash dependsOn) {
        this.dependsOn = dependsOn;
        return this;
    }

    @Override
    public LegacyBuilder nonce(final BigInteger nonce) {
        this.nonce = nonce;
        return this;
    }

    @Override
    public LegacyBuilder nonceGenerator(final NonceGenerator generator) {
        this.nonceGenerator = generator;
        return this;
    }

    @Override
    public LegacyBuilder reserved(final Reserved reserved) {
        this.reserved = Objects.requireNonNull(reserved, "reserved cannot be null");
        return this;
    }

    @Override
    public LegacyBuilder feeDelegation(final boolean enabled) {
        this.reserved = enabled ? reserved.withFeeDelegation() : reserved.withoutFeeDelegation();
        return this;
    }

    @Override
    public LegacyBuilder defaults(final TransactionDefaults defaults) {
        this.defaults = Objects.requireNonNull(defaults, "defaults cannot be null");
        return this;
    }

    /**
     * Sets the gas price coefficient (0-255).
     *
     * @param gasPriceCoef the coefficient
     * @return this builder for chaining
     */
    public LegacyBuilder gasPriceCoef(final int gasPriceCoef) {
        this.gasPriceCoef = gasPriceCoef;
        return this;
    }

    @Override
    public LegacyTransaction build() {
        final int tag = BuilderValidation.resolveChainTag(chainTag != null ? chainTag : networkChainTag);
        final long exp = expiration != null ? expiration : defaults.expiration();
        BuilderValidation.validateExpiration(exp);
        final HexData ref = BuilderValidation.resolveBlockRef(blockRef, blockRefProvider);

        final LegacyTransaction tx = LegacyTransaction.unsigned(
                tag,
                ref,
                exp,
                clauses,
                gasPriceCoef != null ? gasPriceCoef : defaults.gasPriceCoef(),
                BuilderValidation.resolveGas(gas, clauses),
                dependsOn,
                BuilderValidation.resolveNonce(nonce, nonceGenerator),
                reserved);
        DebugLogger.logTx(LogFormatter.formatTxBuild(
                tx.type().name(), tx.chainTag(), tx.clauses().size(), tx.gas(), tx.isDelegated()));
        return tx;
    }
}
