// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core.builder;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.util.List;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import sh.thor.core.ThorDebug;
import sh.thor.core.chain.BlockRefProvider;
import sh.thor.core.chain.Networks;
import sh.thor.core.chain.NonceGenerator;
import sh.thor.core.chain.TransactionDefaults;
import sh.thor.core.tx.Clause;
import sh.thor.core.tx.DynamicFeeTransaction;
import sh.thor.core.tx.IntrinsicGas;
import sh.thor.core.tx.LegacyTransaction;
import sh.thor.core.tx.Reserved;
import sh.thor.core.types.HexData;

class TxBuilderTest {

    private static final HexData BLOCK_REF = HexData.of("0x00000000aabbccdd");
    private static final Clause TRANSFER =
            Clause.transfer("0x7567d83b7b8d80addcb281a71d54fc7b3364ffed", BigInteger.TEN);

    @Test
    void legacyUsesDefaultsAndIntrinsicGas() {
        final LegacyTransaction tx = TxBuilder.legacy()
                .network(Networks.TESTNET)
                .blockRef(BLOCK_REF)
                .clause(TRANSFER)
                .nonce(BigInteger.ONE)
                .build();

        assertEquals(0x27, tx.chainTag());
        assertEquals(BLOCK_REF, tx.blockRef());
        assertEquals(32L, tx.expiration());
        assertEquals(0, tx.gasPriceCoef());
        assertEquals(21_000L, tx.gas());
        assertEquals(BigInteger.ONE, tx.nonce());
        assertNull(tx.dependsOn());
        assertTrue(tx.reserved().isEmpty());
        assertFalse(tx.isSigned());
    }

    @Test
    void explicitChainTagWinsOverNetwork() {
        final LegacyTransaction tx = TxBuilder.legacy()
                .chainTag(0x01)
                .network(Networks.MAINNET)
                .blockRef(BLOCK_REF)
                .build();

        assertEquals(0x01, tx.chainTag());
    }

    @Test
    void missingChainTagIsRejected() {
        final TxBuilderException ex = assertThrows(TxBuilderException.class,
                () -> TxBuilder.legacy().blockRef(BLOCK_REF).build());

        assertTrue(ex.getMessage().contains("Chain tag"));
    }

    @Test
    void missingBlockRefIsRejected() {
        assertThrows(TxBuilderException.class,
                () -> TxBuilder.dynamicFee().network(Networks.SOLO).build());
    }

    @Test
    void blockRefComesFromProvider() {
        final DynamicFeeTransaction tx = TxBuilder.dynamicFee()
                .network(Networks.SOLO)
                .blockRefProvider(BlockRefProvider.fixed(new byte[] {0, 0, 0, 1, 2, 3, 4, 5}))
                .build();

        assertEquals(HexData.of("0x0000000102030405"), tx.blockRef());
    }

    @Test
    void fixedBlockRefWinsOverProvider() {
        final LegacyTransaction tx = TxBuilder.legacy()
                .network(Networks.SOLO)
                .blockRefProvider(() -> {
                    throw new IllegalStateException("not called");
                })
                .blockRef(BLOCK_REF)
                .build();

        assertEquals(BLOCK_REF, tx.blockRef());
    }

    @Test
    void failingProviderIsWrapped() {
        final TxBuilderException ex = assertThrows(TxBuilderException.class, () -> TxBuilder.legacy()
                .network(Networks.SOLO)
                .blockRefProvider(() -> {
                    throw new IllegalStateException("node down");
                })
                .build());

        assertTrue(ex.getMessage().contains("node down"));
        assertInstanceOf(IllegalStateException.class, ex.getCause());
    }

    @Test
    void providerMustReturnEightBytes() {
        assertThrows(TxBuilderException.class, () -> TxBuilder.legacy()
                .network(Networks.SOLO)
                .blockRefProvider(() -> new byte[4])
                .build());
    }

    @Test
    void zeroExpirationIsRejected() {
        assertThrows(TxBuilderException.class, () -> TxBuilder.legacy()
                .network(Networks.SOLO)
                .blockRef(BLOCK_REF)
                .expiration(0)
                .build());
    }

    @Test
    void dynamicFeeFallsBackToDefaultFees() {
        final DynamicFeeTransaction tx = TxBuilder.dynamicFee()
                .network(Networks.TESTNET)
                .blockRef(BLOCK_REF)
                .clauses(List.of(TRANSFER, TRANSFER))
                .build();

        assertEquals(BigInteger.valueOf(400_000L), tx.maxPriorityFeePerGas());
        assertEquals(BigInteger.valueOf(400_000L), tx.maxFeePerGas());
        assertEquals(IntrinsicGas.calculate(List.of(TRANSFER, TRANSFER)), tx.gas());
    }

    @Test
    void customDefaultsApply() {
        final DynamicFeeTransaction tx = TxBuilder.dynamicFee()
                .network(Networks.TESTNET)
                .blockRef(BLOCK_REF)
                .defaults(TransactionDefaults.STANDARD.withExpiration(720).withFees(BigInteger.ONE, BigInteger.TEN))
                .maxFeePerGas(BigInteger.valueOf(100))
                .build();

        assertEquals(720L, tx.expiration());
        assertEquals(BigInteger.ONE, tx.maxPriorityFeePerGas());
        assertEquals(BigInteger.valueOf(100), tx.maxFeePerGas());
    }

    @Test
    void priorityFeeAboveCapIsRejected() {
        assertThrows(TxBuilderException.class, () -> TxBuilder.dynamicFee()
                .network(Networks.TESTNET)
                .blockRef(BLOCK_REF)
                .maxPriorityFeePerGas(BigInteger.valueOf(11))
                .maxFeePerGas(BigInteger.TEN)
                .build());
    }

    @Test
    void explicitGasIsKept() {
        final LegacyTransaction tx = TxBuilder.legacy()
                .network(Networks.TESTNET)
                .blockRef(BLOCK_REF)
                .clause(TRANSFER)
                .gas(90_000)
                .gasPriceCoef(128)
                .build();

        assertEquals(90_000L, tx.gas());
        assertEquals(128, tx.gasPriceCoef());
    }

    @Test
    void feeDelegationTogglesReservedBit() {
        final LegacyTransaction on = TxBuilder.legacy()
                .network(Networks.TESTNET)
                .blockRef(BLOCK_REF)
                .feeDelegation(true)
                .build();
        final LegacyTransaction off = TxBuilder.legacy()
                .network(Networks.TESTNET)
                .blockRef(BLOCK_REF)
                .reserved(Reserved.EMPTY.withFeeDelegation())
                .feeDelegation(false)
                .build();

        assertTrue(on.isDelegated());
        assertEquals(List.of("fee_delegation"), on.reserved().features());
        assertFalse(off.isDelegated());
    }

    @Test
    void nonceComesFromGenerator() {
        final LegacyTransaction tx = TxBuilder.legacy()
                .network(Networks.TESTNET)
                .blockRef(BLOCK_REF)
                .nonceGenerator(NonceGenerator.fixed(BigInteger.valueOf(42)))
                .build();

        assertEquals(BigInteger.valueOf(42), tx.nonce());
    }

    @Test
    void outOfRangeFieldsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> TxBuilder.legacy()
                .network(Networks.TESTNET)
                .blockRef(BLOCK_REF)
                .gasPriceCoef(256)
                .build());
        assertThrows(IllegalArgumentException.class, () -> TxBuilder.legacy()
                .network(Networks.TESTNET)
                .blockRef(HexData.of("0x0102"))
                .build());
    }

    @Test
    void buildIsLoggedWhenTxLoggingIsOn() {
        final Logger logger = (Logger) LoggerFactory.getLogger("sh.thor.debug");
        final ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        ThorDebug.setTxLogging(true);
        try {
            TxBuilder.legacy().network(Networks.TESTNET).blockRef(BLOCK_REF).clause(TRANSFER).build();
        } finally {
            ThorDebug.setTxLogging(false);
            logger.detachAppender(appender);
        }

        assertEquals(1, appender.list.size());
        assertEquals("[TX-BUILD] type=LEGACY chainTag=0x27 clauses=1 gas=21000 delegated=false",
                appender.list.get(0).getFormattedMessage());
    }
}
