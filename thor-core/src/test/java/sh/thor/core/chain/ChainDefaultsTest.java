// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core.chain;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;

import org.junit.jupiter.api.Test;

import sh.thor.core.types.Hash;

class ChainDefaultsTest {

    @Test
    void blockRefIsFirstEightBytesOfBlockId() {
        final Hash blockId = Hash.of("0x0000abcd00001234" + "ff".repeat(24));

        final byte[] ref = BlockRefProvider.of(blockId).blockRef();

        assertArrayEquals(new byte[] {0, 0, (byte) 0xab, (byte) 0xcd, 0, 0, 0x12, 0x34}, ref);
    }

    @Test
    void fixedBlockRefIsCopied() {
        final byte[] source = new byte[8];
        final BlockRefProvider provider = BlockRefProvider.fixed(source);
        source[0] = 1;
        provider.blockRef()[1] = 1;

        assertArrayEquals(new byte[8], provider.blockRef());
    }

    @Test
    void fixedBlockRefMustBeEightBytes() {
        assertThrows(IllegalArgumentException.class, () -> BlockRefProvider.fixed(new byte[7]));
    }

    @Test
    void secureRandomNonceFitsEightBytes() {
        final NonceGenerator generator = NonceGenerator.secureRandom();
        for (int i = 0; i < 32; i++) {
            final BigInteger nonce = generator.next();
            assertTrue(nonce.signum() >= 0);
            assertTrue(nonce.bitLength() <= 64);
        }
    }

    @Test
    void fixedNonceRejectsOutOfRange() {
        assertEquals(BigInteger.TEN, NonceGenerator.fixed(BigInteger.TEN).next());
        assertThrows(IllegalArgumentException.class, () -> NonceGenerator.fixed(BigInteger.ONE.shiftLeft(64)));
        assertThrows(IllegalArgumentException.class, () -> NonceGenerator.fixed(BigInteger.ONE.negate()));
    }

    @Test
    void standardDefaults() {
        final TransactionDefaults defaults = TransactionDefaults.STANDARD;

        assertEquals(32L, defaults.expiration());
        assertEquals(0, defaults.gasPriceCoef());
        assertEquals(BigInteger.valueOf(400_000L), defaults.maxPriorityFeePerGas());
        assertEquals(BigInteger.valueOf(400_000L), defaults.maxFeePerGas());
    }

    @Test
    void withersReplaceOneField() {
        final TransactionDefaults custom = TransactionDefaults.STANDARD
                .withExpiration(720)
                .withGasPriceCoef(255)
                .withFees(BigInteger.ONE, BigInteger.TWO);

        assertEquals(new TransactionDefaults(720, 255, BigInteger.ONE, BigInteger.TWO), custom);
        assertThrows(IllegalArgumentException.class, () -> TransactionDefaults.STANDARD.withExpiration(0));
        assertThrows(IllegalArgumentException.class, () -> TransactionDefaults.STANDARD.withGasPriceCoef(256));
    }
}
