// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core.tx;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import sh.thor.core.crypto.Blake2b256;
import sh.thor.core.crypto.PrivateKey;
import sh.thor.core.crypto.Signature;
import sh.thor.core.error.InvalidSignatureException;
import sh.thor.core.types.Hash;
import sh.thor.core.types.HexData;
import sh.thor.primitives.Hex;
import sh.thor.primitives.rlp.Rlp;
import sh.thor.primitives.rlp.RlpItem;
import sh.thor.primitives.rlp.RlpString;

class SignatureEngineTest {

    @Test
    void signingHashIsBlake2bOfUnsignedEncoding() {
        final LegacyTransaction tx = TestTransactions.devkitLegacy();

        assertArrayEquals(
                Blake2b256.hash(Hex.decode(TestTransactions.DEVKIT_UNSIGNED)),
                SignatureEngine.signingHash(tx));
    }

    @Test
    void dynamicFeeSigningHashCoversPrefix() {
        final DynamicFeeTransaction tx = TestTransactions.dynamicFee(Reserved.EMPTY);
        final byte[] unsigned = TransactionCodec.encodeUnsigned(tx);

        assertEquals(0x51, unsigned[0]);
        assertArrayEquals(Blake2b256.hash(unsigned), SignatureEngine.signingHash(tx));
    }

    @Test
    void signingHashIgnoresSignature() {
        final LegacyTransaction tx = TestTransactions.devkitLegacy();
        final Transaction signed = Transactions.sign(tx, TestTransactions.SENDER);

        assertArrayEquals(SignatureEngine.signingHash(tx), SignatureEngine.signingHash(signed));
    }

    @Test
    void singleSignatureRecoversOrigin() {
        final LegacyTransaction tx = TestTransactions.devkitLegacy();
        final Transaction signed = Transactions.sign(tx, TestTransactions.SENDER);

        final SignatureEngine.Recovered recovered = SignatureEngine.recover(signed);

        assertEquals(TestTransactions.SENDER.address(), recovered.origin());
        assertNull(recovered.delegator());
        assertEquals(
                Hash.fromBytes(Blake2b256.hash(SignatureEngine.signingHash(tx),
                        TestTransactions.SENDER.address().toBytes())),
                recovered.id());
        assertEquals(recovered.id(), signed.id());
    }

    @Test
    void delegatedSignatureRecoversBothParties() {
        final Transaction tx = TestTransactions.devkitLegacy().withReserved(Reserved.EMPTY.withFeeDelegation());
        final Transaction signed = Transactions.sign(tx, TestTransactions.SENDER, TestTransactions.GAS_PAYER);

        assertEquals(SignatureEngine.DELEGATED_LENGTH, signed.signature().byteLength());
        assertEquals(TestTransactions.SENDER.address(), signed.origin());
        assertEquals(TestTransactions.GAS_PAYER.address(), signed.delegator());
    }

    @Test
    void gasPayerSignsOverDelegatorHash() {
        final Transaction tx = TestTransactions.devkitLegacy().withReserved(Reserved.EMPTY.withFeeDelegation());
        final Transaction signed = Transactions.sign(tx, TestTransactions.SENDER, TestTransactions.GAS_PAYER);
        final byte[] raw = signed.signature().toBytes();

        final byte[] delegatorHash = SignatureEngine.delegatorSigningHash(tx, TestTransactions.SENDER.address());

        assertEquals(TestTransactions.GAS_PAYER.address(), PrivateKey.recoverAddress(
                delegatorHash,
                Signature.fromBytes(Arrays.copyOfRange(raw, 65, 130))));
    }

    @Test
    void swappedHalvesDoNotRecoverTheSameParties() {
        final Transaction tx = TestTransactions.devkitLegacy().withReserved(Reserved.EMPTY.withFeeDelegation());
        final byte[] raw = Transactions.sign(tx, TestTransactions.SENDER, TestTransactions.GAS_PAYER)
                .signature().toBytes();
        final byte[] swapped = new byte[130];
        System.arraycopy(raw, 65, swapped, 0, 65);
        System.arraycopy(raw, 0, swapped, 65, 65);

        final SignatureEngine.Recovered recovered = SignatureEngine.recover(tx, HexData.fromBytes(swapped));

        assertNotEquals(TestTransactions.SENDER.address(), recovered.origin());
        assertNotEquals(TestTransactions.GAS_PAYER.address(), recovered.delegator());
    }

    @Test
    void rejectsSixtyFourAndSixtySixByteSignatures() {
        final LegacyTransaction tx = TestTransactions.devkitLegacy();

        assertThrows(InvalidSignatureException.class,
                () -> SignatureEngine.recover(tx, HexData.fromBytes(new byte[64])));
        assertThrows(InvalidSignatureException.class,
                () -> SignatureEngine.recover(tx, HexData.fromBytes(new byte[66])));
        assertThrows(InvalidSignatureException.class, () -> new LegacyTransaction(
                tx.chainTag(), tx.blockRef(), tx.expiration(), tx.clauses(), tx.gasPriceCoef(), tx.gas(),
                tx.dependsOn(), tx.nonce(), tx.reserved(), HexData.fromBytes(new byte[64]), null, null, null));
    }

    @Test
    void castRejectsSignatureOfWrongLength() {
        final LegacyTransaction tx = TestTransactions.devkitLegacy();
        final byte[] signed = TransactionCodec.encode(Transactions.sign(tx, TestTransactions.SENDER), true);
        final byte[] truncated = Rlp.encodeList(withSignature(signed, new byte[64]));

        assertThrows(InvalidSignatureException.class, () -> Transactions.cast(truncated));
    }

    @Test
    void unrecoverableSignatureIsAnError() {
        final LegacyTransaction tx = TestTransactions.devkitLegacy();
        final byte[] garbage = new byte[65];
        Arrays.fill(garbage, 0, 64, (byte) 0xff);

        assertThrows(InvalidSignatureException.class,
                () -> SignatureEngine.recover(tx, HexData.fromBytes(garbage)));

        final byte[] badRecoveryId = new byte[65];
        badRecoveryId[31] = 1;
        badRecoveryId[63] = 1;
        badRecoveryId[64] = 7;
        assertThrows(InvalidSignatureException.class,
                () -> SignatureEngine.recover(tx, HexData.fromBytes(badRecoveryId)));
    }

    @Test
    void unsignedTransactionHasNothingToRecover() {
        assertThrows(InvalidSignatureException.class,
                () -> SignatureEngine.recover(TestTransactions.devkitLegacy()));
    }

    private static List<RlpItem> withSignature(final byte[] signedRaw, final byte[] signature) {
        final List<RlpItem> items = new ArrayList<>(Rlp.decodeList(signedRaw));
        items.set(items.size() - 1, RlpString.of(signature));
        return items;
    }
}
