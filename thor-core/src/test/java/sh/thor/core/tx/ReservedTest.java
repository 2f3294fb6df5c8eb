// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core.tx;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import sh.thor.core.error.RlpCodecException;
import sh.thor.core.types.HexData;
import sh.thor.primitives.Hex;

class ReservedTest {

    @Test
    void emptyEncodesAsEmptyList() {
        assertTrue(Reserved.EMPTY.toRlpList().isEmpty());
        assertTrue(Reserved.of(0).isEmpty());
        assertTrue(Reserved.EMPTY.features().isEmpty());
    }

    @Test
    void feeDelegationTogglesBitZero() {
        final Reserved delegated = Reserved.EMPTY.withFeeDelegation();

        assertTrue(delegated.isFeeDelegationEnabled());
        assertEquals(List.of("fee_delegation"), delegated.features());
        assertEquals(1, delegated.toRlpList().size());
        assertArrayEquals(new byte[] {0x01}, delegated.toRlpList().get(0));
        assertFalse(delegated.withoutFeeDelegation().isFeeDelegationEnabled());
        assertEquals(Reserved.EMPTY, delegated.withoutFeeDelegation());
    }

    @Test
    void decodingEmptyListGivesEmpty() {
        assertSame(Reserved.EMPTY, Reserved.fromRlpList(List.of()));
    }

    @Test
    void unusedEntriesSurviveRoundTrip() {
        final Reserved reserved = new Reserved(1, List.of(HexData.of("0xbeef")));

        assertEquals(reserved, Reserved.fromRlpList(reserved.toRlpList()));
    }

    @Test
    void reservedWithUnusedEntriesTravelsThroughCodec() {
        final Reserved reserved = new Reserved(3, List.of(HexData.of("0x01ff")));
        final Transaction tx = TestTransactions.devkitLegacy().withReserved(reserved);

        final Transaction decoded = TransactionCodec.decode(TransactionCodec.encode(tx, false));

        assertEquals(reserved, decoded.reserved());
        assertTrue(decoded.isDelegated());
    }

    @Test
    void delegatedLegacyEncodesReservedAsSingleByteList() {
        final Transaction tx = TestTransactions.devkitLegacy().withReserved(Reserved.EMPTY.withFeeDelegation());
        final String hex = Hex.encode(TransactionCodec.encode(tx, false));

        assertTrue(hex.endsWith("83bc614ec101"));
    }

    @Test
    void rejectsNonCanonicalFeatureMask() {
        final RlpCodecException ex = assertThrows(RlpCodecException.class,
                () -> Reserved.fromRlpList(List.of(new byte[] {0x00, 0x01})));

        assertEquals("transaction.reserved[0]", ex.path());
        assertThrows(RlpCodecException.class, () -> Reserved.fromRlpList(List.of(new byte[0])));
    }

    @Test
    void rejectsTrailingEmptyEntry() {
        final RlpCodecException ex = assertThrows(RlpCodecException.class,
                () -> Reserved.fromRlpList(List.of(new byte[] {0x01}, new byte[0])));

        assertEquals("transaction.reserved[1]", ex.path());
    }

    @Test
    void emptyFeaturesAllowedBeforeUnusedEntry() {
        final Reserved reserved = Reserved.fromRlpList(List.of(new byte[0], new byte[] {0x02}));

        assertEquals(new Reserved(0, List.of(HexData.of("0x02"))), reserved);
        assertFalse(reserved.isFeeDelegationEnabled());
    }

    @Test
    void encodingTrimsTrailingEmptyEntries() {
        final Reserved reserved = new Reserved(1, List.of(HexData.of("0xbeef"), HexData.EMPTY));

        final List<byte[]> items = reserved.toRlpList();

        assertEquals(2, items.size());
        assertTrue(new Reserved(0, List.of(HexData.EMPTY)).toRlpList().isEmpty());
    }

    @Test
    void rejectsOversizedFeatureMask() {
        assertThrows(RlpCodecException.class, () -> Reserved.fromRlpList(List.of(new byte[5])));
        assertThrows(IllegalArgumentException.class, () -> Reserved.of(-1));
    }
}
