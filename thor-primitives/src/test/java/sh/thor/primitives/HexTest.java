// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.primitives;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class HexTest {
    @Test
    @DisplayName("Encoding empty and single bytes")
    void encodeBasic() {
        assertEquals("0x", Hex.encode(new byte[] {}));
        assertEquals("0x00", Hex.encode(new byte[] {0x00}));
        assertEquals("0xff", Hex.encode(new byte[] {(byte) 0xFF}));
    }

    @Test
    void encodeMultipleBytes() {
        byte[] bytes = new byte[] {0x01, 0x23, (byte) 0xAB, (byte) 0xCD};
        assertEquals("0x0123abcd", Hex.encode(bytes));
        assertEquals("0123abcd", Hex.encodeNoPrefix(bytes));
    }

    @Test
    void decodeIsCaseInsensitiveAndPrefixOptional() {
        byte[] expected = new byte[] {0x0A, (byte) 0xBC, (byte) 0xDE, (byte) 0xF0};
        assertArrayEquals(expected, Hex.decode("0x0AbCdEf0"));
        assertArrayEquals(expected, Hex.decode("0X0aBcDeF0"));
        assertArrayEquals(expected, Hex.decode("0aBcDeF0"));
        assertArrayEquals(new byte[] {}, Hex.decode("0x"));
    }

    @Test
    void encodeByte() {
        assertEquals("0x51", Hex.encodeByte(0x51));
        assertEquals("0x00", Hex.encodeByte(0));
        assertThrows(IllegalArgumentException.class, () -> Hex.encodeByte(256));
        assertThrows(IllegalArgumentException.class, () -> Hex.encodeByte(-1));
    }

    @Test
    void prefixHelpers() {
        assertEquals("1234", Hex.cleanPrefix("0x1234"));
        assertEquals("1234", Hex.cleanPrefix("1234"));
        assertTrue(Hex.hasPrefix("0Xff"));
        assertFalse(Hex.hasPrefix("1"));
        assertFalse(Hex.hasPrefix(null));
    }

    @Test
    void isHexDigits() {
        assertTrue(Hex.isHexDigits("0xdeadBEEF"));
        assertTrue(Hex.isHexDigits("0x"));
        assertTrue(Hex.isHexDigits("abc"));
        assertFalse(Hex.isHexDigits("0xzz"));
        assertFalse(Hex.isHexDigits(null));
    }

    @Test
    void decodeInvalidInputs() {
        assertThrows(IllegalArgumentException.class, () -> Hex.decode(null));
        assertThrows(IllegalArgumentException.class, () -> Hex.decode("0x1"));
        assertThrows(IllegalArgumentException.class, () -> Hex.decode("0xz1"));
        assertThrows(IllegalArgumentException.class, () -> Hex.encode(null));
    }
}
