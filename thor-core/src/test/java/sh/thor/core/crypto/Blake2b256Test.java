// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core.crypto;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import sh.thor.primitives.Hex;

class Blake2b256Test {

    @Test
    void hashesEmptyInput() {
        assertEquals(
                "0x0e5751c026e543b2e8ab2eb06099daa1d1e5df47778f7787faab45cdf12fe3a8",
                Hex.encode(Blake2b256.hash(new byte[0])));
    }

    @Test
    void hashesHello() {
        assertEquals(
                "0x324dcf027dd4a30a932c441f365a25e86b173defa4b8e58948253471b81b72cf",
                Hex.encode(Blake2b256.hash("hello".getBytes(StandardCharsets.UTF_8))));
    }

    @Test
    void multiPartHashEqualsConcatenation() {
        final byte[] a = "hel".getBytes(StandardCharsets.UTF_8);
        final byte[] b = "lo".getBytes(StandardCharsets.UTF_8);

        assertArrayEquals(Blake2b256.hash("hello".getBytes(StandardCharsets.UTF_8)), Blake2b256.hash(a, b));
    }

    @Test
    void digestIsReusableAcrossCalls() {
        final byte[] first = Blake2b256.hash(new byte[] {1, 2, 3});
        Blake2b256.hash(new byte[] {9});
        assertArrayEquals(first, Blake2b256.hash(new byte[] {1, 2, 3}));
        assertEquals(Blake2b256.HASH_LENGTH, first.length);
    }
}
