// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core.crypto;

import java.util.Objects;

import org.bouncycastle.jcajce.provider.digest.Keccak;

/**
 * Keccak-256, which Thor keeps only for deriving an account address from an
 * uncompressed public key. Transaction hashes use {@link Blake2b256}.
 */
public final class Keccak256 {

    private Keccak256() {
    }

    /**
     * @param input the data to hash
     * @return 32-byte digest
     */
    public static byte[] hash(final byte[] input) {
        Objects.requireNonNull(input, "input cannot be null");
        return new Keccak.Digest256().digest(input);
    }
}
