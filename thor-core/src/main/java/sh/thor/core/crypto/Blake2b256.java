// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core.crypto;

import java.util.Objects;

import org.bouncycastle.crypto.digests.Blake2bDigest;

/**
 * Blake2b with a 256-bit output, the hash behind Thor signing hashes, transaction
 * ids and the delegator signing hash.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * byte[] signingHash = Blake2b256.hash(unsignedRlp);
 * byte[] txId = Blake2b256.hash(signingHash, origin.toBytes());
 * }</pre>
 *
 * <p>
 * Digests are cached per thread.
 *
 * @since 0.1.0
 */
public final class Blake2b256 {

    /** Output size in bytes. */
    public static final int HASH_LENGTH = 32;

    private static final ThreadLocal<Blake2bDigest> DIGEST =
            ThreadLocal.withInitial(() -> new Blake2bDigest(HASH_LENGTH * 8));

    private Blake2b256() {
        // Utility class
    }

    /**
     * @param input the data to hash
     * @return 32-byte hash
     */
    public static byte[] hash(final byte[] input) {
        Objects.requireNonNull(input, "input cannot be null");
        final Blake2bDigest digest = DIGEST.get();
        digest.reset();
        digest.update(input, 0, input.length);
        return finish(digest);
    }

    /**
     * Hashes the concatenation of the inputs.
     *
     * @param inputs the data arrays to hash
     * @return 32-byte hash
     */
    public static byte[] hash(final byte[]... inputs) {
        Objects.requireNonNull(inputs, "inputs cannot be null");
        final Blake2bDigest digest = DIGEST.get();
        digest.reset();
        for (byte[] input : inputs) {
            Objects.requireNonNull(input, "input element cannot be null");
            digest.update(input, 0, input.length);
        }
        return finish(digest);
    }

    private static byte[] finish(final Blake2bDigest digest) {
        final byte[] out = new byte[HASH_LENGTH];
        digest.doFinal(out, 0);
        return out;
    }
}
