// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core.chain;

import java.math.BigInteger;
import java.security.SecureRandom;

/**
 * Source of transaction nonces. Thor nonces are not sequential; any 8-byte value
 * that makes the transaction id unique will do.
 */
@FunctionalInterface
public interface NonceGenerator {

    /**
     * @return a non-negative nonce of at most 8 bytes
     */
    BigInteger next();

    /**
     * @return a generator drawing 8 random bytes from a shared {@link SecureRandom}
     */
    static NonceGenerator secureRandom() {
        return SecureRandomNonce.INSTANCE;
    }

    /**
     * @param nonce the value to return every time
     * @return a generator that always yields {@code nonce}
     */
    static NonceGenerator fixed(final BigInteger nonce) {
        if (nonce.signum() < 0 || nonce.bitLength() > 64) {
            throw new IllegalArgumentException("nonce must fit in 8 unsigned bytes: " + nonce);
        }
        return () -> nonce;
    }

    /** Shared holder so the {@link SecureRandom} is seeded once. */
    final class SecureRandomNonce implements NonceGenerator {
        static final SecureRandomNonce INSTANCE = new SecureRandomNonce();

        private final SecureRandom random = new SecureRandom();

        private SecureRandomNonce() {
        }

        @Override
        public BigInteger next() {
            final byte[] bytes = new byte[8];
            random.nextBytes(bytes);
            return new BigInteger(1, bytes);
        }
    }
}
