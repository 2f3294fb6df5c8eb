// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core.crypto;

import sh.thor.core.types.Address;

/**
 * Source of recoverable signatures over 32-byte hashes.
 *
 * <p>
 * Implementations may hold the key in memory ({@link PrivateKeySigner}) or
 * forward the hash to a remote service or hardware device. Transaction signing
 * code only needs the hash-level contract.
 *
 * @since 0.1.0
 */
public interface Signer {

    /**
     * @return the address whose key produces this signer's signatures
     */
    Address address();

    /**
     * Signs a 32-byte hash.
     *
     * @param hash the hash to sign
     * @return a 65-byte recoverable signature
     */
    Signature sign(byte[] hash);
}
