// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core.crypto;

import java.util.Objects;

import sh.thor.core.types.Address;

/**
 * {@link Signer} backed by an in-memory {@link PrivateKey}.
 */
public final class PrivateKeySigner implements Signer {

    private final PrivateKey privateKey;
    private final Address address;

    public PrivateKeySigner(final PrivateKey privateKey) {
        this.privateKey = Objects.requireNonNull(privateKey, "privateKey");
        this.address = privateKey.toAddress();
    }

    /**
     * @param privateKeyHex hex-encoded key, with or without {@code 0x}
     */
    public PrivateKeySigner(final String privateKeyHex) {
        this(PrivateKey.fromHex(privateKeyHex));
    }

    @Override
    public Address address() {
        return address;
    }

    @Override
    public Signature sign(final byte[] hash) {
        return privateKey.sign(hash);
    }

    @Override
    public String toString() {
        return "PrivateKeySigner[address=" + address + "]";
    }
}
