// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core.crypto;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

import javax.security.auth.Destroyable;

import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;

import sh.thor.core.types.Address;
import sh.thor.primitives.Hex;

/**
 * secp256k1 private key with signing and public-key recovery.
 *
 * <p>
 * This class provides:
 * <ul>
 * <li>Private key loading from hex strings or raw bytes</li>
 * <li>Address derivation: last 20 bytes of Keccak-256 over the 64-byte public key</li>
 * <li>Deterministic ECDSA signing (RFC 6979) with low-s normalization</li>
 * <li>Public key and address recovery from 65-byte signatures</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * PrivateKey key = PrivateKey.fromHex("0x1234...");
 * Address address = key.toAddress();
 *
 * byte[] signingHash = Blake2b256.hash(unsignedRlp);
 * Signature signature = key.sign(signingHash);
 *
 * Address recovered = PrivateKey.recoverAddress(signingHash, signature);
 * assert recovered.equals(address);
 * }</pre>
 *
 * <h2>Security Considerations</h2>
 *
 * <p>
 * Implements {@link Destroyable}. {@link #destroy()} drops the internal
 * references and makes later operations fail; the immutable {@link BigInteger}
 * itself cannot be zeroed.
 *
 * @since 0.1.0
 */
public final class PrivateKey implements Destroyable {

    private static final int PRIVATE_KEY_SIZE = 32;
    /** Length of an uncompressed public key without the {@code 0x04} tag. */
    public static final int PUBLIC_KEY_SIZE = 64;

    private volatile BigInteger privateKeyValue;
    private volatile ECPoint publicKey;
    private volatile boolean destroyed = false;

    private PrivateKey(final byte[] keyBytes) {
        if (keyBytes.length != PRIVATE_KEY_SIZE) {
            throw new IllegalArgumentException("Private key must be " + PRIVATE_KEY_SIZE + " bytes, got " + keyBytes.length);
        }

        try {
            this.privateKeyValue = new BigInteger(1, keyBytes);

            if (privateKeyValue.signum() == 0) {
                throw new IllegalArgumentException("Private key cannot be zero");
            }
            if (privateKeyValue.compareTo(FastSigner.CURVE.getN()) >= 0) {
                throw new IllegalArgumentException("Private key must be less than curve order");
            }

            this.publicKey = new FixedPointCombMultiplier().multiply(FastSigner.CURVE.getG(), privateKeyValue).normalize();
        } finally {
            Arrays.fill(keyBytes, (byte) 0);
        }
    }

    /**
     * Creates a private key from a hex string.
     *
     * @param hexString hex-encoded private key (with or without 0x prefix)
     * @return private key instance
     * @throws IllegalArgumentException if hex string is invalid or key is out of range
     */
    public static PrivateKey fromHex(final String hexString) {
        Objects.requireNonNull(hexString, "hex string cannot be null");
        return new PrivateKey(Hex.decode(hexString));
    }

    /**
     * Creates a private key from raw bytes.
     *
     * @apiNote This method zeroes the provided array after reading it. Pass a copy
     *          to keep the original: {@code PrivateKey.fromBytes(keyBytes.clone())}.
     *
     * @param keyBytes 32-byte private key (will be zeroed after use)
     * @return private key instance
     * @throws IllegalArgumentException if key bytes are invalid
     */
    public static PrivateKey fromBytes(final byte[] keyBytes) {
        Objects.requireNonNull(keyBytes, "key bytes cannot be null");
        return new PrivateKey(keyBytes);
    }

    /**
     * @return the 64-byte uncompressed public key ({@code x ‖ y}, no {@code 0x04} tag)
     * @throws IllegalStateException if the key has been destroyed
     */
    public byte[] publicKey() {
        final ECPoint pubKey;
        synchronized (this) {
            checkNotDestroyed();
            pubKey = publicKey;
        }
        final byte[] encoded = pubKey.getEncoded(false);
        return Arrays.copyOfRange(encoded, 1, encoded.length);
    }

    /**
     * Derives the account address of this key.
     *
     * @return the address
     * @throws IllegalStateException if the key has been destroyed
     */
    public Address toAddress() {
        return addressOf(publicKey());
    }

    /**
     * Signs a 32-byte hash using deterministic ECDSA (RFC 6979).
     *
     * @param messageHash 32-byte hash
     * @return signature with v=0 or v=1
     * @throws IllegalArgumentException if message hash is not 32 bytes
     * @throws IllegalStateException if the key has been destroyed
     */
    public Signature sign(final byte[] messageHash) {
        Objects.requireNonNull(messageHash, "message hash cannot be null");
        if (messageHash.length != 32) {
            throw new IllegalArgumentException("Message hash must be 32 bytes, got " + messageHash.length);
        }
        final BigInteger key;
        synchronized (this) {
            checkNotDestroyed();
            key = privateKeyValue;
        }
        return FastSigner.sign(messageHash, key);
    }

    /**
     * Derives an address from a public key.
     *
     * @param publicKey 64-byte key, or 65-byte key with the {@code 0x04} tag
     * @return the address: last 20 bytes of {@code keccak256(x ‖ y)}
     * @throws IllegalArgumentException if the key length or tag is wrong
     */
    public static Address addressOf(final byte[] publicKey) {
        Objects.requireNonNull(publicKey, "public key cannot be null");
        final byte[] raw;
        if (publicKey.length == PUBLIC_KEY_SIZE) {
            raw = publicKey;
        } else if (publicKey.length == PUBLIC_KEY_SIZE + 1 && publicKey[0] == 0x04) {
            raw = Arrays.copyOfRange(publicKey, 1, publicKey.length);
        } else {
            throw new IllegalArgumentException("Public key must be 64 bytes (or 65 with 0x04 prefix), got "
                    + publicKey.length);
        }
        final byte[] hash = Keccak256.hash(raw);
        return Address.fromBytes(Arrays.copyOfRange(hash, 12, 32));
    }

    /**
     * Recovers the 64-byte public key that produced a signature.
     *
     * @param messageHash 32-byte hash that was signed
     * @param signature   the signature
     * @return the 64-byte public key
     * @throws IllegalArgumentException if recovery fails
     */
    public static byte[] recoverPublicKey(final byte[] messageHash, final Signature signature) {
        Objects.requireNonNull(messageHash, "message hash cannot be null");
        Objects.requireNonNull(signature, "signature cannot be null");

        if (messageHash.length != 32) {
            throw new IllegalArgumentException("Message hash must be 32 bytes");
        }

        final BigInteger r = new BigInteger(1, signature.r());
        final BigInteger s = new BigInteger(1, signature.s());

        final ECPoint point;
        try {
            point = recoverPoint(r, s, messageHash, signature.v());
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Failed to recover public key from signature", e);
        }
        if (point == null || point.isInfinity()) {
            throw new IllegalArgumentException("Failed to recover public key from signature");
        }
        final byte[] encoded = point.getEncoded(false);
        return Arrays.copyOfRange(encoded, 1, encoded.length);
    }

    /**
     * Recovers the signer's address from a signature and message hash.
     *
     * @param messageHash 32-byte hash that was signed
     * @param signature   the signature
     * @return recovered address
     * @throws IllegalArgumentException if recovery fails
     */
    public static Address recoverAddress(final byte[] messageHash, final Signature signature) {
        return addressOf(recoverPublicKey(messageHash, signature));
    }

    // Q = r^-1 * (s*R - e*G)
    private static ECPoint recoverPoint(
            final BigInteger r,
            final BigInteger s,
            final byte[] messageHash,
            final int recoveryId) {
        final BigInteger n = FastSigner.CURVE.getN();

        if (r.signum() <= 0 || s.signum() <= 0) {
            return null;
        }
        if (r.compareTo(n) >= 0 || s.compareTo(n) >= 0) {
            return null;
        }

        final ECPoint rPoint = decompressKey(r, (recoveryId & 1) == 1);
        if (rPoint == null || !rPoint.multiply(n).isInfinity()) {
            return null;
        }

        final BigInteger e = new BigInteger(1, messageHash);
        final BigInteger rInv = r.modInverse(n);
        final BigInteger srInv = rInv.multiply(s).mod(n);
        final BigInteger eInv = rInv.multiply(e).mod(n);

        return rPoint.multiply(srInv).subtract(FastSigner.CURVE.getG().multiply(eInv)).normalize();
    }

    private static ECPoint decompressKey(final BigInteger x, final boolean yBit) {
        final byte[] encoded = new byte[33];
        encoded[0] = (byte) (yBit ? 0x03 : 0x02);
        System.arraycopy(FastSigner.toBytes32(x), 0, encoded, 1, 32);
        final ECPoint point = FastSigner.CURVE.getCurve().decodePoint(encoded);
        return point.isValid() ? point : null;
    }

    @Override
    public void destroy() {
        synchronized (this) {
            destroyed = true;
            privateKeyValue = null;
            publicKey = null;
        }
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    private void checkNotDestroyed() {
        if (destroyed) {
            throw new IllegalStateException("PrivateKey has been destroyed");
        }
    }

    /**
     * Shows the derived address, never the key material.
     */
    @Override
    public String toString() {
        try {
            return "PrivateKey[address=" + toAddress() + "]";
        } catch (IllegalStateException e) {
            return "PrivateKey[destroyed]";
        }
    }
}
