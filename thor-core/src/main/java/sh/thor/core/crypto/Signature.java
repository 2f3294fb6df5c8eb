// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core.crypto;

import java.util.Arrays;
import java.util.Objects;

import sh.thor.primitives.Hex;

/**
 * Recoverable secp256k1 signature.
 *
 * <p>
 * On the wire a Thor signature is 65 bytes, {@code r ‖ s ‖ v}, where {@code v}
 * is the bare recovery id (0 or 1). There is no chain-id folding into {@code v}.
 *
 * @param r first 32 bytes of signature
 * @param s second 32 bytes of signature (low-s normalized when produced here)
 * @param v recovery id, 0 or 1
 * @since 0.1.0
 */
public record Signature(byte[] r, byte[] s, int v) {

    /** Serialized length in bytes. */
    public static final int LENGTH = 65;

    private static final int MAX_BYTES_TO_DISPLAY = 8;

    public Signature {
        Objects.requireNonNull(r, "r cannot be null");
        Objects.requireNonNull(s, "s cannot be null");

        if (r.length != 32) {
            throw new IllegalArgumentException("r must be 32 bytes, got " + r.length);
        }
        if (s.length != 32) {
            throw new IllegalArgumentException("s must be 32 bytes, got " + s.length);
        }
        if (v != 0 && v != 1) {
            throw new IllegalArgumentException("recovery id must be 0 or 1, got " + v);
        }

        r = Arrays.copyOf(r, 32);
        s = Arrays.copyOf(s, 32);
    }

    /**
     * Parses the 65-byte {@code r ‖ s ‖ v} form.
     *
     * @param bytes serialized signature
     * @return the signature
     * @throws IllegalArgumentException if the length or recovery byte is invalid
     */
    public static Signature fromBytes(final byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        if (bytes.length != LENGTH) {
            throw new IllegalArgumentException("Signature must be " + LENGTH + " bytes, got " + bytes.length);
        }
        return new Signature(
                Arrays.copyOfRange(bytes, 0, 32),
                Arrays.copyOfRange(bytes, 32, 64),
                bytes[64] & 0xFF);
    }

    /**
     * @return the 65-byte {@code r ‖ s ‖ v} form
     */
    public byte[] toBytes() {
        final byte[] out = new byte[LENGTH];
        System.arraycopy(r, 0, out, 0, 32);
        System.arraycopy(s, 0, out, 32, 32);
        out[64] = (byte) v;
        return out;
    }

    @Override
    public byte[] r() {
        return Arrays.copyOf(r, r.length);
    }

    @Override
    public byte[] s() {
        return Arrays.copyOf(s, s.length);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof Signature other))
            return false;
        return Arrays.equals(r, other.r) && Arrays.equals(s, other.s) && v == other.v;
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(r), Arrays.hashCode(s), v);
    }

    @Override
    public String toString() {
        return "Signature[r=" + bytesToHex(r) + ", s=" + bytesToHex(s) + ", v=" + v + "]";
    }

    private static String bytesToHex(byte[] bytes) {
        if (bytes.length > MAX_BYTES_TO_DISPLAY) {
            return bytes.length + " bytes";
        }
        return Hex.encodeNoPrefix(bytes);
    }
}
