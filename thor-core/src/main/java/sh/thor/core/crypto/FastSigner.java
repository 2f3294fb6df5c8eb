// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core.crypto;

import java.math.BigInteger;

import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;

/**
 * Deterministic ECDSA signer over secp256k1
 * (<a href="https://tools.ietf.org/html/rfc6979">RFC 6979</a>).
 * <p>
 * The recovery id is taken from the y-parity of {@code R = k·G} during signing,
 * so no public-key recovery is needed afterwards. Signatures are normalized to
 * low-s, and the recovery id is flipped to match.
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Thread-safe. Each call creates its own {@link HMacDSAKCalculator}; the shared
 * {@link FixedPointCombMultiplier} keeps no per-call state.
 */
final class FastSigner {

    static final X9ECParameters CURVE_PARAMS = CustomNamedCurves.getByName("secp256k1");
    static final ECDomainParameters CURVE = new ECDomainParameters(
            CURVE_PARAMS.getCurve(),
            CURVE_PARAMS.getG(),
            CURVE_PARAMS.getN(),
            CURVE_PARAMS.getH());
    private static final BigInteger HALF_CURVE_ORDER = CURVE_PARAMS.getN().shiftRight(1);

    private static final FixedPointCombMultiplier MULTIPLIER = new FixedPointCombMultiplier();

    private FastSigner() {
    }

    /**
     * Signs a 32-byte hash.
     *
     * @param messageHash 32-byte hash
     * @param privateKey  private scalar
     * @return signature with v (0 or 1)
     */
    static Signature sign(byte[] messageHash, BigInteger privateKey) {
        HMacDSAKCalculator kCalculator = new HMacDSAKCalculator(new SHA256Digest());
        kCalculator.init(CURVE.getN(), privateKey, messageHash);

        final BigInteger n = CURVE.getN();
        final BigInteger z = new BigInteger(1, messageHash);

        while (true) {
            final BigInteger k = kCalculator.nextK();
            final ECPoint p = MULTIPLIER.multiply(CURVE.getG(), k).normalize();

            final BigInteger r = p.getAffineXCoord().toBigInteger().mod(n);
            if (r.signum() == 0) {
                continue;
            }

            // s = k^-1 * (z + r * d) mod n
            BigInteger s = k.modInverse(n).multiply(z.add(r.multiply(privateKey))).mod(n);
            if (s.signum() == 0) {
                continue;
            }

            int v = p.getAffineYCoord().toBigInteger().testBit(0) ? 1 : 0;

            // (r, n - s) corresponds to -R, whose y has the opposite parity
            if (s.compareTo(HALF_CURVE_ORDER) > 0) {
                s = n.subtract(s);
                v ^= 1;
            }

            return new Signature(toBytes32(r), toBytes32(s), v);
        }
    }

    static byte[] toBytes32(BigInteger value) {
        byte[] bytes = value.toByteArray();
        if (bytes.length == 32) {
            return bytes;
        }
        byte[] result = new byte[32];
        if (bytes.length < 32) {
            System.arraycopy(bytes, 0, result, 32 - bytes.length, bytes.length);
        } else {
            // drop BigInteger's sign byte
            System.arraycopy(bytes, bytes.length - 32, result, 0, 32);
        }
        return result;
    }
}
