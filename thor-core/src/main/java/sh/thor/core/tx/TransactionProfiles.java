// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core.tx;

import java.util.ArrayList;
import java.util.List;

import sh.thor.core.rlp.Kind;
import sh.thor.core.rlp.Profile;

/**
 * Wire layouts of clauses and the four transaction shapes.
 */
public final class TransactionProfiles {

    public static final String ROOT = "transaction";

    /** {@code [to, value, data]}. */
    public static final Profile CLAUSE = Profile.of("clause", Kind.struct(
            Profile.of("to", Kind.optionalFixedHexBlob(20)),
            Profile.of("value", Kind.numeric(32)),
            Profile.of("data", Kind.hexBlob())));

    private static final Profile CHAIN_TAG = Profile.of("chainTag", Kind.numeric(1));
    private static final Profile BLOCK_REF = Profile.of("blockRef", Kind.compactFixedHexBlob(8));
    private static final Profile EXPIRATION = Profile.of("expiration", Kind.numeric(4));
    private static final Profile CLAUSES = Profile.of("clauses", Kind.array(CLAUSE.kind()));
    private static final Profile GAS_PRICE_COEF = Profile.of("gasPriceCoef", Kind.numeric(1));
    private static final Profile MAX_PRIORITY_FEE = Profile.of("maxPriorityFeePerGas", Kind.numeric(32));
    private static final Profile MAX_FEE = Profile.of("maxFeePerGas", Kind.numeric(32));
    private static final Profile GAS = Profile.of("gas", Kind.numeric(8));
    private static final Profile DEPENDS_ON = Profile.of("dependsOn", Kind.optionalFixedHexBlob(32));
    private static final Profile NONCE = Profile.of("nonce", Kind.numeric(8));
    private static final Profile RESERVED = Profile.of("reserved", Kind.array(Kind.buffer()));
    private static final Profile SIGNATURE = Profile.of("signature", Kind.buffer());

    public static final Profile LEGACY_UNSIGNED = root(List.of(
            CHAIN_TAG, BLOCK_REF, EXPIRATION, CLAUSES, GAS_PRICE_COEF, GAS, DEPENDS_ON, NONCE, RESERVED), false);

    public static final Profile LEGACY_SIGNED = root(((Kind.Struct) LEGACY_UNSIGNED.kind()).fields(), true);

    public static final Profile DYNAMIC_FEE_UNSIGNED = root(List.of(
            CHAIN_TAG, BLOCK_REF, EXPIRATION, CLAUSES, MAX_PRIORITY_FEE, MAX_FEE, GAS, DEPENDS_ON, NONCE, RESERVED),
            false);

    public static final Profile DYNAMIC_FEE_SIGNED = root(((Kind.Struct) DYNAMIC_FEE_UNSIGNED.kind()).fields(), true);

    private TransactionProfiles() {
    }

    private static Profile root(final List<Profile> fields, final boolean signed) {
        final List<Profile> all = new ArrayList<>(fields);
        if (signed) {
            all.add(SIGNATURE);
        }
        return Profile.of(ROOT, new Kind.Struct(all));
    }
}
