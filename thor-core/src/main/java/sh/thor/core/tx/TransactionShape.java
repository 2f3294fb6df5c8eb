// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core.tx;

import sh.thor.core.rlp.Kind;
import sh.thor.core.rlp.Profile;

/**
 * The four wire shapes a raw transaction can take: type times signed/unsigned.
 *
 * @see TransactionCodec#classify(byte[])
 */
public enum TransactionShape {
    LEGACY_UNSIGNED(TransactionType.LEGACY, false, TransactionProfiles.LEGACY_UNSIGNED),
    LEGACY_SIGNED(TransactionType.LEGACY, true, TransactionProfiles.LEGACY_SIGNED),
    DYNAMIC_FEE_UNSIGNED(TransactionType.DYNAMIC_FEE, false, TransactionProfiles.DYNAMIC_FEE_UNSIGNED),
    DYNAMIC_FEE_SIGNED(TransactionType.DYNAMIC_FEE, true, TransactionProfiles.DYNAMIC_FEE_SIGNED);

    private final TransactionType type;
    private final boolean signed;
    private final Profile profile;

    TransactionShape(final TransactionType type, final boolean signed, final Profile profile) {
        this.type = type;
        this.signed = signed;
        this.profile = profile;
    }

    public TransactionType type() {
        return type;
    }

    public boolean signed() {
        return signed;
    }

    public Profile profile() {
        return profile;
    }

    /**
     * @return number of top-level RLP fields
     */
    public int fieldCount() {
        return ((Kind.Struct) profile.kind()).arity();
    }

    public static TransactionShape of(final TransactionType type, final boolean signed) {
        if (type == TransactionType.LEGACY) {
            return signed ? LEGACY_SIGNED : LEGACY_UNSIGNED;
        }
        return signed ? DYNAMIC_FEE_SIGNED : DYNAMIC_FEE_UNSIGNED;
    }
}
