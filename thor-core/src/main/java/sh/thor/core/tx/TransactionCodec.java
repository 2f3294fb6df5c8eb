// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core.tx;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import sh.thor.core.error.InvalidClauseException;
import sh.thor.core.error.RlpCodecException;
import sh.thor.core.rlp.Profiler;
import sh.thor.core.types.Hash;
import sh.thor.core.types.HexData;
import sh.thor.primitives.Hex;
import sh.thor.primitives.rlp.Rlp;
import sh.thor.primitives.rlp.RlpItem;
import sh.thor.primitives.rlp.RlpList;

/**
 * Converts transactions to and from their wire bytes.
 *
 * <p>
 * Encoding maps the record onto the matching {@link TransactionProfiles} layout
 * and, for dynamic-fee transactions, prepends {@code 0x51}. Decoding runs
 * {@link #classify(byte[])} first and never guesses: an unknown prefix or an
 * unexpected field count is an {@link RlpCodecException}.
 *
 * <p>
 * Decoding does not recover signers; {@link Transactions#cast(byte[])} does.
 */
public final class TransactionCodec {

    private TransactionCodec() {
        // Utility class
    }

    /**
     * @param tx               the transaction
     * @param includeSignature append the signature when the transaction has one
     * @return wire bytes
     */
    public static byte[] encode(final Transaction tx, final boolean includeSignature) {
        Objects.requireNonNull(tx, "tx cannot be null");
        final boolean signed = includeSignature && tx.isSigned();
        final TransactionShape shape = TransactionShape.of(tx.type(), signed);
        final byte[] body = Profiler.encode(toFields(tx, signed), shape.profile());
        return withPrefix(tx.type(), body);
    }

    /**
     * @return the unsigned encoding, which is what both parties sign
     */
    public static byte[] encodeUnsigned(final Transaction tx) {
        return encode(tx, false);
    }

    /**
     * Determines the wire shape without decoding the fields.
     *
     * @param raw wire bytes
     * @return the shape
     * @throws RlpCodecException on an unknown prefix, malformed RLP or a wrong field count
     */
    public static TransactionShape classify(final byte[] raw) {
        return parse(raw).shape();
    }

    /**
     * Decodes wire bytes into an unsigned or signed transaction. Origin, delegator
     * and id are left unset.
     *
     * @param raw wire bytes
     * @return the transaction
     * @throws RlpCodecException if the bytes do not match a transaction layout
     */
    public static Transaction decode(final byte[] raw) {
        final Parsed parsed = parse(raw);
        final TransactionShape shape = parsed.shape();
        final Map<?, ?> fields = (Map<?, ?>) Profiler.unpack(parsed.list(), shape.profile());
        return fromFields(fields, shape);
    }

    private static Parsed parse(final byte[] raw) {
        Objects.requireNonNull(raw, "raw cannot be null");
        if (raw.length == 0) {
            throw new RlpCodecException("Empty transaction data", TransactionProfiles.ROOT);
        }
        final int first = raw[0] & 0xFF;
        final TransactionType type;
        final byte[] body;
        if (first == (TransactionType.DYNAMIC_FEE.prefix() & 0xFF)) {
            type = TransactionType.DYNAMIC_FEE;
            body = Arrays.copyOfRange(raw, 1, raw.length);
        } else if (first >= 0xC0) {
            type = TransactionType.LEGACY;
            body = raw;
        } else {
            throw new RlpCodecException(
                    "Unsupported transaction type prefix " + Hex.encodeByte(first), TransactionProfiles.ROOT);
        }

        final RlpItem item;
        try {
            item = Rlp.decode(body);
        } catch (IllegalArgumentException e) {
            throw new RlpCodecException("RLP decode error: " + e.getMessage(), TransactionProfiles.ROOT, e);
        }
        if (!(item instanceof RlpList list)) {
            throw new RlpCodecException(
                    "Type mismatch in " + TransactionProfiles.ROOT + ": expected list, got byte string",
                    TransactionProfiles.ROOT);
        }
        final TransactionShape unsigned = TransactionShape.of(type, false);
        final TransactionShape signed = TransactionShape.of(type, true);
        if (list.size() == unsigned.fieldCount()) {
            return new Parsed(unsigned, list);
        }
        if (list.size() == signed.fieldCount()) {
            return new Parsed(signed, list);
        }
        throw new RlpCodecException(
                "Invalid " + type + " transaction structure: expected " + unsigned.fieldCount() + " or "
                        + signed.fieldCount() + " fields, got " + list.size(),
                TransactionProfiles.ROOT);
    }

    private static byte[] withPrefix(final TransactionType type, final byte[] body) {
        final Byte prefix = type.prefix();
        if (prefix == null) {
            return body;
        }
        final byte[] out = new byte[body.length + 1];
        out[0] = prefix;
        System.arraycopy(body, 0, out, 1, body.length);
        return out;
    }

    private static Map<String, Object> toFields(final Transaction tx, final boolean signed) {
        final Map<String, Object> fields = new HashMap<>();
        fields.put("chainTag", tx.chainTag());
        fields.put("blockRef", tx.blockRef());
        fields.put("expiration", tx.expiration());
        final List<Map<String, Object>> clauses = new ArrayList<>(tx.clauses().size());
        for (final Clause clause : tx.clauses()) {
            clauses.add(clause.toFields());
        }
        fields.put("clauses", clauses);
        if (tx instanceof LegacyTransaction legacy) {
            fields.put("gasPriceCoef", legacy.gasPriceCoef());
        } else {
            final DynamicFeeTransaction dynamic = (DynamicFeeTransaction) tx;
            fields.put("maxPriorityFeePerGas", dynamic.maxPriorityFeePerGas());
            fields.put("maxFeePerGas", dynamic.maxFeePerGas());
        }
        fields.put("gas", tx.gas());
        fields.put("dependsOn", tx.dependsOn() == null ? null : tx.dependsOn().toBytes());
        fields.put("nonce", tx.nonce());
        fields.put("reserved", tx.reserved().toRlpList());
        if (signed) {
            fields.put("signature", tx.signature());
        }
        return fields;
    }

    @SuppressWarnings("unchecked")
    private static Transaction fromFields(final Map<?, ?> fields, final TransactionShape shape) {
        final int chainTag = ((BigInteger) fields.get("chainTag")).intValue();
        final HexData blockRef = HexData.fromBytes((byte[]) fields.get("blockRef"));
        final long expiration = ((BigInteger) fields.get("expiration")).longValue();
        final List<Object> clauseFields = (List<Object>) fields.get("clauses");
        final List<Clause> clauses = new ArrayList<>(clauseFields.size());
        for (int i = 0; i < clauseFields.size(); i++) {
            clauses.add(toClause((Map<?, ?>) clauseFields.get(i), i));
        }
        final long gas = toGas((BigInteger) fields.get("gas"));
        final byte[] dependsOnBytes = (byte[]) fields.get("dependsOn");
        final Hash dependsOn = dependsOnBytes.length == 0 ? null : Hash.fromBytes(dependsOnBytes);
        final BigInteger nonce = (BigInteger) fields.get("nonce");
        final Reserved reserved = Reserved.fromRlpList((List<byte[]>) (List<?>) fields.get("reserved"));
        final HexData signature = shape.signed() ? HexData.fromBytes((byte[]) fields.get("signature")) : null;

        if (shape.type() == TransactionType.LEGACY) {
            final int gasPriceCoef = ((BigInteger) fields.get("gasPriceCoef")).intValue();
            return new LegacyTransaction(chainTag, blockRef, expiration, clauses, gasPriceCoef, gas,
                    dependsOn, nonce, reserved, signature, null, null, null);
        }
        return new DynamicFeeTransaction(chainTag, blockRef, expiration, clauses,
                (BigInteger) fields.get("maxPriorityFeePerGas"), (BigInteger) fields.get("maxFeePerGas"),
                gas, dependsOn, nonce, reserved, signature, null, null, null);
    }

    private static Clause toClause(final Map<?, ?> fields, final int index) {
        try {
            return Clause.fromFields(fields);
        } catch (InvalidClauseException e) {
            final String path = TransactionProfiles.ROOT + ".clauses[" + index + "]";
            throw new RlpCodecException(e.getMessage() + " in " + path, path, e);
        }
    }

    private static long toGas(final BigInteger gas) {
        if (gas.bitLength() > 63) {
            throw new RlpCodecException("Gas exceeds supported range in transaction.gas: " + gas, "transaction.gas");
        }
        return gas.longValue();
    }

    private record Parsed(TransactionShape shape, RlpList list) {
    }
}
