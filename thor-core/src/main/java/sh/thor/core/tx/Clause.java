// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core.tx;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.thor.core.error.InvalidClauseException;
import sh.thor.core.types.Address;
import sh.thor.core.types.HexData;
import sh.thor.primitives.rlp.RlpNumeric;

/**
 * One action inside a transaction: a VET transfer, a contract call or a contract
 * deployment. A transaction carries one or more clauses and executes them
 * atomically.
 *
 * <p>
 * <strong>Field constraints:</strong>
 * <ul>
 * <li>{@code to} - recipient, or {@code null} for contract creation</li>
 * <li>{@code value} - non-negative, at most 32 bytes (wei)</li>
 * <li>{@code data} - never null; must be non-empty when {@code to} is null</li>
 * </ul>
 *
 * <p><strong>Example:</strong>
 * <pre>{@code
 * Clause pay = Clause.transfer("0x7567d83b7b8d80addcb281a71d54fc7b3364ffed", BigInteger.TEN);
 * Clause deploy = Clause.deploy("0x6080604052...", BigInteger.ZERO);
 * }</pre>
 *
 * @param to    recipient, {@code null} for contract creation
 * @param value amount in wei
 * @param data  call data or deployment bytecode
 */
public record Clause(@Nullable Address to, BigInteger value, HexData data) {

    static final int MAX_VALUE_BYTES = 32;

    /**
     * @throws IllegalArgumentException if value is negative or wider than 32 bytes
     * @throws InvalidClauseException if {@code to} is null and {@code data} is empty
     */
    public Clause {
        Objects.requireNonNull(value, "value cannot be null");
        encodeValue(value);
        data = data == null ? HexData.EMPTY : data;
        if (to == null && data.isEmpty()) {
            throw new InvalidClauseException("Contract creation clause requires non-empty data");
        }
    }

    public static Clause transfer(final Address to, final BigInteger value) {
        Objects.requireNonNull(to, "to cannot be null");
        return new Clause(to, value, HexData.EMPTY);
    }

    public static Clause transfer(final String to, final BigInteger value) {
        return transfer(Address.of(to), value);
    }

    public static Clause call(final Address to, final BigInteger value, final HexData data) {
        Objects.requireNonNull(to, "to cannot be null");
        return new Clause(to, value, data);
    }

    public static Clause call(final String to, final BigInteger value, final String data) {
        return call(Address.of(to), value, HexData.of(data));
    }

    /**
     * @param bytecode contract creation code
     * @param value    endowment in wei
     * @return a clause with no recipient
     * @throws InvalidClauseException if {@code bytecode} is empty
     */
    public static Clause deploy(final HexData bytecode, final BigInteger value) {
        return new Clause(null, value, bytecode);
    }

    public static Clause deploy(final String bytecode, final BigInteger value) {
        return deploy(HexData.of(bytecode), value);
    }

    public boolean isContractCreation() {
        return to == null;
    }

    /**
     * Encodes a clause value in its wire form: minimal big-endian bytes, empty for zero.
     *
     * @param value non-negative amount
     * @return the minimal bytes
     * @throws IllegalArgumentException if negative or wider than 32 bytes
     */
    public static byte[] encodeValue(final BigInteger value) {
        Objects.requireNonNull(value, "value cannot be null");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("Clause value must be non-negative, got: " + value);
        }
        final byte[] bytes = RlpNumeric.toMinimalBytes(value);
        if (bytes.length > MAX_VALUE_BYTES) {
            throw new IllegalArgumentException("Clause value exceeds 32 bytes: " + value);
        }
        return bytes;
    }

    Map<String, Object> toFields() {
        final Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("to", to == null ? null : to.toBytes());
        fields.put("value", value);
        fields.put("data", data.toBytes());
        return fields;
    }

    static Clause fromFields(final Map<?, ?> fields) {
        final byte[] to = (byte[]) fields.get("to");
        return new Clause(
                to.length == 0 ? null : Address.fromBytes(to),
                (BigInteger) fields.get("value"),
                HexData.fromBytes((byte[]) fields.get("data")));
    }
}
