// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core.tx;

import java.util.List;
import java.util.Objects;

/**
 * Intrinsic gas: the gas a transaction consumes before any execution.
 *
 * <pre>
 * 5000 + sum over clauses of (to == null ? 48000 : 16000)
 *      + sum over data bytes of (b == 0 ? 4 : 68)
 * </pre>
 */
public final class IntrinsicGas {

    public static final long TX_GAS = 5_000L;
    public static final long CLAUSE_GAS = 16_000L;
    public static final long CLAUSE_GAS_CONTRACT_CREATION = 48_000L;
    public static final long ZERO_BYTE_GAS = 4L;
    public static final long NON_ZERO_BYTE_GAS = 68L;

    private IntrinsicGas() {
        // Utility class
    }

    /**
     * @param clauses the transaction's clauses, possibly empty
     * @return the intrinsic gas
     */
    public static long calculate(final List<Clause> clauses) {
        Objects.requireNonNull(clauses, "clauses cannot be null");
        long total = TX_GAS;
        for (final Clause clause : clauses) {
            total += clause.isContractCreation() ? CLAUSE_GAS_CONTRACT_CREATION : CLAUSE_GAS;
            total += dataGas(clause.data().toBytes());
        }
        return total;
    }

    static long dataGas(final byte[] data) {
        long gas = 0;
        for (final byte b : data) {
            gas += b == 0 ? ZERO_BYTE_GAS : NON_ZERO_BYTE_GAS;
        }
        return gas;
    }
}
