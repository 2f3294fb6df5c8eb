// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.rpc;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import sh.thor.core.types.Address;
import sh.thor.core.types.Hash;
import sh.thor.primitives.Hex;

/**
 * Transaction receipt as returned by {@code GET /transactions/{id}/receipt}.
 *
 * @param gasUsed  gas consumed
 * @param gasPayer account that paid; the delegator for fee-delegated transactions
 * @param paid     energy paid, hex wei
 * @param reward   energy rewarded to the block producer, hex wei
 * @param reverted whether execution reverted
 * @param meta     inclusion metadata
 * @param outputs  per-clause outputs (events, transfers), left as parsed JSON
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Receipt(
        @JsonProperty("gasUsed") long gasUsed,
        @JsonProperty("gasPayer") String gasPayer,
        @JsonProperty("paid") String paid,
        @JsonProperty("reward") String reward,
        @JsonProperty("reverted") boolean reverted,
        @JsonProperty("meta") Meta meta,
        @JsonProperty("outputs") List<Map<String, Object>> outputs) {

    public Receipt {
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
    }

    public Address gasPayerAddress() {
        return Address.of(gasPayer);
    }

    public BigInteger paidWei() {
        return hexToBigInteger(paid);
    }

    public BigInteger rewardWei() {
        return hexToBigInteger(reward);
    }

    static BigInteger hexToBigInteger(final String value) {
        if (value == null) {
            return BigInteger.ZERO;
        }
        final String digits = Hex.cleanPrefix(value);
        return digits.isEmpty() ? BigInteger.ZERO : new BigInteger(digits, 16);
    }

    /**
     * Where and when the transaction was included.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Meta(
            @JsonProperty("blockID") String blockId,
            @JsonProperty("blockNumber") long blockNumber,
            @JsonProperty("blockTimestamp") long blockTimestamp,
            @JsonProperty("txID") String txId,
            @JsonProperty("txOrigin") String txOrigin) {

        public Hash transactionId() {
            return Hash.of(txId);
        }

        public Address origin() {
            return Address.of(txOrigin);
        }
    }
}
