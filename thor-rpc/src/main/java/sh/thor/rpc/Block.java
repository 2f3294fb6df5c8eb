// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.rpc;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

import sh.thor.core.types.Address;
import sh.thor.core.types.Hash;

/**
 * Block as returned by {@code GET /blocks/{revision}}.
 *
 * <p>Hashes and addresses are kept as the node's hex text; {@link #blockId()},
 * {@link #parentBlockId()} and {@link #signerAddress()} parse them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Block(
        @JsonProperty("number") long number,
        @JsonProperty("id") String id,
        @JsonProperty("size") long size,
        @JsonProperty("parentID") String parentId,
        @JsonProperty("timestamp") long timestamp,
        @JsonProperty("gasLimit") long gasLimit,
        @JsonProperty("beneficiary") String beneficiary,
        @JsonProperty("gasUsed") long gasUsed,
        @JsonProperty("baseFeePerGas") @Nullable String baseFeePerGas,
        @JsonProperty("totalScore") long totalScore,
        @JsonProperty("txsRoot") String txsRoot,
        @JsonProperty("txsFeatures") long txsFeatures,
        @JsonProperty("stateRoot") String stateRoot,
        @JsonProperty("receiptsRoot") String receiptsRoot,
        @JsonProperty("com") boolean com,
        @JsonProperty("signer") String signer,
        @JsonProperty("isTrunk") boolean trunk,
        @JsonProperty("isFinalized") boolean finalized,
        @JsonProperty("transactions") List<String> transactions) {

    public Block {
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
    }

    public Hash blockId() {
        return Hash.of(id);
    }

    public Hash parentBlockId() {
        return Hash.of(parentId);
    }

    public Address signerAddress() {
        return Address.of(signer);
    }
}
