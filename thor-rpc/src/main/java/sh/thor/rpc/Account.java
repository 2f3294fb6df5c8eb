// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.rpc;

import java.math.BigInteger;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Account state from {@code GET /accounts/{address}}.
 *
 * @param balance VET balance, hex wei
 * @param energy  VTHO balance, hex wei
 * @param hasCode whether the account is a contract
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Account(
        @JsonProperty("balance") String balance,
        @JsonProperty("energy") String energy,
        @JsonProperty("hasCode") boolean hasCode) {

    public BigInteger balanceWei() {
        return Receipt.hexToBigInteger(balance);
    }

    public BigInteger energyWei() {
        return Receipt.hexToBigInteger(energy);
    }
}
