// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core.chain;

import java.util.Objects;

/**
 * A Thor network: its chain tag (the last byte of the genesis block id, written
 * into every transaction for replay protection) and a default node URL.
 *
 * @param name           short lowercase name, e.g. {@code "testnet"}
 * @param chainTag       chain tag (0-255)
 * @param defaultNodeUrl default REST endpoint
 *
 * @see Networks
 */
public record Network(String name, int chainTag, String defaultNodeUrl) {

    /**
     * @throws IllegalArgumentException if the chain tag is outside 0-255 or a string is blank
     * @throws NullPointerException if name or defaultNodeUrl is null
     */
    public Network {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(defaultNodeUrl, "defaultNodeUrl cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name cannot be empty");
        }
        if (chainTag < 0 || chainTag > 0xFF) {
            throw new IllegalArgumentException("chainTag must be in range 0-255, got: " + chainTag);
        }
        if (defaultNodeUrl.isBlank()) {
            throw new IllegalArgumentException("defaultNodeUrl cannot be empty");
        }
    }

    public static Network of(final String name, final int chainTag, final String defaultNodeUrl) {
        return new Network(name, chainTag, defaultNodeUrl);
    }
}
