// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.rpc;

import java.util.Objects;

import sh.thor.core.chain.BlockRefProvider;

/**
 * Block reference taken from the node's best block on every call.
 */
public final class BestBlockRefProvider implements BlockRefProvider {

    private final ThorClient client;

    public BestBlockRefProvider(final ThorClient client) {
        this.client = Objects.requireNonNull(client, "client cannot be null");
    }

    @Override
    public byte[] blockRef() {
        return BlockRefProvider.of(client.bestBlock().blockId()).blockRef();
    }
}
