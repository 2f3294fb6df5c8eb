// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.rpc;

import java.time.Duration;
import java.util.Optional;

import sh.thor.core.chain.Network;
import sh.thor.core.error.ThorApiException;
import sh.thor.core.tx.Transaction;
import sh.thor.core.types.Address;
import sh.thor.core.types.Hash;

/**
 * Client for a Thor node's REST API.
 *
 * <p>Every call is synchronous and every failure is a {@link ThorApiException}.
 * Implementations are thread-safe.
 *
 * <pre>{@code
 * try (ThorClient client = ThorClient.connect(Networks.TESTNET)) {
 *     Transaction tx = Transactions.legacy()
 *             .network(Networks.TESTNET)
 *             .blockRefProvider(new BestBlockRefProvider(client))
 *             .clause(Clause.transfer(recipient, amount))
 *             .build();
 *     Hash id = client.sendTransaction(Transactions.sign(tx, signer));
 *     Receipt receipt = client.awaitReceipt(id, Duration.ofMinutes(1), Duration.ofSeconds(2));
 * }
 * }</pre>
 */
public interface ThorClient extends AutoCloseable {

    /** Revision of the latest block. */
    String BEST = "best";

    /** Revision of the latest finalized block. */
    String FINALIZED = "finalized";

    /**
     * @param revision {@link #BEST}, {@link #FINALIZED}, a block number or a {@code 0x} block id
     * @return the block, or empty if the node does not know it
     */
    Optional<Block> getBlock(String revision);

    default Optional<Block> getBlock(final long number) {
        return getBlock(Long.toString(number));
    }

    /**
     * @return the latest block
     * @throws ThorApiException if the node answers with no block
     */
    default Block bestBlock() {
        return getBlock(BEST).orElseThrow(() -> new ThorApiException(
                ThorApiException.NO_STATUS, "Node returned no best block", "/blocks/" + BEST, null));
    }

    /**
     * Submits raw transaction bytes.
     *
     * @param raw signed wire encoding
     * @return the id assigned by the node
     */
    Hash postTransaction(byte[] raw);

    /**
     * Encodes and submits a signed transaction.
     *
     * @param tx a signed transaction
     * @return the id assigned by the node
     * @throws sh.thor.core.error.InvalidSignatureException if {@code tx} is unsigned
     */
    Hash sendTransaction(Transaction tx);

    /**
     * @param id transaction id
     * @return the receipt, or empty while the transaction is pending
     */
    Optional<Receipt> getTransactionReceipt(Hash id);

    Account getAccount(Address address);

    /**
     * Polls {@link #getTransactionReceipt} until a receipt appears.
     *
     * @param id           transaction id
     * @param timeout      total time to wait
     * @param pollInterval delay between polls
     * @return the receipt
     * @throws ThorApiException if the timeout elapses or the wait is interrupted
     */
    Receipt awaitReceipt(Hash id, Duration timeout, Duration pollInterval);

    @Override
    void close();

    /**
     * Connects to the default public node of {@code network}.
     */
    static ThorClient connect(final Network network) {
        return HttpThorClient.builder(network.defaultNodeUrl()).build();
    }

    static ThorClient connect(final String baseUrl) {
        return HttpThorClient.builder(baseUrl).build();
    }
}
