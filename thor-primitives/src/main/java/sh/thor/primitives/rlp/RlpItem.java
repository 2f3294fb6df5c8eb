// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.primitives.rlp;

/**
 * A node in a decoded RLP tree: either a byte string or a list of nodes.
 *
 * @since 0.1.0
 */
public sealed interface RlpItem permits RlpString, RlpList {

    /**
     * Serializes this node, including its RLP header.
     *
     * @return encoded bytes
     */
    byte[] encode();
}
