// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core.error;

/**
 * Base class for transaction-related failures (clauses, signing, building).
 * <p>
 * This class is {@code non-sealed} so applications can define their own
 * transaction exception types.
 *
 * @since 0.1.0
 */
public non-sealed class TxnException extends ThorException {

    public TxnException(final String message) {
        super(message);
    }

    public TxnException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
