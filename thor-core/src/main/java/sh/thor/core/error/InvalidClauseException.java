// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core.error;

/**
 * Thrown when a clause violates a structural rule, such as a contract deployment
 * without bytecode.
 */
public final class InvalidClauseException extends TxnException {

    public InvalidClauseException(final String message) {
        super(message);
    }

    public InvalidClauseException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
