// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core.error;

/**
 * Thrown when a transaction signature has the wrong shape or no public key can be
 * recovered from it.
 */
public final class InvalidSignatureException extends TxnException {

    public InvalidSignatureException(final String message) {
        super(message);
    }

    public InvalidSignatureException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
