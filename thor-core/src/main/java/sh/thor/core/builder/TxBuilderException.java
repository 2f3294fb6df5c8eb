// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core.builder;

import sh.thor.core.error.TxnException;

/** Thrown when a transaction builder or a signing step is in an invalid state. */
public final class TxBuilderException extends TxnException {
    public TxBuilderException(final String message) {
        super(message);
    }

    public TxBuilderException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
