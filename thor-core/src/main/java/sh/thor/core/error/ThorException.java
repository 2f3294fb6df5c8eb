// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core.error;

/**
 * Base runtime exception for all SDK failures.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * ThorException
 * ├── {@link RlpCodecException} - field encoding and wire-structure failures
 * ├── {@link ThorApiException} - Thor REST API failures
 * └── {@link TxnException} - transaction-level failures
 *     ├── {@link InvalidClauseException} - clause invariant violations
 *     ├── {@link InvalidSignatureException} - malformed or unrecoverable signatures
 *     └── {@link sh.thor.core.builder.TxBuilderException TxBuilderException} - option conflicts
 * </pre>
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try {
 *     Transaction tx = Transactions.cast(raw);
 * } catch (RlpCodecException e) {
 *     log.warn("bad field {}", e.path());
 * } catch (InvalidSignatureException e) {
 *     // wrong length or recovery failed
 * } catch (ThorException e) {
 *     // anything else raised by the SDK
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed class ThorException extends RuntimeException
        permits RlpCodecException,
        ThorApiException,
        TxnException {

    public ThorException(final String message) {
        super(message);
    }

    public ThorException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
