// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core.error;

/**
 * Raised when a value cannot be encoded to, or decoded from, its RLP field form.
 *
 * <p>The {@link #path()} names the offending field, e.g.
 * {@code transaction.clauses[0].to}. It is empty when the failure concerns the
 * payload as a whole (for example an unknown type prefix).
 */
public final class RlpCodecException extends ThorException {

    private final String path;

    public RlpCodecException(final String message) {
        this(message, "", null);
    }

    public RlpCodecException(final String message, final String path) {
        this(message, path, null);
    }

    public RlpCodecException(final String message, final String path, final Throwable cause) {
        super(message, cause);
        this.path = path == null ? "" : path;
    }

    public String path() {
        return path;
    }
}
