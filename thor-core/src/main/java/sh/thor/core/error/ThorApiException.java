// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core.error;

/**
 * Exception thrown when a request to a Thor node's REST API fails.
 *
 * <p>
 * {@link #status()} carries the HTTP status code, or {@code -1} when no response
 * was received (connection failure, timeout, interrupted call) or the response
 * could not be parsed. {@link #body()} holds the raw response body when one was
 * available.
 */
public final class ThorApiException extends ThorException {

    /** Status used when no HTTP response was obtained. */
    public static final int NO_STATUS = -1;

    private final int status;
    private final String body;
    private final String path;

    public ThorApiException(
            final int status,
            final String message,
            final String path,
            final String body,
            final Throwable cause) {
        super(augmentMessage(message, path), cause);
        this.status = status;
        this.path = path;
        this.body = body;
    }

    public ThorApiException(final int status, final String message, final String path, final String body) {
        this(status, message, path, body, null);
    }

    public int status() {
        return status;
    }

    public String body() {
        return body;
    }

    public String path() {
        return path;
    }

    public boolean isNotFound() {
        return status == 404;
    }

    @Override
    public String toString() {
        return "ThorApiException{"
                + "status="
                + status
                + ", message="
                + getMessage()
                + ", body="
                + body
                + "}";
    }

    private static String augmentMessage(final String message, final String path) {
        if (path == null || message == null || message.isBlank()) {
            return message;
        }
        return "[" + path + "] " + message;
    }
}
