// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core;

/**
 * Formats the one-line debug messages emitted by the transaction pipeline and
 * the REST client. Hashes and addresses are shortened to {@code 0x1234...abcd}.
 */
public final class LogFormatter {

    private static final int HASH_PREFIX_LENGTH = 6;

    private static final int HASH_SUFFIX_LENGTH = 4;

    private static final int HASH_SHORTEN_THRESHOLD = HASH_PREFIX_LENGTH + HASH_SUFFIX_LENGTH;

    private LogFormatter() {
    }

    /**
     * Format: {@code [TX-BUILD] type=LEGACY chainTag=0x27 clauses=2 gas=37432 delegated=false}
     */
    public static String formatTxBuild(
            final String type, final int chainTag, final int clauseCount, final long gas, final boolean delegated) {
        return String.format(
                "[TX-BUILD] type=%s chainTag=0x%02x clauses=%d gas=%d delegated=%s",
                type, chainTag, clauseCount, gas, delegated);
    }

    public static String formatTxSign(final String id, final String origin, final String delegator) {
        return String.format(
                "[TX-SIGN] id=%s origin=%s delegator=%s",
                shortenHash(id),
                shortenHash(origin),
                delegator != null ? shortenHash(delegator) : "none");
    }

    public static String formatTxSend(final String id, final int rawLength) {
        return String.format("[TX-SEND] id=%s size=%dB", shortenHash(id), rawLength);
    }

    public static String formatHttp(final String method, final String path, final int status, final long durationMicros) {
        return String.format(
                "[HTTP] %s %s status=%d %s",
                method, path, status, duration(durationMicros));
    }

    public static String formatHttpError(final String method, final String path, final int status, final String message) {
        return String.format(
                "[HTTP-ERROR] %s %s status=%d message=%s",
                method, path, status, message);
    }

    private static String duration(final long micros) {
        final double ms = micros / 1000.0;
        if (ms < 1000) {
            return String.format("duration=%.2fms", ms);
        }
        return String.format("duration=%.2fs", ms / 1000.0);
    }

    static String shortenHash(final String fullHash) {
        if (fullHash == null || fullHash.length() <= HASH_SHORTEN_THRESHOLD) {
            return fullHash;
        }
        return fullHash.substring(0, HASH_PREFIX_LENGTH)
                + "..."
                + fullHash.substring(fullHash.length() - HASH_SUFFIX_LENGTH);
    }
}
