// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core;

/**
 * Global toggle for verbose debug logging across the Thor modules.
 *
 * <p>The flags are volatile; {@link #isEnabled()} reads them without locking,
 * which is good enough for log gating.
 */
public final class ThorDebug {

    private static volatile boolean rpcLogging = false;
    private static volatile boolean txLogging = false;

    private ThorDebug() {
    }

    /**
     * @return true if either REST or transaction logging is enabled
     */
    public static boolean isEnabled() {
        return rpcLogging || txLogging;
    }

    public static void setEnabled(final boolean enabled) {
        rpcLogging = enabled;
        txLogging = enabled;
    }

    public static void setRpcLogging(final boolean enabled) {
        rpcLogging = enabled;
    }

    public static boolean isRpcLoggingEnabled() {
        return rpcLogging;
    }

    public static void setTxLogging(final boolean enabled) {
        txLogging = enabled;
    }

    public static boolean isTxLoggingEnabled() {
        return txLogging;
    }
}
