// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core;

import java.util.function.BooleanSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opt-in diagnostics for transaction building, signing and node calls.
 *
 * <p>Each channel is switched by {@link ThorDebug}. Messages use
 * {@link String#formatted} placeholders and pass through {@link LogSanitizer}
 * before reaching the {@code sh.thor.debug} logger at INFO.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.thor.debug");

    private enum Channel {
        TX(ThorDebug::isTxLoggingEnabled),
        RPC(ThorDebug::isRpcLoggingEnabled),
        ANY(ThorDebug::isEnabled);

        private final BooleanSupplier gate;

        Channel(final BooleanSupplier gate) {
            this.gate = gate;
        }
    }

    private DebugLogger() {
    }

    /** Transaction build and sign events. */
    public static void logTx(final String message, final Object... args) {
        write(Channel.TX, message, args);
    }

    /** HTTP exchanges with a Thor node. */
    public static void logRpc(final String message, final Object... args) {
        write(Channel.RPC, message, args);
    }

    public static void log(final String message, final Object... args) {
        write(Channel.ANY, message, args);
    }

    private static void write(final Channel channel, final String message, final Object[] args) {
        if (!channel.gate.getAsBoolean() || !LOG.isInfoEnabled()) {
            return;
        }
        final String text = args == null || args.length == 0 ? message : message.formatted(args);
        LOG.info(LogSanitizer.sanitize(text));
    }
}
