// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core.chain;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Pre-configured Thor networks.
 *
 * <p>
 * The default URLs point at public nodes. For production use, create a
 * {@link Network} with your own node:
 *
 * <pre>{@code
 * Network mine = Network.of("main", Networks.MAINNET.chainTag(), "https://node.example.org");
 * }</pre>
 */
public final class Networks {
    private Networks() {}

    /** VeChainThor mainnet (chain tag 0x4a). */
    public static final Network MAINNET = Network.of("mainnet", 0x4a, "https://mainnet.veblocks.net");

    /** VeChainThor testnet (chain tag 0x27). */
    public static final Network TESTNET = Network.of("testnet", 0x27, "https://testnet.veblocks.net");

    /** Local solo node (chain tag 0xf6). */
    public static final Network SOLO = Network.of("solo", 0xf6, "http://localhost:8669");

    private static final List<Network> PRESETS = List.of(MAINNET, TESTNET, SOLO);

    /**
     * Looks up a preset by name, ignoring case. {@code "main"} and {@code "test"}
     * are accepted as aliases.
     *
     * @param name network name
     * @return the preset, or empty when unknown
     */
    public static Optional<Network> byName(final String name) {
        if (name == null) {
            return Optional.empty();
        }
        final String key = name.trim().toLowerCase(Locale.ROOT);
        final String canonical = switch (key) {
            case "main" -> "mainnet";
            case "test" -> "testnet";
            default -> key;
        };
        return PRESETS.stream().filter(n -> n.name().equals(canonical)).findFirst();
    }

    public static List<Network> all() {
        return PRESETS;
    }
}
