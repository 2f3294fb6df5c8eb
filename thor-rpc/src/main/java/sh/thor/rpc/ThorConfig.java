// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.rpc;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Connection settings for {@link HttpThorClient}.
 *
 * @param baseUrl        node root, e.g. {@code https://testnet.veblocks.net}; a trailing slash is dropped
 * @param connectTimeout TCP connect timeout
 * @param readTimeout    per-request timeout
 * @param headers        extra headers sent with every request
 */
public record ThorConfig(
        String baseUrl,
        Duration connectTimeout,
        Duration readTimeout,
        Map<String, String> headers) {

    private static final Duration DEFAULT_CONNECT = Duration.ofSeconds(10);
    private static final Duration DEFAULT_READ = Duration.ofSeconds(30);

    public ThorConfig {
        Objects.requireNonNull(baseUrl, "baseUrl");
        if (baseUrl.isBlank()) {
            throw new IllegalArgumentException("baseUrl cannot be empty");
        }
        while (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        connectTimeout = connectTimeout == null ? DEFAULT_CONNECT : connectTimeout;
        readTimeout = readTimeout == null ? DEFAULT_READ : readTimeout;
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static ThorConfig withDefaults(final String baseUrl) {
        return new ThorConfig(baseUrl, DEFAULT_CONNECT, DEFAULT_READ, Map.of());
    }
}
