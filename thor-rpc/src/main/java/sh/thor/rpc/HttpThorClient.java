// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.rpc;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.thor.core.DebugLogger;
import sh.thor.core.LogFormatter;
import sh.thor.core.error.InvalidSignatureException;
import sh.thor.core.error.ThorApiException;
import sh.thor.core.tx.Transaction;
import sh.thor.core.tx.Transactions;
import sh.thor.core.types.Address;
import sh.thor.core.types.Hash;
import sh.thor.primitives.Hex;

/**
 * {@link ThorClient} over {@code java.net.http} with Jackson for JSON.
 *
 * <p>Non-2xx answers become {@link ThorApiException} carrying the status and body,
 * except where a 404 means "not found" ({@link #getBlock}, {@link #getTransactionReceipt}).
 * Transport failures and unparsable bodies use {@link ThorApiException#NO_STATUS}.
 */
public final class HttpThorClient implements ThorClient {

    private static final Logger log = LoggerFactory.getLogger(HttpThorClient.class);

    private final ThorConfig config;
    private final HttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private HttpThorClient(final ThorConfig config) {
        this.config = config;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(config.connectTimeout())
                .build();
    }

    public static Builder builder(final String baseUrl) {
        return new Builder(baseUrl);
    }

    public static HttpThorClient create(final ThorConfig config) {
        return new HttpThorClient(Objects.requireNonNull(config, "config cannot be null"));
    }

    public ThorConfig config() {
        return config;
    }

    @Override
    public Optional<Block> getBlock(final String revision) {
        Objects.requireNonNull(revision, "revision cannot be null");
        final String path = "/blocks/" + revision;
        final HttpResponse<String> response = execute("GET", path, null);
        if (response.statusCode() == 404) {
            return Optional.empty();
        }
        requireSuccess("GET", path, response);
        return Optional.ofNullable(parse(path, response.body(), Block.class));
    }

    @Override
    public Hash postTransaction(final byte[] raw) {
        Objects.requireNonNull(raw, "raw cannot be null");
        final String path = "/transactions";
        final String payload = serialize(path, Map.of("raw", Hex.encode(raw)));
        final HttpResponse<String> response = execute("POST", path, payload);
        requireSuccess("POST", path, response);
        final TxIdResponse result = parse(path, response.body(), TxIdResponse.class);
        if (result == null || result.id() == null) {
            throw new ThorApiException(
                    response.statusCode(), "Node response carries no transaction id", path, response.body());
        }
        final Hash id = parseHash(path, result.id(), response.body());
        DebugLogger.logTx(LogFormatter.formatTxSend(id.value(), raw.length));
        return id;
    }

    @Override
    public Hash sendTransaction(final Transaction tx) {
        Objects.requireNonNull(tx, "tx cannot be null");
        if (!tx.isSigned()) {
            throw new InvalidSignatureException("Transaction must be signed before sending");
        }
        final Hash id = postTransaction(Transactions.encode(tx, true));
        if (tx.id() != null && !tx.id().equals(id)) {
            log.warn("Node returned id {} for transaction {}", id, tx.id());
        }
        return id;
    }

    @Override
    public Optional<Receipt> getTransactionReceipt(final Hash id) {
        Objects.requireNonNull(id, "id cannot be null");
        final String path = "/transactions/" + id.value() + "/receipt";
        final HttpResponse<String> response = execute("GET", path, null);
        if (response.statusCode() == 404) {
            return Optional.empty();
        }
        requireSuccess("GET", path, response);
        return Optional.ofNullable(parse(path, response.body(), Receipt.class));
    }

    @Override
    public Account getAccount(final Address address) {
        Objects.requireNonNull(address, "address cannot be null");
        final String path = "/accounts/" + address.value();
        final HttpResponse<String> response = execute("GET", path, null);
        requireSuccess("GET", path, response);
        final Account account = parse(path, response.body(), Account.class);
        if (account == null) {
            throw new ThorApiException(response.statusCode(), "Node returned no account", path, response.body());
        }
        return account;
    }

    @Override
    public Receipt awaitReceipt(final Hash id, final Duration timeout, final Duration pollInterval) {
        Objects.requireNonNull(timeout, "timeout cannot be null");
        Objects.requireNonNull(pollInterval, "pollInterval cannot be null");
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive, got " + pollInterval);
        }
        final long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            final Optional<Receipt> receipt = getTransactionReceipt(id);
            if (receipt.isPresent()) {
                return receipt.get();
            }
            final long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new ThorApiException(ThorApiException.NO_STATUS,
                        "Timed out after " + timeout + " waiting for receipt of " + id,
                        "/transactions/" + id.value() + "/receipt", null);
            }
            try {
                Thread.sleep(Math.min(pollInterval.toMillis(), Math.max(1L, remaining / 1_000_000L)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ThorApiException(ThorApiException.NO_STATUS,
                        "Interrupted while waiting for receipt of " + id,
                        "/transactions/" + id.value() + "/receipt", null, e);
            }
        }
    }

    @Override
    public void close() {
        // nothing to release: HttpClient is not AutoCloseable on JDK 17
    }

    private HttpResponse<String> execute(final String method, final String path, final String payload) {
        final HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(config.baseUrl() + path))
                .header("Accept", "application/json")
                .timeout(config.readTimeout());
        if (payload == null) {
            builder.GET();
        } else {
            builder.header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(payload));
        }
        for (Map.Entry<String, String> entry : config.headers().entrySet()) {
            builder.header(entry.getKey(), entry.getValue());
        }

        final long start = System.nanoTime();
        final HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw networkError(method, path, e);
        } catch (IOException e) {
            throw networkError(method, path, e);
        }
        final long durationMicros = (System.nanoTime() - start) / 1_000L;
        DebugLogger.logRpc(LogFormatter.formatHttp(method, path, response.statusCode(), durationMicros));
        return response;
    }

    private ThorApiException networkError(final String method, final String path, final Exception e) {
        DebugLogger.logRpc(LogFormatter.formatHttpError(
                method, path, ThorApiException.NO_STATUS, e.getClass().getSimpleName()));
        return new ThorApiException(
                ThorApiException.NO_STATUS, "Network error during " + method + " " + path, path, null, e);
    }

    private static void requireSuccess(final String method, final String path, final HttpResponse<String> response) {
        final int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return;
        }
        final String body = response.body();
        final String detail = body == null || body.isBlank() ? "HTTP " + status : body.strip();
        DebugLogger.logRpc(LogFormatter.formatHttpError(method, path, status, detail));
        throw new ThorApiException(status, "HTTP error for " + method + " " + path + ": " + status, path, body);
    }

    private String serialize(final String path, final Object payload) {
        try {
            return mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new ThorApiException(
                    ThorApiException.NO_STATUS, "Unable to serialize request body", path, null, e);
        }
    }

    private <T> T parse(final String path, final String body, final Class<T> type) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return mapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new ThorApiException(ThorApiException.NO_STATUS,
                    "Unable to parse " + type.getSimpleName() + " response", path, body, e);
        }
    }

    private static Hash parseHash(final String path, final String value, final String body) {
        try {
            return Hash.of(value);
        } catch (IllegalArgumentException e) {
            throw new ThorApiException(ThorApiException.NO_STATUS,
                    "Node returned a malformed transaction id: " + value, path, body, e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TxIdResponse(@JsonProperty("id") String id) {
    }

    public static final class Builder {
        private final String baseUrl;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
        private final Map<String, String> headers = new LinkedHashMap<>();

        private Builder(final String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public Builder connectTimeout(final Duration connectTimeout) {
            if (connectTimeout != null) {
                this.connectTimeout = connectTimeout;
            }
            return this;
        }

        public Builder readTimeout(final Duration readTimeout) {
            if (readTimeout != null) {
                this.readTimeout = readTimeout;
            }
            return this;
        }

        public Builder header(final String key, final String value) {
            headers.put(key, value);
            return this;
        }

        public HttpThorClient build() {
            return new HttpThorClient(new ThorConfig(baseUrl, connectTimeout, readTimeout, headers));
        }
    }
}
