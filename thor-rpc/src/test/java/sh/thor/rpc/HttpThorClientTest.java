// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.rpc;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.math.BigInteger;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import sh.thor.core.crypto.PrivateKeySigner;
import sh.thor.core.error.InvalidSignatureException;
import sh.thor.core.error.ThorApiException;
import sh.thor.core.tx.Clause;
import sh.thor.core.tx.Transaction;
import sh.thor.core.tx.Transactions;
import sh.thor.core.types.Address;
import sh.thor.core.types.Hash;
import sh.thor.core.types.HexData;

class HttpThorClientTest {

    static final String BLOCK_ID = "0x0000abcd00001234" + "11".repeat(24);
    static final String TX_ID = "0x" + "ab".repeat(32);

    static final String BLOCK_JSON = """
            {
              "number": 43981,
              "id": "%s",
              "size": 361,
              "parentID": "0x0000abcc%s",
              "timestamp": 1700000000,
              "gasLimit": 30000000,
              "beneficiary": "0x7567d83b7b8d80addcb281a71d54fc7b3364ffed",
              "gasUsed": 21000,
              "baseFeePerGas": "0x9184e72a000",
              "totalScore": 100,
              "txsRoot": "0x%s",
              "txsFeatures": 1,
              "stateRoot": "0x%s",
              "receiptsRoot": "0x%s",
              "com": true,
              "signer": "0xf39fd6e51aad88f6f4ce6ab8827279cfffb92266",
              "isTrunk": true,
              "isFinalized": false,
              "transactions": ["%s"],
              "unknownField": 1
            }
            """.formatted(BLOCK_ID, "22".repeat(28), "33".repeat(32), "44".repeat(32), "55".repeat(32), TX_ID);

    static final String RECEIPT_JSON = """
            {
              "gasUsed": 21000,
              "gasPayer": "0x70997970c51812dc3a010c7d01b50e0d17dc79c8",
              "paid": "0x1236efcbcbb340000",
              "reward": "0x576e189f04f60000",
              "reverted": false,
              "meta": {
                "blockID": "%s",
                "blockNumber": 43981,
                "blockTimestamp": 1700000000,
                "txID": "%s",
                "txOrigin": "0xf39fd6e51aad88f6f4ce6ab8827279cfffb92266"
              },
              "outputs": [{"contractAddress": null, "events": [], "transfers": []}]
            }
            """.formatted(BLOCK_ID, TX_ID);

    private HttpServer server;
    private URI baseUri;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.start();
        baseUri = URI.create("http://127.0.0.1:" + server.getAddress().getPort());
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private ThorClient client() {
        return HttpThorClient.builder(baseUri + "/").readTimeout(Duration.ofSeconds(5)).build();
    }

    @Test
    void getBlockParsesNodeJson() {
        server.createContext("/blocks/best", exchange -> respond(exchange, 200, BLOCK_JSON));

        final Block block = client().getBlock(ThorClient.BEST).orElseThrow();

        assertEquals(43981L, block.number());
        assertEquals(Hash.of(BLOCK_ID), block.blockId());
        assertEquals(Address.of("0xf39fd6e51aad88f6f4ce6ab8827279cfffb92266"), block.signerAddress());
        assertTrue(block.trunk());
        assertFalse(block.finalized());
        assertEquals("0x9184e72a000", block.baseFeePerGas());
        assertEquals(List.of(TX_ID), block.transactions());
    }

    @Test
    void getBlockByNumberUsesDecimalRevision() {
        final AtomicReference<String> path = new AtomicReference<>();
        server.createContext("/blocks/", exchange -> {
            path.set(exchange.getRequestURI().getPath());
            respond(exchange, 200, BLOCK_JSON);
        });

        client().getBlock(43981L);

        assertEquals("/blocks/43981", path.get());
    }

    @Test
    void unknownBlockIsEmpty() {
        server.createContext("/blocks/", exchange -> respond(exchange, 200, "null"));

        assertEquals(Optional.empty(), client().getBlock("0x" + "00".repeat(32)));
    }

    @Test
    void bestBlockFailsWhenNodeReturnsNull() {
        server.createContext("/blocks/best", exchange -> respond(exchange, 200, "null"));

        assertThrows(ThorApiException.class, () -> client().bestBlock());
    }

    @Test
    void postTransactionSendsRawHex() {
        final AtomicReference<String> body = new AtomicReference<>();
        final AtomicReference<String> method = new AtomicReference<>();
        server.createContext("/transactions", exchange -> {
            method.set(exchange.getRequestMethod());
            body.set(readBody(exchange));
            respond(exchange, 200, "{\"id\":\"" + TX_ID + "\"}");
        });

        final Hash id = client().postTransaction(new byte[] {(byte) 0xf8, 0x01, 0x02});

        assertEquals(Hash.of(TX_ID), id);
        assertEquals("POST", method.get());
        assertEquals("{\"raw\":\"0xf80102\"}", body.get());
    }

    @Test
    void sendTransactionEncodesSignedTransaction() {
        final PrivateKeySigner signer =
                new PrivateKeySigner("0xac0974bec39a17e36ba4a6b4d238ff944bacb478cbed5efcae784d7bf4f2ff80");
        final Transaction tx = Transactions.sign(Transactions.legacy()
                .chainTag(0xf6)
                .blockRef(HexData.of("0x0000000000000000"))
                .nonce(BigInteger.ONE)
                .clause(Clause.transfer("0x7567d83b7b8d80addcb281a71d54fc7b3364ffed", BigInteger.TEN))
                .build(), signer);
        final AtomicReference<String> body = new AtomicReference<>();
        server.createContext("/transactions", exchange -> {
            body.set(readBody(exchange));
            respond(exchange, 200, "{\"id\":\"" + tx.id().value() + "\"}");
        });

        final Hash id = client().sendTransaction(tx);

        assertEquals(tx.id(), id);
        assertEquals("{\"raw\":\"" + HexData.fromBytes(Transactions.encode(tx, true)).value() + "\"}", body.get());
    }

    @Test
    void sendTransactionRejectsUnsigned() {
        final Transaction tx = Transactions.legacy()
                .chainTag(0xf6)
                .blockRef(HexData.of("0x0000000000000000"))
                .build();

        assertThrows(InvalidSignatureException.class, () -> client().sendTransaction(tx));
    }

    @Test
    void rejectedTransactionCarriesStatusAndBody() {
        server.createContext("/transactions", exchange -> respond(exchange, 400, "bad tx: insufficient energy\n"));

        final ThorApiException ex = assertThrows(ThorApiException.class,
                () -> client().postTransaction(new byte[] {(byte) 0xc0}));

        assertEquals(400, ex.status());
        assertEquals("/transactions", ex.path());
        assertTrue(ex.body().contains("insufficient energy"));
        assertFalse(ex.isNotFound());
    }

    @Test
    void receiptIsParsed() {
        server.createContext("/transactions/" + TX_ID + "/receipt", exchange -> respond(exchange, 200, RECEIPT_JSON));

        final Receipt receipt = client().getTransactionReceipt(Hash.of(TX_ID)).orElseThrow();

        assertEquals(21000L, receipt.gasUsed());
        assertFalse(receipt.reverted());
        assertEquals(Address.of("0x70997970c51812dc3a010c7d01b50e0d17dc79c8"), receipt.gasPayerAddress());
        assertEquals(new BigInteger("1236efcbcbb340000", 16), receipt.paidWei());
        assertEquals(Hash.of(TX_ID), receipt.meta().transactionId());
        assertEquals(43981L, receipt.meta().blockNumber());
        assertEquals(1, receipt.outputs().size());
    }

    @Test
    void pendingReceiptIsEmpty() {
        server.createContext("/transactions/", exchange -> respond(exchange, 200, "null"));

        assertTrue(client().getTransactionReceipt(Hash.of(TX_ID)).isEmpty());
    }

    @Test
    void notFoundReceiptIsEmpty() {
        server.createContext("/transactions/", exchange -> respond(exchange, 404, ""));

        assertTrue(client().getTransactionReceipt(Hash.of(TX_ID)).isEmpty());
    }

    @Test
    void serverErrorOnReceiptThrows() {
        server.createContext("/transactions/", exchange -> respond(exchange, 500, "boom"));

        final ThorApiException ex = assertThrows(ThorApiException.class,
                () -> client().getTransactionReceipt(Hash.of(TX_ID)));
        assertEquals(500, ex.status());
    }

    @Test
    void accountBalancesAreParsed() {
        server.createContext("/accounts/", exchange -> respond(exchange, 200,
                "{\"balance\":\"0xde0b6b3a7640000\",\"energy\":\"0x0\",\"hasCode\":false}"));

        final Account account = client().getAccount(Address.of("0x7567D83B7B8D80ADDCB281A71D54FC7B3364FFED"));

        assertEquals(new BigInteger("1000000000000000000"), account.balanceWei());
        assertEquals(BigInteger.ZERO, account.energyWei());
        assertFalse(account.hasCode());
    }

    @Test
    void malformedJsonIsReported() {
        server.createContext("/accounts/", exchange -> respond(exchange, 200, "{not json"));

        final ThorApiException ex = assertThrows(ThorApiException.class,
                () -> client().getAccount(Address.ZERO));
        assertEquals(ThorApiException.NO_STATUS, ex.status());
        assertEquals("{not json", ex.body());
    }

    @Test
    void customHeadersAreSent() {
        final AtomicReference<String> header = new AtomicReference<>();
        server.createContext("/blocks/", exchange -> {
            header.set(exchange.getRequestHeaders().getFirst("X-Project-Id"));
            respond(exchange, 200, BLOCK_JSON);
        });

        HttpThorClient.builder(baseUri.toString()).header("X-Project-Id", "demo").build().getBlock(1L);

        assertEquals("demo", header.get());
    }

    @Test
    void unreachableNodeIsNetworkError() throws IOException {
        final int freePort;
        try (ServerSocket socket = new ServerSocket(0)) {
            freePort = socket.getLocalPort();
        }

        final ThorApiException ex = assertThrows(ThorApiException.class,
                () -> HttpThorClient.builder("http://127.0.0.1:" + freePort)
                        .connectTimeout(Duration.ofSeconds(1))
                        .build()
                        .getBlock(ThorClient.BEST));
        assertEquals(ThorApiException.NO_STATUS, ex.status());
        assertNotNull(ex.getCause());
    }

    @Test
    void awaitReceiptPollsUntilIncluded() {
        final AtomicInteger calls = new AtomicInteger();
        server.createContext("/transactions/", exchange -> {
            if (calls.incrementAndGet() < 3) {
                respond(exchange, 200, "null");
            } else {
                respond(exchange, 200, RECEIPT_JSON);
            }
        });

        final Receipt receipt = client().awaitReceipt(Hash.of(TX_ID), Duration.ofSeconds(5), Duration.ofMillis(10));

        assertEquals(3, calls.get());
        assertEquals(21000L, receipt.gasUsed());
    }

    @Test
    void awaitReceiptTimesOut() {
        server.createContext("/transactions/", exchange -> respond(exchange, 404, ""));

        final ThorApiException ex = assertThrows(ThorApiException.class,
                () -> client().awaitReceipt(Hash.of(TX_ID), Duration.ofMillis(50), Duration.ofMillis(10)));
        assertTrue(ex.getMessage().contains("Timed out"));
    }

    @Test
    void configDropsTrailingSlashAndDefaultsTimeouts() {
        final ThorConfig config = new ThorConfig("http://localhost:8669//", null, null, null);

        assertEquals("http://localhost:8669", config.baseUrl());
        assertEquals(Duration.ofSeconds(10), config.connectTimeout());
        assertEquals(Duration.ofSeconds(30), config.readTimeout());
        assertTrue(config.headers().isEmpty());
        assertThrows(IllegalArgumentException.class, () -> ThorConfig.withDefaults(" "));
    }

    static String readBody(final HttpExchange exchange) throws IOException {
        try (InputStream in = exchange.getRequestBody()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    static void respond(final HttpExchange exchange, final int statusCode, final String body) throws IOException {
        final byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length == 0 ? -1 : bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
