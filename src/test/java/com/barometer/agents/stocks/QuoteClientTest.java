package com.barometer.agents.stocks;

import com.barometer.core.provider.ProviderException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class QuoteClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private static String fixture(String name) throws IOException {
        try (InputStream in = QuoteClientTest.class.getResourceAsStream("/stocks/" + name)) {
            assertNotNull(in, "missing fixture " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Nested
    @DisplayName("parse")
    class Parse {

        @Test
        @DisplayName("reads price, previous close and ranges from the chart metadata")
        void mapsMeta() throws Exception {
            var quote = QuoteClient.parse("AAPL", objectMapper.readTree(fixture("chart.json")));

            assertEquals("AAPL", quote.symbol());
            assertEquals("Apple Inc.", quote.name());
            assertEquals("NasdaqGS", quote.exchange());
            assertEquals(231.78, quote.price());
            assertEquals(228.5, quote.previousClose());
            assertEquals(229.1, quote.dayLow());
            assertEquals(260.1, quote.yearHigh());
            assertEquals(48_125_300L, quote.volume());
            assertEquals(3.28, quote.change(), 1e-9);
        }

        @Test
        @DisplayName("falls back to the chart's previous close and the short name")
        void fallbacks() throws Exception {
            var json = objectMapper.readTree(
                    "{\"chart\":{\"result\":[{\"meta\":{\"regularMarketPrice\":10.0,"
                            + "\"chartPreviousClose\":8.0,\"shortName\":\"Example\"}}]}}");

            var quote = QuoteClient.parse("EXM", json);

            assertEquals("EXM", quote.symbol());
            assertEquals("Example", quote.name());
            assertEquals(8.0, quote.previousClose());
            assertEquals(25.0, quote.changePercent(), 1e-9);
        }

        @Test
        @DisplayName("a document without a price is rejected")
        void missingPrice() throws Exception {
            var json = objectMapper.readTree("{\"chart\":{\"result\":[{\"meta\":{\"symbol\":\"X\"}}]}}");

            var error = assertThrows(ProviderException.class, () -> QuoteClient.parse("X", json));
            assertEquals("no quote for X", error.getMessage());
        }
    }

    @Nested
    @DisplayName("quote over HTTP")
    class Quote {

        private HttpServer server;
        private final AtomicReference<String> lastPath = new AtomicReference<>();
        private final AtomicReference<String> lastAgent = new AtomicReference<>();
        private int status;
        private String body;

        @BeforeEach
        void setUp() throws IOException {
            server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
            server.createContext("/v8/finance/chart/", exchange -> {
                lastPath.set(exchange.getRequestURI().getRawPath() + "?" + exchange.getRequestURI().getRawQuery());
                lastAgent.set(exchange.getRequestHeaders().getFirst("User-Agent"));
                byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
                exchange.getResponseHeaders().add("Content-Type", "application/json");
                exchange.sendResponseHeaders(status, bytes.length);
                try (var out = exchange.getResponseBody()) {
                    out.write(bytes);
                }
            });
            server.start();
        }

        @AfterEach
        void tearDown() {
            server.stop(0);
        }

        private QuoteClient client() {
            var properties = new StocksProperties();
            properties.setBaseUrl("http://" + server.getAddress().getHostString() + ":" + server.getAddress().getPort());
            properties.setRequestTimeout(Duration.ofSeconds(5));
            return new QuoteClient(properties, objectMapper);
        }

        @Test
        @DisplayName("requests the symbol's daily chart with a browser-like agent")
        void success() throws Exception {
            status = 200;
            body = fixture("chart.json");

            var quote = client().quote("AAPL");

            assertEquals(231.78, quote.price());
            assertEquals("/v8/finance/chart/AAPL?interval=1d&range=1d", lastPath.get());
            assertEquals(QuoteClient.USER_AGENT, lastAgent.get());
        }

        @Test
        @DisplayName("the API's error description becomes the failure text")
        void apiError() throws Exception {
            status = 404;
            body = fixture("error.json");

            var error = assertThrows(ProviderException.class, () -> client().quote("NOPE"));
            assertEquals("NOPE: No data found, symbol may be delisted", error.getMessage());
        }

        @Test
        @DisplayName("a non-JSON error falls back to the status code")
        void plainError() {
            status = 429;
            body = "Too Many Requests";

            var error = assertThrows(ProviderException.class, () -> client().quote("AAPL"));
            assertEquals("AAPL: HTTP 429", error.getMessage());
        }
    }
}
