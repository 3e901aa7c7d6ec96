package com.barometer.agents.stocks;

import com.barometer.core.provider.ProviderException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;

/**
 * Client for the Yahoo Finance {@code v8/finance/chart} endpoint; only the quote
 * metadata of the response is read.
 */
public class QuoteClient {

    private static final Logger log = LoggerFactory.getLogger(QuoteClient.class);

    // the endpoint rejects requests without a browser-like agent
    static final String USER_AGENT = "Mozilla/5.0 (X11; Linux x86_64) barometer";

    private final StocksProperties properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public QuoteClient(StocksProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(properties.getRequestTimeout())
                .build();
    }

    public StockQuote quote(String symbol) throws ProviderException {
        var uri = URI.create(properties.getBaseUrl() + "/v8/finance/chart/"
                + URLEncoder.encode(symbol, StandardCharsets.UTF_8)
                + "?interval=1d&range=1d");
        var request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(properties.getRequestTimeout())
                .header("Accept", "application/json")
                .header("User-Agent", USER_AGENT)
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ProviderException("request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException("request interrupted", e);
        }

        log.debug("GET chart/{} -> HTTP {}", symbol, response.statusCode());
        JsonNode json = readTree(response.body());
        String apiError = json != null ? json.path("chart").path("error").path("description").asText("") : "";
        if (!apiError.isBlank()) {
            throw new ProviderException(symbol + ": " + apiError);
        }
        if (response.statusCode() != 200) {
            throw new ProviderException(symbol + ": HTTP " + response.statusCode());
        }
        if (json == null) {
            throw new ProviderException(symbol + ": empty response");
        }
        return parse(symbol, json);
    }

    /**
     * Maps {@code chart.result[0].meta} onto a quote.
     *
     * @throws ProviderException if the document has no price for the symbol
     */
    static StockQuote parse(String symbol, JsonNode json) throws ProviderException {
        JsonNode meta = json.path("chart").path("result").path(0).path("meta");
        if (!meta.path("regularMarketPrice").isNumber()) {
            throw new ProviderException("no quote for " + symbol);
        }
        double price = meta.path("regularMarketPrice").asDouble();
        double previousClose = meta.has("previousClose")
                ? meta.path("previousClose").asDouble()
                : meta.path("chartPreviousClose").asDouble(price);
        String name = meta.path("longName").asText(meta.path("shortName").asText(symbol));

        return new StockQuote(
                meta.path("symbol").asText(symbol),
                name,
                meta.path("fullExchangeName").asText(meta.path("exchangeName").asText("")),
                meta.path("currency").asText("USD"),
                price,
                previousClose,
                meta.path("regularMarketDayHigh").asDouble(price),
                meta.path("regularMarketDayLow").asDouble(price),
                meta.path("fiftyTwoWeekHigh").asDouble(),
                meta.path("fiftyTwoWeekLow").asDouble(),
                meta.path("regularMarketVolume").asLong());
    }

    private JsonNode readTree(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("Response is not JSON: {}", e.getOriginalMessage());
            return null;
        }
    }
}
