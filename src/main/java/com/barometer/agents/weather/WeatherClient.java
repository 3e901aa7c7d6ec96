package com.barometer.agents.weather;

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
 * Client for the weatherapi.com {@code forecast.json} endpoint.
 */
public class WeatherClient {

    private static final Logger log = LoggerFactory.getLogger(WeatherClient.class);

    private final WeatherProperties properties;
    private final String apiKey;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public WeatherClient(WeatherProperties properties, String apiKey, ObjectMapper objectMapper) {
        this.properties = properties;
        this.apiKey = apiKey;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(properties.getRequestTimeout())
                .build();
    }

    public WeatherReport forecast(String location) throws ProviderException {
        var uri = URI.create(properties.getBaseUrl() + "/forecast.json"
                + "?key=" + encode(apiKey)
                + "&q=" + encode(location)
                + "&days=1&aqi=no&alerts=no");
        var request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(properties.getRequestTimeout())
                .header("Accept", "application/json")
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

        log.debug("GET forecast.json q={} -> HTTP {}", location, response.statusCode());
        JsonNode json = readTree(response.body());
        if (response.statusCode() != 200) {
            String message = json != null ? json.path("error").path("message").asText("") : "";
            throw new ProviderException(message.isBlank()
                    ? "HTTP " + response.statusCode()
                    : message);
        }
        if (json == null) {
            throw new ProviderException("empty response");
        }
        return parse(location, json);
    }

    /**
     * Maps a {@code forecast.json} document onto a report.
     *
     * @throws ProviderException if the document has no current conditions
     */
    static WeatherReport parse(String query, JsonNode json) throws ProviderException {
        JsonNode current = json.path("current");
        if (current.isMissingNode()) {
            throw new ProviderException("response has no current conditions");
        }
        JsonNode location = json.path("location");
        JsonNode today = json.path("forecast").path("forecastday").path(0);
        JsonNode day = today.path("day");
        JsonNode astro = today.path("astro");

        return new WeatherReport(
                query,
                location.path("name").asText(query),
                location.path("region").asText(""),
                location.path("country").asText(""),
                current.path("condition").path("text").asText(""),
                current.path("condition").path("code").asInt(0),
                current.path("is_day").asInt(1) == 1,
                temperature(current, "temp"),
                temperature(current, "feelslike"),
                temperature(day, "maxtemp"),
                temperature(day, "mintemp"),
                temperature(current, "dewpoint"),
                current.path("wind_kph").asDouble(),
                current.path("wind_mph").asDouble(),
                current.path("wind_dir").asText(""),
                current.path("humidity").asInt(),
                current.path("cloud").asInt(),
                current.path("uv").asDouble(),
                astro.path("sunrise").asText(""),
                astro.path("sunset").asText(""),
                astro.path("moon_phase").asText(""));
    }

    private static WeatherReport.Temperature temperature(JsonNode node, String prefix) {
        return new WeatherReport.Temperature(
                node.path(prefix + "_c").asDouble(),
                node.path(prefix + "_f").asDouble());
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

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
