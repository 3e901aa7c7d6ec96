package com.barometer.agents.quakes;

import com.barometer.core.provider.ProviderException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Locates the host by its public IP, then asks the USGS event service for
 * the last day's earthquakes around that point.
 */
public class QuakesClient {

    private static final Logger log = LoggerFactory.getLogger(QuakesClient.class);

    static final Duration WINDOW = Duration.ofDays(1);

    private static final Pattern LAT_LON = Pattern.compile("\\s*-?\\d+(\\.\\d+)?\\s*,\\s*-?\\d+(\\.\\d+)?\\s*");

    private final QuakesProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final HttpClient httpClient;

    public QuakesClient(QuakesProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(properties.getRequestTimeout())
                .build();
    }

    public QuakeReport recent(QuakeQuery query) throws ProviderException {
        String location = locate();
        String[] latLon = location.split(",");
        Instant end = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        var uri = URI.create(properties.getFeedUrl()
                + "?format=geojson"
                + "&starttime=" + end.minus(WINDOW)
                + "&endtime=" + end
                + "&latitude=" + latLon[0].strip()
                + "&longitude=" + latLon[1].strip()
                + "&limit=" + query.limit()
                + "&maxradiuskm=" + String.format(Locale.ROOT, "%.3f", query.radiusKm())
                + "&minmagnitude=" + query.minMagnitude()
                + "&orderby=time");

        HttpResponse<String> response = get(uri);
        log.debug("GET event query at {} -> HTTP {}", location, response.statusCode());
        if (response.statusCode() != 200) {
            throw new ProviderException("a non-200 " + response.statusCode() + " was received");
        }
        JsonNode json = readTree(response.body());
        if (json == null || !json.has("features")) {
            throw new ProviderException("no data was received");
        }
        return parse(location, json);
    }

    /** {@code lat,lon} of the public IP. */
    String locate() throws ProviderException {
        HttpResponse<String> response = get(URI.create(properties.getGeolocationUrl()));
        JsonNode json = response.statusCode() == 200 ? readTree(response.body()) : null;
        String loc = json == null ? "" : json.path("loc").asText("");
        if (!LAT_LON.matcher(loc).matches()) {
            log.warn("Geolocation returned HTTP {} without a usable loc", response.statusCode());
            throw new ProviderException("failed to geolocate");
        }
        return loc.strip();
    }

    static QuakeReport parse(String location, JsonNode json) {
        var quakes = new ArrayList<Earthquake>();
        for (JsonNode feature : json.path("features")) {
            JsonNode properties = feature.path("properties");
            quakes.add(new Earthquake(
                    properties.path("mag").asDouble(),
                    properties.path("place").asText("unknown location"),
                    Instant.ofEpochMilli(properties.path("time").asLong())));
        }
        return new QuakeReport(location, quakes);
    }

    private HttpResponse<String> get(URI uri) throws ProviderException {
        var request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(properties.getRequestTimeout())
                .header("Accept", "application/json")
                .GET()
                .build();
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ProviderException("request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException("request interrupted", e);
        }
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
