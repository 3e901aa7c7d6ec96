package com.barometer.agents.quakes;

import com.barometer.core.agent.ConfigurationException;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Search parameters for the USGS feed around the host's location.
 *
 * @param radiusKm     search radius in kilometres
 * @param limit        maximum number of events
 * @param minMagnitude smallest magnitude reported
 */
public record QuakeQuery(double radiusKm, int limit, double minMagnitude) {

    static final double KM_PER_MILE = 1.609344;

    private static final Pattern RADIUS = Pattern.compile("(\\d+)(m|km)");

    public QuakeQuery {
        if (limit < 1) {
            throw new ConfigurationException("quakes: limit must be at least 1");
        }
        if (minMagnitude < 0) {
            throw new ConfigurationException("quakes: magnitude must not be negative");
        }
    }

    /**
     * @param radius {@code 50m} for miles or {@code 80km} for kilometres
     */
    public static QuakeQuery of(String radius, int limit, double minMagnitude) {
        Matcher matcher = RADIUS.matcher(radius == null ? "" : radius.strip().toLowerCase(Locale.ROOT));
        if (!matcher.matches()) {
            throw new ConfigurationException("quakes: invalid radius '" + radius + "', expected e.g. 50m or 80km");
        }
        double value = Double.parseDouble(matcher.group(1));
        double km = "km".equals(matcher.group(2)) ? value : value * KM_PER_MILE;
        return new QuakeQuery(km, limit, minMagnitude);
    }
}
