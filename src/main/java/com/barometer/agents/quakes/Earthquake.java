package com.barometer.agents.quakes;

import java.time.Instant;

/**
 * One USGS event.
 *
 * @param place e.g. {@code 5 km NW of The Geysers, CA}
 */
public record Earthquake(double magnitude, String place, Instant time) {}
