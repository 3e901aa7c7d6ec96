package com.barometer.agents.quakes;

import java.util.List;

/**
 * Events of the last day near {@code location}, newest first.
 *
 * @param location {@code lat,lon} the search was centred on
 */
public record QuakeReport(String location, List<Earthquake> quakes) {

    public QuakeReport {
        quakes = List.copyOf(quakes);
    }

    public int count() {
        return quakes.size();
    }
}
