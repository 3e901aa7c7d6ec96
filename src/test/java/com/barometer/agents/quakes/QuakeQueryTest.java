package com.barometer.agents.quakes;

import com.barometer.core.agent.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QuakeQueryTest {

    @Test
    @DisplayName("miles are converted to kilometres")
    void miles() {
        assertEquals(160.9344, QuakeQuery.of("100m", 20, 0.1).radiusKm(), 1e-9);
    }

    @Test
    @DisplayName("kilometres are taken as given, in any case")
    void kilometres() {
        assertEquals(80.0, QuakeQuery.of("80km", 20, 0.1).radiusKm());
        assertEquals(80.0, QuakeQuery.of(" 80KM ", 20, 0.1).radiusKm());
    }

    @Test
    @DisplayName("a radius without a unit or with a fraction is rejected")
    void invalidRadius() {
        for (String radius : List.of("", "100", "100 miles", "-5km", "1.5km")) {
            var error = assertThrows(ConfigurationException.class, () -> QuakeQuery.of(radius, 20, 0.1));
            assertEquals("quakes: invalid radius '" + radius + "', expected e.g. 50m or 80km", error.getMessage());
        }
    }

    @Test
    @DisplayName("limit and magnitude are bounded")
    void bounds() {
        assertThrows(ConfigurationException.class, () -> QuakeQuery.of("100m", 0, 0.1));
        assertThrows(ConfigurationException.class, () -> QuakeQuery.of("100m", 20, -1));
    }
}
