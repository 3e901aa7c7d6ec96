package com.barometer.agents.quakes;

import com.barometer.core.format.Glyphs;
import com.barometer.core.model.Result;
import com.barometer.core.model.StatusClass;
import com.barometer.core.model.StatusRecord;
import com.barometer.core.model.Target;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QuakesRendererTest {

    private static final Instant UPDATED = Instant.parse("2026-10-20T10:00:00Z");

    private final QuakesRenderer renderer = new QuakesRenderer(ZoneOffset.UTC);

    private StatusRecord render(Earthquake... quakes) {
        return renderer.render(new Result.Success<>(new QuakeReport("32.7157,-117.1647", List.of(quakes)), UPDATED), 0);
    }

    @Test
    @DisplayName("counts events and lists each with time and magnitude")
    void events() {
        var record = render(
                new Earthquake(2.31, "12 km SE of Ocotillo Wells, CA", Instant.parse("2026-10-20T09:05:00Z")),
                new Earthquake(1.1, "5 km N of Borrego Springs, CA", Instant.parse("2026-10-19T23:00:00Z")));

        assertEquals("Earthquakes: 2", record.text());
        assertEquals(StatusClass.SUCCESS, record.status());
        assertEquals(String.join("\n",
                "2026-10-20 09:05 - mag 2.3 12 km SE of Ocotillo Wells, CA",
                "2026-10-19 23:00 - mag 1.1 5 km N of Borrego Springs, CA",
                "",
                "Last updated 2026-10-20 10:00:00"), record.tooltip());
    }

    @Test
    @DisplayName("places line up when magnitudes differ in width")
    void alignsPlaces() {
        var record = render(
                new Earthquake(10.0, "far away", Instant.parse("2026-10-20T09:05:00Z")),
                new Earthquake(3.0, "nearby", Instant.parse("2026-10-20T08:00:00Z")));

        assertTrue(record.tooltip().startsWith(
                "2026-10-20 09:05 - mag 10.0 far away\n"
                        + "2026-10-20 08:00 - mag 3.0  nearby\n"));
    }

    @Test
    @DisplayName("a quiet day still renders")
    void quietDay() {
        var record = render();

        assertEquals("Earthquakes: 0", record.text());
        assertEquals("No earthquakes in the last 24 hours\n\nLast updated 2026-10-20 10:00:00", record.tooltip());
    }

    @Test
    @DisplayName("a failure shows the alert and the message")
    void failure() {
        var record = renderer.render(new Result.Failure<>("failed to geolocate"), 0);

        assertEquals(Glyphs.prefix(Glyphs.ALERT, "failed to geolocate"), record.text());
        assertEquals(StatusClass.ERROR, record.status());
    }

    @Test
    @DisplayName("the first fetch names the feed")
    void fetching() {
        assertEquals(Glyphs.prefix(Glyphs.TIMER, "Checking USGS..."), renderer.fetching(new Target("quakes")).text());
    }
}
