package com.barometer.agents.speedtest;

import com.barometer.core.format.Glyphs;
import com.barometer.core.model.Result;
import com.barometer.core.model.StatusClass;
import com.barometer.core.model.Target;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class SpeedtestRendererTest {

    private static final double MBIT = 1024 * 1024;

    private final SpeedtestRenderer renderer = new SpeedtestRenderer(ZoneOffset.UTC);

    private static Result<SpeedtestResult> run(double download, double upload) {
        var result = new SpeedtestResult(download, upload, 11.482, 51_904_512L, 367_431_680L,
                new SpeedtestResult.Server("San Diego, CA", "United States", "Example Fiber",
                        "speedtest.example.net:8080", 11.482),
                new SpeedtestResult.Client("203.0.113.24", "Example Cable", "US"));
        return new Result.Success<>(result, Instant.parse("2026-10-19T09:15:02Z"));
    }

    @Test
    @DisplayName("renders both directions behind a speedometer")
    void text() {
        var record = renderer.render(run(250 * MBIT, 40 * MBIT), 0);

        assertEquals(Glyphs.prefix(Glyphs.SPEEDOMETER_MEDIUM,
                "Speedtest " + Glyphs.ARROW_DOWN + "250.00 Mbit/s " + Glyphs.ARROW_UP + "40.00 Mbit/s"), record.text());
        assertEquals(StatusClass.SUCCESS, record.status());
    }

    @Test
    @DisplayName("the speedometer follows the average speed")
    void icons() {
        assertEquals(Glyphs.SPEEDOMETER_SLOW, SpeedtestRenderer.icon(99_999_999));
        assertEquals(Glyphs.SPEEDOMETER_MEDIUM, SpeedtestRenderer.icon(100_000_000));
        assertEquals(Glyphs.SPEEDOMETER_FAST, SpeedtestRenderer.icon(500_000_000));
    }

    @Test
    @DisplayName("the tooltip lists transfer figures, then server and client")
    void tooltip() {
        String tooltip = renderer.render(run(250 * MBIT, 40 * MBIT), 0).tooltip();

        assertEquals(String.join("\n",
                "Bytes sent     : 49.50 MiB",
                "Bytes received : 350.41 MiB",
                "Upload speed   : 40.00 Mbit/s",
                "Download speed : 250.00 Mbit/s",
                "Ping           : 11.48 ms",
                "",
                "Server",
                "  Location : San Diego, CA, United States",
                "  Hostname : speedtest.example.net",
                "  Sponsor  : Example Fiber",
                "  Latency  : 11.48 ms",
                "",
                "Client",
                "  IP       : 203.0.113.24",
                "  Location : US",
                "  ISP      : Example Cable",
                "",
                "Last updated 2026-10-19 09:15:02"), tooltip);
    }

    @Test
    @DisplayName("the first fetch says the test is running")
    void fetching() {
        assertEquals(Glyphs.prefix(Glyphs.TIMER, "Running speedtest..."),
                renderer.fetching(new Target("speedtest")).text());
    }
}
