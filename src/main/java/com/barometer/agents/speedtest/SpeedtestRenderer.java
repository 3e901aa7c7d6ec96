package com.barometer.agents.speedtest;

import com.barometer.core.format.ByteFormat;
import com.barometer.core.format.Glyphs;
import com.barometer.core.format.Tooltip;
import com.barometer.core.model.Result;
import com.barometer.core.model.StatusClass;
import com.barometer.core.model.StatusRecord;
import com.barometer.core.model.Target;
import com.barometer.core.provider.Renderer;

import java.time.ZoneId;

/**
 * {@code Speedtest <down> <up>} behind a speedometer matching the average speed.
 */
public class SpeedtestRenderer implements Renderer<SpeedtestResult> {

    static final double MEDIUM_THRESHOLD = 100_000_000;
    static final double FAST_THRESHOLD = 500_000_000;

    private final ZoneId zone;

    public SpeedtestRenderer(ZoneId zone) {
        this.zone = zone;
    }

    @Override
    public StatusRecord render(Result<SpeedtestResult> result, int mode) {
        if (result instanceof Result.Failure<SpeedtestResult> failure) {
            return Renderer.failure(failure);
        }
        var success = (Result.Success<SpeedtestResult>) result;
        SpeedtestResult run = success.payload();

        String text = "Speedtest "
                + Glyphs.ARROW_DOWN + ByteFormat.bitRate(run.download()) + " "
                + Glyphs.ARROW_UP + ByteFormat.bitRate(run.upload());
        SpeedtestResult.Server server = run.server();
        SpeedtestResult.Client client = run.client();
        String tooltip = Tooltip.builder()
                .row("Bytes sent", ByteFormat.bytes(run.bytesSent(), "auto"))
                .row("Bytes received", ByteFormat.bytes(run.bytesReceived(), "auto"))
                .row("Upload speed", ByteFormat.bitRate(run.upload()))
                .row("Download speed", ByteFormat.bitRate(run.download()))
                .row("Ping", ByteFormat.pad(run.ping()) + " ms")
                .heading("Server")
                .row("Location", join(server.name(), server.country()))
                .row("Hostname", server.hostname())
                .row("Sponsor", server.sponsor())
                .row("Latency", ByteFormat.pad(server.latency()) + " ms")
                .heading("Client")
                .row("IP", client.ip())
                .row("Location", client.country())
                .row("ISP", client.isp())
                .build(success.updatedAt(), zone);
        return new StatusRecord(Glyphs.prefix(icon(run.averageSpeed()), text), StatusClass.SUCCESS, tooltip);
    }

    @Override
    public StatusRecord fetching(Target target) {
        String text = "Running speedtest...";
        return new StatusRecord(Glyphs.prefix(Glyphs.TIMER, text), StatusClass.LOADING, text);
    }

    static String icon(double bitsPerSecond) {
        if (bitsPerSecond < MEDIUM_THRESHOLD) {
            return Glyphs.SPEEDOMETER_SLOW;
        }
        if (bitsPerSecond < FAST_THRESHOLD) {
            return Glyphs.SPEEDOMETER_MEDIUM;
        }
        return Glyphs.SPEEDOMETER_FAST;
    }

    private static String join(String first, String second) {
        if (first.isBlank()) {
            return second;
        }
        return second.isBlank() ? first : first + ", " + second;
    }
}
