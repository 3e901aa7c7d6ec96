package com.barometer.agents.quakes;

import com.barometer.core.format.Glyphs;
import com.barometer.core.format.Tooltip;
import com.barometer.core.model.Result;
import com.barometer.core.model.StatusClass;
import com.barometer.core.model.StatusRecord;
import com.barometer.core.model.Target;
import com.barometer.core.provider.Renderer;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * {@code Earthquakes: <count>}, one tooltip line per event.
 */
public class QuakesRenderer implements Renderer<QuakeReport> {

    private static final DateTimeFormatter EVENT_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm", Locale.ROOT);

    private final ZoneId zone;

    public QuakesRenderer(ZoneId zone) {
        this.zone = zone;
    }

    @Override
    public StatusRecord render(Result<QuakeReport> result, int mode) {
        if (result instanceof Result.Failure<QuakeReport> failure) {
            return Renderer.failure(failure);
        }
        var success = (Result.Success<QuakeReport>) result;
        QuakeReport report = success.payload();

        var tooltip = Tooltip.builder();
        if (report.quakes().isEmpty()) {
            tooltip.line("No earthquakes in the last 24 hours");
        }
        List<String> headers = report.quakes().stream().map(this::header).toList();
        int width = headers.stream().mapToInt(String::length).max().orElse(0);
        for (int i = 0; i < headers.size(); i++) {
            tooltip.line(String.format("%-" + width + "s %s", headers.get(i), report.quakes().get(i).place()));
        }
        return new StatusRecord("Earthquakes: " + report.count(), StatusClass.SUCCESS,
                tooltip.build(success.updatedAt(), zone));
    }

    @Override
    public StatusRecord fetching(Target target) {
        String text = "Checking USGS...";
        return new StatusRecord(Glyphs.prefix(Glyphs.TIMER, text), StatusClass.LOADING, text);
    }

    private String header(Earthquake quake) {
        return EVENT_TIME.format(quake.time().atZone(zone))
                + " - mag " + String.format(Locale.ROOT, "%.1f", quake.magnitude());
    }
}
