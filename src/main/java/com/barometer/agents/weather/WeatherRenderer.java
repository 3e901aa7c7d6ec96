package com.barometer.agents.weather;

import com.barometer.core.format.Glyphs;
import com.barometer.core.format.Tooltip;
import com.barometer.core.model.Result;
import com.barometer.core.model.StatusClass;
import com.barometer.core.model.StatusRecord;
import com.barometer.core.provider.Renderer;

import java.time.ZoneId;
import java.util.Locale;

/**
 * {@code <icon>  <location> <temperature>}; the toggle signal cycles through locations.
 */
public class WeatherRenderer implements Renderer<WeatherReport> {

    private final boolean useCelsius;
    private final ZoneId zone;

    public WeatherRenderer(boolean useCelsius, ZoneId zone) {
        this.useCelsius = useCelsius;
        this.zone = zone;
    }

    @Override
    public StatusRecord render(Result<WeatherReport> result, int mode) {
        if (result instanceof Result.Failure<WeatherReport> failure) {
            return Renderer.failure(failure);
        }
        var success = (Result.Success<WeatherReport>) result;
        WeatherReport report = success.payload();

        String icon = WeatherIcons.forCondition(report.conditionCode(), report.day());
        String text = report.name() + " " + report.temperature().format(useCelsius);
        String wind = useCelsius
                ? String.format(Locale.ROOT, "%.0f km/h %s", report.windKph(), report.windDirection())
                : String.format(Locale.ROOT, "%.0f mph %s", report.windMph(), report.windDirection());

        String tooltip = Tooltip.builder()
                .row("Location", location(report))
                .row("Condition", report.condition())
                .row("Feels Like", report.feelsLike().format(useCelsius))
                .row("High / Low", report.high().format(useCelsius) + " / " + report.low().format(useCelsius))
                .row("Wind", wind)
                .row("Cloud Cover", report.cloud() + "%")
                .row("Humidity", report.humidity() + "%")
                .row("Dew Point", report.dewPoint().format(useCelsius))
                .row("UV Index", String.format(Locale.ROOT, "%.0f of 11", report.uv()))
                .row("Sunrise", report.sunrise())
                .row("Sunset", report.sunset())
                .row("Moon Phase", report.moonPhase())
                .build(success.updatedAt(), zone);
        return new StatusRecord(Glyphs.prefix(icon, text), StatusClass.SUCCESS, tooltip);
    }

    private static String location(WeatherReport report) {
        var builder = new StringBuilder(report.name());
        if (!report.region().isBlank()) {
            builder.append(", ").append(report.region());
        }
        if (!report.country().isBlank()) {
            builder.append(", ").append(report.country());
        }
        return builder.toString();
    }
}
