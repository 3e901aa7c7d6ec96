package com.barometer.agents.weather;

/**
 * Current conditions and today's forecast for one location. Temperatures are
 * kept in both scales so the renderer can pick one.
 *
 * @param query the location as configured
 * @param name  the location name resolved by the API
 */
public record WeatherReport(
    String query,
    String name,
    String region,
    String country,
    String condition,
    int conditionCode,
    boolean day,
    Temperature temperature,
    Temperature feelsLike,
    Temperature high,
    Temperature low,
    Temperature dewPoint,
    double windKph,
    double windMph,
    String windDirection,
    int humidity,
    int cloud,
    double uv,
    String sunrise,
    String sunset,
    String moonPhase
) {
    public record Temperature(double celsius, double fahrenheit) {

        public String format(boolean useCelsius) {
            return Math.round(useCelsius ? celsius : fahrenheit) + "°" + (useCelsius ? "C" : "F");
        }
    }
}
