package com.barometer.agents.weather;

import com.barometer.core.format.Glyphs;

import java.util.Set;

/**
 * Maps weatherapi.com condition codes to glyphs.
 * See https://www.weatherapi.com/docs/weather_conditions.json
 */
final class WeatherIcons {

    private static final Set<Integer> FOG = Set.of(1030, 1135, 1147);
    private static final Set<Integer> THUNDER = Set.of(1087, 1273, 1276, 1279, 1282);
    private static final Set<Integer> SNOW = Set.of(
            1066, 1069, 1114, 1117, 1204, 1207, 1210, 1213, 1216, 1219, 1222, 1225,
            1237, 1249, 1252, 1255, 1258, 1261, 1264);

    private WeatherIcons() {}

    static String forCondition(int code, boolean day) {
        if (code == 1000) {
            return day ? Glyphs.WEATHER_SUNNY : Glyphs.WEATHER_NIGHT;
        }
        if (code == 1003) {
            return Glyphs.WEATHER_PARTLY_CLOUDY;
        }
        if (code == 1006 || code == 1009) {
            return Glyphs.WEATHER_CLOUDY;
        }
        if (FOG.contains(code)) {
            return Glyphs.WEATHER_FOG;
        }
        if (THUNDER.contains(code)) {
            return Glyphs.WEATHER_LIGHTNING;
        }
        if (SNOW.contains(code)) {
            return Glyphs.WEATHER_SNOWY;
        }
        if (code >= 1063) {
            return Glyphs.WEATHER_RAINY;
        }
        return day ? Glyphs.WEATHER_SUNNY : Glyphs.WEATHER_NIGHT;
    }
}
