package com.barometer.core.format;

/**
 * Nerd Font glyphs used in status text.
 */
public final class Glyphs {

    private Glyphs() {}

    /** Separator between an icon and the text that follows it. */
    public static final String SPACER = "  ";

    public static final String ALERT = "󰀦";
    public static final String TIMER = "󰔛";
    public static final String HARDDISK = "󰋊";
    public static final String MEMORY = "󰍛";
    public static final String CPU = "󰻠";
    public static final String NETWORK = "󰛳";
    public static final String NETWORK_OFF = "󰲛";
    public static final String ARROW_DOWN = "";
    public static final String ARROW_UP = "";
    public static final String PACKAGE = "󰏖";
    public static final String GRAPH_LINE = "";
    public static final String SPEEDOMETER_SLOW = "󰾆";
    public static final String SPEEDOMETER_MEDIUM = "󰾅";
    public static final String SPEEDOMETER_FAST = "󰓅";

    public static final String WEATHER_SUNNY = "";
    public static final String WEATHER_NIGHT = "󰖔";
    public static final String WEATHER_PARTLY_CLOUDY = "󰖕";
    public static final String WEATHER_CLOUDY = "󰖐";
    public static final String WEATHER_FOG = "󰖑";
    public static final String WEATHER_RAINY = "󰖗";
    public static final String WEATHER_SNOWY = "󰖘";
    public static final String WEATHER_LIGHTNING = "󰖓";

    /** Icon, spacer, then text. */
    public static String prefix(String icon, String text) {
        return icon + SPACER + text;
    }
}
