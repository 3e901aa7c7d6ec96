package com.barometer.core.format;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Human-readable byte counts and transfer rates.
 */
public final class ByteFormat {

    private ByteFormat() {}

    /** Units accepted by {@code --unit}; {@code auto} picks the largest binary unit below 1024. */
    public static final List<String> UNITS = List.of(
            "K", "Ki", "M", "Mi", "G", "Gi", "T", "Ti", "P", "Pi", "E", "Ei", "Z", "Zi", "auto");

    private static final List<String> BINARY_PREFIXES = List.of("", "Ki", "Mi", "Gi", "Ti", "Pi", "Ei", "Zi");

    private static final List<String> BIT_PREFIXES = List.of("", "K", "M", "G", "T", "P");

    private static final Map<String, Integer> POWERS = Map.ofEntries(
            Map.entry("K", 1), Map.entry("Ki", 1),
            Map.entry("M", 2), Map.entry("Mi", 2),
            Map.entry("G", 3), Map.entry("Gi", 3),
            Map.entry("T", 4), Map.entry("Ti", 4),
            Map.entry("P", 5), Map.entry("Pi", 5),
            Map.entry("E", 6), Map.entry("Ei", 6),
            Map.entry("Z", 7), Map.entry("Zi", 7));

    public static boolean isValidUnit(String unit) {
        return unit == null || UNITS.contains(unit);
    }

    /**
     * Formats a byte count in the given unit. Units ending in {@code i} are powers of 1024,
     * the others powers of 1000.
     *
     * @param bytes the raw byte count
     * @param unit  one of {@link #UNITS}; null means {@code auto}
     */
    public static String bytes(double bytes, String unit) {
        if (unit == null || "auto".equals(unit)) {
            return scaled(bytes, "B");
        }
        Integer power = POWERS.get(unit);
        if (power == null) {
            return pad(bytes) + " B";
        }
        double divisor = Math.pow(unit.endsWith("i") ? 1024 : 1000, power);
        return pad(bytes / divisor) + " " + unit + "B";
    }

    /** Formats a per-second byte rate, e.g. {@code 1.50 MiB/s}. */
    public static String rate(double bytesPerSecond) {
        return scaled(bytesPerSecond, "B") + "/s";
    }

    /** Formats a bit rate with 1024-based prefixes, e.g. {@code 93.41 Mbit/s}. */
    public static String bitRate(double bitsPerSecond) {
        double number = bitsPerSecond;
        for (String prefix : BIT_PREFIXES) {
            if (Math.abs(number) < 1024.0) {
                return pad(number) + " " + prefix + "bit/s";
            }
            number /= 1024;
        }
        return pad(number) + " Ebit/s";
    }

    public static String pad(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    private static String scaled(double value, String suffix) {
        double number = value;
        for (String prefix : BINARY_PREFIXES) {
            if (Math.abs(number) < 1024.0) {
                return pad(number) + " " + prefix + suffix;
            }
            number /= 1024;
        }
        return pad(number) + " Yi" + suffix;
    }
}
