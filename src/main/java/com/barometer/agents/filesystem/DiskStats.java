package com.barometer.agents.filesystem;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Cumulative I/O counters of one block device, from a {@code /proc/diskstats} line:
 * {@code major minor name reads merged sectors read_ms writes merged sectors write_ms ...}.
 */
public record DiskStats(
    String device,
    long readsCompleted,
    long readTimeMs,
    long writesCompleted,
    long writeTimeMs
) {
    private static final Pattern DIGITS = Pattern.compile("\\d{1,18}");

    /**
     * Parses every well-formed line, keyed by kernel device name. Short or
     * non-numeric lines are skipped.
     */
    public static Map<String, DiskStats> parse(List<String> lines) {
        var stats = new HashMap<String, DiskStats>();
        for (String line : lines) {
            String[] fields = line.trim().split("\\s+");
            if (fields.length < 11 || !numeric(fields[3], fields[6], fields[7], fields[10])) {
                continue;
            }
            stats.put(fields[2], new DiskStats(
                    fields[2],
                    Long.parseLong(fields[3]),
                    Long.parseLong(fields[6]),
                    Long.parseLong(fields[7]),
                    Long.parseLong(fields[10])));
        }
        return stats;
    }

    private static boolean numeric(String... values) {
        for (String value : values) {
            if (!DIGITS.matcher(value).matches()) {
                return false;
            }
        }
        return true;
    }
}
