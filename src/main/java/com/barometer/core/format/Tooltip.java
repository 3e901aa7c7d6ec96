package com.barometer.core.format;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds multi-line tooltips with the keys padded to a common width:
 * <pre>
 * Mountpoint : /home
 * Type       : ext4
 *
 * Last updated 2026-10-19 09:15:02
 * </pre>
 */
public final class Tooltip {

    private static final DateTimeFormatter UPDATED_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ROOT);

    private final List<String> lines = new ArrayList<>();
    private Map<String, String> section = new LinkedHashMap<>();
    private String indent = "";

    public static Tooltip builder() {
        return new Tooltip();
    }

    /** Starts a titled section whose rows are indented by two spaces. */
    public Tooltip heading(String title) {
        flush();
        if (!lines.isEmpty()) {
            lines.add("");
        }
        lines.add(title);
        indent = "  ";
        return this;
    }

    /** Adds a row; null or blank values are skipped. */
    public Tooltip row(String key, Object value) {
        if (value == null) {
            return this;
        }
        String text = value.toString();
        if (!text.isBlank()) {
            section.put(key, text);
        }
        return this;
    }

    public Tooltip line(String text) {
        flush();
        lines.add(text);
        return this;
    }

    /** Renders the rows followed by a blank line and the time of the last update. */
    public String build(Instant updatedAt, ZoneId zone) {
        flush();
        if (!lines.isEmpty() && updatedAt != null) {
            lines.add("");
            lines.add("Last updated " + UPDATED_FORMAT.format(updatedAt.atZone(zone)));
        }
        return String.join("\n", lines);
    }

    public String build() {
        flush();
        return String.join("\n", lines);
    }

    private void flush() {
        if (section.isEmpty()) {
            return;
        }
        int width = section.keySet().stream().mapToInt(String::length).max().orElse(0);
        for (var entry : section.entrySet()) {
            lines.add(indent + String.format("%-" + width + "s : %s", entry.getKey(), entry.getValue()));
        }
        section = new LinkedHashMap<>();
    }
}
