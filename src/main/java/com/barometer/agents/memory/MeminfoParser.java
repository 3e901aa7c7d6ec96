package com.barometer.agents.memory;

import com.barometer.core.provider.ProviderException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parses {@code /proc/meminfo}, whose lines look like {@code MemTotal:  16318460 kB}.
 */
public final class MeminfoParser {

    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private MeminfoParser() {}

    public static MemoryUsage parse(List<String> lines) throws ProviderException {
        Map<String, Long> values = new HashMap<>();
        for (String line : lines) {
            int colon = line.indexOf(':');
            if (colon <= 0) {
                continue;
            }
            String[] parts = line.substring(colon + 1).trim().split("\\s+");
            if (!DIGITS.matcher(parts[0]).matches()) {
                continue;
            }
            long value = Long.parseLong(parts[0]);
            if (parts.length > 1 && "kB".equals(parts[1])) {
                value *= 1024;
            }
            values.put(line.substring(0, colon).trim(), value);
        }

        Long total = values.get("MemTotal");
        if (total == null) {
            throw new ProviderException("MemTotal missing from /proc/meminfo");
        }
        long free = values.getOrDefault("MemFree", 0L);
        long buffers = values.getOrDefault("Buffers", 0L);
        long cached = values.getOrDefault("Cached", 0L) + values.getOrDefault("SReclaimable", 0L);
        // kernels before 3.14 have no MemAvailable
        long available = values.getOrDefault("MemAvailable", free + buffers + cached);
        return new MemoryUsage(total, available, free, buffers, cached,
                values.getOrDefault("SwapTotal", 0L), values.getOrDefault("SwapFree", 0L));
    }
}
