package com.barometer.agents.cpu;

import com.barometer.core.provider.ProviderException;

import java.util.List;

/**
 * Cumulative jiffies from the aggregate {@code cpu} line of {@code /proc/stat}.
 */
public record CpuSample(
    long user,
    long nice,
    long system,
    long idle,
    long iowait,
    long irq,
    long softirq,
    long steal,
    int cores
) {
    public long idleTotal() {
        return idle + iowait;
    }

    public long total() {
        return user + nice + system + idle + iowait + irq + softirq + steal;
    }

    /**
     * @param lines the contents of {@code /proc/stat}
     * @throws ProviderException if the aggregate line is missing or malformed
     */
    public static CpuSample parse(List<String> lines) throws ProviderException {
        String aggregate = null;
        int cores = 0;
        for (String line : lines) {
            if (line.startsWith("cpu ")) {
                aggregate = line;
            } else if (line.startsWith("cpu")) {
                cores++;
            }
        }
        if (aggregate == null) {
            throw new ProviderException("no cpu line in /proc/stat");
        }
        String[] fields = aggregate.trim().split("\\s+");
        if (fields.length < 5) {
            throw new ProviderException("malformed cpu line in /proc/stat");
        }
        try {
            return new CpuSample(
                    Long.parseLong(fields[1]),
                    Long.parseLong(fields[2]),
                    Long.parseLong(fields[3]),
                    Long.parseLong(fields[4]),
                    field(fields, 5),
                    field(fields, 6),
                    field(fields, 7),
                    field(fields, 8),
                    cores);
        } catch (NumberFormatException e) {
            throw new ProviderException("malformed cpu line in /proc/stat: " + e.getMessage(), e);
        }
    }

    private static long field(String[] fields, int index) {
        return index < fields.length ? Long.parseLong(fields[index]) : 0;
    }
}
