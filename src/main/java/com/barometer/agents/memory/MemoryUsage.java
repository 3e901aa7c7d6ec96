package com.barometer.agents.memory;

/**
 * Memory figures in bytes. {@code used} excludes reclaimable cache.
 */
public record MemoryUsage(
    long total,
    long available,
    long free,
    long buffers,
    long cached,
    long swapTotal,
    long swapFree
) {
    public long used() {
        return total - available;
    }

    public long swapUsed() {
        return swapTotal - swapFree;
    }

    public int pctUsed() {
        return total == 0 ? 0 : (int) Math.round(used() * 100.0 / total);
    }

    public int pctFree() {
        return 100 - pctUsed();
    }
}
