package com.barometer.agents.filesystem;

/**
 * Capacity of the filesystem holding a mountpoint, in bytes.
 *
 * @param activity I/O of the backing device, or {@code null} when stats are not sampled
 */
public record FilesystemUsage(
    String mountpoint,
    String device,
    String type,
    long total,
    long used,
    long free,
    DiskActivity activity
) {
    public FilesystemUsage(String mountpoint, String device, String type, long total, long used, long free) {
        this(mountpoint, device, type, total, used, free, null);
    }

    public FilesystemUsage withActivity(DiskActivity activity) {
        return new FilesystemUsage(mountpoint, device, type, total, used, free, activity);
    }

    /** A filesystem reporting no capacity has nothing to run out of. */
    public int pctFree() {
        return total == 0 ? 100 : (int) Math.round(free * 100.0 / total);
    }

    public int pctUsed() {
        return total == 0 ? 0 : (int) Math.round(used * 100.0 / total);
    }
}
