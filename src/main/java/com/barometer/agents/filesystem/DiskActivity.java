package com.barometer.agents.filesystem;

/**
 * Per-second I/O of the device behind a mountpoint, between two {@link DiskStats} samples.
 *
 * @param readsPerSecond     completed reads
 * @param writesPerSecond    completed writes
 * @param readTimePerSecond  milliseconds spent reading
 * @param writeTimePerSecond milliseconds spent writing
 */
public record DiskActivity(
    long readsPerSecond,
    long writesPerSecond,
    long readTimePerSecond,
    long writeTimePerSecond
) {
    public static DiskActivity between(DiskStats first, DiskStats second, double seconds) {
        double window = Math.max(seconds, 0.001);
        return new DiskActivity(
                rate(first.readsCompleted(), second.readsCompleted(), window),
                rate(first.writesCompleted(), second.writesCompleted(), window),
                rate(first.readTimeMs(), second.readTimeMs(), window),
                rate(first.writeTimeMs(), second.writeTimeMs(), window));
    }

    private static long rate(long before, long after, double seconds) {
        return Math.round(Math.max(after - before, 0) / seconds);
    }
}
