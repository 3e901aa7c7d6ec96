package com.barometer.agents.filesystem;

import com.barometer.core.model.Target;
import com.barometer.core.provider.PerTargetProvider;
import com.barometer.core.provider.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Reads capacity figures from the {@link FileStore} backing each mountpoint.
 * With a diskstats file configured, also samples the backing device's I/O
 * counters twice and attaches the per-second activity.
 */
public class FilesystemProvider extends PerTargetProvider<FilesystemUsage> {

    private static final Logger log = LoggerFactory.getLogger(FilesystemProvider.class);

    static final Path DISKSTATS = Path.of("/proc/diskstats");

    private final StoreLookup lookup;
    private final StatsSource diskstats;
    private final Duration sampleInterval;

    public FilesystemProvider() {
        this(Files::getFileStore, null, Duration.ZERO);
    }

    /** Samples {@code /proc/diskstats} one second apart for every mountpoint. */
    public static FilesystemProvider withStats() {
        return new FilesystemProvider(Files::getFileStore, () -> Files.readAllLines(DISKSTATS), Duration.ofSeconds(1));
    }

    FilesystemProvider(StoreLookup lookup) {
        this(lookup, null, Duration.ZERO);
    }

    FilesystemProvider(StoreLookup lookup, StatsSource diskstats, Duration sampleInterval) {
        this.lookup = lookup;
        this.diskstats = diskstats;
        this.sampleInterval = sampleInterval;
    }

    public boolean samplesDiskStats() {
        return diskstats != null;
    }

    @Override
    protected FilesystemUsage measure(Target target) throws ProviderException {
        Path path = Path.of(target.name());
        FileStore store;
        long total;
        long unallocated;
        long usable;
        try {
            store = lookup.find(path);
            total = store.getTotalSpace();
            unallocated = store.getUnallocatedSpace();
            usable = store.getUsableSpace();
        } catch (NoSuchFileException e) {
            throw new ProviderException(target.name() + " does not exist", e);
        } catch (IOException e) {
            throw new ProviderException(target.name() + " could not be read: " + e.getMessage(), e);
        }
        if (total <= 0) {
            throw new ProviderException(target.name() + " reports no capacity");
        }
        long used = total - unallocated;
        log.debug("{}: total={} used={} usable={}", target, total, used, usable);
        var usage = new FilesystemUsage(target.name(), store.name(), store.type(), total, used, usable);
        return diskstats == null ? usage : usage.withActivity(activity(store.name()));
    }

    /**
     * Activity of the device between two samples, or {@code null} when the device
     * has no diskstats entry or the file cannot be read; capacity is still reported.
     */
    private DiskActivity activity(String device) throws ProviderException {
        String kernelName = kernelName(device);
        try {
            DiskStats first = DiskStats.parse(diskstats.read()).get(kernelName);
            long started = System.nanoTime();
            Thread.sleep(sampleInterval.toMillis());
            DiskStats second = DiskStats.parse(diskstats.read()).get(kernelName);
            if (first == null || second == null) {
                log.debug("{} has no diskstats entry", kernelName);
                return null;
            }
            return DiskActivity.between(first, second, (System.nanoTime() - started) / 1e9);
        } catch (IOException e) {
            log.warn("Failed to read disk stats for {}: {}", kernelName, e.getMessage());
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException("interrupted while sampling " + kernelName, e);
        }
    }

    /** {@code /dev/mapper/root} resolves to {@code dm-0}; anything else keeps its last path element. */
    static String kernelName(String device) {
        Path path = Path.of(device);
        try {
            return path.toRealPath().getFileName().toString();
        } catch (IOException e) {
            Path name = path.getFileName();
            return name == null ? device : name.toString();
        }
    }

    @FunctionalInterface
    interface StoreLookup {
        FileStore find(Path path) throws IOException;
    }

    /** Current lines of {@code /proc/diskstats}. */
    @FunctionalInterface
    interface StatsSource {
        List<String> read() throws IOException;
    }
}
