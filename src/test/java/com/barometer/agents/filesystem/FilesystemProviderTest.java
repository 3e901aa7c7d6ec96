package com.barometer.agents.filesystem;

import com.barometer.core.model.Result;
import com.barometer.core.model.Target;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.FileStore;
import java.nio.file.NoSuchFileException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class FilesystemProviderTest {

    private static final long GIB = 1024L * 1024 * 1024;

    private static FileStore store(long total, long unallocated, long usable) throws IOException {
        FileStore store = mock(FileStore.class);
        when(store.name()).thenReturn("/dev/nvme0n1p2");
        when(store.type()).thenReturn("ext4");
        when(store.getTotalSpace()).thenReturn(total);
        when(store.getUnallocatedSpace()).thenReturn(unallocated);
        when(store.getUsableSpace()).thenReturn(usable);
        return store;
    }

    @Test
    @DisplayName("used is total minus unallocated and free is the usable space")
    void measuresStore() throws IOException {
        FileStore store = store(100 * GIB, 40 * GIB, 35 * GIB);
        var provider = new FilesystemProvider(path -> store);

        var success = assertInstanceOf(Result.Success.class, provider.fetch(List.of(new Target("/home"))).get(0));
        var usage = (FilesystemUsage) success.payload();

        assertEquals("/home", usage.mountpoint());
        assertEquals("/dev/nvme0n1p2", usage.device());
        assertEquals("ext4", usage.type());
        assertEquals(60 * GIB, usage.used());
        assertEquals(35 * GIB, usage.free());
        assertEquals(60, usage.pctUsed());
        assertEquals(35, usage.pctFree());
    }

    @Test
    @DisplayName("lookup errors become per-mountpoint failures")
    void lookupErrors() {
        var provider = new FilesystemProvider(path -> {
            if (path.toString().equals("/gone")) {
                throw new NoSuchFileException("/gone");
            }
            throw new IOException("Permission denied");
        });

        var results = provider.fetch(Target.of(List.of("/gone", "/root")));

        assertEquals("/gone does not exist", ((Result.Failure<FilesystemUsage>) results.get(0)).error());
        assertEquals("/root could not be read: Permission denied",
                ((Result.Failure<FilesystemUsage>) results.get(1)).error());
    }

    @Test
    @DisplayName("a store with no capacity is a failure")
    void zeroCapacity() throws IOException {
        FileStore store = store(0, 0, 0);

        var results = new FilesystemProvider(path -> store).fetch(List.of(new Target("/proc")));

        assertEquals("/proc reports no capacity", ((Result.Failure<FilesystemUsage>) results.get(0)).error());
    }

    // -- disk activity ---

    @Test
    @DisplayName("with stats enabled the device's I/O between two samples is attached")
    void attachesDiskActivity() throws IOException {
        FileStore store = store(100 * GIB, 40 * GIB, 35 * GIB);
        var samples = new ArrayDeque<>(List.of(
                List.of("259  2 nvme0n1p2 100 0 800 40 200 0 1600 90 0 0 0",
                        "  8  0 sda 5 0 10 1 5 0 10 1 0 0 0"),
                List.of("259  2 nvme0n1p2 130 0 900 52 210 0 1700 95 0 0 0",
                        "  8  0 sda 9 0 10 1 5 0 10 1 0 0 0")));
        var provider = new FilesystemProvider(path -> store, samples::poll, Duration.ofMillis(1));

        var usage = (FilesystemUsage) assertInstanceOf(Result.Success.class,
                provider.fetch(List.of(new Target("/home"))).get(0)).payload();

        DiskActivity activity = usage.activity();
        assertNotNull(activity);
        assertTrue(activity.readsPerSecond() > 0, activity::toString);
        assertTrue(activity.writesPerSecond() > 0, activity::toString);
        assertTrue(samples.isEmpty());
    }

    @Test
    @DisplayName("unreadable stats still report capacity")
    void unreadableStats() throws IOException {
        FileStore store = store(100 * GIB, 40 * GIB, 35 * GIB);
        var provider = new FilesystemProvider(path -> store, () -> {
            throw new IOException("No such file or directory");
        }, Duration.ofMillis(1));

        var usage = (FilesystemUsage) assertInstanceOf(Result.Success.class,
                provider.fetch(List.of(new Target("/home"))).get(0)).payload();

        assertNull(usage.activity());
        assertEquals(35, usage.pctFree());
    }

    @Test
    @DisplayName("without stats no activity is sampled")
    void noStatsByDefault() throws IOException {
        FileStore store = store(100 * GIB, 40 * GIB, 35 * GIB);

        var usage = (FilesystemUsage) assertInstanceOf(Result.Success.class,
                new FilesystemProvider(path -> store).fetch(List.of(new Target("/"))).get(0)).payload();

        assertNull(usage.activity());
    }

    @Test
    @DisplayName("kernel names fall back to the last path element")
    void kernelName() {
        assertEquals("barometer-missing-disk", FilesystemProvider.kernelName("/dev/barometer-missing-disk"));
        assertEquals("tmpfs", FilesystemProvider.kernelName("tmpfs"));
    }
}
