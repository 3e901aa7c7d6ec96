package com.barometer.agents.filesystem;

import com.barometer.core.format.Glyphs;
import com.barometer.core.model.Result;
import com.barometer.core.model.StatusClass;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class FilesystemRendererTest {

    private static final long GIB = 1024L * 1024 * 1024;

    private static Result<FilesystemUsage> usage(long used, long free) {
        var usage = new FilesystemUsage("/", "/dev/sda1", "btrfs", 100 * GIB, used, free);
        return new Result.Success<>(usage, Instant.parse("2026-10-19T09:15:02Z"));
    }

    @Test
    @DisplayName("renders used over total in the chosen unit")
    void text() {
        var record = new FilesystemRenderer("Gi", ZoneOffset.UTC).render(usage(60 * GIB, 40 * GIB), 0);

        assertEquals(Glyphs.prefix(Glyphs.HARDDISK, "/ 60.00 GiB / 100.00 GiB"), record.text());
        assertEquals(StatusClass.WARNING, record.status());
    }

    @Test
    @DisplayName("the tooltip lists the device and percentages")
    void tooltip() {
        String tooltip = new FilesystemRenderer("auto", ZoneOffset.UTC).render(usage(90 * GIB, 10 * GIB), 0).tooltip();

        assertEquals(String.join("\n",
                "Mountpoint : /",
                "Device     : /dev/sda1",
                "Type       : btrfs",
                "Used       : 90.00 GiB (90%)",
                "Free       : 10.00 GiB (10%)",
                "Total      : 100.00 GiB",
                "",
                "Last updated 2026-10-19 09:15:02"), tooltip);
    }

    @Test
    @DisplayName("the class follows the free share")
    void classes() {
        var renderer = new FilesystemRenderer("auto", ZoneOffset.UTC);

        assertEquals(StatusClass.SUCCESS, renderer.render(usage(20 * GIB, 80 * GIB), 0).status());
        assertEquals(StatusClass.CRITICAL, renderer.render(usage(95 * GIB, 5 * GIB), 0).status());
    }

    @Test
    @DisplayName("a filesystem without capacity is not reported as full")
    void zeroCapacityIsNotCritical() {
        var empty = new FilesystemUsage("/run/empty", "tmpfs", "tmpfs", 0, 0, 0);

        var record = new FilesystemRenderer("auto", ZoneOffset.UTC)
                .render(new Result.Success<>(empty, Instant.parse("2026-10-19T09:15:02Z")), 0);

        assertEquals(100, empty.pctFree());
        assertEquals(StatusClass.SUCCESS, record.status());
    }

    @Test
    @DisplayName("sampled disk activity adds per-second rows to the tooltip")
    void activityRows() {
        var usage = new FilesystemUsage("/", "/dev/sda1", "btrfs", 100 * GIB, 90 * GIB, 10 * GIB)
                .withActivity(new DiskActivity(12, 3, 40, 7));

        String tooltip = new FilesystemRenderer("auto", ZoneOffset.UTC)
                .render(new Result.Success<>(usage, Instant.parse("2026-10-19T09:15:02Z")), 0).tooltip();

        assertEquals(String.join("\n",
                "Mountpoint     : /",
                "Device         : /dev/sda1",
                "Type           : btrfs",
                "Used           : 90.00 GiB (90%)",
                "Free           : 10.00 GiB (10%)",
                "Total          : 100.00 GiB",
                "Reads/sec      : 12",
                "Writes/sec     : 3",
                "Read time/sec  : 40 ms",
                "Write time/sec : 7 ms",
                "",
                "Last updated 2026-10-19 09:15:02"), tooltip);
    }
}
