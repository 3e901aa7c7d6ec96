package com.barometer.agents.filesystem;

import com.barometer.core.format.ByteFormat;
import com.barometer.core.format.Glyphs;
import com.barometer.core.format.Tooltip;
import com.barometer.core.model.Result;
import com.barometer.core.model.StatusClass;
import com.barometer.core.model.StatusRecord;
import com.barometer.core.provider.Renderer;

import java.time.ZoneId;

/**
 * {@code <mountpoint> <used> / <total>}, classed by the share still free.
 */
public class FilesystemRenderer implements Renderer<FilesystemUsage> {

    private final String unit;
    private final ZoneId zone;

    public FilesystemRenderer(String unit, ZoneId zone) {
        this.unit = unit;
        this.zone = zone;
    }

    @Override
    public StatusRecord render(Result<FilesystemUsage> result, int mode) {
        if (result instanceof Result.Failure<FilesystemUsage> failure) {
            return Renderer.failure(failure);
        }
        var success = (Result.Success<FilesystemUsage>) result;
        FilesystemUsage usage = success.payload();

        String text = usage.mountpoint() + " "
                + ByteFormat.bytes(usage.used(), unit) + " / " + ByteFormat.bytes(usage.total(), unit);
        var tooltip = Tooltip.builder()
                .row("Mountpoint", usage.mountpoint())
                .row("Device", usage.device())
                .row("Type", usage.type())
                .row("Used", ByteFormat.bytes(usage.used(), unit) + " (" + usage.pctUsed() + "%)")
                .row("Free", ByteFormat.bytes(usage.free(), unit) + " (" + usage.pctFree() + "%)")
                .row("Total", ByteFormat.bytes(usage.total(), unit));
        DiskActivity activity = usage.activity();
        if (activity != null) {
            tooltip.row("Reads/sec", activity.readsPerSecond())
                    .row("Writes/sec", activity.writesPerSecond())
                    .row("Read time/sec", activity.readTimePerSecond() + " ms")
                    .row("Write time/sec", activity.writeTimePerSecond() + " ms");
        }
        return new StatusRecord(Glyphs.prefix(Glyphs.HARDDISK, text),
                StatusClass.forFreePercent(usage.pctFree()), tooltip.build(success.updatedAt(), zone));
    }
}
