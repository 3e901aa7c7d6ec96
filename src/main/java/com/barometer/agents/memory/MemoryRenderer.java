package com.barometer.agents.memory;

import com.barometer.core.format.ByteFormat;
import com.barometer.core.format.Glyphs;
import com.barometer.core.format.Tooltip;
import com.barometer.core.model.Result;
import com.barometer.core.model.StatusClass;
import com.barometer.core.model.StatusRecord;
import com.barometer.core.provider.Renderer;

import java.time.ZoneId;

/**
 * Three formats, cycled by the toggle signal: used / total, percent used, free.
 */
public class MemoryRenderer implements Renderer<MemoryUsage> {

    public static final int FORMAT_COUNT = 3;

    private final String unit;
    private final ZoneId zone;

    public MemoryRenderer(String unit, ZoneId zone) {
        this.unit = unit;
        this.zone = zone;
    }

    @Override
    public StatusRecord render(Result<MemoryUsage> result, int mode) {
        if (result instanceof Result.Failure<MemoryUsage> failure) {
            return Renderer.failure(failure);
        }
        var success = (Result.Success<MemoryUsage>) result;
        MemoryUsage memory = success.payload();

        String text = switch (mode % FORMAT_COUNT) {
            case 0 -> ByteFormat.bytes(memory.used(), unit) + " / " + ByteFormat.bytes(memory.total(), unit);
            case 1 -> memory.pctUsed() + "% used";
            default -> ByteFormat.bytes(memory.available(), unit) + " free";
        };

        var tooltip = Tooltip.builder()
                .heading("Memory")
                .row("Total", ByteFormat.bytes(memory.total(), unit))
                .row("Used", ByteFormat.bytes(memory.used(), unit) + " (" + memory.pctUsed() + "%)")
                .row("Available", ByteFormat.bytes(memory.available(), unit))
                .row("Buffers", ByteFormat.bytes(memory.buffers(), unit))
                .row("Cached", ByteFormat.bytes(memory.cached(), unit));
        if (memory.swapTotal() > 0) {
            tooltip.heading("Swap")
                    .row("Total", ByteFormat.bytes(memory.swapTotal(), unit))
                    .row("Used", ByteFormat.bytes(memory.swapUsed(), unit));
        }
        return new StatusRecord(Glyphs.prefix(Glyphs.MEMORY, text),
                StatusClass.forFreePercent(memory.pctFree()),
                tooltip.build(success.updatedAt(), zone));
    }
}
