package com.barometer.agents.cpu;

import com.barometer.core.format.Glyphs;
import com.barometer.core.format.Tooltip;
import com.barometer.core.model.Result;
import com.barometer.core.model.StatusClass;
import com.barometer.core.model.StatusRecord;
import com.barometer.core.provider.Renderer;

import java.time.ZoneId;
import java.util.Locale;

public class CpuRenderer implements Renderer<CpuUsage> {

    static final double CRITICAL_BUSY = 90.0;
    static final double WARNING_BUSY = 70.0;

    private final ZoneId zone;

    public CpuRenderer(ZoneId zone) {
        this.zone = zone;
    }

    @Override
    public StatusRecord render(Result<CpuUsage> result, int mode) {
        if (result instanceof Result.Failure<CpuUsage> failure) {
            return Renderer.failure(failure);
        }
        var success = (Result.Success<CpuUsage>) result;
        CpuUsage usage = success.payload();

        String text = "user " + percent(usage.user())
                + ", sys " + percent(usage.system())
                + ", idle " + percent(usage.idle());
        String tooltip = Tooltip.builder()
                .row("Cores", usage.cores())
                .row("Busy", percent(usage.busy()))
                .row("User", percent(usage.user()))
                .row("System", percent(usage.system()))
                .row("Idle", percent(usage.idle()))
                .build(success.updatedAt(), zone);
        return new StatusRecord(Glyphs.prefix(Glyphs.CPU, text), classify(usage.busy()), tooltip);
    }

    static StatusClass classify(double busy) {
        if (busy >= CRITICAL_BUSY) {
            return StatusClass.CRITICAL;
        }
        if (busy >= WARNING_BUSY) {
            return StatusClass.WARNING;
        }
        return StatusClass.SUCCESS;
    }

    private static String percent(double value) {
        return String.format(Locale.ROOT, "%.1f%%", value);
    }
}
