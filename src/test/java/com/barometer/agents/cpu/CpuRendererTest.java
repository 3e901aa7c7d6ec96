package com.barometer.agents.cpu;

import com.barometer.core.format.Glyphs;
import com.barometer.core.model.Result;
import com.barometer.core.model.StatusClass;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class CpuRendererTest {

    private final CpuRenderer renderer = new CpuRenderer(ZoneOffset.UTC);

    @Test
    @DisplayName("shows user, system and idle shares")
    void text() {
        var record = renderer.render(new Result.Success<>(new CpuUsage(12.5, 3.0, 84.5, 8), Instant.EPOCH), 0);

        assertEquals(Glyphs.prefix(Glyphs.CPU, "user 12.5%, sys 3.0%, idle 84.5%"), record.text());
        assertEquals(StatusClass.SUCCESS, record.status());
        assertTrue(record.tooltip().contains("Cores  : 8"));
        assertTrue(record.tooltip().contains("Busy   : 15.5%"));
    }

    @Test
    @DisplayName("classify escalates at 70 and 90 percent busy")
    void classify() {
        assertEquals(StatusClass.SUCCESS, CpuRenderer.classify(69.9));
        assertEquals(StatusClass.WARNING, CpuRenderer.classify(70.0));
        assertEquals(StatusClass.CRITICAL, CpuRenderer.classify(95.0));
    }
}
