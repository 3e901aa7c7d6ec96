package com.barometer.core.format;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class TooltipTest {

    @Test
    @DisplayName("pads keys to a common width")
    void padsKeys() {
        String tooltip = Tooltip.builder()
                .row("Type", "ext4")
                .row("Mountpoint", "/home")
                .build();

        assertEquals("Type       : ext4\nMountpoint : /home", tooltip);
    }

    @Test
    @DisplayName("skips null and blank values")
    void skipsEmptyValues() {
        String tooltip = Tooltip.builder()
                .row("Device", null)
                .row("Label", " ")
                .row("Type", "xfs")
                .build();

        assertEquals("Type : xfs", tooltip);
    }

    @Test
    @DisplayName("indents rows under a heading and separates sections")
    void headings() {
        String tooltip = Tooltip.builder()
                .heading("Memory")
                .row("Total", "8")
                .heading("Swap")
                .row("Used", "1")
                .build();

        assertEquals("Memory\n  Total : 8\n\nSwap\n  Used : 1", tooltip);
    }

    @Test
    @DisplayName("appends the last update time after a blank line")
    void appendsLastUpdated() {
        Instant at = Instant.parse("2026-10-19T09:15:02Z");

        String tooltip = Tooltip.builder()
                .row("Cores", 8)
                .build(at, ZoneOffset.UTC);

        assertEquals("Cores : 8\n\nLast updated 2026-10-19 09:15:02", tooltip);
    }
}
