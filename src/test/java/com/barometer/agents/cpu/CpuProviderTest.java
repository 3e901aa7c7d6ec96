package com.barometer.agents.cpu;

import com.barometer.core.model.Result;
import com.barometer.core.model.Target;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CpuProviderTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("an unchanged stat file reads as idle")
    void unchangedFile() throws IOException {
        Path stat = dir.resolve("stat");
        Files.writeString(stat, "cpu  10 0 10 80 0 0 0 0\ncpu0 10 0 10 80 0 0 0 0\n");

        var results = new CpuProvider(stat, Duration.ofMillis(5)).fetch(List.of(new Target("cpu")));

        var success = assertInstanceOf(Result.Success.class, results.get(0));
        var usage = (CpuUsage) success.payload();
        assertEquals(100.0, usage.idle());
        assertEquals(1, usage.cores());
    }

    @Test
    @DisplayName("a missing stat file becomes a failure")
    void missingFile() {
        var results = new CpuProvider(dir.resolve("absent"), Duration.ZERO).fetch(List.of(new Target("cpu")));

        assertFalse(results.get(0).isSuccess());
    }
}
