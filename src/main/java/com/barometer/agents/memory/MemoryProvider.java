package com.barometer.agents.memory;

import com.barometer.core.model.Target;
import com.barometer.core.provider.PerTargetProvider;
import com.barometer.core.provider.ProviderException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public class MemoryProvider extends PerTargetProvider<MemoryUsage> {

    private final Path meminfo;

    public MemoryProvider() {
        this(Path.of("/proc/meminfo"));
    }

    MemoryProvider(Path meminfo) {
        this.meminfo = meminfo;
    }

    @Override
    protected MemoryUsage measure(Target target) throws ProviderException {
        try {
            return MeminfoParser.parse(Files.readAllLines(meminfo));
        } catch (IOException e) {
            throw new ProviderException("failed to read " + meminfo + ": " + e.getMessage(), e);
        }
    }
}
