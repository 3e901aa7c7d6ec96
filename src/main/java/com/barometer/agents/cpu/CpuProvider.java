package com.barometer.agents.cpu;

import com.barometer.core.model.Target;
import com.barometer.core.provider.PerTargetProvider;
import com.barometer.core.provider.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Samples {@code /proc/stat} twice and reports the usage in between.
 */
public class CpuProvider extends PerTargetProvider<CpuUsage> {

    private static final Logger log = LoggerFactory.getLogger(CpuProvider.class);

    private final Path stat;
    private final Duration sampleInterval;

    public CpuProvider() {
        this(Path.of("/proc/stat"), Duration.ofSeconds(1));
    }

    CpuProvider(Path stat, Duration sampleInterval) {
        this.stat = stat;
        this.sampleInterval = sampleInterval;
    }

    @Override
    protected CpuUsage measure(Target target) throws ProviderException {
        CpuSample first = sample();
        try {
            Thread.sleep(sampleInterval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException("interrupted while sampling", e);
        }
        CpuSample second = sample();
        CpuUsage usage = CpuUsage.between(first, second);
        log.debug("cpu usage {}", usage);
        return usage;
    }

    private CpuSample sample() throws ProviderException {
        try {
            return CpuSample.parse(Files.readAllLines(stat));
        } catch (IOException e) {
            throw new ProviderException("failed to read " + stat + ": " + e.getMessage(), e);
        }
    }
}
