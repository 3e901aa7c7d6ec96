package com.barometer.dispatch.cli;

import com.barometer.agents.memory.MemoryProvider;
import com.barometer.agents.memory.MemoryRenderer;
import com.barometer.core.agent.AgentDefinition;
import com.barometer.core.agent.AgentLauncher;
import com.barometer.core.agent.ConfigurationException;
import com.barometer.core.format.ByteFormat;
import com.barometer.core.model.Target;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: barometer memory
 * <p>
 * The toggle signal cycles between used / total, percent used and free memory.
 */
@Command(name = "memory", mixinStandardHelpOptions = true, description = "Report memory usage from /proc/meminfo")
@Component
public class MemoryCommand implements Callable<Integer> {

    static final long DEFAULT_INTERVAL_SECONDS = 5;

    @Mixin
    AgentOptions options = new AgentOptions();

    @Option(names = {"-u", "--unit"}, defaultValue = "auto",
            description = "Display unit: K, Ki, M, Mi, G, Gi, T, Ti, P, Pi, E, Ei, Z, Zi or auto (default: ${DEFAULT-VALUE})")
    String unit;

    private final AgentLauncher launcher;

    public MemoryCommand(AgentLauncher launcher) {
        this.launcher = launcher;
    }

    @Override
    public Integer call() {
        return launcher.launch("memory", () -> {
            if (!ByteFormat.isValidUnit(unit)) {
                throw new ConfigurationException("memory: invalid unit '" + unit + "'");
            }
            return AgentDefinition.of("memory", Target.of(List.of("memory")),
                            new MemoryProvider(), new MemoryRenderer(unit, ZoneId.systemDefault()))
                    .withFormatCount(MemoryRenderer.FORMAT_COUNT);
        }, options.toLaunchOptions(DEFAULT_INTERVAL_SECONDS));
    }
}
