package com.barometer.dispatch.cli;

import com.barometer.agents.filesystem.FilesystemProvider;
import com.barometer.agents.filesystem.FilesystemRenderer;
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
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: barometer filesystem -m / -m /home
 */
@Command(name = "filesystem", mixinStandardHelpOptions = true,
        description = "Report used and total space of one or more mountpoints")
@Component
public class FilesystemCommand implements Callable<Integer> {

    static final long DEFAULT_INTERVAL_SECONDS = 5;

    @Mixin
    AgentOptions options = new AgentOptions();

    @Option(names = {"-m", "--mountpoint"}, paramLabel = "<path>",
            description = "Mountpoint to report; repeat to cycle through several")
    List<String> mountpoints = new ArrayList<>();

    @Option(names = {"-u", "--unit"}, defaultValue = "auto",
            description = "Display unit: K, Ki, M, Mi, G, Gi, T, Ti, P, Pi, E, Ei, Z, Zi or auto (default: ${DEFAULT-VALUE})")
    String unit;

    @Option(names = "--show-stats", description = "Add read and write activity of the backing device to the tooltip")
    boolean showStats;

    private final AgentLauncher launcher;

    public FilesystemCommand(AgentLauncher launcher) {
        this.launcher = launcher;
    }

    @Override
    public Integer call() {
        return launcher.launch("filesystem", () -> {
            if (!ByteFormat.isValidUnit(unit)) {
                throw new ConfigurationException("filesystem: invalid unit '" + unit + "'");
            }
            return AgentDefinition.of("filesystem", Target.of(mountpoints),
                    showStats ? FilesystemProvider.withStats() : new FilesystemProvider(),
                    new FilesystemRenderer(unit, ZoneId.systemDefault()));
        }, options.toLaunchOptions(DEFAULT_INTERVAL_SECONDS));
    }
}
