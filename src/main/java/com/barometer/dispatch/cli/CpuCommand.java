package com.barometer.dispatch.cli;

import com.barometer.agents.cpu.CpuProvider;
import com.barometer.agents.cpu.CpuRenderer;
import com.barometer.core.agent.AgentDefinition;
import com.barometer.core.agent.AgentLauncher;
import com.barometer.core.model.Target;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "cpu", mixinStandardHelpOptions = true, description = "Report CPU usage from /proc/stat")
@Component
public class CpuCommand implements Callable<Integer> {

    static final long DEFAULT_INTERVAL_SECONDS = 5;

    @Mixin
    AgentOptions options = new AgentOptions();

    private final AgentLauncher launcher;

    public CpuCommand(AgentLauncher launcher) {
        this.launcher = launcher;
    }

    @Override
    public Integer call() {
        return launcher.launch("cpu",
                () -> AgentDefinition.of("cpu", Target.of(List.of("cpu")),
                        new CpuProvider(), new CpuRenderer(ZoneId.systemDefault())),
                options.toLaunchOptions(DEFAULT_INTERVAL_SECONDS));
    }
}
