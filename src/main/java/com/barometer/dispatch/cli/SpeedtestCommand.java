package com.barometer.dispatch.cli;

import com.barometer.agents.speedtest.SpeedtestProperties;
import com.barometer.agents.speedtest.SpeedtestProvider;
import com.barometer.agents.speedtest.SpeedtestRenderer;
import com.barometer.core.agent.AgentDefinition;
import com.barometer.core.agent.AgentLauncher;
import com.barometer.core.agent.ConfigurationException;
import com.barometer.core.health.NetworkReachability;
import com.barometer.core.model.Target;
import com.barometer.core.system.CommandRunner;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: barometer speedtest
 */
@Command(name = "speedtest", mixinStandardHelpOptions = true,
        description = "Report download and upload speed measured by speedtest-cli")
@Component
public class SpeedtestCommand implements Callable<Integer> {

    static final long DEFAULT_INTERVAL_SECONDS = 300;

    @Mixin
    AgentOptions options = new AgentOptions();

    private final AgentLauncher launcher;
    private final SpeedtestProperties properties;
    private final NetworkReachability reachability;
    private final ObjectMapper objectMapper;

    public SpeedtestCommand(AgentLauncher launcher,
                            SpeedtestProperties properties,
                            NetworkReachability reachability,
                            ObjectMapper objectMapper) {
        this.launcher = launcher;
        this.properties = properties;
        this.reachability = reachability;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        return launcher.launch("speedtest", () -> {
            if (properties.getCommand() == null || properties.getCommand().isEmpty()) {
                throw new ConfigurationException("speedtest: barometer.speedtest.command is empty");
            }
            var runner = new CommandRunner(properties.getCommandTimeout());
            return AgentDefinition.of("speedtest", List.of(new Target("speedtest")),
                            new SpeedtestProvider(runner, properties.getCommand(), objectMapper),
                            new SpeedtestRenderer(ZoneId.systemDefault()))
                    .withAvailability(reachability)
                    .withFetchTimeout(properties.fetchTimeout());
        }, options.toLaunchOptions(DEFAULT_INTERVAL_SECONDS));
    }
}
