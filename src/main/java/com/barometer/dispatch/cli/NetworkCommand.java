package com.barometer.dispatch.cli;

import com.barometer.agents.network.NetworkProvider;
import com.barometer.agents.network.NetworkRenderer;
import com.barometer.core.agent.AgentDefinition;
import com.barometer.core.agent.AgentLauncher;
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
 * CLI command: barometer network -I eth0 -I wlan0
 */
@Command(name = "network", mixinStandardHelpOptions = true,
        description = "Report receive and transmit rates of one or more interfaces")
@Component
public class NetworkCommand implements Callable<Integer> {

    static final long DEFAULT_INTERVAL_SECONDS = 5;

    @Mixin
    AgentOptions options = new AgentOptions();

    @Option(names = {"-I", "--interface"}, paramLabel = "<name>",
            description = "Interface to report; repeat to cycle through several")
    List<String> interfaces = new ArrayList<>();

    private final AgentLauncher launcher;

    public NetworkCommand(AgentLauncher launcher) {
        this.launcher = launcher;
    }

    @Override
    public Integer call() {
        return launcher.launch("network",
                () -> AgentDefinition.of("network", Target.of(interfaces),
                        new NetworkProvider(), new NetworkRenderer(ZoneId.systemDefault())),
                options.toLaunchOptions(DEFAULT_INTERVAL_SECONDS));
    }
}
