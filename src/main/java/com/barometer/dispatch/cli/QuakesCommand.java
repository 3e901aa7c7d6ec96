package com.barometer.dispatch.cli;

import com.barometer.agents.quakes.QuakeQuery;
import com.barometer.agents.quakes.QuakesClient;
import com.barometer.agents.quakes.QuakesProperties;
import com.barometer.agents.quakes.QuakesProvider;
import com.barometer.agents.quakes.QuakesRenderer;
import com.barometer.core.agent.AgentDefinition;
import com.barometer.core.agent.AgentLauncher;
import com.barometer.core.health.NetworkReachability;
import com.barometer.core.model.Target;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.time.Clock;
import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: barometer quakes -r 50m -m 2.5
 */
@Command(name = "quakes", mixinStandardHelpOptions = true,
        description = "Report earthquakes of the last 24 hours near this host's public IP")
@Component
public class QuakesCommand implements Callable<Integer> {

    static final long DEFAULT_INTERVAL_SECONDS = 900;

    @Mixin
    AgentOptions options = new AgentOptions();

    @Option(names = {"-r", "--radius"}, defaultValue = "100m",
            description = "Search radius in miles (50m) or kilometres (80km) (default: ${DEFAULT-VALUE})")
    String radius;

    @Option(names = {"-l", "--limit"}, defaultValue = "20",
            description = "Maximum number of earthquakes to list (default: ${DEFAULT-VALUE})")
    int limit;

    @Option(names = {"-m", "--magnitude"}, defaultValue = "0.1",
            description = "Minimum magnitude (default: ${DEFAULT-VALUE})")
    double magnitude;

    private final AgentLauncher launcher;
    private final QuakesProperties properties;
    private final NetworkReachability reachability;
    private final ObjectMapper objectMapper;

    public QuakesCommand(AgentLauncher launcher,
                         QuakesProperties properties,
                         NetworkReachability reachability,
                         ObjectMapper objectMapper) {
        this.launcher = launcher;
        this.properties = properties;
        this.reachability = reachability;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        return launcher.launch("quakes", () -> {
            var query = QuakeQuery.of(radius, limit, magnitude);
            var client = new QuakesClient(properties, objectMapper, Clock.systemUTC());
            return AgentDefinition.of("quakes", List.of(new Target("quakes")),
                            new QuakesProvider(client, query), new QuakesRenderer(ZoneId.systemDefault()))
                    .withAvailability(reachability);
        }, options.toLaunchOptions(DEFAULT_INTERVAL_SECONDS));
    }
}
