package com.barometer.dispatch.cli;

import com.barometer.agents.weather.WeatherClient;
import com.barometer.agents.weather.WeatherProperties;
import com.barometer.agents.weather.WeatherProvider;
import com.barometer.agents.weather.WeatherRenderer;
import com.barometer.core.agent.AgentDefinition;
import com.barometer.core.agent.AgentLauncher;
import com.barometer.core.agent.ConfigurationException;
import com.barometer.core.health.NetworkReachability;
import com.barometer.core.model.Target;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: barometer weather -l "Berlin" -l "San Diego, CA" -c
 */
@Command(name = "weather", mixinStandardHelpOptions = true,
        description = "Report current weather for one or more locations from weatherapi.com")
@Component
public class WeatherCommand implements Callable<Integer> {

    static final long DEFAULT_INTERVAL_SECONDS = 300;

    @Mixin
    AgentOptions options = new AgentOptions();

    @Option(names = {"-a", "--api-key"}, description = "weatherapi.com API key (default: barometer.weather.api-key)")
    String apiKey;

    @Option(names = {"-l", "--location"}, paramLabel = "<location>",
            description = "City, postcode or lat,lon; repeat to cycle through several")
    List<String> locations = new ArrayList<>();

    @Option(names = {"-c", "--use-celsius"}, description = "Show temperatures in Celsius")
    boolean useCelsius;

    private final AgentLauncher launcher;
    private final WeatherProperties properties;
    private final NetworkReachability reachability;
    private final ObjectMapper objectMapper;

    public WeatherCommand(AgentLauncher launcher,
                          WeatherProperties properties,
                          NetworkReachability reachability,
                          ObjectMapper objectMapper) {
        this.launcher = launcher;
        this.properties = properties;
        this.reachability = reachability;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        return launcher.launch("weather", () -> {
            String key = apiKey != null && !apiKey.isBlank() ? apiKey : properties.getApiKey();
            if (key == null || key.isBlank()) {
                throw new ConfigurationException("weather: an API key is required");
            }
            var client = new WeatherClient(properties, key, objectMapper);
            return AgentDefinition.of("weather", Target.of(locations),
                            new WeatherProvider(client), new WeatherRenderer(useCelsius, ZoneId.systemDefault()))
                    .withAvailability(reachability);
        }, options.toLaunchOptions(DEFAULT_INTERVAL_SECONDS));
    }
}
