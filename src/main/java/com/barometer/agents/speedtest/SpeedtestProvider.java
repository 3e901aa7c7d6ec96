package com.barometer.agents.speedtest;

import com.barometer.core.model.Target;
import com.barometer.core.provider.PerTargetProvider;
import com.barometer.core.provider.ProviderException;
import com.barometer.core.system.CommandResult;
import com.barometer.core.system.CommandRunner;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs speedtest-cli and reads its JSON report. The single target only names the agent.
 */
public class SpeedtestProvider extends PerTargetProvider<SpeedtestResult> {

    private static final Logger log = LoggerFactory.getLogger(SpeedtestProvider.class);

    private final CommandRunner runner;
    private final List<String> command;
    private final ObjectMapper objectMapper;

    public SpeedtestProvider(CommandRunner runner, List<String> command, ObjectMapper objectMapper) {
        this.runner = runner;
        this.command = List.copyOf(command);
        this.objectMapper = objectMapper;
    }

    @Override
    protected SpeedtestResult measure(Target target) throws ProviderException {
        CommandResult result = runner.run(command);
        if (!result.succeeded()) {
            String detail = result.stderr().lines().findFirst()
                    .orElse("failed to execute \"" + String.join(" ", command) + "\"");
            throw new ProviderException(detail);
        }
        if (result.stdout().isBlank()) {
            throw new ProviderException("empty results received");
        }
        JsonNode json;
        try {
            json = objectMapper.readTree(result.stdout());
        } catch (JsonProcessingException e) {
            log.debug("speedtest output is not JSON: {}", e.getOriginalMessage());
            throw new ProviderException("failed to parse the JSON data", e);
        }
        SpeedtestResult parsed = parse(json);
        log.info("speedtest: down={} up={} ping={}", parsed.download(), parsed.upload(), parsed.ping());
        return parsed;
    }

    /**
     * @throws ProviderException if neither direction produced a speed
     */
    static SpeedtestResult parse(JsonNode json) throws ProviderException {
        double download = json.path("download").asDouble();
        double upload = json.path("upload").asDouble();
        if (download <= 0 && upload <= 0) {
            throw new ProviderException("all tests failed");
        }
        JsonNode server = json.path("server");
        JsonNode client = json.path("client");
        return new SpeedtestResult(
                download,
                upload,
                json.path("ping").asDouble(),
                json.path("bytes_sent").asLong(),
                json.path("bytes_received").asLong(),
                new SpeedtestResult.Server(
                        server.path("name").asText(""),
                        server.path("country").asText(""),
                        server.path("sponsor").asText(""),
                        server.path("host").asText(""),
                        server.path("latency").asDouble()),
                new SpeedtestResult.Client(
                        client.path("ip").asText(""),
                        client.path("isp").asText(""),
                        client.path("country").asText("")));
    }
}
