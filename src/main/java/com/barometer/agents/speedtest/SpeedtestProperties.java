package com.barometer.agents.speedtest;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "barometer.speedtest")
public class SpeedtestProperties {

    static final Duration FETCH_MARGIN = Duration.ofSeconds(5);

    /** Must print speedtest-cli's {@code --json} report on stdout. */
    private List<String> command = new ArrayList<>(List.of("speedtest-cli", "--secure", "--json"));

    /** Bound on one run; a full test outlasts the reactor's default fetch timeout. */
    private Duration commandTimeout = Duration.ofSeconds(120);

    public List<String> getCommand() {
        return command;
    }

    public void setCommand(List<String> command) {
        this.command = command;
    }

    public Duration getCommandTimeout() {
        return commandTimeout;
    }

    public void setCommandTimeout(Duration commandTimeout) {
        this.commandTimeout = commandTimeout;
    }

    /** The command times out first, so its own message reaches the status line. */
    public Duration fetchTimeout() {
        return commandTimeout.plus(FETCH_MARGIN);
    }
}
