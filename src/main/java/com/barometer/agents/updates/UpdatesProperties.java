package com.barometer.agents.updates;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "barometer.updates")
public class UpdatesProperties {

    static final Duration FETCH_MARGIN = Duration.ofSeconds(5);

    /** Upper bound for one package-manager invocation. */
    private Duration commandTimeout = Duration.ofSeconds(120);

    public Duration getCommandTimeout() {
        return commandTimeout;
    }

    public void setCommandTimeout(Duration commandTimeout) {
        this.commandTimeout = commandTimeout;
    }

    /**
     * Bound on one fetch of {@code managers} package managers, which run one after another.
     * Each command times out on its own first, so a slow manager fails alone.
     */
    public Duration fetchTimeoutFor(int managers) {
        return commandTimeout.multipliedBy(Math.max(1, managers)).plus(FETCH_MARGIN);
    }
}
