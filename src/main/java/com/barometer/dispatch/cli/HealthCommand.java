package com.barometer.dispatch.cli;

import com.barometer.core.health.HealthCheckService;
import com.barometer.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: barometer health
 * <p>
 * Checks the prerequisites of every agent and prints one colored line per
 * check. Exits 0 when nothing is down, 1 otherwise.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check agent prerequisites")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;
    private final ConsoleOutput console;

    @Autowired
    public HealthCommand(HealthCheckService healthCheckService) {
        this(healthCheckService, ConsoleOutput.stdout());
    }

    HealthCommand(HealthCheckService healthCheckService, ConsoleOutput console) {
        this.healthCheckService = healthCheckService;
        this.console = console;
    }

    @Override
    public Integer call() {
        console.banner();

        var checks = healthCheckService.checkAll();
        for (HealthStatus check : checks) {
            String label = check.component() + ": " + check.detail() + " " + check.agents();
            switch (check.status()) {
                case UP -> console.success(label);
                case DOWN -> console.error(label);
                case DEGRADED -> console.info(label);
            }
        }

        console.rule();
        if (HealthCheckService.allPassing(checks)) {
            console.success("Overall: all agents can run");
            return 0;
        }
        console.error("Overall: one or more agents are missing prerequisites");
        return 1;
    }
}
