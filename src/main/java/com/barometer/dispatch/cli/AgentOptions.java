package com.barometer.dispatch.cli;

import com.barometer.core.agent.LaunchOptions;
import picocli.CommandLine.Option;

import java.time.Duration;

/**
 * Options shared by every agent subcommand.
 */
public class AgentOptions {

    @Option(names = {"-i", "--interval"}, paramLabel = "<seconds>",
            description = "Seconds between refreshes; each agent has its own default")
    Long interval;

    @Option(names = {"-t", "--test"},
            description = "Fetch once, print text, class and tooltip on separate lines, and exit")
    boolean test;

    @Option(names = {"-d", "--debug"}, description = "Enable debug logging")
    boolean debug;

    LaunchOptions toLaunchOptions(long defaultIntervalSeconds) {
        long seconds = interval != null ? interval : defaultIntervalSeconds;
        return new LaunchOptions(Duration.ofSeconds(seconds), test, debug);
    }
}
