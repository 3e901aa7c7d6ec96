package com.barometer.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command. Each subcommand is either a status-bar agent or
 * the {@code health} check.
 */
@Command(
        name = "barometer",
        mixinStandardHelpOptions = true,
        version = "Barometer 0.1.0",
        description = "Status-bar agents that print one JSON status line per update",
        subcommands = {
                FilesystemCommand.class,
                MemoryCommand.class,
                CpuCommand.class,
                NetworkCommand.class,
                WeatherCommand.class,
                UpdatesCommand.class,
                StocksCommand.class,
                SpeedtestCommand.class,
                QuakesCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class BarometerCommand implements Runnable {

    @Override
    public void run() {
        // no subcommand given
        new CommandLine(this).usage(System.out);
    }
}
