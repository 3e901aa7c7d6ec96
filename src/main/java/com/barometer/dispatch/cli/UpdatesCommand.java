package com.barometer.dispatch.cli;

import com.barometer.agents.updates.PackageManager;
import com.barometer.agents.updates.UpdatesProperties;
import com.barometer.agents.updates.UpdatesProvider;
import com.barometer.agents.updates.UpdatesRenderer;
import com.barometer.core.agent.AgentDefinition;
import com.barometer.core.agent.AgentLauncher;
import com.barometer.core.health.NetworkReachability;
import com.barometer.core.model.Target;
import com.barometer.core.system.CommandRunner;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: barometer updates -p pacman -p flatpak
 */
@Command(name = "updates", mixinStandardHelpOptions = true,
        description = "Report pending updates of one or more package managers")
@Component
public class UpdatesCommand implements Callable<Integer> {

    static final long DEFAULT_INTERVAL_SECONDS = 3600;

    @Mixin
    AgentOptions options = new AgentOptions();

    @Option(names = {"-p", "--package-manager"}, paramLabel = "<name>",
            description = "apt, brew, dnf, flatpak, mint, pacman, snap, yay or yum; repeat to cycle through several")
    List<String> packageManagers = new ArrayList<>();

    private final AgentLauncher launcher;
    private final UpdatesProperties properties;
    private final NetworkReachability reachability;

    public UpdatesCommand(AgentLauncher launcher, UpdatesProperties properties, NetworkReachability reachability) {
        this.launcher = launcher;
        this.properties = properties;
        this.reachability = reachability;
    }

    @Override
    public Integer call() {
        return launcher.launch("updates", () -> {
            packageManagers.forEach(PackageManager::of);
            var runner = new CommandRunner(properties.getCommandTimeout());
            return AgentDefinition.of("updates", Target.of(packageManagers),
                            new UpdatesProvider(runner), new UpdatesRenderer(ZoneId.systemDefault()))
                    .withAvailability(reachability)
                    .withFetchTimeout(properties.fetchTimeoutFor(packageManagers.size()));
        }, options.toLaunchOptions(DEFAULT_INTERVAL_SECONDS));
    }
}
