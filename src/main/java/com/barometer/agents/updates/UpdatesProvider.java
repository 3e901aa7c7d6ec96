package com.barometer.agents.updates;

import com.barometer.core.model.Target;
import com.barometer.core.provider.PerTargetProvider;
import com.barometer.core.provider.ProviderException;
import com.barometer.core.system.CommandResult;
import com.barometer.core.system.CommandRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Asks each configured package manager for its pending updates.
 */
public class UpdatesProvider extends PerTargetProvider<UpdateList> {

    private static final Logger log = LoggerFactory.getLogger(UpdatesProvider.class);

    private final CommandRunner runner;

    public UpdatesProvider(CommandRunner runner) {
        this.runner = runner;
    }

    @Override
    protected UpdateList measure(Target target) throws ProviderException {
        PackageManager manager = PackageManager.of(target.name());
        CommandResult result = runner.run(manager.command());
        if (!manager.isOkExit(result.exitCode())) {
            String detail = result.stderr().lines().findFirst().orElse("exit code " + result.exitCode());
            throw new ProviderException(manager.displayName() + " failed to find updates: " + detail);
        }
        List<PackageUpdate> packages = manager.parse(result.lines());
        log.info("{}: {} update(s) pending", manager.displayName(), packages.size());
        return new UpdateList(manager, packages);
    }
}
