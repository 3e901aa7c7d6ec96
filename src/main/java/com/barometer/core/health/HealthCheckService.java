package com.barometer.core.health;

import com.barometer.agents.updates.PackageManager;
import com.barometer.agents.weather.WeatherProperties;
import com.barometer.core.provider.AvailabilityCheck;
import com.barometer.core.system.CommandRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Checks the host prerequisites of each agent.
 */
@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    /** Agents that run the reachability pre-check before each fetch. */
    static final List<String> NETWORK_AGENTS = List.of("weather", "updates", "stocks", "speedtest", "quakes");

    static final String SPEEDTEST_EXECUTABLE = "speedtest-cli";

    private final AvailabilityCheck reachability;
    private final WeatherProperties weatherProperties;
    private final Path procRoot;
    private final Path sysRoot;
    private final Function<String, Optional<Path>> executableLookup;

    @Autowired
    public HealthCheckService(NetworkReachability reachability, WeatherProperties weatherProperties) {
        this(reachability, weatherProperties, Path.of("/proc"), Path.of("/sys"), CommandRunner::which);
    }

    HealthCheckService(AvailabilityCheck reachability,
                       WeatherProperties weatherProperties,
                       Path procRoot,
                       Path sysRoot,
                       Function<String, Optional<Path>> executableLookup) {
        this.reachability = reachability;
        this.weatherProperties = weatherProperties;
        this.procRoot = procRoot;
        this.sysRoot = sysRoot;
        this.executableLookup = executableLookup;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkReadable(procRoot.resolve("meminfo"), List.of("memory")));
        results.add(checkReadable(procRoot.resolve("stat"), List.of("cpu")));
        results.add(checkNetworkInterfaces());
        results.add(checkReachability());
        results.add(checkApiKey());
        results.add(checkPackageManagers());
        results.add(checkSpeedtest());
        return results;
    }

    /** True when no check is {@link HealthStatus.Status#DOWN}. */
    public static boolean allPassing(List<HealthStatus> results) {
        return results.stream().noneMatch(status -> status.status() == HealthStatus.Status.DOWN);
    }

    private HealthStatus checkReadable(Path file, List<String> agents) {
        if (Files.isReadable(file)) {
            return HealthStatus.up(file.toString(), "readable", agents);
        }
        return HealthStatus.down(file.toString(), "not readable", agents);
    }

    private HealthStatus checkNetworkInterfaces() {
        Path net = sysRoot.resolve("class").resolve("net");
        if (!Files.isDirectory(net)) {
            return HealthStatus.down(net.toString(), "missing", List.of("network"));
        }
        try (var entries = Files.list(net)) {
            List<String> names = entries.map(path -> path.getFileName().toString()).sorted().toList();
            return HealthStatus.up(net.toString(), String.join(", ", names), List.of("network"));
        } catch (IOException e) {
            log.warn("Listing {} failed: {}", net, e.getMessage());
            return HealthStatus.down(net.toString(), "unreadable: " + e.getMessage(), List.of("network"));
        }
    }

    private HealthStatus checkReachability() {
        if (reachability.isAvailable()) {
            return HealthStatus.up("internet", "reachable", NETWORK_AGENTS);
        }
        return HealthStatus.down("internet", reachability.unavailableMessage(), NETWORK_AGENTS);
    }

    private HealthStatus checkApiKey() {
        if (weatherProperties.hasApiKey()) {
            return HealthStatus.up("weather api key", "configured", List.of("weather"));
        }
        return HealthStatus.degraded("weather api key",
                "not configured; pass --api-key or set barometer.weather.api-key", List.of("weather"));
    }

    private HealthStatus checkPackageManagers() {
        List<String> found = Arrays.stream(PackageManager.values())
                .filter(manager -> executableLookup.apply(manager.executable()).isPresent())
                .map(PackageManager::displayName)
                .toList();
        if (found.isEmpty()) {
            List<String> supported = Arrays.stream(PackageManager.values()).map(PackageManager::displayName).toList();
            return HealthStatus.down("package managers", "none of " + supported + " on PATH",
                    List.of("updates"));
        }
        return HealthStatus.up("package managers", String.join(", ", found), List.of("updates"));
    }

    private HealthStatus checkSpeedtest() {
        return executableLookup.apply(SPEEDTEST_EXECUTABLE)
                .map(path -> HealthStatus.up(SPEEDTEST_EXECUTABLE, path.toString(), List.of("speedtest")))
                .orElseGet(() -> HealthStatus.degraded(SPEEDTEST_EXECUTABLE, "not on PATH", List.of("speedtest")));
    }
}
