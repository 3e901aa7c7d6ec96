package com.barometer.agents.updates;

import com.barometer.core.agent.ConfigurationException;
import com.barometer.core.provider.ProviderException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Supported package managers: the command that lists pending updates, the exit
 * codes that mean success, and the parser for its output.
 */
public enum PackageManager {

    APT(List.of("apt", "list", "--upgradable"), Set.of(0)) {
        @Override
        List<PackageUpdate> parse(List<String> lines) {
            // zsh/stable 5.9-4+b2 amd64 [upgradable from: 5.9-4+b1]
            var updates = new ArrayList<PackageUpdate>();
            for (String line : lines) {
                int slash = line.indexOf('/');
                if (slash <= 0 || line.startsWith("Listing") || line.startsWith("WARNING")) {
                    continue;
                }
                String[] fields = line.split("\\s+");
                updates.add(new PackageUpdate(line.substring(0, slash), fields.length > 1 ? fields[1] : ""));
            }
            return updates;
        }
    },

    BREW(List.of("brew", "outdated", "--json=v2"), Set.of(0)) {
        @Override
        List<PackageUpdate> parse(List<String> lines) throws ProviderException {
            JsonNode root;
            try {
                root = MAPPER.readTree(String.join("\n", lines));
            } catch (JsonProcessingException e) {
                throw new ProviderException("failed to parse JSON from brew outdated: " + e.getOriginalMessage(), e);
            }
            var updates = new ArrayList<PackageUpdate>();
            for (String section : List.of("formulae", "casks")) {
                for (JsonNode item : root.path(section)) {
                    updates.add(new PackageUpdate(item.path("name").asText(), item.path("current_version").asText("")));
                }
            }
            return updates;
        }
    },

    // check-update exits 100 when updates are available
    DNF(List.of("dnf", "check-update", "--quiet"), Set.of(0, 100)) {
        @Override
        List<PackageUpdate> parse(List<String> lines) {
            return parseCheckUpdate(lines);
        }
    },

    FLATPAK(List.of("flatpak", "remote-ls", "--updates", "--columns=application,version"), Set.of(0)) {
        @Override
        List<PackageUpdate> parse(List<String> lines) {
            var updates = new ArrayList<PackageUpdate>();
            for (String line : lines) {
                String[] fields = line.split("\t");
                updates.add(new PackageUpdate(fields[0].strip(), fields.length > 1 ? fields[1].strip() : ""));
            }
            return updates;
        }
    },

    // package  firefox  131.0.3+linuxmint1+virginia  ...
    MINT(List.of("mintupdate-cli", "list", "-r"), Set.of(0)) {
        @Override
        List<PackageUpdate> parse(List<String> lines) {
            var updates = new ArrayList<PackageUpdate>();
            for (String line : lines) {
                String[] fields = line.split("\\s+");
                if (fields.length < 3) {
                    continue;
                }
                updates.add(new PackageUpdate(fields[1], fields[2]));
            }
            return updates;
        }
    },

    // -Qu exits 1 when nothing is outdated
    PACMAN(List.of("pacman", "-Qu"), Set.of(0, 1)) {
        @Override
        List<PackageUpdate> parse(List<String> lines) {
            return parseArrowFormat(lines);
        }
    },

    // first line is the column header; "All snaps up to date." when there is nothing
    SNAP(List.of("snap", "refresh", "--list"), Set.of(0)) {
        @Override
        List<PackageUpdate> parse(List<String> lines) {
            var updates = new ArrayList<PackageUpdate>();
            for (String line : lines) {
                if (line.startsWith("Name ") || line.startsWith("All snaps")) {
                    continue;
                }
                String[] fields = line.split("\\s+");
                updates.add(new PackageUpdate(fields[0], fields.length > 1 ? fields[1] : ""));
            }
            return updates;
        }
    },

    YAY(List.of("yay", "-Qua"), Set.of(0, 1)) {
        @Override
        List<PackageUpdate> parse(List<String> lines) {
            return parseArrowFormat(lines);
        }
    },

    YUM(List.of("yum", "check-update", "--quiet"), Set.of(0, 100)) {
        @Override
        List<PackageUpdate> parse(List<String> lines) {
            return parseCheckUpdate(lines);
        }
    };

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<String> command;
    private final Set<Integer> okExitCodes;

    PackageManager(List<String> command, Set<Integer> okExitCodes) {
        this.command = command;
        this.okExitCodes = okExitCodes;
    }

    public String displayName() {
        return name().toLowerCase();
    }

    /** Program looked up on {@code PATH}. */
    public String executable() {
        return command.get(0);
    }

    public List<String> command() {
        return command;
    }

    public boolean isOkExit(int exitCode) {
        return okExitCodes.contains(exitCode);
    }

    /** Parses the non-blank stdout lines of {@link #command()}. */
    abstract List<PackageUpdate> parse(List<String> lines) throws ProviderException;

    /**
     * @throws ConfigurationException for names outside {@link #values()}
     */
    public static PackageManager of(String name) {
        for (PackageManager manager : values()) {
            if (manager.displayName().equalsIgnoreCase(name)) {
                return manager;
            }
        }
        throw new ConfigurationException("unsupported package manager '" + name + "', expected one of "
                + Arrays.stream(values()).map(PackageManager::displayName).collect(Collectors.joining(", ")));
    }

    /** dnf and yum: {@code name.arch  version  repo}, up to the obsoleted section. */
    private static List<PackageUpdate> parseCheckUpdate(List<String> lines) {
        var updates = new ArrayList<PackageUpdate>();
        for (String line : lines) {
            if (line.startsWith("Obsoleting")) {
                break;
            }
            String[] fields = line.split("\\s+");
            if (fields.length != 3 || line.startsWith("Last metadata")) {
                continue;
            }
            String name = fields[0];
            int arch = name.lastIndexOf('.');
            updates.add(new PackageUpdate(arch > 0 ? name.substring(0, arch) : name, fields[1]));
        }
        return updates;
    }

    /** {@code linux 6.9.1.arch1-1 -> 6.9.2.arch1-1}; ignored packages end with {@code [ignored]}. */
    private static List<PackageUpdate> parseArrowFormat(List<String> lines) {
        var updates = new ArrayList<PackageUpdate>();
        for (String line : lines) {
            String[] fields = line.split("\\s+");
            if (fields.length < 4 || !"->".equals(fields[2]) || line.endsWith("[ignored]")) {
                continue;
            }
            updates.add(new PackageUpdate(fields[0], fields[3]));
        }
        return updates;
    }
}
