package com.barometer.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One configured unit of measurement: a mountpoint, an interface, a location, a package manager.
 *
 * @param name the value as configured on the command line
 */
public record Target(String name) {

    public Target {
        Objects.requireNonNull(name, "name");
    }

    public static List<Target> of(List<String> names) {
        return names.stream().map(Target::new).toList();
    }

    @Override
    public String toString() {
        return name;
    }
}
