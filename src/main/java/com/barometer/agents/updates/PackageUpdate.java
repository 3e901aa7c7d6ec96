package com.barometer.agents.updates;

/**
 * One outdated package and the version it would be upgraded to.
 */
public record PackageUpdate(String name, String version) {
}
