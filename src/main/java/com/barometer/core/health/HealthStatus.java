package com.barometer.core.health;

import java.util.List;

/**
 * Outcome of one prerequisite check.
 *
 * @param component what was checked, e.g. {@code /proc/meminfo} or {@code pacman}
 * @param status    check result
 * @param detail    one-line explanation
 * @param agents    agents that depend on the component
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    List<String> agents
) {
    public enum Status { UP, DOWN, DEGRADED }

    public static HealthStatus up(String component, String detail, List<String> agents) {
        return new HealthStatus(component, Status.UP, detail, agents);
    }

    public static HealthStatus down(String component, String detail, List<String> agents) {
        return new HealthStatus(component, Status.DOWN, detail, agents);
    }

    public static HealthStatus degraded(String component, String detail, List<String> agents) {
        return new HealthStatus(component, Status.DEGRADED, detail, agents);
    }
}
