package com.barometer.core.agent;

import com.barometer.core.model.Target;
import com.barometer.core.provider.AvailabilityCheck;
import com.barometer.core.provider.Provider;
import com.barometer.core.provider.Renderer;

import java.time.Duration;
import java.util.List;

/**
 * Everything the reactor needs to run one agent.
 *
 * @param name         agent name, used in logs and metrics
 * @param targets      configured targets, in toggle order
 * @param formatCount  number of display formats the toggle signal cycles through
 * @param provider     measurement source
 * @param renderer     record rendering
 * @param availability pre-check run before each fetch
 * @param fetchTimeout bound on one provider fetch; {@code null} uses the reactor default
 * @param <T>          payload type
 */
public record AgentDefinition<T>(
    String name,
    List<Target> targets,
    int formatCount,
    Provider<T> provider,
    Renderer<T> renderer,
    AvailabilityCheck availability,
    Duration fetchTimeout
) {
    public AgentDefinition {
        if (targets == null || targets.isEmpty()) {
            throw new ConfigurationException(name + ": at least one target is required");
        }
        if (formatCount < 1) {
            throw new ConfigurationException(name + ": at least one display format is required");
        }
        if (fetchTimeout != null && (fetchTimeout.isNegative() || fetchTimeout.isZero())) {
            throw new ConfigurationException(name + ": fetch timeout must be positive");
        }
        targets = List.copyOf(targets);
    }

    /** One display format per target, no pre-check. */
    public static <T> AgentDefinition<T> of(String name, List<Target> targets,
                                            Provider<T> provider, Renderer<T> renderer) {
        int formats = targets == null ? 0 : targets.size();
        return new AgentDefinition<>(name, targets, formats, provider, renderer, AvailabilityCheck.ALWAYS, null);
    }

    public AgentDefinition<T> withFormatCount(int count) {
        return new AgentDefinition<>(name, targets, count, provider, renderer, availability, fetchTimeout);
    }

    public AgentDefinition<T> withAvailability(AvailabilityCheck check) {
        return new AgentDefinition<>(name, targets, formatCount, provider, renderer, check, fetchTimeout);
    }

    /** Bounds fetches by {@code timeout} instead of the reactor default. */
    public AgentDefinition<T> withFetchTimeout(Duration timeout) {
        return new AgentDefinition<>(name, targets, formatCount, provider, renderer, availability, timeout);
    }

    /** The definition's own fetch timeout, or {@code fallback} when none is set. */
    public Duration fetchTimeoutOr(Duration fallback) {
        return fetchTimeout != null ? fetchTimeout : fallback;
    }
}
