package com.barometer.core.provider;

/**
 * Cheap pre-check run before a fetch. When it reports the environment unavailable,
 * the reactor records {@link #unavailableMessage()} as a failure for every target
 * instead of invoking the (slower) provider.
 */
@FunctionalInterface
public interface AvailabilityCheck {

    AvailabilityCheck ALWAYS = () -> true;

    boolean isAvailable();

    default String unavailableMessage() {
        return "unreachable";
    }
}
