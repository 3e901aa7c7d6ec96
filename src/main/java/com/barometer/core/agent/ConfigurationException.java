package com.barometer.core.agent;

/**
 * Startup misconfiguration (no targets, non-positive interval, conflicting signals).
 * Raised before the reactor starts; the process reports it and exits.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
