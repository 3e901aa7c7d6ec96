package com.barometer.core.agent;

import java.time.Duration;

/**
 * Options shared by every agent.
 *
 * @param interval time between scheduled refreshes
 * @param test     fetch and render once, print, and exit without starting the reactor
 * @param debug    raise the application's log level to DEBUG
 */
public record LaunchOptions(Duration interval, boolean test, boolean debug) {}
