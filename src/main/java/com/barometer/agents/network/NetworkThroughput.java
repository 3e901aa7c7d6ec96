package com.barometer.agents.network;

/**
 * Transfer rates of one interface over the sampling window.
 *
 * @param received    bytes per second received
 * @param transmitted bytes per second transmitted
 */
public record NetworkThroughput(
    String iface,
    boolean wireless,
    String macAddress,
    double received,
    double transmitted,
    long receivedTotal,
    long transmittedTotal
) {
}
