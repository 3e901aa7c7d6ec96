package com.barometer.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Styling class consumed by the status-bar host.
 */
public enum StatusClass {
    SUCCESS,
    WARNING,
    CRITICAL,
    ERROR,
    LOADING;

    /**
     * Picks a class from the share of a resource still free, using the
     * thresholds shared by the usage agents (below 20% critical, below 50% warning).
     */
    public static StatusClass forFreePercent(int pctFree) {
        if (pctFree < 20) {
            return CRITICAL;
        }
        if (pctFree < 50) {
            return WARNING;
        }
        return SUCCESS;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
