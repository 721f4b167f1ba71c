package com.adlanda.ethicsassistant.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Aggregated health across all required dependencies.
 */
public enum OverallStatus {
    HEALTHY,
    DEGRADED,
    UNHEALTHY;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
