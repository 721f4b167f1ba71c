package com.adlanda.ethicsassistant.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Reachability of a single dependency.
 */
public enum ComponentStatus {
    HEALTHY,
    UNHEALTHY,
    UNKNOWN;

    public static ComponentStatus of(boolean reachable) {
        return reachable ? HEALTHY : UNHEALTHY;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
