package com.platform.faultlab.infra;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Whether infrastructure operations reach a real orchestrator or are simulated.
 */
public enum InfraMode {
    LIVE,
    SYNTHETIC;

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }
}
