package com.platform.faultlab.infra;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Running state of a node as reported by the orchestrator.
 */
public enum NodeState {
    RUNNING,
    STOPPED,
    UNKNOWN;

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }
}
