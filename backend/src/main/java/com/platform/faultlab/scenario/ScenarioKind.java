package com.platform.faultlab.scenario;

import com.fasterxml.jackson.annotation.JsonValue;
import com.platform.faultlab.error.ValidationException;

/**
 * Kind of failure a scenario injects, keyed by the API's failureType.
 */
public enum ScenarioKind {

    NODE_FAILURE("node"),
    NETWORK_PARTITION("network");

    private final String failureType;

    ScenarioKind(String failureType) {
        this.failureType = failureType;
    }

    @JsonValue
    public String getFailureType() {
        return failureType;
    }

    /**
     * Parse an API failureType.
     * @throws ValidationException for anything other than node or network
     */
    public static ScenarioKind fromFailureType(String failureType) {
        for (ScenarioKind kind : values()) {
            if (kind.failureType.equalsIgnoreCase(failureType)) {
                return kind;
            }
        }
        throw ValidationException.unknownFailureType(failureType);
    }
}
