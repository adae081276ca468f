package com.platform.faultlab.benchmark;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.platform.faultlab.error.ErrorCode;
import com.platform.faultlab.error.ValidationException;

/**
 * Requested consistency level. Recorded with the results, not applied to the drivers.
 */
public enum ConsistencyLevel {

    EVENTUAL("eventual"),
    STRONG("strong"),
    SESSION("session");

    private final String value;

    ConsistencyLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ConsistencyLevel fromValue(String value) {
        for (ConsistencyLevel level : values()) {
            if (level.value.equalsIgnoreCase(value)) {
                return level;
            }
        }
        throw new ValidationException(ErrorCode.INVALID_FIELD_VALUE, "consistencyLevel", value,
            "must be one of eventual, strong, session");
    }
}
