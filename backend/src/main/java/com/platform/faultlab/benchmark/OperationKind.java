package com.platform.faultlab.benchmark;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Timed benchmark operations, in report order.
 */
public enum OperationKind {

    INSERT("insert"),
    READ("read"),
    UPDATE("update");

    private final String key;

    OperationKind(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }
}
