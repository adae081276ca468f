package com.platform.faultlab.benchmark;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.platform.faultlab.error.ErrorCode;
import com.platform.faultlab.error.ValidationException;

/**
 * Workload mix of a benchmark. Every batch is inserted; reads and updates depend on the type.
 */
public enum TestType {

    MIXED("mixed", true, true),
    READ("read", true, false),
    WRITE("write", false, false),
    UPDATE("update", false, true);

    private final String value;
    private final boolean reads;
    private final boolean updates;

    TestType(String value, boolean reads, boolean updates) {
        this.value = value;
        this.reads = reads;
        this.updates = updates;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean includesRead() {
        return reads;
    }

    public boolean includesUpdate() {
        return updates;
    }

    @JsonCreator
    public static TestType fromValue(String value) {
        for (TestType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new ValidationException(ErrorCode.INVALID_FIELD_VALUE, "testType", value,
            "must be one of mixed, read, write, update");
    }
}
