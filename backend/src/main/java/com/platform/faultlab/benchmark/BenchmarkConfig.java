package com.platform.faultlab.benchmark;

import com.platform.faultlab.error.ErrorCode;
import com.platform.faultlab.error.ValidationException;

/**
 * Parameters of one benchmark run.
 */
public record BenchmarkConfig(int operationCount, int batchSize,
                              ConsistencyLevel consistencyLevel, TestType testType) {

    public static final int MAX_OPERATIONS = 10_000;
    public static final int MAX_BATCH_SIZE = 1_000;

    public BenchmarkConfig {
        if (operationCount < 1 || operationCount > MAX_OPERATIONS) {
            throw new ValidationException(ErrorCode.INVALID_FIELD_VALUE, "operationCount", operationCount,
                "must be between 1 and " + MAX_OPERATIONS);
        }
        if (batchSize < 1 || batchSize > MAX_BATCH_SIZE) {
            throw new ValidationException(ErrorCode.INVALID_FIELD_VALUE, "batchSize", batchSize,
                "must be between 1 and " + MAX_BATCH_SIZE);
        }
        if (consistencyLevel == null) {
            consistencyLevel = ConsistencyLevel.EVENTUAL;
        }
        if (testType == null) {
            testType = TestType.MIXED;
        }
    }

    /**
     * Number of batches the records split into.
     */
    public int batchCount() {
        return (operationCount + batchSize - 1) / batchSize;
    }
}
