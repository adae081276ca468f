package com.platform.faultlab.api;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Validated request bodies.
 */
public class ApiRequests {

    /**
     * Failure scenario request. The duration cap is checked against configuration by the runner.
     */
    @Data
    public static class FailureSimulationRequest {

        @NotBlank(message = "Failure type is required")
        private String failureType = "node";

        /**
         * One node, or a comma-separated list for partitions.
         */
        @NotBlank(message = "Target node is required")
        private String targetNode = "mongo1";

        @Min(value = 1, message = "Duration must be at least 1 second")
        private int duration = 10;

        private boolean testOperations = true;
    }

    /**
     * Benchmark request.
     */
    @Data
    public static class PerformanceRunRequest {

        @Min(value = 1, message = "Operation count must be at least 1")
        @Max(value = 10000, message = "Operation count cannot exceed 10000")
        private int operationCount = 1000;

        @Min(value = 1, message = "Batch size must be at least 1")
        @Max(value = 1000, message = "Batch size cannot exceed 1000")
        private int batchSize = 100;

        @NotBlank(message = "Consistency level is required")
        private String consistencyLevel = "eventual";

        @NotBlank(message = "Test type is required")
        private String testType = "mixed";
    }
}
