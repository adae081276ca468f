package com.platform.faultlab.benchmark;

import com.platform.faultlab.store.StoreId;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Measurements of one store's benchmark workload.
 */
@Data
@Builder
public class BenchmarkResult {

    private StoreId store;

    /**
     * Batch latencies in seconds per operation, in batch order.
     */
    @Builder.Default
    private Map<OperationKind, List<Double>> latencies = emptyLatencies();

    /**
     * Operations per second over the whole run.
     */
    private double throughput;

    /**
     * Number of failed batches.
     */
    private int errorCount;

    private double totalTimeSeconds;

    private int operationCount;

    private int batchCount;

    private ConsistencyLevel consistencyLevel;

    /**
     * True when the workload could not run at all.
     */
    private boolean failed;

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    /**
     * Mean latency of an operation in seconds, 0 when it never succeeded.
     */
    public double meanLatency(OperationKind operation) {
        List<Double> values = latencies.getOrDefault(operation, List.of());
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0);
    }

    public static Map<OperationKind, List<Double>> emptyLatencies() {
        Map<OperationKind, List<Double>> latencies = new EnumMap<>(OperationKind.class);
        for (OperationKind operation : OperationKind.values()) {
            latencies.put(operation, new ArrayList<>());
        }
        return latencies;
    }

    /**
     * Result for a store whose workload could not run, counted as one error.
     */
    public static BenchmarkResult failure(StoreId store, BenchmarkConfig config, String error) {
        BenchmarkResult result = BenchmarkResult.builder()
            .store(store)
            .operationCount(config.operationCount())
            .consistencyLevel(config.consistencyLevel())
            .errorCount(1)
            .failed(true)
            .build();
        result.getErrors().add(error);
        return result;
    }
}
