package com.platform.faultlab.benchmark;

import com.platform.faultlab.store.StoreId;

import java.time.Instant;
import java.util.Map;

/**
 * Both stores' results for one benchmark run.
 */
public record BenchmarkReport(String benchmarkId, BenchmarkConfig config,
                              Map<StoreId, BenchmarkResult> results,
                              Instant startedAt, Instant completedAt) {

    public BenchmarkResult resultOf(StoreId store) {
        return results.get(store);
    }

    public int totalErrors() {
        return results.values().stream().mapToInt(BenchmarkResult::getErrorCount).sum();
    }

    public int totalBatches() {
        return results.values().stream().mapToInt(BenchmarkResult::getBatchCount).sum();
    }

    /**
     * Failed batches over executed batches, 0 when nothing ran.
     */
    public double errorRate() {
        int batches = totalBatches();
        return batches == 0 ? 0 : (double) totalErrors() / batches;
    }
}
