package com.platform.faultlab.api;

import java.util.List;
import java.util.Map;

/**
 * Response of a benchmark run, shaped for the dashboard charts.
 */
public record PerformanceResponse(
    Summary summary,
    List<LatencyPoint> latencyMetrics,
    List<ThroughputPoint> throughputMetrics,
    Map<String, StoreDetails> detailedResults,
    List<String> reports
) {

    public record Summary(
        int totalOps,
        int errors,
        int batches,
        double errorRate,
        String testType,
        String consistencyLevel,
        String benchmarkId
    ) {}

    /**
     * Mean latency of one operation in seconds for each store.
     */
    public record LatencyPoint(String operation, double mongodb, double cassandra) {}

    public record ThroughputPoint(String db, double throughput) {}

    public record StoreDetails(
        Map<String, List<Double>> latencies,
        int errors,
        int totalOperations,
        int batchCount,
        double throughput,
        double totalTime,
        boolean failed,
        List<String> errorMessages
    ) {}
}
