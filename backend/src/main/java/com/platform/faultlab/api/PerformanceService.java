package com.platform.faultlab.api;

import com.platform.faultlab.benchmark.BenchmarkConfig;
import com.platform.faultlab.benchmark.BenchmarkReport;
import com.platform.faultlab.benchmark.BenchmarkResult;
import com.platform.faultlab.benchmark.ConsistencyLevel;
import com.platform.faultlab.benchmark.OperationKind;
import com.platform.faultlab.benchmark.PerformanceBenchmarkRunner;
import com.platform.faultlab.benchmark.TestType;
import com.platform.faultlab.error.ReportPersistenceException;
import com.platform.faultlab.report.FileReportSink;
import com.platform.faultlab.report.ReportSection;
import com.platform.faultlab.report.ReportSink;
import com.platform.faultlab.store.StoreId;
import com.platform.faultlab.store.StoreOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Runs benchmarks, aggregates both stores' results and saves the report.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PerformanceService {

    static final String REPORT_PREFIX = "performance";

    private final PerformanceBenchmarkRunner runner;
    private final ReportSink reportSink;

    public PerformanceResponse run(ApiRequests.PerformanceRunRequest request) {
        BenchmarkConfig config = new BenchmarkConfig(
            request.getOperationCount(),
            request.getBatchSize(),
            ConsistencyLevel.fromValue(request.getConsistencyLevel()),
            TestType.fromValue(request.getTestType()));
        return run(config);
    }

    public PerformanceResponse run(BenchmarkConfig config) {
        BenchmarkReport report = runner.run(config);
        PerformanceResponse response = toResponse(report, List.of());
        List<String> saved = save(report, response);
        return new PerformanceResponse(response.summary(), response.latencyMetrics(),
            response.throughputMetrics(), response.detailedResults(), saved);
    }

    /**
     * Remove benchmark data from both stores.
     */
    public Map<String, Object> cleanup() {
        Map<StoreId, StoreOutcome<Void>> outcomes = runner.cleanup();
        Map<String, String> errors = new LinkedHashMap<>();
        outcomes.forEach((store, outcome) -> {
            if (outcome.isFailure()) {
                errors.put(store.getKey(), outcome.error());
            }
        });
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", errors.isEmpty() ? "Cleaned successfully" : "Cleaned with errors");
        if (!errors.isEmpty()) {
            body.put("errors", errors);
        }
        return body;
    }

    PerformanceResponse toResponse(BenchmarkReport report, List<String> reports) {
        BenchmarkResult mongo = report.resultOf(StoreId.MONGODB);
        BenchmarkResult cassandra = report.resultOf(StoreId.CASSANDRA);

        List<PerformanceResponse.LatencyPoint> latency = new ArrayList<>();
        for (OperationKind operation : OperationKind.values()) {
            latency.add(new PerformanceResponse.LatencyPoint(operation.getKey(),
                mongo.meanLatency(operation), cassandra.meanLatency(operation)));
        }

        List<PerformanceResponse.ThroughputPoint> throughput = List.of(
            new PerformanceResponse.ThroughputPoint(StoreId.MONGODB.getDisplayName(), mongo.getThroughput()),
            new PerformanceResponse.ThroughputPoint(StoreId.CASSANDRA.getDisplayName(), cassandra.getThroughput()));

        PerformanceResponse.Summary summary = new PerformanceResponse.Summary(
            report.config().operationCount(),
            report.totalErrors(),
            report.totalBatches(),
            report.errorRate(),
            report.config().testType().getValue(),
            report.config().consistencyLevel().getValue(),
            report.benchmarkId());

        Map<String, PerformanceResponse.StoreDetails> details = new LinkedHashMap<>();
        details.put("mongo", details(mongo));
        details.put("cassandra", details(cassandra));

        return new PerformanceResponse(summary, latency, throughput, details, reports);
    }

    private List<String> save(BenchmarkReport report, PerformanceResponse response) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("totalOps", response.summary().totalOps());
        summary.put("errors", response.summary().errors());
        summary.put("errorRate", response.summary().errorRate());
        summary.put("testType", response.summary().testType());
        summary.put("consistencyLevel", response.summary().consistencyLevel());

        ReportSection latency = new ReportSection("Latency", response.latencyMetrics().stream()
            .map(p -> row("operation", p.operation(), "mongodb", p.mongodb(), "cassandra", p.cassandra()))
            .collect(Collectors.toList()));
        ReportSection throughput = new ReportSection("Throughput", response.throughputMetrics().stream()
            .map(p -> row("db", p.db(), "throughput", p.throughput()))
            .collect(Collectors.toList()));

        try {
            List<Path> paths = reportSink.save(REPORT_PREFIX, FileReportSink.timestamp(report.completedAt()),
                summary, response.detailedResults(), latency, throughput);
            return paths.stream().map(p -> p.getFileName().toString()).collect(Collectors.toList());
        } catch (ReportPersistenceException e) {
            log.error("Benchmark {} finished but its report was not saved: {}", report.benchmarkId(), e.getMessage(), e);
            return List.of();
        }
    }

    private static PerformanceResponse.StoreDetails details(BenchmarkResult result) {
        Map<String, List<Double>> latencies = new LinkedHashMap<>();
        result.getLatencies().forEach((operation, values) -> latencies.put(operation.getKey(), values));
        return new PerformanceResponse.StoreDetails(
            latencies,
            result.getErrorCount(),
            result.getOperationCount(),
            result.getBatchCount(),
            result.getThroughput(),
            result.getTotalTimeSeconds(),
            result.isFailed(),
            result.getErrors());
    }

    private static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }
}
