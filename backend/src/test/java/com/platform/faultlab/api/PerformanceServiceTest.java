package com.platform.faultlab.api;

import com.platform.faultlab.benchmark.BenchmarkConfig;
import com.platform.faultlab.benchmark.BenchmarkReport;
import com.platform.faultlab.benchmark.BenchmarkResult;
import com.platform.faultlab.benchmark.ConsistencyLevel;
import com.platform.faultlab.benchmark.OperationKind;
import com.platform.faultlab.benchmark.PerformanceBenchmarkRunner;
import com.platform.faultlab.benchmark.TestType;
import com.platform.faultlab.error.ReportPersistenceException;
import com.platform.faultlab.error.ValidationException;
import com.platform.faultlab.report.ReportSection;
import com.platform.faultlab.report.ReportSink;
import com.platform.faultlab.store.StoreId;
import com.platform.faultlab.store.StoreOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PerformanceServiceTest {

    private static final BenchmarkConfig CONFIG = new BenchmarkConfig(200, 100, ConsistencyLevel.STRONG, TestType.MIXED);

    private PerformanceBenchmarkRunner runner;
    private ReportSink reportSink;
    private PerformanceService service;

    @BeforeEach
    void setUp() {
        runner = mock(PerformanceBenchmarkRunner.class);
        reportSink = mock(ReportSink.class);
        service = new PerformanceService(runner, reportSink);
    }

    @Test
    void aggregatesBothStoresAndSavesReport() {
        when(runner.run(CONFIG)).thenReturn(report());
        when(reportSink.save(eq("performance"), eq("20240101_120000"), anyMap(), any(), any(ReportSection[].class)))
            .thenReturn(List.of(Path.of("reports/performance_20240101_120000.md"),
                Path.of("reports/performance_20240101_120000.json")));

        PerformanceResponse response = service.run(CONFIG);

        assertThat(response.summary().totalOps()).isEqualTo(200);
        assertThat(response.summary().errors()).isEqualTo(1);
        assertThat(response.summary().batches()).isEqualTo(4);
        assertThat(response.summary().errorRate()).isCloseTo(0.25, within(1e-9));
        assertThat(response.summary().consistencyLevel()).isEqualTo("strong");
        assertThat(response.latencyMetrics()).extracting(PerformanceResponse.LatencyPoint::operation)
            .containsExactly("insert", "read", "update");
        assertThat(response.latencyMetrics().get(0).mongodb()).isCloseTo(0.015, within(1e-9));
        assertThat(response.latencyMetrics().get(1).cassandra()).isZero();
        assertThat(response.throughputMetrics()).extracting(PerformanceResponse.ThroughputPoint::db)
            .containsExactly("MongoDB", "Cassandra");
        assertThat(response.detailedResults()).containsOnlyKeys("mongo", "cassandra");
        assertThat(response.detailedResults().get("cassandra").errorMessages()).containsExactly("read: timeout");
        assertThat(response.reports()).containsExactly(
            "performance_20240101_120000.md", "performance_20240101_120000.json");
    }

    @Test
    void unsavedReportDoesNotFailTheRun() {
        when(runner.run(CONFIG)).thenReturn(report());
        when(reportSink.save(anyString(), anyString(), anyMap(), any(), any(ReportSection[].class)))
            .thenThrow(new ReportPersistenceException(Path.of("reports/x.md"), new IOException("disk full")));

        PerformanceResponse response = service.run(CONFIG);

        assertThat(response.reports()).isEmpty();
        assertThat(response.summary().totalOps()).isEqualTo(200);
    }

    @Test
    void requestValuesAreParsed() {
        ApiRequests.PerformanceRunRequest request = new ApiRequests.PerformanceRunRequest();
        request.setTestType("compaction");

        assertThatThrownBy(() -> service.run(request)).isInstanceOf(ValidationException.class);
        verify(runner, never()).run(any());
    }

    @Test
    void cleanupListsStoreErrors() {
        Map<StoreId, StoreOutcome<Void>> outcomes = new EnumMap<>(StoreId.class);
        outcomes.put(StoreId.MONGODB, StoreOutcome.ok());
        outcomes.put(StoreId.CASSANDRA, StoreOutcome.failed("NoHostAvailableException"));
        when(runner.cleanup()).thenReturn(outcomes);

        Map<String, Object> body = service.cleanup();

        assertThat(body).containsEntry("status", "Cleaned with errors");
        assertThat(body).containsEntry("errors", Map.of("cassandra", "NoHostAvailableException"));
    }

    private static BenchmarkReport report() {
        BenchmarkResult mongo = BenchmarkResult.builder()
            .store(StoreId.MONGODB)
            .operationCount(200)
            .batchCount(2)
            .throughput(950.0)
            .totalTimeSeconds(0.21)
            .consistencyLevel(ConsistencyLevel.STRONG)
            .build();
        mongo.getLatencies().get(OperationKind.INSERT).addAll(List.of(0.01, 0.02));

        BenchmarkResult cassandra = BenchmarkResult.builder()
            .store(StoreId.CASSANDRA)
            .operationCount(200)
            .batchCount(2)
            .errorCount(1)
            .throughput(400.0)
            .totalTimeSeconds(0.5)
            .consistencyLevel(ConsistencyLevel.STRONG)
            .build();
        cassandra.getLatencies().get(OperationKind.INSERT).addAll(List.of(0.03, 0.05));
        cassandra.getErrors().add("read: timeout");

        Map<StoreId, BenchmarkResult> results = new EnumMap<>(StoreId.class);
        results.put(StoreId.MONGODB, mongo);
        results.put(StoreId.CASSANDRA, cassandra);
        Instant completed = Instant.parse("2024-01-01T12:00:00Z");
        return new BenchmarkReport("bench-1", CONFIG, results, completed.minusSeconds(1), completed);
    }
}
