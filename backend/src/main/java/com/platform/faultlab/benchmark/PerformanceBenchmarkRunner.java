package com.platform.faultlab.benchmark;

import com.platform.faultlab.config.ExecutorConfig;
import com.platform.faultlab.config.FaultLabProperties;
import com.platform.faultlab.observability.LoggingConfig;
import com.platform.faultlab.observability.MetricsRegistry;
import com.platform.faultlab.store.StoreDriver;
import com.platform.faultlab.store.StoreId;
import com.platform.faultlab.store.StoreOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs the same synthetic workload against both stores concurrently.
 *
 * Each store's workload runs on the benchmark pool; a failure in one never
 * affects the other.
 */
@Slf4j
@Service
public class PerformanceBenchmarkRunner {

    private static final Map<String, Object> READ_FILTER = Map.of("status", "ACTIVE");
    private static final Map<String, Object> UPDATE_PATCH = Map.of("status", "UPDATED");

    private final Map<StoreId, StoreDriver> drivers = new EnumMap<>(StoreId.class);
    private final BenchmarkRecordGenerator generator;
    private final Executor executor;
    private final FaultLabProperties properties;
    private final MetricsRegistry metricsRegistry;

    public PerformanceBenchmarkRunner(List<StoreDriver> drivers,
                                      BenchmarkRecordGenerator generator,
                                      @Qualifier(ExecutorConfig.BENCHMARK_EXECUTOR) Executor executor,
                                      FaultLabProperties properties,
                                      MetricsRegistry metricsRegistry) {
        drivers.forEach(driver -> this.drivers.put(driver.getStoreId(), driver));
        this.generator = generator;
        this.executor = executor;
        this.properties = properties;
        this.metricsRegistry = metricsRegistry;
    }

    /**
     * Run the workload on both stores and wait for both.
     */
    public BenchmarkReport run(BenchmarkConfig config) {
        String benchmarkId = UUID.randomUUID().toString();
        Instant startedAt = Instant.now();
        log.info("Starting benchmark {}: {} operations in batches of {} ({}, consistency {})",
            benchmarkId, config.operationCount(), config.batchSize(),
            config.testType().getValue(), config.consistencyLevel().getValue());

        Map<StoreId, CompletableFuture<BenchmarkResult>> pending = new LinkedHashMap<>();
        for (StoreId store : StoreId.values()) {
            pending.put(store, submit(benchmarkId, store, config));
        }

        Map<StoreId, BenchmarkResult> results = new EnumMap<>(StoreId.class);
        pending.forEach((store, future) -> results.put(store, future.join()));

        BenchmarkReport report = new BenchmarkReport(benchmarkId, config, results, startedAt, Instant.now());
        log.info("Benchmark {} finished: {} errors over {} batches",
            benchmarkId, report.totalErrors(), report.totalBatches());
        return report;
    }

    /**
     * Remove benchmark data from both stores.
     * @return per-store teardown outcome
     */
    public Map<StoreId, StoreOutcome<Void>> cleanup() {
        Map<StoreId, StoreOutcome<Void>> outcomes = new EnumMap<>(StoreId.class);
        for (StoreId store : StoreId.values()) {
            StoreDriver driver = drivers.get(store);
            outcomes.put(store, driver == null
                ? StoreOutcome.failed("No driver for " + store.getDisplayName())
                : teardown(driver));
        }
        return outcomes;
    }

    private CompletableFuture<BenchmarkResult> submit(String benchmarkId, StoreId store, BenchmarkConfig config) {
        StoreDriver driver = drivers.get(store);
        if (driver == null) {
            return CompletableFuture.completedFuture(
                BenchmarkResult.failure(store, config, "No driver for " + store.getDisplayName()));
        }
        try {
            return CompletableFuture
                .supplyAsync(() -> runWithContext(benchmarkId, driver, config), executor)
                .exceptionally(ex -> {
                    log.error("{} benchmark failed: {}", store.getDisplayName(), ex.getMessage(), ex);
                    return BenchmarkResult.failure(store, config, ex.getMessage());
                });
        } catch (RejectedExecutionException e) {
            log.warn("Benchmark pool saturated, cannot run {} workload", store.getDisplayName());
            return CompletableFuture.completedFuture(
                BenchmarkResult.failure(store, config, "Benchmark pool saturated"));
        }
    }

    private BenchmarkResult runWithContext(String benchmarkId, StoreDriver driver, BenchmarkConfig config) {
        LoggingConfig.setBenchmarkContext(benchmarkId, driver.getStoreId().getKey());
        try {
            return runStore(driver, config);
        } finally {
            LoggingConfig.clearBenchmarkContext();
        }
    }

    /**
     * Run one store's workload on the calling thread.
     */
    BenchmarkResult runStore(StoreDriver driver, BenchmarkConfig config) {
        StoreId store = driver.getStoreId();
        String table = properties.getBenchmark().getTable();

        StoreOutcome<Void> connected = driver.connect();
        if (connected.isFailure()) {
            log.error("{} unavailable: {}", store.getDisplayName(), connected.error());
            return BenchmarkResult.failure(store, config, store.getDisplayName() + " unavailable: " + connected.error());
        }
        teardown(driver);
        StoreOutcome<Void> ready = driver.ensureTable(table);
        if (ready.isFailure()) {
            log.error("Cannot prepare {} on {}: {}", table, store.getDisplayName(), ready.error());
            return BenchmarkResult.failure(store, config, "Cannot prepare " + table + ": " + ready.error());
        }

        List<Map<String, Object>> records = generator.generate(config.operationCount());
        BenchmarkResult result = BenchmarkResult.builder()
            .store(store)
            .operationCount(config.operationCount())
            .consistencyLevel(config.consistencyLevel())
            .build();

        long start = System.nanoTime();
        for (int from = 0; from < records.size(); from += config.batchSize()) {
            List<Map<String, Object>> batch = records.subList(from, Math.min(from + config.batchSize(), records.size()));
            result.setBatchCount(result.getBatchCount() + 1);
            String error = runBatch(driver, table, batch, config.testType(), result);
            if (error != null) {
                result.setErrorCount(result.getErrorCount() + 1);
                result.getErrors().add(error);
                metricsRegistry.recordBenchmarkError(store.getKey());
                log.warn("{} batch {} failed: {}", store.getDisplayName(), result.getBatchCount(), error);
            }
        }
        double total = (System.nanoTime() - start) / 1e9;

        result.setTotalTimeSeconds(total);
        result.setThroughput(total > 0 ? config.operationCount() / total : 0);
        teardown(driver);

        log.info("{} finished {} batches in {}s ({} ops/s, {} errors)", store.getDisplayName(),
            result.getBatchCount(), String.format("%.3f", total),
            String.format("%.1f", result.getThroughput()), result.getErrorCount());
        return result;
    }

    /**
     * Run one batch. Stops at the first failed operation.
     * @return the error, or null if every operation succeeded
     */
    private String runBatch(StoreDriver driver, String table, List<Map<String, Object>> batch,
                            TestType testType, BenchmarkResult result) {
        long t0 = System.nanoTime();
        StoreOutcome<Integer> inserted = driver.insertAll(table, batch);
        if (inserted.isFailure()) {
            return "insert: " + inserted.error();
        }
        record(result, OperationKind.INSERT, t0);

        if (testType.includesRead()) {
            t0 = System.nanoTime();
            StoreOutcome<List<Map<String, Object>>> found = driver.find(table, READ_FILTER);
            if (found.isFailure()) {
                return "read: " + found.error();
            }
            record(result, OperationKind.READ, t0);
        }

        if (testType.includesUpdate()) {
            t0 = System.nanoTime();
            for (Map<String, Object> row : batch) {
                StoreOutcome<Long> updated = driver.update(table, Map.of("id", row.get("id")), UPDATE_PATCH);
                if (updated.isFailure()) {
                    return "update: " + updated.error();
                }
            }
            record(result, OperationKind.UPDATE, t0);
        }
        return null;
    }

    private void record(BenchmarkResult result, OperationKind operation, long startNanos) {
        double seconds = (System.nanoTime() - startNanos) / 1e9;
        result.getLatencies().get(operation).add(seconds);
        metricsRegistry.recordBenchmarkLatency(result.getStore().getKey(), operation.getKey(), seconds);
    }

    private StoreOutcome<Void> teardown(StoreDriver driver) {
        StoreOutcome<Void> outcome = driver.truncate(properties.getBenchmark().getTable());
        if (outcome.isFailure()) {
            log.warn("{} cleanup failed: {}", driver.getStoreId().getDisplayName(), outcome.error());
        }
        return outcome;
    }
}
