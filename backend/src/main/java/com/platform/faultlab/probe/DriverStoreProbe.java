package com.platform.faultlab.probe;

import com.platform.faultlab.observability.MetricsRegistry;
import com.platform.faultlab.store.StoreDriver;
import com.platform.faultlab.store.StoreId;
import com.platform.faultlab.store.StoreOutcome;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Probe that inserts a heartbeat row through a {@link StoreDriver} and reads it back by key.
 * The blocking driver calls run on the given executor.
 */
@Slf4j
public class DriverStoreProbe implements StoreProbe {

    private final StoreDriver driver;
    private final String table;
    private final String keyColumn;
    private final Supplier<Map<String, Object>> heartbeatFactory;
    private final Executor executor;
    private final long timeoutMs;
    private final MetricsRegistry metricsRegistry;

    public DriverStoreProbe(
            StoreDriver driver,
            String table,
            String keyColumn,
            Supplier<Map<String, Object>> heartbeatFactory,
            Executor executor,
            long timeoutMs,
            MetricsRegistry metricsRegistry) {
        this.driver = driver;
        this.table = table;
        this.keyColumn = keyColumn;
        this.heartbeatFactory = heartbeatFactory;
        this.executor = executor;
        this.timeoutMs = timeoutMs;
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public StoreId getStoreId() {
        return driver.getStoreId();
    }

    @Override
    public CompletableFuture<ProbeResult> probeAsync() {
        CompletableFuture<ProbeResult> probe;
        try {
            probe = CompletableFuture.supplyAsync(this::probe, executor);
        } catch (RejectedExecutionException e) {
            log.warn("{} probe rejected, worker pool saturated", getStoreId().getDisplayName());
            return CompletableFuture.completedFuture(record(ProbeResult.failed("Probe pool saturated")));
        }
        return probe
            .completeOnTimeout(ProbeResult.failed("Probe timed out after " + timeoutMs + "ms"),
                timeoutMs, TimeUnit.MILLISECONDS)
            .exceptionally(e -> ProbeResult.failed(messageOf(e)))
            .thenApply(this::record);
    }

    ProbeResult probe() {
        long start = System.nanoTime();
        Map<String, Object> heartbeat = heartbeatFactory.get();

        StoreOutcome<Void> written = driver.insert(table, heartbeat);
        if (written.isFailure()) {
            return ProbeResult.failed(written.error());
        }
        StoreOutcome<List<Map<String, Object>>> read =
            driver.find(table, Map.of(keyColumn, heartbeat.get(keyColumn)));
        if (read.isFailure()) {
            return ProbeResult.failed(read.error());
        }

        double latencyMs = Math.round((System.nanoTime() - start) / 10_000.0) / 100.0;
        return ProbeResult.ok(latencyMs);
    }

    private ProbeResult record(ProbeResult result) {
        metricsRegistry.recordProbe(getStoreId().getKey(), result.success(), result.latencyMs());
        if (!result.success()) {
            log.debug("{} probe failed: {}", getStoreId().getDisplayName(), result.error());
        }
        return result;
    }

    private static String messageOf(Throwable e) {
        Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
