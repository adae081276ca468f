package com.platform.faultlab.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Central registry for all application metrics.
 * Records scenario, probe and benchmark activity against the Micrometer registry.
 */
@Slf4j
@Component
public class MetricsRegistry {

    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters;
    private final Map<String, Timer> timers;
    private final AtomicInteger syntheticMode = new AtomicInteger(-1);
    private final AtomicInteger runningScenarios = new AtomicInteger(0);

    public MetricsRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.counters = new ConcurrentHashMap<>();
        this.timers = new ConcurrentHashMap<>();

        Gauge.builder("faultlab.infra.synthetic", syntheticMode, AtomicInteger::get)
            .description("1 when the orchestrator fell back to synthetic mode, 0 when live, -1 before detection")
            .register(meterRegistry);
        Gauge.builder("faultlab.scenarios.running", runningScenarios, AtomicInteger::get)
            .register(meterRegistry);

        log.info("Metrics registry initialized");
    }

    /**
     * Record the detected infrastructure mode.
     */
    public void recordInfraMode(boolean synthetic) {
        syntheticMode.set(synthetic ? 1 : 0);
    }

    /**
     * Record a failure scenario started.
     */
    public void recordScenarioStarted(String kind) {
        runningScenarios.incrementAndGet();
        incrementCounter("faultlab.scenarios.started", "kind", kind);
        log.debug("Recorded scenario started: {}", kind);
    }

    /**
     * Record a failure scenario completed.
     */
    public void recordScenarioCompleted(String kind, String outcome, long durationMs) {
        runningScenarios.decrementAndGet();
        incrementCounter("faultlab.scenarios.completed", "kind", kind, "outcome", outcome);
        timer("faultlab.scenario.duration", "kind", kind).record(Duration.ofMillis(durationMs));
        log.debug("Recorded scenario completed: {} ({}) in {}ms", kind, outcome, durationMs);
    }

    /**
     * Record one probe against a store.
     */
    public void recordProbe(String store, boolean success, Double latencyMs) {
        incrementCounter("faultlab.probe.total", "store", store, "success", String.valueOf(success));
        if (latencyMs != null) {
            timer("faultlab.probe.latency", "store", store)
                .record(Duration.ofNanos((long) (latencyMs * 1_000_000)));
        }
    }

    /**
     * Record the latency of one benchmark batch operation.
     */
    public void recordBenchmarkLatency(String store, String operation, double seconds) {
        timer("faultlab.benchmark.latency", "store", store, "operation", operation)
            .record(Duration.ofNanos((long) (seconds * 1_000_000_000L)));
    }

    /**
     * Record a failed benchmark batch.
     */
    public void recordBenchmarkError(String store) {
        incrementCounter("faultlab.benchmark.errors", "store", store);
    }

    /**
     * Increment a counter with tags.
     */
    public void incrementCounter(String name, String... tags) {
        String key = name + String.join(".", tags);
        counters.computeIfAbsent(key, k ->
            Counter.builder(name)
                .tags(tags)
                .register(meterRegistry))
            .increment();
    }

    private Timer timer(String name, String... tags) {
        String key = name + String.join(".", tags);
        return timers.computeIfAbsent(key, k ->
            Timer.builder(name)
                .tags(tags)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry));
    }
}
