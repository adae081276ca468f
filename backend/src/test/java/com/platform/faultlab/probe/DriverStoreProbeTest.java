package com.platform.faultlab.probe;

import com.platform.faultlab.config.ExecutorConfig;
import com.platform.faultlab.config.FaultLabProperties;
import com.platform.faultlab.observability.MetricsRegistry;
import com.platform.faultlab.store.StoreDriver;
import com.platform.faultlab.store.StoreId;
import com.platform.faultlab.store.StoreOutcome;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DriverStoreProbeTest {

    private StoreDriver driver;
    private ExecutorService executor;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        driver = mock(StoreDriver.class);
        when(driver.getStoreId()).thenReturn(StoreId.CASSANDRA);
        executor = Executors.newCachedThreadPool();
        meterRegistry = new SimpleMeterRegistry();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void successfulWriteAndReadReportsLatency() {
        when(driver.insert(eq("devices"), anyMap())).thenReturn(StoreOutcome.ok());
        when(driver.find(eq("devices"), anyMap())).thenReturn(StoreOutcome.ok(List.<Map<String, Object>>of(Map.of("id", "hb-1"))));

        ProbeResult result = probe(2000).probeAsync().join();

        assertThat(result.success()).isTrue();
        assertThat(result.latencyMs()).isNotNull().isGreaterThanOrEqualTo(0.0);
        assertThat(result.error()).isNull();
        verify(driver).find("devices", Map.of("id", "hb-1"));
        assertThat(meterRegistry.counter("faultlab.probe.total", "store", "cassandra", "success", "true").count())
            .isEqualTo(1.0);
    }

    @Test
    void failedWriteSkipsReadAndCarriesDriverError() {
        when(driver.insert(eq("devices"), anyMap())).thenReturn(StoreOutcome.failed("All host(s) tried for query failed"));

        ProbeResult result = probe(2000).probeAsync().join();

        assertThat(result.success()).isFalse();
        assertThat(result.latencyMs()).isNull();
        assertThat(result.error()).startsWith("All host(s) tried");
        verify(driver, never()).find(any(), any());
    }

    @Test
    void slowStoreTimesOut() {
        when(driver.insert(eq("devices"), anyMap())).thenAnswer(invocation -> {
            Thread.sleep(1000);
            return StoreOutcome.ok();
        });

        ProbeResult result = probe(50).probeAsync().join();

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Probe timed out after 50ms");
    }

    @Test
    void driverExceptionBecomesFailedResult() {
        when(driver.insert(eq("devices"), anyMap())).thenThrow(new IllegalStateException("session closed"));

        ProbeResult result = probe(2000).probeAsync().join();

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("session closed");
    }

    @Test
    void saturatedPoolFailsWithoutRunning() {
        DriverStoreProbe probe = new DriverStoreProbe(driver, "devices", "id", () -> Map.of("id", "hb-1"),
            task -> {
                throw new RejectedExecutionException("full");
            }, 2000, new MetricsRegistry(meterRegistry));

        ProbeResult result = probe.probeAsync().join();

        assertThat(result.error()).isEqualTo("Probe pool saturated");
        verify(driver, never()).insert(any(), any());
    }

    @Test
    void hungStoreDoesNotStarveTheOtherStoresProbes() {
        FaultLabProperties.Pool productionPool = new FaultLabProperties().getProbe().getPool();
        ThreadPoolTaskExecutor mongoPool = ExecutorConfig.boundedExecutor("test-probe-mongodb-", productionPool);
        ThreadPoolTaskExecutor cassandraPool = ExecutorConfig.boundedExecutor("test-probe-cassandra-", productionPool);
        mongoPool.initialize();
        cassandraPool.initialize();

        CountDownLatch release = new CountDownLatch(1);
        StoreDriver hungMongo = mock(StoreDriver.class);
        when(hungMongo.getStoreId()).thenReturn(StoreId.MONGODB);
        when(hungMongo.insert(eq("failure_monitor"), anyMap())).thenAnswer(invocation -> {
            release.await();
            return StoreOutcome.ok();
        });
        when(driver.insert(eq("devices"), anyMap())).thenReturn(StoreOutcome.ok());
        when(driver.find(eq("devices"), anyMap())).thenReturn(StoreOutcome.ok(List.<Map<String, Object>>of(Map.of("id", "hb-1"))));

        MetricsRegistry metrics = new MetricsRegistry(meterRegistry);
        DriverStoreProbe mongoProbe = new DriverStoreProbe(hungMongo, "failure_monitor", "_id",
            () -> Map.of("_id", "hb_1"), mongoPool, 300, metrics);
        DriverStoreProbe cassandraProbe = new DriverStoreProbe(driver, "devices", "id",
            () -> Map.of("id", "hb-1"), cassandraPool, 300, metrics);

        List<ProbeResult> mongoResults = new ArrayList<>();
        List<ProbeResult> cassandraResults = new ArrayList<>();
        try {
            for (int tick = 0; tick < 8; tick++) {
                CompletableFuture<ProbeResult> mongo = mongoProbe.probeAsync();
                CompletableFuture<ProbeResult> cassandra = cassandraProbe.probeAsync();
                mongoResults.add(mongo.join());
                cassandraResults.add(cassandra.join());
            }
        } finally {
            release.countDown();
            mongoPool.shutdown();
            cassandraPool.shutdown();
        }

        assertThat(mongoResults).allSatisfy(result -> assertThat(result.success()).isFalse());
        assertThat(cassandraResults).allSatisfy(result -> {
            assertThat(result.success()).isTrue();
            assertThat(result.error()).isNull();
        });
    }

    private DriverStoreProbe probe(long timeoutMs) {
        return new DriverStoreProbe(driver, "devices", "id", () -> Map.of("id", "hb-1", "name", "health_check"),
            executor, timeoutMs, new MetricsRegistry(meterRegistry));
    }
}
