package com.platform.faultlab.probe;

import com.platform.faultlab.config.ExecutorConfig;
import com.platform.faultlab.config.FaultLabProperties;
import com.platform.faultlab.observability.MetricsRegistry;
import com.platform.faultlab.store.CassandraStoreDriver;
import com.platform.faultlab.store.MongoStoreDriver;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One probe per store, each writing to its own heartbeat table on its own worker pool.
 */
@Configuration
public class ProbeConfig {

    @Bean
    public StoreProbe mongoProbe(
            MongoStoreDriver driver,
            @Qualifier(ExecutorConfig.MONGO_PROBE_EXECUTOR) ThreadPoolTaskExecutor executor,
            FaultLabProperties properties,
            MetricsRegistry metricsRegistry) {
        return new DriverStoreProbe(driver, "failure_monitor", "_id", () -> {
            Map<String, Object> heartbeat = new LinkedHashMap<>();
            heartbeat.put("_id", "hb_" + UUID.randomUUID());
            heartbeat.put("ts", new Date());
            return heartbeat;
        }, executor, properties.getProbe().getTimeoutMs(), metricsRegistry);
    }

    @Bean
    public StoreProbe cassandraProbe(
            CassandraStoreDriver driver,
            @Qualifier(ExecutorConfig.CASSANDRA_PROBE_EXECUTOR) ThreadPoolTaskExecutor executor,
            FaultLabProperties properties,
            MetricsRegistry metricsRegistry) {
        return new DriverStoreProbe(driver, "devices", "id", () -> {
            Map<String, Object> heartbeat = new LinkedHashMap<>();
            heartbeat.put("id", UUID.randomUUID());
            heartbeat.put("name", "health_check");
            heartbeat.put("status", "active");
            heartbeat.put("type", "monitor");
            return heartbeat;
        }, executor, properties.getProbe().getTimeoutMs(), metricsRegistry);
    }
}
