package com.platform.faultlab.config;

import com.platform.faultlab.scenario.TickClock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Worker pools for blocking driver calls and the scenario tick clock.
 * Each store gets its own probe pool so a hung store cannot starve the other.
 */
@Slf4j
@Configuration
public class ExecutorConfig {

    public static final String MONGO_PROBE_EXECUTOR = "mongoProbeExecutor";
    public static final String CASSANDRA_PROBE_EXECUTOR = "cassandraProbeExecutor";
    public static final String BENCHMARK_EXECUTOR = "benchmarkExecutor";
    public static final String STARTUP_EXECUTOR = "storeStartupExecutor";

    @Bean(name = MONGO_PROBE_EXECUTOR)
    public ThreadPoolTaskExecutor mongoProbeExecutor(FaultLabProperties properties) {
        return boundedExecutor("probe-mongodb-", properties.getProbe().getPool());
    }

    @Bean(name = CASSANDRA_PROBE_EXECUTOR)
    public ThreadPoolTaskExecutor cassandraProbeExecutor(FaultLabProperties properties) {
        return boundedExecutor("probe-cassandra-", properties.getProbe().getPool());
    }

    @Bean(name = BENCHMARK_EXECUTOR)
    public ThreadPoolTaskExecutor benchmarkExecutor(FaultLabProperties properties) {
        return boundedExecutor("benchmark-", properties.getBenchmark().getPool());
    }

    /**
     * Runs the connect-with-retry loops at startup. One thread per store, so a
     * store that never comes up holds only its own thread.
     */
    @Bean(name = STARTUP_EXECUTOR)
    public ThreadPoolTaskExecutor storeStartupExecutor() {
        return boundedExecutor("store-startup-", new FaultLabProperties.Pool(2, 2, 4));
    }

    @Bean
    public TickClock tickClock(FaultLabProperties properties) {
        return TickClock.wallClock(properties.getScenario().getTickMillis());
    }

    /**
     * Fixed-bound pool that rejects rather than blocks once the queue is full.
     * Callers outside a Spring context must call {@code initialize()} themselves.
     */
    public static ThreadPoolTaskExecutor boundedExecutor(String prefix, FaultLabProperties.Pool pool) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix(prefix);
        executor.setCorePoolSize(pool.getCoreSize());
        executor.setMaxPoolSize(pool.getMaxSize());
        executor.setQueueCapacity(pool.getQueueCapacity());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        log.info("Initialized {} pool (core={}, max={}, queue={})",
            prefix.substring(0, prefix.length() - 1), pool.getCoreSize(), pool.getMaxSize(), pool.getQueueCapacity());
        return executor;
    }
}
