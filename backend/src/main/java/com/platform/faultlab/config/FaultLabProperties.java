package com.platform.faultlab.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for scenarios, probes, benchmarks and reports.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "faultlab")
public class FaultLabProperties {

    private Scenario scenario = new Scenario();

    private Probe probe = new Probe();

    private Benchmark benchmark = new Benchmark();

    private Report report = new Report();

    /**
     * Nodes restarted by the stop endpoint and listed in uptime queries by default.
     */
    private List<String> knownNodes = new ArrayList<>(List.of(
        "mongo1", "mongo2", "mongo3", "cassandra1", "cassandra2", "cassandra3"));

    @Data
    public static class Scenario {
        /**
         * Upper bound for a scenario's duration in seconds.
         */
        private int maxDurationSeconds = 300;

        /**
         * Maximum number of ticks spent waiting for restored nodes to report running.
         */
        private int recoveryCeilingTicks = 10;

        /**
         * Length of one tick in milliseconds.
         */
        private long tickMillis = 1000;
    }

    @Data
    public static class Probe {
        /**
         * Per-probe timeout in milliseconds.
         */
        private long timeoutMs = 2000;

        /**
         * Sizing for each store's probe pool. Every store gets a pool of this size.
         */
        private Pool pool = new Pool(4, 8, 64);
    }

    @Data
    public static class Benchmark {
        private String table = "performance_test";

        private Pool pool = new Pool(2, 4, 8);
    }

    @Data
    public static class Report {
        private boolean enabled = true;

        /**
         * Directory the Markdown and JSON reports are written to.
         */
        private String directory = "logs/performance_reports";
    }

    @Data
    public static class Pool {
        private int coreSize;
        private int maxSize;
        private int queueCapacity;

        public Pool() {
        }

        public Pool(int coreSize, int maxSize, int queueCapacity) {
            this.coreSize = coreSize;
            this.maxSize = maxSize;
            this.queueCapacity = queueCapacity;
        }
    }
}
