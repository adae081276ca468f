package com.platform.faultlab;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Fault Lab Application
 *
 * Drives controlled failure scenarios and benchmarks against:
 * - MongoDB (three-node replica set)
 * - Cassandra (three-node ring)
 *
 * Features:
 * - Node failure and network partition injection through the Docker Engine
 * - Synthetic mode when no orchestrator is reachable
 * - Per-tick availability probes and recovery measurement
 * - Concurrent throughput and latency benchmarks with saved reports
 *
 * Store clients are built by the store drivers, so Spring Boot's own
 * MongoDB and Cassandra client auto-configuration is excluded.
 */
@SpringBootApplication(exclude = {
    org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration.class,
    org.springframework.boot.autoconfigure.cassandra.CassandraAutoConfiguration.class
})
public class FaultLabApplication {

    public static void main(String[] args) {
        SpringApplication.run(FaultLabApplication.class, args);
    }
}
