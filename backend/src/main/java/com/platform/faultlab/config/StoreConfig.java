package com.platform.faultlab.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Connection settings for the MongoDB replica set and the Cassandra ring.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "faultlab.stores")
public class StoreConfig {

    /**
     * Open both store sessions once the application is ready.
     */
    private boolean connectOnStartup = true;

    private Mongo mongo = new Mongo();

    private Cassandra cassandra = new Cassandra();

    @Data
    public static class Mongo {
        private String uri = "mongodb://mongo1:27017,mongo2:27017,mongo3:27017/?replicaSet=rs0";

        private String database = "testDB";

        private int serverSelectionTimeoutMs = 1500;

        private int connectTimeoutMs = 2000;

        /**
         * Socket read timeout. Kept below faultlab.probe.timeout-ms so a hung member
         * releases its probe worker before the next tick.
         */
        private int readTimeoutMs = 1500;
    }

    @Data
    public static class Cassandra {
        private List<String> contactPoints = new ArrayList<>(List.of("cassandra1", "cassandra2", "cassandra3"));

        private int port = 9042;

        private String localDatacenter = "datacenter1";

        private String keyspace = "testkeyspace";

        private int replicationFactor = 3;

        /**
         * Per-request timeout for reads and writes. Kept below faultlab.probe.timeout-ms.
         */
        private int requestTimeoutMs = 1500;

        /**
         * Timeout for keyspace and table DDL, truncation and connection init queries.
         */
        private int schemaTimeoutMs = 10000;
    }
}
