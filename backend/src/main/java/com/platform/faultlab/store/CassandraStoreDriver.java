package com.platform.faultlab.store;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.config.DefaultDriverOption;
import com.datastax.oss.driver.api.core.config.DriverConfigLoader;
import com.datastax.oss.driver.api.core.cql.AsyncResultSet;
import com.datastax.oss.driver.api.core.cql.ColumnDefinitions;
import com.datastax.oss.driver.api.core.cql.PreparedStatement;
import com.datastax.oss.driver.api.core.cql.Row;
import com.datastax.oss.driver.api.core.cql.SimpleStatement;
import com.platform.faultlab.config.StoreConfig;
import com.platform.faultlab.observability.MetricsRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Cassandra driver over the DataStax Java driver 4.x.
 * All statements use keyspace-qualified table names.
 */
@Slf4j
@Component
public class CassandraStoreDriver implements StoreDriver {

    private final StoreConfig.Cassandra config;
    private final Retry retry;
    private final AtomicReference<CqlSession> session = new AtomicReference<>();
    private final Map<String, PreparedStatement> preparedCache = new ConcurrentHashMap<>();

    public CassandraStoreDriver(StoreConfig storeConfig, RetryRegistry retryRegistry, MetricsRegistry metricsRegistry) {
        this.config = storeConfig.getCassandra();
        this.retry = retryRegistry.retry(StoreId.CASSANDRA.getKey());
        this.retry.getEventPublisher().onRetry(event -> {
            log.warn("Cassandra connect attempt {} failed: {}",
                event.getNumberOfRetryAttempts(), event.getLastThrowable().getMessage());
            metricsRegistry.incrementCounter("faultlab.store.connect.retry", "store", StoreId.CASSANDRA.getKey());
        });
    }

    @Override
    public StoreId getStoreId() {
        return StoreId.CASSANDRA;
    }

    /**
     * Connect with retries. Used at startup and by explicit callers.
     */
    @Override
    public StoreOutcome<Void> connect() {
        if (session.get() != null) {
            return StoreOutcome.ok();
        }
        try {
            retry.executeRunnable(this::openSession);
            return StoreOutcome.ok();
        } catch (Exception e) {
            log.error("Failed to connect to Cassandra at {}: {}", config.getContactPoints(), e.getMessage());
            return StoreOutcome.failed(e);
        }
    }

    @Override
    public StoreOutcome<Void> ensureTable(String table) {
        return withSession("ensureTable", s -> {
            s.execute(schema(CqlStatements.createTable(config.getKeyspace(), table)));
            return null;
        });
    }

    @Override
    public StoreOutcome<Void> insert(String table, Map<String, Object> row) {
        return withSession("insert", s -> {
            Map<String, Object> values = CqlStatements.bindableValues(row);
            PreparedStatement prepared = prepare(s, CqlStatements.insert(config.getKeyspace(), table, values.keySet()));
            s.execute(prepared.bind(values.values().toArray()));
            return null;
        });
    }

    @Override
    public StoreOutcome<Integer> insertAll(String table, List<Map<String, Object>> rows) {
        if (rows.isEmpty()) {
            return StoreOutcome.ok(0);
        }
        return withSession("insertAll", s -> {
            List<CompletableFuture<AsyncResultSet>> writes = new ArrayList<>(rows.size());
            for (Map<String, Object> row : rows) {
                Map<String, Object> values = CqlStatements.bindableValues(row);
                PreparedStatement prepared = prepare(s, CqlStatements.insert(config.getKeyspace(), table, values.keySet()));
                writes.add(s.executeAsync(prepared.bind(values.values().toArray())).toCompletableFuture());
            }
            CompletableFuture.allOf(writes.toArray(new CompletableFuture[0])).join();
            return rows.size();
        });
    }

    @Override
    public StoreOutcome<List<Map<String, Object>>> find(String table, Map<String, Object> filter) {
        return withSession("find", s -> {
            Map<String, Object> values = CqlStatements.bindableValues(filter);
            PreparedStatement prepared = prepare(s, CqlStatements.select(config.getKeyspace(), table, values.keySet()));
            List<Map<String, Object>> rows = new ArrayList<>();
            for (Row row : s.execute(prepared.bind(values.values().toArray()))) {
                rows.add(toMap(row));
            }
            return rows;
        });
    }

    @Override
    public StoreOutcome<Long> update(String table, Map<String, Object> filter, Map<String, Object> patch) {
        return withSession("update", s -> {
            Map<String, Object> setValues = CqlStatements.bindableValues(patch);
            setValues.remove("id");
            Map<String, Object> whereValues = CqlStatements.bindableValues(filter);
            PreparedStatement prepared = prepare(s,
                CqlStatements.update(config.getKeyspace(), table, setValues.keySet(), whereValues.keySet()));

            List<Object> bound = new ArrayList<>(setValues.values());
            bound.addAll(whereValues.values());
            s.execute(prepared.bind(bound.toArray()));
            // Cassandra does not report affected rows
            return -1L;
        });
    }

    @Override
    public StoreOutcome<Void> truncate(String table) {
        return withSession("truncate", s -> {
            s.execute(schema(CqlStatements.createTable(config.getKeyspace(), table)));
            s.execute(schema(CqlStatements.truncate(config.getKeyspace(), table)));
            return null;
        });
    }

    @Override
    public boolean isConnected() {
        CqlSession current = session.get();
        return current != null && !current.isClosed();
    }

    @Override
    @PreDestroy
    public void disconnect() {
        CqlSession current = session.getAndSet(null);
        preparedCache.clear();
        if (current != null) {
            current.close();
            log.info("Disconnected from Cassandra");
        }
    }

    private <T> StoreOutcome<T> withSession(String operation, Function<CqlSession, T> action) {
        try {
            CqlSession current = session.get();
            if (current == null) {
                openSession();
                current = session.get();
            }
            return StoreOutcome.ok(action.apply(current));
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.debug("Cassandra {} failed: {}", operation, cause.getMessage());
            return StoreOutcome.failed(cause);
        } catch (Exception e) {
            log.debug("Cassandra {} failed: {}", operation, e.getMessage());
            return StoreOutcome.failed(e);
        }
    }

    private PreparedStatement prepare(CqlSession s, String query) {
        return preparedCache.computeIfAbsent(query, s::prepare);
    }

    private synchronized void openSession() {
        if (session.get() != null) {
            return;
        }
        List<InetSocketAddress> contactPoints = new ArrayList<>();
        for (String host : config.getContactPoints()) {
            contactPoints.add(new InetSocketAddress(host.trim(), config.getPort()));
        }

        DriverConfigLoader loader = DriverConfigLoader.programmaticBuilder()
            .withDuration(DefaultDriverOption.REQUEST_TIMEOUT, Duration.ofMillis(config.getRequestTimeoutMs()))
            .withDuration(DefaultDriverOption.CONNECTION_INIT_QUERY_TIMEOUT, Duration.ofMillis(config.getSchemaTimeoutMs()))
            .build();

        long start = System.currentTimeMillis();
        CqlSession created = CqlSession.builder()
            .addContactPoints(contactPoints)
            .withLocalDatacenter(config.getLocalDatacenter())
            .withConfigLoader(loader)
            .build();
        try {
            created.execute(schema(CqlStatements.createKeyspace(config.getKeyspace(), config.getReplicationFactor())));
            created.execute(schema(CqlStatements.createTable(config.getKeyspace(), "devices")));
        } catch (RuntimeException e) {
            created.close();
            throw e;
        }
        session.set(created);
        log.info("Connected to Cassandra keyspace {} in {}ms", config.getKeyspace(), System.currentTimeMillis() - start);
    }

    private static Map<String, Object> toMap(Row row) {
        ColumnDefinitions definitions = row.getColumnDefinitions();
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < definitions.size(); i++) {
            values.put(definitions.get(i).getName().asInternal(), row.getObject(i));
        }
        return values;
    }

    // DDL and TRUNCATE wait for schema agreement, so they get a longer budget than probe traffic.
    private SimpleStatement schema(String cql) {
        return SimpleStatement.newInstance(cql).setTimeout(Duration.ofMillis(config.getSchemaTimeoutMs()));
    }
}
