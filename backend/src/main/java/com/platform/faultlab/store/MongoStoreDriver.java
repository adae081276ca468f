package com.platform.faultlab.store;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoCommandException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.result.UpdateResult;
import com.platform.faultlab.config.StoreConfig;
import com.platform.faultlab.observability.MetricsRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.bson.UuidRepresentation;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * MongoDB driver over the synchronous Java driver. Tables map to collections.
 */
@Slf4j
@Component
public class MongoStoreDriver implements StoreDriver {

    private static final int NAMESPACE_EXISTS = 48;

    private final StoreConfig.Mongo config;
    private final Retry retry;
    private final AtomicReference<MongoClient> client = new AtomicReference<>();

    public MongoStoreDriver(StoreConfig storeConfig, RetryRegistry retryRegistry, MetricsRegistry metricsRegistry) {
        this.config = storeConfig.getMongo();
        this.retry = retryRegistry.retry(StoreId.MONGODB.getKey());
        this.retry.getEventPublisher().onRetry(event -> {
            log.warn("MongoDB connect attempt {} failed: {}",
                event.getNumberOfRetryAttempts(), event.getLastThrowable().getMessage());
            metricsRegistry.incrementCounter("faultlab.store.connect.retry", "store", StoreId.MONGODB.getKey());
        });
    }

    @Override
    public StoreId getStoreId() {
        return StoreId.MONGODB;
    }

    /**
     * Connect with retries. Used at startup and by explicit callers.
     */
    @Override
    public StoreOutcome<Void> connect() {
        if (client.get() != null) {
            return StoreOutcome.ok();
        }
        try {
            retry.executeRunnable(this::openClient);
            return StoreOutcome.ok();
        } catch (Exception e) {
            log.error("Failed to connect to MongoDB at {}: {}", config.getUri(), e.getMessage());
            return StoreOutcome.failed(e);
        }
    }

    @Override
    public StoreOutcome<Void> ensureTable(String table) {
        return withDatabase("ensureTable", db -> {
            List<String> existing = db.listCollectionNames().into(new ArrayList<>());
            if (!existing.contains(table)) {
                try {
                    db.createCollection(table);
                    log.info("Created MongoDB collection {}", table);
                } catch (MongoCommandException e) {
                    if (e.getErrorCode() != NAMESPACE_EXISTS) {
                        throw e;
                    }
                }
            }
            return null;
        });
    }

    @Override
    public StoreOutcome<Void> insert(String table, Map<String, Object> row) {
        return withDatabase("insert", db -> {
            db.getCollection(table).insertOne(new Document(row));
            return null;
        });
    }

    @Override
    public StoreOutcome<Integer> insertAll(String table, List<Map<String, Object>> rows) {
        if (rows.isEmpty()) {
            return StoreOutcome.ok(0);
        }
        return withDatabase("insertAll", db -> {
            List<Document> documents = new ArrayList<>(rows.size());
            for (Map<String, Object> row : rows) {
                documents.add(new Document(row));
            }
            db.getCollection(table).insertMany(documents);
            return documents.size();
        });
    }

    @Override
    public StoreOutcome<List<Map<String, Object>>> find(String table, Map<String, Object> filter) {
        return withDatabase("find", db -> {
            List<Map<String, Object>> rows = new ArrayList<>();
            for (Document document : db.getCollection(table).find(new Document(filter))) {
                rows.add(new LinkedHashMap<>(document));
            }
            return rows;
        });
    }

    @Override
    public StoreOutcome<Long> update(String table, Map<String, Object> filter, Map<String, Object> patch) {
        return withDatabase("update", db -> {
            UpdateResult result = db.getCollection(table)
                .updateMany(new Document(filter), new Document("$set", new Document(patch)));
            return result.getMatchedCount();
        });
    }

    @Override
    public StoreOutcome<Void> truncate(String table) {
        return withDatabase("truncate", db -> {
            db.getCollection(table).drop();
            return null;
        });
    }

    @Override
    public boolean isConnected() {
        return client.get() != null;
    }

    @Override
    @PreDestroy
    public void disconnect() {
        MongoClient current = client.getAndSet(null);
        if (current != null) {
            current.close();
            log.info("Disconnected from MongoDB");
        }
    }

    private <T> StoreOutcome<T> withDatabase(String operation, Function<MongoDatabase, T> action) {
        try {
            MongoClient current = client.get();
            if (current == null) {
                openClient();
                current = client.get();
            }
            return StoreOutcome.ok(action.apply(current.getDatabase(config.getDatabase())));
        } catch (Exception e) {
            log.debug("MongoDB {} failed: {}", operation, e.getMessage());
            return StoreOutcome.failed(e);
        }
    }

    private synchronized void openClient() {
        if (client.get() != null) {
            return;
        }
        MongoClientSettings settings = MongoClientSettings.builder()
            .applyConnectionString(new ConnectionString(config.getUri()))
            .uuidRepresentation(UuidRepresentation.STANDARD)
            .applyToClusterSettings(b -> b.serverSelectionTimeout(config.getServerSelectionTimeoutMs(), TimeUnit.MILLISECONDS))
            .applyToSocketSettings(b -> b
                .connectTimeout(config.getConnectTimeoutMs(), TimeUnit.MILLISECONDS)
                .readTimeout(config.getReadTimeoutMs(), TimeUnit.MILLISECONDS))
            .build();

        MongoClient created = MongoClients.create(settings);
        try {
            long start = System.currentTimeMillis();
            created.getDatabase(config.getDatabase()).runCommand(new Document("ping", 1));
            log.info("Connected to MongoDB database {} in {}ms", config.getDatabase(), System.currentTimeMillis() - start);
        } catch (RuntimeException e) {
            created.close();
            throw e;
        }
        client.set(created);
    }
}
