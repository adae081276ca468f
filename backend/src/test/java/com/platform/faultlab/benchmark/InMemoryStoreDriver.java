package com.platform.faultlab.benchmark;

import com.platform.faultlab.store.StoreDriver;
import com.platform.faultlab.store.StoreId;
import com.platform.faultlab.store.StoreOutcome;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Store driver keeping rows in memory, with switchable failures.
 */
class InMemoryStoreDriver implements StoreDriver {

    private final StoreId storeId;
    private final Map<String, List<Map<String, Object>>> tables = new ConcurrentHashMap<>();
    final AtomicInteger insertAllCalls = new AtomicInteger();
    final AtomicInteger findCalls = new AtomicInteger();
    final AtomicInteger updateCalls = new AtomicInteger();
    final AtomicInteger truncateCalls = new AtomicInteger();
    volatile String connectError;
    volatile String truncateError;
    volatile int failInsertAllOnCall = -1;
    volatile RuntimeException insertAllThrows;
    private volatile boolean connected;

    InMemoryStoreDriver(StoreId storeId) {
        this.storeId = storeId;
    }

    @Override
    public StoreId getStoreId() {
        return storeId;
    }

    @Override
    public StoreOutcome<Void> connect() {
        if (connectError != null) {
            return StoreOutcome.failed(connectError);
        }
        connected = true;
        return StoreOutcome.ok();
    }

    @Override
    public StoreOutcome<Void> ensureTable(String table) {
        tables.computeIfAbsent(table, t -> new CopyOnWriteArrayList<>());
        return StoreOutcome.ok();
    }

    @Override
    public StoreOutcome<Void> insert(String table, Map<String, Object> row) {
        tables.computeIfAbsent(table, t -> new CopyOnWriteArrayList<>()).add(new ConcurrentHashMap<>(row));
        return StoreOutcome.ok();
    }

    @Override
    public StoreOutcome<Integer> insertAll(String table, List<Map<String, Object>> rows) {
        int call = insertAllCalls.incrementAndGet();
        if (insertAllThrows != null) {
            throw insertAllThrows;
        }
        if (call == failInsertAllOnCall) {
            return StoreOutcome.failed("write timeout");
        }
        rows.forEach(row -> insert(table, row));
        return StoreOutcome.ok(rows.size());
    }

    @Override
    public StoreOutcome<List<Map<String, Object>>> find(String table, Map<String, Object> filter) {
        findCalls.incrementAndGet();
        List<Map<String, Object>> rows = tables.getOrDefault(table, List.of()).stream()
            .filter(row -> filter.entrySet().stream().allMatch(e -> e.getValue().equals(row.get(e.getKey()))))
            .collect(Collectors.toList());
        return StoreOutcome.ok(rows);
    }

    @Override
    public StoreOutcome<Long> update(String table, Map<String, Object> filter, Map<String, Object> patch) {
        updateCalls.incrementAndGet();
        List<Map<String, Object>> matched = find(table, filter).value();
        findCalls.decrementAndGet();
        matched.forEach(row -> row.putAll(patch));
        return StoreOutcome.ok((long) matched.size());
    }

    @Override
    public StoreOutcome<Void> truncate(String table) {
        truncateCalls.incrementAndGet();
        if (truncateError != null) {
            return StoreOutcome.failed(truncateError);
        }
        tables.remove(table);
        return StoreOutcome.ok();
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public void disconnect() {
        connected = false;
    }

    List<Map<String, Object>> rows(String table) {
        return new ArrayList<>(tables.getOrDefault(table, List.of()));
    }
}
