package com.platform.faultlab.store;

import java.util.List;
import java.util.Map;

/**
 * Narrow driver contract each data store implements.
 * Calls are blocking and never throw: failures come back as {@link StoreOutcome#failed}.
 */
public interface StoreDriver {

    /**
     * Get the store this driver talks to.
     */
    StoreId getStoreId();

    /**
     * Open the client session, idempotent.
     */
    StoreOutcome<Void> connect();

    /**
     * Create the table or collection if it does not exist.
     */
    StoreOutcome<Void> ensureTable(String table);

    StoreOutcome<Void> insert(String table, Map<String, Object> row);

    /**
     * Insert a batch of rows. Fails if any row fails.
     * @return number of rows written
     */
    StoreOutcome<Integer> insertAll(String table, List<Map<String, Object>> rows);

    /**
     * Find rows whose columns equal every entry of the filter.
     */
    StoreOutcome<List<Map<String, Object>>> find(String table, Map<String, Object> filter);

    /**
     * Apply the patch to rows matching the filter.
     * @return number of rows matched, or -1 when the store does not report it
     */
    StoreOutcome<Long> update(String table, Map<String, Object> filter, Map<String, Object> patch);

    /**
     * Remove every row from the table (drop for document stores).
     */
    StoreOutcome<Void> truncate(String table);

    boolean isConnected();

    /**
     * Close the client session and release resources.
     */
    void disconnect();
}
