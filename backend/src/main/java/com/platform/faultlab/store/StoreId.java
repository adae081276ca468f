package com.platform.faultlab.store;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * The two data stores under test. A node belongs to a store when its id
 * starts with the store's node prefix (mongo1 -> MONGODB).
 */
public enum StoreId {

    MONGODB("mongodb", "mongo", "MongoDB"),
    CASSANDRA("cassandra", "cassandra", "Cassandra");

    private final String key;
    private final String nodePrefix;
    private final String displayName;

    StoreId(String key, String nodePrefix, String displayName) {
        this.key = key;
        this.nodePrefix = nodePrefix;
        this.displayName = displayName;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Whether the given node id is one of this store's nodes.
     */
    public boolean owns(String nodeId) {
        return nodeId != null && nodeId.toLowerCase(Locale.ROOT).startsWith(nodePrefix);
    }

    public static Optional<StoreId> ofNode(String nodeId) {
        for (StoreId store : values()) {
            if (store.owns(nodeId)) {
                return Optional.of(store);
            }
        }
        return Optional.empty();
    }
}
