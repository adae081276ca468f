package com.platform.faultlab.scenario;

import com.platform.faultlab.error.ValidationException;
import com.platform.faultlab.store.StoreId;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One bounded failure-injection run. Targets are de-duplicated and keep their request order.
 */
public record Scenario(ScenarioKind kind, List<String> targets, int durationSeconds, boolean testOperations) {

    public Scenario {
        if (kind == null) {
            throw new ValidationException("failureType", null, "must be provided");
        }
        if (targets == null || targets.isEmpty()) {
            throw new ValidationException("targetNode", targets, "at least one target node is required");
        }
        if (durationSeconds < 1) {
            throw new ValidationException("duration", durationSeconds, "must be at least 1 second");
        }
        targets = List.copyOf(new LinkedHashSet<>(targets));
    }

    /**
     * Parse a comma-separated target list, ignoring blanks.
     */
    public static List<String> parseTargets(String targetNode) {
        List<String> targets = new ArrayList<>();
        if (targetNode == null) {
            return targets;
        }
        for (String part : targetNode.split(",")) {
            if (!part.isBlank()) {
                targets.add(part.trim());
            }
        }
        return targets;
    }

    /**
     * Stores that own at least one target.
     */
    public Set<StoreId> targetedStores() {
        Set<StoreId> stores = EnumSet.noneOf(StoreId.class);
        for (String target : targets) {
            StoreId.ofNode(target).ifPresent(stores::add);
        }
        return stores;
    }

    public boolean targets(StoreId store) {
        return targets.stream().anyMatch(store::owns);
    }

    /**
     * Targets owned by the given store.
     */
    public List<String> targetsOf(StoreId store) {
        return targets.stream().filter(store::owns).collect(Collectors.toList());
    }

    public String targetNode() {
        return String.join(",", targets);
    }

    static Scenario of(ScenarioKind kind, Collection<String> targets, int durationSeconds) {
        return new Scenario(kind, new ArrayList<>(targets), durationSeconds, true);
    }
}
