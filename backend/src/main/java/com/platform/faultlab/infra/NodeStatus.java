package com.platform.faultlab.infra;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Point-in-time view of one node. Always read fresh from the orchestrator.
 *
 * @param networks networks the node is attached to, in the orchestrator's listing order
 * @param startedAt last start time, null if the node never started
 */
public record NodeStatus(String nodeId, NodeState state, Set<String> networks, Instant startedAt) {

    public NodeStatus {
        networks = networks == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(networks));
    }

    public boolean isRunning() {
        return state == NodeState.RUNNING;
    }

    public boolean isMemberOf(String network) {
        return networks.contains(network);
    }

    public Optional<String> firstNetwork() {
        return networks.stream().findFirst();
    }
}
