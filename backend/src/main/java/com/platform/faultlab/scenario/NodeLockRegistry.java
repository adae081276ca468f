package com.platform.faultlab.scenario;

import com.platform.faultlab.error.ResolutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Exclusive per-node leases, so two scenarios never mutate the same node.
 * Acquisition never blocks: overlapping requests fail immediately.
 */
@Slf4j
@Component
public class NodeLockRegistry {

    private final Set<String> held = new HashSet<>();

    /**
     * Lease every node or none.
     * @throws ResolutionException with NODE_BUSY if any node is already leased
     */
    public synchronized Lease acquire(Collection<String> nodes) {
        List<String> busy = nodes.stream()
            .filter(held::contains)
            .sorted()
            .collect(Collectors.toList());
        if (!busy.isEmpty()) {
            log.warn("Rejected lease for {}: {} busy", nodes, busy);
            throw ResolutionException.nodeBusy(busy);
        }
        held.addAll(nodes);
        return new Lease(List.copyOf(nodes));
    }

    public synchronized boolean isHeld(String node) {
        return held.contains(node);
    }

    private synchronized void release(List<String> nodes) {
        nodes.forEach(held::remove);
    }

    /**
     * Held nodes, released on close.
     */
    public final class Lease implements AutoCloseable {
        private final List<String> nodes;
        private final AtomicBoolean released = new AtomicBoolean();

        private Lease(List<String> nodes) {
            this.nodes = nodes;
        }

        public List<String> getNodes() {
            return nodes;
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                release(nodes);
            }
        }
    }
}
