package com.platform.faultlab.infra;

import com.platform.faultlab.config.FaultLabProperties;
import com.platform.faultlab.error.ErrorCode;
import com.platform.faultlab.error.InjectionException;
import com.platform.faultlab.error.OrchestratorException;
import com.platform.faultlab.error.ResolutionException;
import com.platform.faultlab.infra.docker.DockerConfig;
import com.platform.faultlab.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Stops, starts and partitions store nodes through the orchestrator.
 *
 * The mode is detected once, on first use: if the orchestrator does not answer
 * a ping the controller runs in {@link InfraMode#SYNTHETIC} mode for the rest of
 * the process lifetime, simulating a topology in memory. The simulated topology
 * holds only the configured known nodes; other names behave like missing containers.
 */
@Slf4j
@Component
public class InfrastructureController {

    /**
     * Status polls a synthetic node reports STOPPED after being started.
     */
    static final int SYNTHETIC_BOOT_POLLS = 2;

    private final OrchestratorBackend backend;
    private final DockerConfig config;
    private final MetricsRegistry metricsRegistry;
    private final Set<String> knownNodes;
    private final AtomicReference<InfraMode> mode = new AtomicReference<>();
    private final Map<String, SyntheticNode> syntheticNodes = new ConcurrentHashMap<>();

    public InfrastructureController(OrchestratorBackend backend, DockerConfig config,
                                    FaultLabProperties properties, MetricsRegistry metricsRegistry) {
        this.backend = backend;
        this.config = config;
        this.knownNodes = Set.copyOf(properties.getKnownNodes());
        this.metricsRegistry = metricsRegistry;
    }

    /**
     * Get the infrastructure mode, detecting it on first call.
     */
    public InfraMode getMode() {
        InfraMode current = mode.get();
        return current != null ? current : detectMode();
    }

    public boolean isSynthetic() {
        return getMode() == InfraMode.SYNTHETIC;
    }

    private synchronized InfraMode detectMode() {
        InfraMode current = mode.get();
        if (current != null) {
            return current;
        }
        InfraMode detected;
        if (!config.isEnabled()) {
            log.info("Docker integration disabled, running in synthetic mode");
            detected = InfraMode.SYNTHETIC;
        } else if (backend.ping()) {
            detected = InfraMode.LIVE;
        } else {
            log.warn("Docker Engine unreachable at {}, switching to synthetic mode", config.getApiUrl());
            detected = InfraMode.SYNTHETIC;
        }
        mode.set(detected);
        metricsRegistry.recordInfraMode(detected == InfraMode.SYNTHETIC);
        return detected;
    }

    // ==================== Node lifecycle ====================

    /**
     * Stop a node.
     * @throws InjectionException if the orchestrator refused
     */
    public void stop(String node) {
        if (isSynthetic()) {
            requireSynthetic(node).stop();
            log.info("Synthetic stop of {}", node);
            return;
        }
        try {
            backend.stopContainer(node, config.getStopTimeoutSeconds());
        } catch (OrchestratorException e) {
            throw InjectionException.stopFailed(node, e);
        }
    }

    /**
     * Start a node.
     * @throws InjectionException with RESTORATION_FAILED if the orchestrator refused
     */
    public void start(String node) {
        if (isSynthetic()) {
            requireSynthetic(node).start();
            log.info("Synthetic start of {}", node);
            return;
        }
        try {
            backend.startContainer(node);
        } catch (OrchestratorException e) {
            throw InjectionException.startFailed(node, e);
        }
    }

    /**
     * Read the node's running state. Never throws.
     */
    public NodeState status(String node) {
        if (isSynthetic()) {
            return synthetic(node).map(SyntheticNode::pollState).orElse(NodeState.UNKNOWN);
        }
        try {
            return backend.inspectContainer(node)
                .map(NodeStatus::state)
                .orElse(NodeState.UNKNOWN);
        } catch (OrchestratorException e) {
            log.warn("Failed to read status of {}: {}", node, e.getMessage());
            return NodeState.UNKNOWN;
        }
    }

    /**
     * Inspect a node.
     * @return the node status, empty if the orchestrator does not know it
     */
    public Optional<NodeStatus> inspect(String node) {
        if (isSynthetic()) {
            return synthetic(node).map(n -> n.snapshot(node));
        }
        return backend.inspectContainer(node);
    }

    /**
     * Inspect a scenario target, failing if it does not exist.
     */
    public NodeStatus requireNode(String node) {
        try {
            return inspect(node)
                .orElseThrow(() -> ResolutionException.targetUnresolved(node, "no such container"));
        } catch (OrchestratorException e) {
            throw new ResolutionException(ErrorCode.TARGET_UNRESOLVED,
                String.format("Target node '%s' could not be inspected: %s", node, e.getMessage()), e);
        }
    }

    // ==================== Network partition ====================

    /**
     * Detach a node from a network and verify it no longer lists it.
     * Detaching a node that is not attached is a no-op.
     */
    public void disconnect(String node, String network) {
        if (isSynthetic()) {
            requireSynthetic(node).leave(network);
            log.info("Synthetic disconnect of {} from {}", node, network);
            return;
        }
        try {
            if (!currentMembership(node).isMemberOf(network)) {
                log.info("{} is not attached to {}, nothing to disconnect", node, network);
                return;
            }
            backend.disconnect(network, node);
            if (currentMembership(node).isMemberOf(network)) {
                throw InjectionException.verificationFailed(node, network, false);
            }
        } catch (OrchestratorException e) {
            throw InjectionException.disconnectFailed(node, network, e);
        }
        log.info("{} isolated from {}", node, network);
    }

    /**
     * Attach a node to a network and verify it lists it.
     * Attaching a node that is already attached is a no-op.
     */
    public void connect(String node, String network) {
        if (isSynthetic()) {
            requireSynthetic(node).join(network);
            log.info("Synthetic connect of {} to {}", node, network);
            return;
        }
        try {
            if (currentMembership(node).isMemberOf(network)) {
                log.info("{} already attached to {}", node, network);
                return;
            }
            backend.connect(network, node);
            if (!currentMembership(node).isMemberOf(network)) {
                throw InjectionException.verificationFailed(node, network, true);
            }
        } catch (OrchestratorException e) {
            throw InjectionException.connectFailed(node, network, e);
        }
        log.info("{} reconnected to {}", node, network);
    }

    /**
     * Resolve the network to partition the targets from: the configured network if it
     * exists, else the first network listed by the first target.
     * @throws ResolutionException if neither resolves
     */
    public String resolveNetwork(List<String> targets) {
        String configured = config.getNetwork();
        String firstTarget = targets.isEmpty() ? null : targets.get(0);

        if (isSynthetic()) {
            if (config.isSyntheticNetworkAvailable()) {
                return configured;
            }
            return Optional.ofNullable(firstTarget)
                .flatMap(t -> synthetic(t).flatMap(n -> n.snapshot(t).firstNetwork()))
                .orElseThrow(() -> ResolutionException.networkUnresolved(configured, firstTarget));
        }

        try {
            if (configured != null && backend.networkExists(configured)) {
                return configured;
            }
            log.warn("Network {} not found, falling back to first network of {}", configured, firstTarget);
        } catch (OrchestratorException e) {
            log.warn("Failed to look up network {}: {}", configured, e.getMessage());
        }

        if (firstTarget != null) {
            try {
                Optional<String> fromTarget = backend.inspectContainer(firstTarget)
                    .flatMap(NodeStatus::firstNetwork);
                if (fromTarget.isPresent()) {
                    log.info("Resolved network {} from node {}", fromTarget.get(), firstTarget);
                    return fromTarget.get();
                }
            } catch (OrchestratorException e) {
                log.warn("Could not determine network from {}: {}", firstTarget, e.getMessage());
            }
        }
        throw ResolutionException.networkUnresolved(configured, firstTarget);
    }

    // ==================== Uptime / restore ====================

    /**
     * Time since the node last started.
     */
    public NodeUptime uptime(String node) {
        if (isSynthetic()) {
            return synthetic(node)
                .map(n -> NodeUptime.of(Duration.between(n.startedAt(), Instant.now()).getSeconds(), "synthetic"))
                .orElseGet(() -> NodeUptime.error("Container " + node + " not found"));
        }
        try {
            Optional<NodeStatus> status = backend.inspectContainer(node);
            if (status.isEmpty()) {
                return NodeUptime.error("Container " + node + " not found");
            }
            if (status.get().startedAt() == null) {
                return NodeUptime.error("No start time");
            }
            long seconds = Duration.between(status.get().startedAt(), Instant.now()).getSeconds();
            return NodeUptime.of(seconds, status.get().state().toJson());
        } catch (OrchestratorException e) {
            return NodeUptime.error(e.getMessage());
        }
    }

    /**
     * Best-effort restore of the given nodes: start stopped ones and reattach
     * running ones missing from the configured network.
     * @return nodes that were changed
     */
    public List<String> restore(List<String> nodes) {
        List<String> restored = new ArrayList<>();
        for (String node : nodes) {
            try {
                if (restoreNode(node)) {
                    restored.add(node);
                }
            } catch (RuntimeException e) {
                log.warn("Failed to restore {}: {}", node, e.getMessage());
            }
        }
        log.info("Restored {} of {} nodes: {}", restored.size(), nodes.size(), restored);
        return restored;
    }

    private boolean restoreNode(String node) {
        if (isSynthetic()) {
            SyntheticNode synthetic = syntheticNodes.get(node);
            return synthetic != null && synthetic.restore(config.getNetwork(), config.isSyntheticNetworkAvailable());
        }
        Optional<NodeStatus> status = backend.inspectContainer(node);
        if (status.isEmpty()) {
            log.warn("Cannot restore {}: no such container", node);
            return false;
        }
        if (!status.get().isRunning()) {
            start(node);
            return true;
        }
        String network = config.getNetwork();
        if (!status.get().isMemberOf(network) && backend.networkExists(network)) {
            connect(node, network);
            return true;
        }
        return false;
    }

    private NodeStatus currentMembership(String node) {
        return backend.inspectContainer(node)
            .orElseThrow(() -> new OrchestratorException("inspect", 404, "Container " + node + " not found"));
    }

    /**
     * Number of nodes simulated so far.
     */
    int syntheticNodeCount() {
        return syntheticNodes.size();
    }

    private Optional<SyntheticNode> synthetic(String node) {
        if (!knownNodes.contains(node)) {
            return Optional.empty();
        }
        return Optional.of(syntheticNodes.computeIfAbsent(node, n -> new SyntheticNode(
            config.isSyntheticNetworkAvailable() ? Set.of(config.getNetwork()) : Set.of())));
    }

    private SyntheticNode requireSynthetic(String node) {
        return synthetic(node)
            .orElseThrow(() -> ResolutionException.targetUnresolved(node, "not a known node"));
    }

    /**
     * In-memory node used in synthetic mode.
     */
    private static final class SyntheticNode {
        private NodeState state = NodeState.RUNNING;
        private final Set<String> networks;
        private Instant startedAt;
        private int bootPollsRemaining;

        SyntheticNode(Set<String> networks) {
            this.networks = new LinkedHashSet<>(networks);
            long uptimeSeconds = ThreadLocalRandom.current().nextLong(3600, 72 * 3600 + 1);
            this.startedAt = Instant.now().minusSeconds(uptimeSeconds);
        }

        synchronized void stop() {
            state = NodeState.STOPPED;
            bootPollsRemaining = 0;
        }

        synchronized void start() {
            if (state == NodeState.RUNNING && bootPollsRemaining == 0) {
                return;
            }
            state = NodeState.RUNNING;
            startedAt = Instant.now();
            bootPollsRemaining = SYNTHETIC_BOOT_POLLS;
        }

        synchronized NodeState pollState() {
            if (bootPollsRemaining > 0) {
                bootPollsRemaining--;
                return NodeState.STOPPED;
            }
            return state;
        }

        synchronized void leave(String network) {
            networks.remove(network);
        }

        synchronized void join(String network) {
            networks.add(network);
        }

        synchronized Instant startedAt() {
            return startedAt;
        }

        synchronized boolean restore(String network, boolean networkAvailable) {
            boolean changed = false;
            if (state != NodeState.RUNNING) {
                state = NodeState.RUNNING;
                startedAt = Instant.now();
                changed = true;
            }
            bootPollsRemaining = 0;
            if (networkAvailable && networks.add(network)) {
                changed = true;
            }
            return changed;
        }

        synchronized NodeStatus snapshot(String node) {
            NodeState reported = bootPollsRemaining > 0 ? NodeState.STOPPED : state;
            return new NodeStatus(node, reported, networks, startedAt);
        }
    }
}
