package com.platform.faultlab.infra;

import java.util.Optional;

/**
 * Container orchestrator the infrastructure controller drives.
 * Every call except {@link #ping()} throws
 * {@link com.platform.faultlab.error.OrchestratorException} on failure.
 */
public interface OrchestratorBackend {

    /**
     * Check the orchestrator is reachable.
     * @return true if it answered
     */
    boolean ping();

    /**
     * Inspect a container.
     * @return the node status, empty if no such container exists
     */
    Optional<NodeStatus> inspectContainer(String name);

    /**
     * Stop a container, waiting up to the grace timeout before killing it.
     * Stopping a stopped container is a no-op.
     */
    void stopContainer(String name, int timeoutSeconds);

    /**
     * Start a container. Starting a running container is a no-op.
     */
    void startContainer(String name);

    boolean networkExists(String network);

    void disconnect(String network, String container);

    void connect(String network, String container);
}
