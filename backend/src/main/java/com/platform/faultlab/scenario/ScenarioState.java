package com.platform.faultlab.scenario;

import java.util.Map;
import java.util.Set;

/**
 * States of a failure scenario. Transitions are validated against {@link #canTransitionTo}.
 */
public enum ScenarioState {
    /**
     * Scenario accepted, nothing done yet.
     * Transitions: PREPARING
     */
    IDLE,

    /**
     * Acquiring node locks and resolving targets and network.
     * Transitions: INJECTING, COMPLETED
     */
    PREPARING,

    /**
     * Stopping or disconnecting target nodes.
     * Transitions: MONITORING, COMPLETED
     */
    INJECTING,

    /**
     * Sampling both stores once per tick.
     * Transitions: RESTORING
     */
    MONITORING,

    /**
     * Starting or reconnecting mutated nodes.
     * Transitions: RECOVERY_WATCH, COMPLETED
     */
    RESTORING,

    /**
     * Waiting for restarted nodes to report running.
     * Transitions: COMPLETED
     */
    RECOVERY_WATCH,

    COMPLETED;

    private static final Map<ScenarioState, Set<ScenarioState>> ALLOWED_TRANSITIONS = Map.of(
        IDLE, Set.of(PREPARING),
        PREPARING, Set.of(INJECTING, COMPLETED),
        INJECTING, Set.of(MONITORING, COMPLETED),
        MONITORING, Set.of(RESTORING),
        RESTORING, Set.of(RECOVERY_WATCH, COMPLETED),
        RECOVERY_WATCH, Set.of(COMPLETED),
        COMPLETED, Set.of()
    );

    public boolean canTransitionTo(ScenarioState target) {
        return ALLOWED_TRANSITIONS.get(this).contains(target);
    }
}
