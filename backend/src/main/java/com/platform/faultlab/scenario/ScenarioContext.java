package com.platform.faultlab.scenario;

import com.platform.faultlab.error.ErrorCode;
import com.platform.faultlab.infra.InfraMode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Mutable working state of one scenario run. Confined to the thread running the scenario.
 */
@Slf4j
@Getter
class ScenarioContext {

    private final String scenarioId = UUID.randomUUID().toString();
    private final Scenario scenario;
    private final InfraMode mode;
    private final Instant startedAt = Instant.now();
    private ScenarioState state = ScenarioState.IDLE;
    private String network;

    /**
     * Nodes whose state may have been changed, in mutation order.
     */
    private final List<String> mutated = new ArrayList<>();
    private final List<AvailabilitySample> availability = new ArrayList<>();
    private final List<RecoverySample> recovery = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();
    private ErrorCode failureCode;
    private int ticksRun;
    private double recoveryTimeSeconds;
    private boolean recoveryComplete;
    private boolean interrupted;

    ScenarioContext(Scenario scenario, InfraMode mode) {
        this.scenario = scenario;
        this.mode = mode;
    }

    /**
     * Move to the next state.
     * @throws IllegalStateException if the transition is not allowed
     */
    void transitionTo(ScenarioState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException(String.format(
                "Invalid scenario transition %s -> %s", state, next));
        }
        log.debug("Scenario {} {} -> {}", scenarioId, state, next);
        state = next;
    }

    void setNetwork(String network) {
        this.network = network;
    }

    void markMutated(String node) {
        mutated.add(node);
    }

    List<String> mutatedNodes() {
        return Collections.unmodifiableList(mutated);
    }

    void addAvailability(List<AvailabilitySample> samples) {
        availability.addAll(samples);
        ticksRun++;
    }

    void addRecovery(List<RecoverySample> samples) {
        recovery.addAll(samples);
    }

    /**
     * Record an error. The first code recorded wins.
     */
    void fail(ErrorCode code, String message) {
        errors.add(message);
        if (failureCode == null) {
            failureCode = code;
        }
    }

    void recovered(double seconds, boolean complete) {
        this.recoveryTimeSeconds = seconds;
        this.recoveryComplete = complete;
    }

    void markInterrupted() {
        this.interrupted = true;
    }

    boolean hasErrors() {
        return !errors.isEmpty();
    }
}
