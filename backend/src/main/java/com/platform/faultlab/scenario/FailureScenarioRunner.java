package com.platform.faultlab.scenario;

import com.platform.faultlab.config.FaultLabProperties;
import com.platform.faultlab.error.ErrorCode;
import com.platform.faultlab.error.FaultLabException;
import com.platform.faultlab.error.ResolutionException;
import com.platform.faultlab.error.ValidationException;
import com.platform.faultlab.infra.InfraMode;
import com.platform.faultlab.infra.InfrastructureController;
import com.platform.faultlab.infra.NodeState;
import com.platform.faultlab.observability.LoggingConfig;
import com.platform.faultlab.observability.MetricsRegistry;
import com.platform.faultlab.probe.ProbeResult;
import com.platform.faultlab.probe.StoreProbe;
import com.platform.faultlab.store.StoreId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Runs one failure scenario through its state machine:
 * PREPARING, INJECTING, MONITORING, RESTORING, RECOVERY_WATCH, COMPLETED.
 *
 * Runs on the caller's thread. Interrupting that thread cancels the monitoring
 * and recovery phases; mutated nodes are still restored.
 */
@Slf4j
@Service
public class FailureScenarioRunner {

    private static final String NODE_DOWN = "Node down";
    private static final String NODE_PARTITIONED = "Node partitioned";
    private static final String SIMULATED_FAILURE = "Simulated failure";

    private final InfrastructureController infrastructure;
    private final Map<StoreId, StoreProbe> probes = new EnumMap<>(StoreId.class);
    private final NodeLockRegistry lockRegistry;
    private final TickClock tickClock;
    private final FaultLabProperties properties;
    private final MetricsRegistry metricsRegistry;

    public FailureScenarioRunner(InfrastructureController infrastructure,
                                 List<StoreProbe> probes,
                                 NodeLockRegistry lockRegistry,
                                 TickClock tickClock,
                                 FaultLabProperties properties,
                                 MetricsRegistry metricsRegistry) {
        this.infrastructure = infrastructure;
        probes.forEach(probe -> this.probes.put(probe.getStoreId(), probe));
        this.lockRegistry = lockRegistry;
        this.tickClock = tickClock;
        this.properties = properties;
        this.metricsRegistry = metricsRegistry;
    }

    /**
     * Run a scenario to completion.
     *
     * Failures after validation never propagate: they are reported in the
     * result's outcome, failure code and errors.
     *
     * @throws ValidationException if the duration exceeds the configured cap
     */
    public ScenarioResult run(Scenario scenario) {
        int cap = properties.getScenario().getMaxDurationSeconds();
        if (scenario.durationSeconds() > cap) {
            throw new ValidationException(ErrorCode.INVALID_FIELD_VALUE, "duration",
                scenario.durationSeconds(), "must be between 1 and " + cap);
        }

        ScenarioContext ctx = new ScenarioContext(scenario, infrastructure.getMode());
        String kind = scenario.kind().getFailureType();
        LoggingConfig.setScenarioContext(ctx.getScenarioId());
        metricsRegistry.recordScenarioStarted(kind);
        log.info("Starting {} scenario on {} for {}s (mode {})",
            kind, scenario.targets(), scenario.durationSeconds(), ctx.getMode());

        ScenarioResult result;
        try {
            result = execute(ctx);
        } finally {
            LoggingConfig.clearScenarioContext();
        }

        metricsRegistry.recordScenarioCompleted(kind, result.getOutcome().name(),
            Duration.between(result.getStartedAt(), result.getCompletedAt()).toMillis());
        if (ctx.isInterrupted()) {
            Thread.currentThread().interrupt();
        }
        return result;
    }

    private ScenarioResult execute(ScenarioContext ctx) {
        ctx.transitionTo(ScenarioState.PREPARING);
        NodeLockRegistry.Lease lease;
        try {
            lease = lockRegistry.acquire(ctx.getScenario().targets());
        } catch (FaultLabException e) {
            return abort(ctx, e);
        }

        try (lease) {
            try {
                prepare(ctx);
            } catch (FaultLabException e) {
                return abort(ctx, e);
            }

            ctx.transitionTo(ScenarioState.INJECTING);
            try {
                inject(ctx);
            } catch (FaultLabException e) {
                return abort(ctx, e, () -> rollback(ctx));
            }

            ctx.transitionTo(ScenarioState.MONITORING);
            monitor(ctx);

            ctx.transitionTo(ScenarioState.RESTORING);
            restore(ctx);

            if (ctx.getScenario().kind() == ScenarioKind.NODE_FAILURE && !ctx.isInterrupted()) {
                ctx.transitionTo(ScenarioState.RECOVERY_WATCH);
                watchRecovery(ctx);
            } else if (ctx.getScenario().kind() == ScenarioKind.NETWORK_PARTITION) {
                ctx.recovered(0, true);
            }

            ctx.transitionTo(ScenarioState.COMPLETED);
            ScenarioOutcome outcome = ctx.hasErrors() || ctx.isInterrupted()
                ? ScenarioOutcome.PARTIAL_FAILURE
                : ScenarioOutcome.SUCCESS;
            log.info("Scenario completed: outcome={}, recoveryTime={}s, errors={}",
                outcome, ctx.getRecoveryTimeSeconds(), ctx.getErrors().size());
            return toResult(ctx, outcome);
        }
    }

    // ==================== PREPARING ====================

    private void prepare(ScenarioContext ctx) {
        Scenario scenario = ctx.getScenario();
        if (scenario.kind() == ScenarioKind.NETWORK_PARTITION) {
            String network = infrastructure.resolveNetwork(scenario.targets());
            ctx.setNetwork(network);
            log.info("Partitioning {} from network {}", scenario.targets(), network);
        }
        for (String target : scenario.targets()) {
            if (ctx.getMode() == InfraMode.SYNTHETIC) {
                if (!properties.getKnownNodes().contains(target)) {
                    throw ResolutionException.targetUnresolved(target, "not a known node");
                }
            } else {
                infrastructure.requireNode(target);
            }
        }
    }

    // ==================== INJECTING ====================

    private void inject(ScenarioContext ctx) {
        for (String target : ctx.getScenario().targets()) {
            ctx.markMutated(target);
            if (ctx.getScenario().kind() == ScenarioKind.NODE_FAILURE) {
                infrastructure.stop(target);
                log.info("Stopped {}", target);
            } else {
                infrastructure.disconnect(target, ctx.getNetwork());
            }
        }
    }

    private void rollback(ScenarioContext ctx) {
        List<String> mutated = new ArrayList<>(ctx.mutatedNodes());
        Collections.reverse(mutated);
        log.warn("Injection failed, rolling back {}", mutated);
        for (String node : mutated) {
            try {
                revert(ctx, node);
            } catch (RuntimeException e) {
                log.error("Rollback of {} failed: {}", node, e.getMessage());
                ctx.fail(codeOf(e, ErrorCode.RESTORATION_FAILED), "Rollback: " + e.getMessage());
            }
        }
    }

    // ==================== MONITORING ====================

    private void monitor(ScenarioContext ctx) {
        int duration = ctx.getScenario().durationSeconds();
        for (int tick = 0; tick < duration; tick++) {
            try {
                tickClock.awaitNextTick();
            } catch (InterruptedException e) {
                log.warn("Scenario interrupted after {} of {} ticks", tick, duration);
                ctx.markInterrupted();
                ctx.fail(ErrorCode.INTERNAL_ERROR,
                    String.format("Interrupted after %d of %d seconds", tick, duration));
                return;
            }
            ctx.addAvailability(sampleTick(ctx, tick));
        }
    }

    /**
     * Probe both stores concurrently and correlate the results by tick.
     */
    private List<AvailabilitySample> sampleTick(ScenarioContext ctx, int tick) {
        Scenario scenario = ctx.getScenario();
        Map<StoreId, CompletableFuture<ProbeResult>> pending = new LinkedHashMap<>();
        if (scenario.testOperations()) {
            for (StoreId store : StoreId.values()) {
                StoreProbe probe = probes.get(store);
                pending.put(store, probe != null
                    ? probe.probeAsync()
                    : CompletableFuture.completedFuture(ProbeResult.failed("No probe configured")));
            }
        }

        List<AvailabilitySample> samples = new ArrayList<>();
        for (StoreId store : StoreId.values()) {
            CompletableFuture<ProbeResult> future = pending.get(store);
            ProbeResult result = future == null ? null : future
                .handle((r, ex) -> ex == null ? r : ProbeResult.failed(ex.getMessage()))
                .join();

            if (scenario.targets(store)) {
                samples.add(AvailabilitySample.failed(tick, store, overrideMessage(ctx)));
            } else if (result == null) {
                samples.add(AvailabilitySample.untested(tick, store));
            } else {
                samples.add(AvailabilitySample.of(tick, store, result));
            }
        }
        return samples;
    }

    private String overrideMessage(ScenarioContext ctx) {
        if (ctx.getMode() == InfraMode.SYNTHETIC) {
            return SIMULATED_FAILURE;
        }
        return ctx.getScenario().kind() == ScenarioKind.NODE_FAILURE ? NODE_DOWN : NODE_PARTITIONED;
    }

    // ==================== RESTORING ====================

    private void restore(ScenarioContext ctx) {
        for (String node : ctx.mutatedNodes()) {
            try {
                revert(ctx, node);
            } catch (RuntimeException e) {
                log.error("Failed to restore {}: {}", node, e.getMessage());
                ctx.fail(codeOf(e, ErrorCode.RESTORATION_FAILED), e.getMessage());
            }
        }
    }

    private void revert(ScenarioContext ctx, String node) {
        if (ctx.getScenario().kind() == ScenarioKind.NODE_FAILURE) {
            infrastructure.start(node);
            log.info("Started {}", node);
        } else {
            infrastructure.connect(node, ctx.getNetwork());
        }
    }

    // ==================== RECOVERY_WATCH ====================

    private void watchRecovery(ScenarioContext ctx) {
        Scenario scenario = ctx.getScenario();
        int ceiling = properties.getScenario().getRecoveryCeilingTicks();
        for (int tick = 0; tick < ceiling; tick++) {
            try {
                tickClock.awaitNextTick();
            } catch (InterruptedException e) {
                log.warn("Recovery watch interrupted after {} ticks", tick);
                ctx.markInterrupted();
                ctx.recovered(tick, false);
                ctx.fail(ErrorCode.INTERNAL_ERROR, "Recovery watch interrupted after " + tick + " seconds");
                return;
            }

            Map<String, Boolean> running = new LinkedHashMap<>();
            for (String target : scenario.targets()) {
                running.put(target, infrastructure.status(target) == NodeState.RUNNING);
            }

            List<RecoverySample> samples = new ArrayList<>();
            for (StoreId store : StoreId.values()) {
                boolean online = scenario.targetsOf(store).stream().allMatch(running::get);
                samples.add(new RecoverySample(tick, store, online));
            }
            ctx.addRecovery(samples);

            if (!running.containsValue(false)) {
                log.info("All targets running again after {}s", tick + 1);
                ctx.recovered(tick + 1, true);
                return;
            }
        }

        log.warn("Targets {} not running after {}s", scenario.targets(), ceiling);
        ctx.recovered(ceiling, false);
        ctx.fail(ErrorCode.RECOVERY_TIMEOUT,
            String.format("Recovery not observed within %d seconds", ceiling));
    }

    // ==================== COMPLETED ====================

    private ScenarioResult abort(ScenarioContext ctx, FaultLabException e) {
        return abort(ctx, e, () -> { });
    }

    /**
     * Record a fatal failure, run the cleanup, and complete with FAILED.
     */
    private ScenarioResult abort(ScenarioContext ctx, FaultLabException e, Runnable cleanup) {
        log.error("Scenario failed in {}: [{}] {}", ctx.getState(), e.getErrorCode().getCode(), e.getMessage());
        ctx.fail(e.getErrorCode(), e.getMessage());
        cleanup.run();
        ctx.transitionTo(ScenarioState.COMPLETED);
        return toResult(ctx, ScenarioOutcome.FAILED);
    }

    private ScenarioResult toResult(ScenarioContext ctx, ScenarioOutcome outcome) {
        return ScenarioResult.builder()
            .scenarioId(ctx.getScenarioId())
            .scenario(ctx.getScenario())
            .network(ctx.getNetwork())
            .mode(ctx.getMode())
            .outcome(outcome)
            .actualDurationSeconds(ctx.getTicksRun())
            .recoveryTimeSeconds(ctx.getRecoveryTimeSeconds())
            .recoveryComplete(ctx.isRecoveryComplete())
            .availability(new ArrayList<>(ctx.getAvailability()))
            .recovery(new ArrayList<>(ctx.getRecovery()))
            .dataLoss(0)
            .failureCode(ctx.getFailureCode() != null ? ctx.getFailureCode().getCode() : null)
            .errors(new ArrayList<>(ctx.getErrors()))
            .startedAt(ctx.getStartedAt())
            .completedAt(Instant.now())
            .build();
    }

    private static ErrorCode codeOf(RuntimeException e, ErrorCode fallback) {
        return e instanceof FaultLabException fle ? fle.getErrorCode() : fallback;
    }
}
