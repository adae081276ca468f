package com.platform.faultlab.scenario;

import com.platform.faultlab.infra.InfraMode;
import com.platform.faultlab.store.StoreId;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of one failure scenario.
 */
@Data
@Builder
public class ScenarioResult {

    private String scenarioId;

    private Scenario scenario;

    /**
     * Network the targets were partitioned from, for partitions only.
     */
    private String network;

    private InfraMode mode;

    private ScenarioOutcome outcome;

    /**
     * Monitoring ticks actually executed.
     */
    private int actualDurationSeconds;

    private double recoveryTimeSeconds;

    private boolean recoveryComplete;

    /**
     * Availability samples in tick order, one per store per tick.
     */
    @Builder.Default
    private List<AvailabilitySample> availability = new ArrayList<>();

    /**
     * Recovery samples in tick order, one per store per tick.
     */
    @Builder.Default
    private List<RecoverySample> recovery = new ArrayList<>();

    /**
     * Always 0: data loss is not measured.
     */
    private long dataLoss;

    /**
     * Code of the first failure, if any.
     */
    private String failureCode;

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    private Instant startedAt;

    private Instant completedAt;

    public boolean isSuccess() {
        return outcome == ScenarioOutcome.SUCCESS;
    }

    public List<AvailabilitySample> availabilityOf(StoreId store) {
        return availability.stream().filter(s -> s.store() == store).collect(Collectors.toList());
    }

    public List<RecoverySample> recoveryOf(StoreId store) {
        return recovery.stream().filter(s -> s.store() == store).collect(Collectors.toList());
    }
}
