package com.platform.faultlab.api;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Response of a failure simulation, shaped for the dashboard charts.
 */
public record ScenarioResponse(
    Summary summary,
    List<RecoveryPoint> recoveryMetrics,
    List<AvailabilityPoint> availabilityMetrics,
    Details detailedResults
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Summary(
        String failureType,
        String targetNode,
        int duration,
        int mongodbDowntime,
        int cassandraDowntime,
        long dataLossMongo,
        long dataLossCassandra,
        double recoveryTime,
        boolean recoveryComplete,
        String mode,
        boolean success,
        String outcome,
        String failureCode,
        List<String> errors
    ) {}

    /**
     * Availability of each store, in percent, during one recovery tick.
     */
    public record RecoveryPoint(String time, int mongodb, int cassandra) {}

    public record AvailabilityPoint(String time, ProbeView mongodb, ProbeView cassandra) {}

    public record ProbeView(boolean success, Double latency, String error) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Details(
        String scenarioId,
        String network,
        int actualDurationSeconds,
        List<String> mutatedTargets,
        Instant startedAt,
        Instant completedAt
    ) {}
}
