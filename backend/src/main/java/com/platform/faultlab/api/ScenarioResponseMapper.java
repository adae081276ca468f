package com.platform.faultlab.api;

import com.platform.faultlab.scenario.AvailabilitySample;
import com.platform.faultlab.scenario.RecoverySample;
import com.platform.faultlab.scenario.Scenario;
import com.platform.faultlab.scenario.ScenarioResult;
import com.platform.faultlab.store.StoreId;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Maps scenario results to the API response.
 */
@Component
public class ScenarioResponseMapper {

    public ScenarioResponse toResponse(ScenarioResult result) {
        Scenario scenario = result.getScenario();
        int downtime = result.getActualDurationSeconds();

        ScenarioResponse.Summary summary = new ScenarioResponse.Summary(
            scenario.kind().getFailureType(),
            scenario.targetNode(),
            scenario.durationSeconds(),
            scenario.targets(StoreId.MONGODB) ? downtime : 0,
            scenario.targets(StoreId.CASSANDRA) ? downtime : 0,
            result.getDataLoss(),
            result.getDataLoss(),
            result.getRecoveryTimeSeconds(),
            result.isRecoveryComplete(),
            result.getMode().toJson(),
            result.isSuccess(),
            result.getOutcome().name(),
            result.getFailureCode(),
            result.getErrors());

        ScenarioResponse.Details details = new ScenarioResponse.Details(
            result.getScenarioId(),
            result.getNetwork(),
            result.getActualDurationSeconds(),
            scenario.targets(),
            result.getStartedAt(),
            result.getCompletedAt());

        return new ScenarioResponse(summary, recoveryPoints(result), availabilityPoints(result), details);
    }

    private List<ScenarioResponse.AvailabilityPoint> availabilityPoints(ScenarioResult result) {
        Map<Integer, Map<StoreId, AvailabilitySample>> byTick = new TreeMap<>();
        for (AvailabilitySample sample : result.getAvailability()) {
            byTick.computeIfAbsent(sample.tick(), t -> new EnumMap<>(StoreId.class)).put(sample.store(), sample);
        }
        List<ScenarioResponse.AvailabilityPoint> points = new ArrayList<>();
        byTick.forEach((tick, samples) -> points.add(new ScenarioResponse.AvailabilityPoint(
            tick + "s", view(samples.get(StoreId.MONGODB)), view(samples.get(StoreId.CASSANDRA)))));
        return points;
    }

    private List<ScenarioResponse.RecoveryPoint> recoveryPoints(ScenarioResult result) {
        Map<Integer, Map<StoreId, Boolean>> byTick = new TreeMap<>();
        for (RecoverySample sample : result.getRecovery()) {
            byTick.computeIfAbsent(sample.tick(), t -> new EnumMap<>(StoreId.class))
                .put(sample.store(), sample.storeOnline());
        }
        List<ScenarioResponse.RecoveryPoint> points = new ArrayList<>();
        byTick.forEach((tick, online) -> points.add(new ScenarioResponse.RecoveryPoint(tick + "s",
            percent(online.get(StoreId.MONGODB)), percent(online.get(StoreId.CASSANDRA)))));
        return points;
    }

    private static ScenarioResponse.ProbeView view(AvailabilitySample sample) {
        if (sample == null) {
            return null;
        }
        return new ScenarioResponse.ProbeView(sample.success(), sample.latencyMs(), sample.error());
    }

    private static int percent(Boolean online) {
        return Boolean.FALSE.equals(online) ? 0 : 100;
    }
}
