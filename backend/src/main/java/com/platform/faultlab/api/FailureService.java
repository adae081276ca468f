package com.platform.faultlab.api;

import com.platform.faultlab.config.FaultLabProperties;
import com.platform.faultlab.error.ValidationException;
import com.platform.faultlab.infra.InfrastructureController;
import com.platform.faultlab.infra.NodeUptime;
import com.platform.faultlab.scenario.FailureScenarioRunner;
import com.platform.faultlab.scenario.Scenario;
import com.platform.faultlab.scenario.ScenarioKind;
import com.platform.faultlab.scenario.ScenarioResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for failure simulations and node maintenance.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FailureService {

    static final String SYNTHETIC_STOP_MESSAGE = "Synthetic mode: no containers to restore";
    static final String STOP_MESSAGE = "Restoration complete";

    private final FailureScenarioRunner runner;
    private final InfrastructureController infrastructure;
    private final ScenarioResponseMapper mapper;
    private final FaultLabProperties properties;

    /**
     * Run a failure scenario and block until it completes.
     * @throws ValidationException if the request cannot form a scenario
     */
    public ScenarioResponse simulate(ApiRequests.FailureSimulationRequest request) {
        ScenarioKind kind = ScenarioKind.fromFailureType(request.getFailureType());
        Scenario scenario = new Scenario(kind, Scenario.parseTargets(request.getTargetNode()),
            request.getDuration(), request.isTestOperations());
        ScenarioResult result = runner.run(scenario);
        return mapper.toResponse(result);
    }

    /**
     * Uptime of each named node.
     */
    public Map<String, NodeUptime> uptimes(String names) {
        List<String> nodes = Scenario.parseTargets(names);
        if (nodes.isEmpty()) {
            throw new ValidationException("names", names, "No container names provided");
        }
        Map<String, NodeUptime> uptimes = new LinkedHashMap<>();
        for (String node : nodes) {
            uptimes.put(node, infrastructure.uptime(node));
        }
        return uptimes;
    }

    /**
     * Start every known node that is not running.
     */
    public StopResult stop() {
        if (infrastructure.isSynthetic()) {
            return new StopResult(SYNTHETIC_STOP_MESSAGE, List.of());
        }
        List<String> restored = infrastructure.restore(properties.getKnownNodes());
        return new StopResult(STOP_MESSAGE, restored);
    }

    public record StopResult(String message, List<String> restored) {}
}
