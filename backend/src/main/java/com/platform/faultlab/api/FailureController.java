package com.platform.faultlab.api;

import com.platform.faultlab.infra.NodeUptime;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST API for failure simulations.
 */
@Slf4j
@RestController
@RequestMapping("/api/failure")
@RequiredArgsConstructor
@CrossOrigin(origins = "${faultlab.cors.allowed-origins:*}")
public class FailureController {

    private final FailureService failureService;

    /**
     * Run a failure scenario. Blocks for the scenario's duration plus recovery.
     * Scenario failures are reported in the summary, not as HTTP errors.
     */
    @PostMapping("/simulate")
    public ResponseEntity<ScenarioResponse> simulate(
            @Valid @RequestBody ApiRequests.FailureSimulationRequest request) {
        log.info("Simulation requested: {} on {} for {}s",
            request.getFailureType(), request.getTargetNode(), request.getDuration());
        return ResponseEntity.ok(failureService.simulate(request));
    }

    /**
     * Get uptime of the named nodes.
     */
    @GetMapping("/container-uptimes")
    public ResponseEntity<Map<String, Map<String, NodeUptime>>> containerUptimes(@RequestParam String names) {
        return ResponseEntity.ok(Map.of("uptimes", failureService.uptimes(names)));
    }

    /**
     * Restart every stopped node.
     */
    @PostMapping("/stop")
    public ResponseEntity<FailureService.StopResult> stop() {
        return ResponseEntity.ok(failureService.stop());
    }

    @GetMapping("/cap-analysis")
    public ResponseEntity<Map<String, CapAnalysis.Scorecard>> capAnalysis() {
        return ResponseEntity.ok(CapAnalysis.scorecards());
    }
}
