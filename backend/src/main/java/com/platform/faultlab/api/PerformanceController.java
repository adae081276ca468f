package com.platform.faultlab.api;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST API for store benchmarks.
 */
@Slf4j
@RestController
@RequestMapping("/api/performance")
@RequiredArgsConstructor
@CrossOrigin(origins = "${faultlab.cors.allowed-origins:*}")
public class PerformanceController {

    private final PerformanceService performanceService;

    /**
     * Run the benchmark on both stores and save a report.
     */
    @PostMapping("/run")
    public ResponseEntity<PerformanceResponse> run(@Valid @RequestBody ApiRequests.PerformanceRunRequest request) {
        log.info("Benchmark requested: {} operations, batch {}, {}",
            request.getOperationCount(), request.getBatchSize(), request.getTestType());
        return ResponseEntity.ok(performanceService.run(request));
    }

    /**
     * Remove benchmark data from both stores.
     */
    @PostMapping("/cleanup")
    public ResponseEntity<Map<String, Object>> cleanup() {
        return ResponseEntity.ok(performanceService.cleanup());
    }
}
