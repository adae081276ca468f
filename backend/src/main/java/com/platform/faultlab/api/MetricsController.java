package com.platform.faultlab.api;

import com.platform.faultlab.observability.RequestStats;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST API for request statistics. Reading a category resets it.
 */
@RestController
@RequestMapping("/api/metrics")
@RequiredArgsConstructor
@CrossOrigin(origins = "${faultlab.cors.allowed-origins:*}")
public class MetricsController {

    private final RequestStats requestStats;

    /**
     * Request count and mean latency per category since the last read.
     */
    @GetMapping("/requests")
    public ResponseEntity<Map<String, RequestStats.Interval>> requests() {
        return ResponseEntity.ok(requestStats.snapshotAndResetAll());
    }

    @GetMapping("/requests/{category}")
    public ResponseEntity<RequestStats.Interval> requests(@PathVariable String category) {
        return ResponseEntity.ok(requestStats.snapshotAndReset(category));
    }
}
