package com.platform.faultlab.api;

import com.platform.faultlab.infra.InfrastructureController;
import com.platform.faultlab.store.StoreDriver;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST API for service health.
 */
@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
@CrossOrigin(origins = "${faultlab.cors.allowed-origins:*}")
public class HealthController {

    private final InfrastructureController infrastructure;
    private final List<StoreDriver> drivers;

    /**
     * Service status with the infrastructure mode and store connections.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Boolean> stores = new LinkedHashMap<>();
        drivers.forEach(driver -> stores.put(driver.getStoreId().getKey(), driver.isConnected()));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("message", "Controller API is running!");
        body.put("mode", infrastructure.getMode().toJson());
        body.put("stores", stores);
        return ResponseEntity.ok(body);
    }

    /**
     * Simple liveness probe.
     */
    @GetMapping("/live")
    public ResponseEntity<Map<String, String>> liveness() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }
}
