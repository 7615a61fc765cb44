package com.flagship.drink_ledger.health;

import com.flagship.drink_ledger.store.LedgerStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Simple health check endpoint for liveness/readiness probes.
 * Unlike the Actuator health endpoint, this needs no identity headers.
 */
@RestController
public class HealthController {

    private final LedgerStore store;

    public HealthController(LedgerStore store) {
        this.store = store;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        boolean storeHealthy = store.isAvailable();
        response.put("store", storeHealthy ? "UP" : "DOWN");

        if (!storeHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
    }
}
