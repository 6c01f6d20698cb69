package com.example.pdp.enforcer.controller;

import com.example.pdp.enforcer.statistics.DecisionStatisticsTracker;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Liveness endpoints for orchestrators. Unhealthy once the engine failure rate has tripped the
 * statistics tracker.
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final DecisionStatisticsTracker statistics;

    @GetMapping({"/health", "/healthy", "/ready"})
    public Mono<ResponseEntity<Map<String, String>>> health() {
        return Mono.fromSupplier(() -> statistics.status()
                ? ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("status", "unhealthy"))
                : ResponseEntity.ok(Map.of("status", "ok")));
    }
}
