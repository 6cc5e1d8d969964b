package com.oddsdata.gamesync.api.controller;

import com.oddsdata.gamesync.application.service.OutcomeSyncService;
import com.oddsdata.gamesync.domain.enums.CircuitState;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Health check controller
 */
@RestController
@RequestMapping("/health")
public class HealthController {
    
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final OutcomeSyncService outcomeSyncService;
    
    public HealthController(CircuitBreakerRegistry circuitBreakerRegistry, OutcomeSyncService outcomeSyncService) {
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.outcomeSyncService = outcomeSyncService;
    }
    
    @GetMapping("/liveness")
    public ResponseEntity<Map<String, String>> liveness() {
        Map<String, String> response = new HashMap<>();
        response.put("status", "UP");
        return ResponseEntity.ok(response);
    }
    
    /**
     * DEGRADED while any breaker is open. Lookups keep working in that state.
     */
    @GetMapping("/readiness")
    public ResponseEntity<Map<String, Object>> readiness() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "UP");
        
        Map<String, String> circuitBreakers = new TreeMap<>();
        circuitBreakerRegistry.getAllCircuitBreakers()
                .forEach(cb -> circuitBreakers.put(cb.getName(), cb.getState().name()));
        response.put("circuitBreakers", circuitBreakers);
        
        boolean anyOpen = circuitBreakers.values().stream()
                .anyMatch(state -> CircuitBreaker.State.OPEN.name().equals(state)
                        || CircuitBreaker.State.FORCED_OPEN.name().equals(state))
                || outcomeSyncService.circuitState() == CircuitState.OPEN;
        if (anyOpen) {
            response.put("status", "DEGRADED");
            response.put("message", "Some circuit breakers are open");
        }
        
        return ResponseEntity.ok(response);
    }
}
