package com.oddsdata.gamesync.application.config;

import com.oddsdata.gamesync.application.resilience.SyncCircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Resiliency configuration
 * Circuit breakers for the outcome synchronization queries and the external resolver
 */
@Configuration
public class ResiliencyConfig {
    
    /**
     * Circuit breaker registry
     */
    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        return CircuitBreakerRegistry.ofDefaults();
    }
    
    /**
     * Circuit breaker for the synchronization engine's page queries
     */
    @Bean
    public SyncCircuitBreaker outcomeSyncCircuitBreaker(
            CircuitBreakerRegistry registry,
            @Value("${app.sync.circuit-breaker.failure-threshold:5}") int failureThreshold,
            @Value("${app.sync.circuit-breaker.recovery-timeout:PT60S}") Duration recoveryTimeout,
            @Value("${app.sync.circuit-breaker.success-threshold:3}") int successThreshold) {
        return SyncCircuitBreaker.create(registry, "outcomeSync", failureThreshold, recoveryTimeout,
                successThreshold);
    }
    
    /**
     * Circuit breaker for the external resolver service
     */
    @Bean("externalResolverCircuitBreaker")
    public CircuitBreaker externalResolverCircuitBreaker(CircuitBreakerRegistry registry) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(50.0f) // Open after 50% failures
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .slidingWindowSize(20)
                .minimumNumberOfCalls(10)
                .permittedNumberOfCallsInHalfOpenState(3)
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .recordExceptions(Exception.class)
                .build();
        
        return registry.circuitBreaker("externalResolver", config);
    }
}
