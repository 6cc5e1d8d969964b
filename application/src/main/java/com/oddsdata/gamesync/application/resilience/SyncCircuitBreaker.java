package com.oddsdata.gamesync.application.resilience;

import com.oddsdata.gamesync.domain.enums.CircuitState;
import com.oddsdata.gamesync.domain.exception.CircuitOpenException;
import com.oddsdata.gamesync.domain.exception.InvalidArgumentException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * Consecutive-failure circuit breaker around the synchronization store queries.
 * <p>
 * Backed by a resilience4j count-based window of {@code failureThreshold} calls with a 100% failure
 * rate threshold, so the breaker opens after that many consecutive failures and any success resets it.
 * A single failure while half-open sends it straight back to OPEN.
 * Rejected calls surface as {@link CircuitOpenException} carrying the earliest retry instant,
 * stamped from the system clock that resilience4j also uses for the OPEN wait.
 */
public class SyncCircuitBreaker {
    
    private static final Logger log = LoggerFactory.getLogger(SyncCircuitBreaker.class);
    
    private final CircuitBreaker circuitBreaker;
    private final Duration recoveryTimeout;
    private volatile Instant openedAt;
    
    public SyncCircuitBreaker(CircuitBreaker circuitBreaker, Duration recoveryTimeout) {
        this.circuitBreaker = circuitBreaker;
        this.recoveryTimeout = recoveryTimeout;
        this.circuitBreaker.getEventPublisher().onStateTransition(event -> {
            CircuitBreaker.State toState = event.getStateTransition().getToState();
            if (toState == CircuitBreaker.State.OPEN) {
                openedAt = Instant.now();
            }
            log.info("Circuit breaker '{}' transitioned {}", circuitBreaker.getName(), event.getStateTransition());
        });
    }
    
    /**
     * Build a breaker with the consecutive-failure semantics and register it under {@code name}
     */
    public static SyncCircuitBreaker create(CircuitBreakerRegistry registry, String name, int failureThreshold,
                                            Duration recoveryTimeout, int successThreshold) {
        if (failureThreshold <= 0 || successThreshold <= 0) {
            throw new InvalidArgumentException("Circuit breaker thresholds must be positive");
        }
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(failureThreshold)
                .minimumNumberOfCalls(failureThreshold) // Only a full window of failures opens it
                .failureRateThreshold(100.0f)
                .waitDurationInOpenState(recoveryTimeout)
                .permittedNumberOfCallsInHalfOpenState(successThreshold)
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .ignoreExceptions(InvalidArgumentException.class)
                .build();
        return new SyncCircuitBreaker(registry.circuitBreaker(name, config), recoveryTimeout);
    }
    
    /**
     * Run a store call through the breaker
     * @throws CircuitOpenException when the breaker rejects the call
     */
    public <T> T execute(Supplier<T> call) {
        try {
            return circuitBreaker.executeSupplier(call);
        } catch (CallNotPermittedException e) {
            throw new CircuitOpenException(circuitBreaker.getName(), retryAfter());
        } catch (InvalidArgumentException e) {
            throw e;
        } catch (RuntimeException e) {
            reopenIfHalfOpen();
            throw e;
        }
    }
    
    public CircuitState getState() {
        return switch (circuitBreaker.getState()) {
            case OPEN, FORCED_OPEN -> CircuitState.OPEN;
            case HALF_OPEN -> CircuitState.HALF_OPEN;
            default -> CircuitState.CLOSED;
        };
    }
    
    public String getName() {
        return circuitBreaker.getName();
    }
    
    /**
     * Earliest instant at which a trial call is let through, null while closed
     */
    public Instant retryAfter() {
        Instant opened = openedAt;
        if (opened == null || getState() == CircuitState.CLOSED) {
            return null;
        }
        return opened.plus(recoveryTimeout);
    }
    
    private synchronized void reopenIfHalfOpen() {
        if (circuitBreaker.getState() != CircuitBreaker.State.HALF_OPEN) {
            return;
        }
        try {
            circuitBreaker.transitionToOpenState();
        } catch (IllegalStateException e) {
            log.debug("Circuit breaker '{}' already left HALF_OPEN: {}", circuitBreaker.getName(), e.getMessage());
        }
    }
}
