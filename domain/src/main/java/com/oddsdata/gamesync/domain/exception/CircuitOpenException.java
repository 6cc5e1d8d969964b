package com.oddsdata.gamesync.domain.exception;

import java.time.Instant;

/**
 * Call rejected because the synchronization circuit breaker is open
 */
public class CircuitOpenException extends RuntimeException {
    
    private final String breakerName;
    private final Instant retryAfter;
    
    public CircuitOpenException(String breakerName, Instant retryAfter) {
        super(String.format("Circuit breaker '%s' is open, retry after %s", breakerName, retryAfter));
        this.breakerName = breakerName;
        this.retryAfter = retryAfter;
    }
    
    public String getBreakerName() {
        return breakerName;
    }
    
    /**
     * Earliest instant at which a trial call will be let through
     */
    public Instant getRetryAfter() {
        return retryAfter;
    }
}
