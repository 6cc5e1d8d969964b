package com.oddsdata.gamesync.domain.exception;

/**
 * Transient store connectivity or timeout failure
 */
public class StoreUnavailableException extends RuntimeException {
    
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
