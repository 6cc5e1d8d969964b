package com.oddsdata.gamesync.domain.exception;

/**
 * Malformed input rejected before any store access. Never retried.
 */
public class InvalidArgumentException extends IllegalArgumentException {
    
    public InvalidArgumentException(String message) {
        super(message);
    }
}
