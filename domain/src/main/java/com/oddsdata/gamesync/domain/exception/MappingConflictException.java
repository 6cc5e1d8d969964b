package com.oddsdata.gamesync.domain.exception;

/**
 * A mapping write collided with an external id already owned by another canonical id
 */
public class MappingConflictException extends RuntimeException {
    
    public MappingConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
