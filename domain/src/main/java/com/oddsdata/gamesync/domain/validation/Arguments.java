package com.oddsdata.gamesync.domain.validation;

import com.oddsdata.gamesync.domain.exception.InvalidArgumentException;

/**
 * Argument checks shared by the service entry points.
 * All checks run before any I/O.
 */
public final class Arguments {
    
    private Arguments() {
    }
    
    public static String requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new InvalidArgumentException(name + " is required");
        }
        return value.trim();
    }
    
    public static int requireNonNegative(int value, String name) {
        if (value < 0) {
            throw new InvalidArgumentException(String.format("%s must be non-negative, got %d", name, value));
        }
        return value;
    }
    
    public static int requirePositive(int value, String name) {
        if (value <= 0) {
            throw new InvalidArgumentException(String.format("%s must be a positive integer, got %d", name, value));
        }
        return value;
    }
    
    public static <T> T requirePresent(T value, String name) {
        if (value == null) {
            throw new InvalidArgumentException(name + " is required");
        }
        return value;
    }
}
