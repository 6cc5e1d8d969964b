package com.oddsdata.gamesync.domain.enums;

/**
 * Outcome of a canonical id lookup
 */
public enum ResolutionStatus {
    RESOLVED,
    NOT_FOUND,
    UNAVAILABLE // Store error, degraded to a miss
}
