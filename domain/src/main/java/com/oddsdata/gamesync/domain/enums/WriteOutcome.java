package com.oddsdata.gamesync.domain.enums;

/**
 * Effect of an idempotent upsert on the enriched outcome table
 */
public enum WriteOutcome {
    CREATED,
    UPDATED,
    UNCHANGED
}
