package com.oddsdata.gamesync.domain.enums;

/**
 * Why a synchronization run stopped before exhausting its pages
 */
public enum SyncAbortReason {
    NONE,
    CIRCUIT_OPEN,   // Breaker rejected the page query, retry after the reported time
    STORE_UNAVAILABLE
}
