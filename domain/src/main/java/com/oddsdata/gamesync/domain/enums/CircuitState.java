package com.oddsdata.gamesync.domain.enums;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
