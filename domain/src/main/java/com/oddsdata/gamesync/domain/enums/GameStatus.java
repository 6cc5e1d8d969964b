package com.oddsdata.gamesync.domain.enums;

/**
 * Game status stored on enriched outcome rows
 */
public enum GameStatus {
    SCHEDULED("scheduled"),
    LIVE("live"),
    FINAL("final"),
    POSTPONED("postponed"),
    CANCELLED("cancelled");
    
    private final String value;
    
    GameStatus(String value) {
        this.value = value;
    }
    
    public String getValue() {
        return value;
    }
    
    public static GameStatus fromValue(String value) {
        if (value == null) {
            return SCHEDULED;
        }
        for (GameStatus status : values()) {
            if (status.value.equalsIgnoreCase(value.trim())) {
                return status;
            }
        }
        return SCHEDULED;
    }
}
