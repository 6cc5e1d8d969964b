package com.oddsdata.gamesync.domain.model;

import com.oddsdata.gamesync.domain.enums.CircuitState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Health of the outcome synchronization: healthy, needs_sync or unhealthy
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncHealth {
    
    public static final String HEALTHY = "healthy";
    public static final String NEEDS_SYNC = "needs_sync";
    public static final String UNHEALTHY = "unhealthy";
    
    private String status;
    private boolean databaseConnected;
    private long enrichedWithScores;
    private long missingEnriched;
    private boolean mlTrainingReady;
    private boolean syncNeeded;
    private CircuitState circuitState;
    private String error;
}
