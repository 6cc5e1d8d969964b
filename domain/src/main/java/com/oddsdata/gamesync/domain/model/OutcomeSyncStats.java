package com.oddsdata.gamesync.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutcomeSyncStats {
    private long enrichedWithScores;
    private long totalCompleteOutcomes;
    private long missingEnriched;
    private double completionRatePercent;
    private boolean mlTrainingReady;
    private long totalSynced;
    private long totalCreated;
    private long totalUpdated;
    private OffsetDateTime lastSync;
}
