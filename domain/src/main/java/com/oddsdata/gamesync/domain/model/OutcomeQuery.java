package com.oddsdata.gamesync.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * One keyset page of complete outcomes
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class OutcomeQuery {
    
    /** Only outcomes whose enriched row is absent or lacks scores */
    private boolean onlyMissing;
    
    /** Inclusive lower bound on the outcome date, null for no bound */
    private LocalDate since;
    
    /** Exclusive outcome id cursor */
    private long afterOutcomeId;
    
    private int pageSize;
    
    public OutcomeQuery next(long lastOutcomeId) {
        return toBuilder().afterOutcomeId(lastOutcomeId).build();
    }
}
