package com.oddsdata.gamesync.domain.outcome;

import com.oddsdata.gamesync.domain.model.OutcomeQuery;
import com.oddsdata.gamesync.domain.model.OutcomeSourceRow;

import java.util.List;

/**
 * Read-only access to authoritative game outcomes
 */
public interface OutcomeSourceReader {
    
    /**
     * Fetch one page of outcomes with both scores present, ordered by outcome id
     * @param query Filter and keyset cursor
     */
    List<OutcomeSourceRow> findOutcomes(OutcomeQuery query);
    
    long countCompleteOutcomes();
    
    /**
     * Complete outcomes whose enriched row is missing or has no scores
     */
    long countMissing();
}
