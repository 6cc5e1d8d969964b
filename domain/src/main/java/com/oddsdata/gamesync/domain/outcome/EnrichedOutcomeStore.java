package com.oddsdata.gamesync.domain.outcome;

import com.oddsdata.gamesync.domain.enums.WriteOutcome;
import com.oddsdata.gamesync.domain.model.EnrichedOutcomeRecord;

import java.util.List;

/**
 * Store of enriched outcome rows consumed by downstream analytics
 */
public interface EnrichedOutcomeStore {
    
    /**
     * Report what an upsert would do without writing
     */
    WriteOutcome classify(EnrichedOutcomeRecord record);
    
    /**
     * Create or update one row. Writing the same content twice reports UNCHANGED.
     */
    WriteOutcome upsert(EnrichedOutcomeRecord record);
    
    /**
     * Upsert a batch atomically; either every record is written or none is
     * @return Outcome per record, in input order
     */
    List<WriteOutcome> upsertAll(List<EnrichedOutcomeRecord> records);
    
    long countWithScores();
}
