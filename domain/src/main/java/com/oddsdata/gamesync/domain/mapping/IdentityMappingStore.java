package com.oddsdata.gamesync.domain.mapping;

import com.oddsdata.gamesync.domain.enums.GameSource;
import com.oddsdata.gamesync.domain.model.GameIdentityMapping;
import com.oddsdata.gamesync.domain.model.MappingStats;
import com.oddsdata.gamesync.domain.model.MappingValidationIssue;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Abstraction over the persistent identity mapping table.
 * Implementations throw {@link com.oddsdata.gamesync.domain.exception.StoreUnavailableException}
 * when the backing store cannot be reached.
 */
public interface IdentityMappingStore {
    
    /**
     * Find the canonical id an external id is mapped to
     * @param source The source the external id belongs to
     * @param externalId The external id
     * @return The canonical id, empty when unmapped
     */
    Optional<String> findCanonicalId(GameSource source, String externalId);
    
    /**
     * Look up many external ids of one source in a single round trip
     * @param source The source all ids belong to
     * @param externalIds The external ids
     * @return Canonical id per mapped external id; unmapped ids are absent
     */
    Map<String, String> findCanonicalIds(GameSource source, Collection<String> externalIds);
    
    Optional<GameIdentityMapping> findByCanonicalId(String canonicalId);
    
    /**
     * Insert or merge a mapping row keyed by canonical id.
     * Existing external ids of other sources are kept and confidence never decreases.
     * @param mapping The mapping to write
     * @return The row as stored after the merge
     */
    GameIdentityMapping upsert(GameIdentityMapping mapping);
    
    /**
     * Compute mapping counts per source, average confidence and last update time.
     * Unmapped count and coverage are filled in by the caller.
     */
    MappingStats stats();
    
    /**
     * Flag low-confidence, stale and duplicate mappings
     * @param minConfidence Rows below this confidence are reported
     * @param staleAfterDays Rows not verified for longer than this are reported
     */
    List<MappingValidationIssue> validate(double minConfidence, int staleAfterDays);
}
