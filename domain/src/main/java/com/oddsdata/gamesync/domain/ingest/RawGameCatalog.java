package com.oddsdata.gamesync.domain.ingest;

import com.oddsdata.gamesync.domain.enums.GameSource;
import com.oddsdata.gamesync.domain.model.RawGameInfo;
import com.oddsdata.gamesync.domain.model.UnmappedCandidate;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view over the raw per-source ingestion tables
 */
public interface RawGameCatalog {
    
    /**
     * Page through external ids that appear in ingestion tables but have no mapping.
     * Ordered by (source, external id) so pages are stable between calls.
     * @param source Restrict to one source, empty for all sources
     * @param pageSize Maximum number of candidates
     * @param offset Number of candidates to skip
     */
    List<UnmappedCandidate> findUnmapped(Optional<GameSource> source, int pageSize, int offset);
    
    long countUnmapped(Optional<GameSource> source);
    
    /**
     * Teams and date ingested for an external id, used to create a mapping on demand
     */
    Optional<RawGameInfo> findGameInfo(GameSource source, String externalId);
}
