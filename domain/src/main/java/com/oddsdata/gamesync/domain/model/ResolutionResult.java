package com.oddsdata.gamesync.domain.model;

import com.oddsdata.gamesync.domain.enums.GameSource;
import com.oddsdata.gamesync.domain.enums.MatchConfidence;
import com.oddsdata.gamesync.domain.enums.ResolutionStatus;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.Optional;

/**
 * Result of resolving one external id to its canonical id.
 * Only RESOLVED carries a canonical id; UNAVAILABLE is a miss caused by a store error.
 */
@Data
@AllArgsConstructor
public class ResolutionResult {
    
    private final ResolutionStatus status;
    private final String externalId;
    private final GameSource source;
    private final String canonicalId;
    private final boolean newlyMapped;
    private final MatchConfidence confidence; // Only set when the external resolver was consulted
    
    public static ResolutionResult cached(String externalId, GameSource source, String canonicalId) {
        return new ResolutionResult(ResolutionStatus.RESOLVED, externalId, source, canonicalId, false, null);
    }
    
    public static ResolutionResult mapped(String externalId, GameSource source, String canonicalId,
                                          MatchConfidence confidence) {
        return new ResolutionResult(ResolutionStatus.RESOLVED, externalId, source, canonicalId, true, confidence);
    }
    
    public static ResolutionResult notFound(String externalId, GameSource source) {
        return new ResolutionResult(ResolutionStatus.NOT_FOUND, externalId, source, null, false, null);
    }
    
    public static ResolutionResult unavailable(String externalId, GameSource source) {
        return new ResolutionResult(ResolutionStatus.UNAVAILABLE, externalId, source, null, false, null);
    }
    
    public boolean isResolved() {
        return status == ResolutionStatus.RESOLVED;
    }
    
    public Optional<String> canonicalId() {
        return Optional.ofNullable(canonicalId);
    }
}
