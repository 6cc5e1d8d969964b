package com.oddsdata.gamesync.domain.model;

import com.oddsdata.gamesync.domain.enums.GameSource;
import com.oddsdata.gamesync.domain.enums.PrimarySource;
import com.oddsdata.gamesync.domain.exception.InvalidArgumentException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Canonical identity of a game across all odds sources.
 * Keyed by the canonical id, holding at most one external id per source.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class GameIdentityMapping {
    
    private String canonicalId;
    
    @Builder.Default
    private Map<GameSource, String> externalIds = new EnumMap<>(GameSource.class);
    
    private String homeTeam;
    private String awayTeam;
    private LocalDate gameDate;
    private OffsetDateTime gameDatetime;
    
    @Builder.Default
    private double resolutionConfidence = 1.0;
    
    private PrimarySource primarySource;
    private OffsetDateTime lastVerifiedAt;
    private int verificationAttempts;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
    
    public Optional<String> externalId(GameSource source) {
        return Optional.ofNullable(externalIds.get(source));
    }
    
    public GameIdentityMapping withExternalId(GameSource source, String externalId) {
        externalIds.put(source, externalId);
        return this;
    }
    
    /**
     * Check the row-level invariants enforced by the table constraints
     */
    public void validate() {
        if (canonicalId == null || canonicalId.isBlank()) {
            throw new InvalidArgumentException("Canonical id is required");
        }
        if (externalIds == null || externalIds.values().stream().allMatch(id -> id == null || id.isBlank())) {
            throw new InvalidArgumentException("Mapping " + canonicalId + " must carry at least one external id");
        }
        if (homeTeam == null || homeTeam.isBlank() || awayTeam == null || awayTeam.isBlank()) {
            throw new InvalidArgumentException("Mapping " + canonicalId + " requires home and away team");
        }
        if (gameDate == null) {
            throw new InvalidArgumentException("Mapping " + canonicalId + " requires a game date");
        }
        if (resolutionConfidence < 0.0 || resolutionConfidence > 1.0) {
            throw new InvalidArgumentException(String.format("Resolution confidence must be within [0,1], got %s",
                    resolutionConfidence));
        }
    }
}
