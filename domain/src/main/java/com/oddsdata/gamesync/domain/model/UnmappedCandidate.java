package com.oddsdata.gamesync.domain.model;

import com.oddsdata.gamesync.domain.enums.GameSource;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * External id found in a raw ingestion table with no mapping row yet
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UnmappedCandidate {
    private String externalId;
    private GameSource source;
    private String homeTeam;
    private String awayTeam;
    private LocalDate gameDate;
    private String originTable;
    
    public ExternalGameRef toRef() {
        return ExternalGameRef.of(externalId, source);
    }
}
