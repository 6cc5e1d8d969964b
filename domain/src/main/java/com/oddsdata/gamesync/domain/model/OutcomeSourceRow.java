package com.oddsdata.gamesync.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.OffsetDateTime;

/**
 * Authoritative outcome joined with the game identity it belongs to
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutcomeSourceRow {
    private long outcomeId;
    private long sourceGameId;
    private String canonicalId;
    private String actionNetworkGameId;
    private String homeTeam;
    private String awayTeam;
    private Integer homeScore;
    private Integer awayScore;
    private Boolean homeWin;
    private Boolean over;
    private Boolean homeCoverSpread;
    private Double totalLine;
    private Double homeSpreadLine;
    private LocalDate gameDate;
    private OffsetDateTime gameDatetime;
    private Integer season;
    private String venueName;
    private String gameStatus;
    
    public boolean hasCompleteScores() {
        return homeScore != null && awayScore != null;
    }
}
