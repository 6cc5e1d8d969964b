package com.oddsdata.gamesync.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.OffsetDateTime;

/**
 * Teams and date of a game as recorded by a raw ingestion table
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawGameInfo {
    private String homeTeam;
    private String awayTeam;
    private LocalDate gameDate;
    private OffsetDateTime gameDatetime;
}
