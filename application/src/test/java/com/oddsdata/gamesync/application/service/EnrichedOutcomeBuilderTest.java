package com.oddsdata.gamesync.application.service;

import com.oddsdata.gamesync.domain.enums.GameStatus;
import com.oddsdata.gamesync.domain.exception.InvalidArgumentException;
import com.oddsdata.gamesync.domain.model.EnrichedOutcomeRecord;
import com.oddsdata.gamesync.domain.model.OutcomeSourceRow;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EnrichedOutcomeBuilderTest {
    
    private final EnrichedOutcomeBuilder builder = new EnrichedOutcomeBuilder();
    
    @Test
    void testHomeWinDerivedFromScores() {
        EnrichedOutcomeRecord record = builder.build(base().build());
        
        assertEquals("MLB-778899", record.getCanonicalId());
        assertEquals(7, record.getHomeScore());
        assertEquals(4, record.getAwayScore());
        assertTrue(record.isHomeWin());
        assertEquals("Red Sox", record.getWinningTeam());
        assertEquals(GameStatus.FINAL, record.getGameStatus());
        assertEquals(2024, record.getSeason());
    }
    
    @Test
    void testAwayWinAndExplicitFlag() {
        EnrichedOutcomeRecord awayWin = builder.build(base().homeScore(2).awayScore(5).build());
        assertFalse(awayWin.isHomeWin());
        assertEquals("Yankees", awayWin.getWinningTeam());
        
        // Source flag wins over the score comparison
        EnrichedOutcomeRecord flagged = builder.build(base().homeWin(false).build());
        assertFalse(flagged.isHomeWin());
    }
    
    @Test
    void testSeasonFromRowThenDatetime() {
        assertEquals(2023, builder.build(base().season(2023).build()).getSeason());
        OffsetDateTime lateGame = OffsetDateTime.of(2025, 4, 1, 1, 5, 0, 0, ZoneOffset.UTC);
        assertEquals(2025, builder.build(base().gameDatetime(lateGame).build()).getSeason());
    }
    
    @Test
    void testIncompleteScoresRejected() {
        assertThrows(InvalidArgumentException.class, () -> builder.build(base().awayScore(null).build()));
    }
    
    @Test
    void testRowWithoutAnyIdRejected() {
        assertThrows(InvalidArgumentException.class,
                () -> builder.build(base().canonicalId(null).actionNetworkGameId(" ").build()));
    }
    
    @Test
    void testActionNetworkKeyUsedWithoutCanonicalId() {
        EnrichedOutcomeRecord record = builder.build(base().canonicalId(null).build());
        
        assertNull(record.getCanonicalId());
        assertEquals("action_network:AN-9001", record.recordKey());
    }
    
    @Test
    void testBuildIsDeterministic() {
        OutcomeSourceRow row = base().totalLine(8.5).over(true).build();
        
        EnrichedOutcomeRecord first = builder.build(row);
        EnrichedOutcomeRecord second = builder.build(row);
        
        assertTrue(first.sameOutcomeAs(second));
        assertEquals(first.getFeatureData(), second.getFeatureData());
        assertEquals(first.getMlMetadata(), second.getMlMetadata());
    }
    
    @Test
    @SuppressWarnings("unchecked")
    void testFeatureAndMetadataPayloads() {
        EnrichedOutcomeRecord record = builder.build(base().totalLine(8.5).over(true).build());
        
        Map<String, Object> outcome = (Map<String, Object>) record.getFeatureData().get("outcome_summary");
        assertEquals(11, outcome.get("total_runs"));
        assertEquals(3, outcome.get("margin"));
        Map<String, Object> betting = (Map<String, Object>) record.getFeatureData().get("betting_summary");
        assertEquals(true, betting.get("has_total_line"));
        assertEquals(false, betting.get("has_spread_line"));
        
        Map<String, Object> outcomeMetadata = (Map<String, Object>) record.getMlMetadata().get("outcome_metadata");
        assertEquals("5001", outcomeMetadata.get("original_game_id"));
    }
    
    @Test
    void testQualityScoreCountsPassedChecks() {
        // Teams, date and scores present; no datetime, no lines
        assertEquals(0.6, builder.build(base().build()).getDataQualityScore(), 1e-9);
        
        OffsetDateTime start = OffsetDateTime.of(2024, 8, 15, 23, 10, 0, 0, ZoneOffset.UTC);
        assertEquals(1.0, builder.build(base().gameDatetime(start).homeSpreadLine(-1.5).build())
                .getDataQualityScore(), 1e-9);
    }
    
    private static OutcomeSourceRow.OutcomeSourceRowBuilder base() {
        return OutcomeSourceRow.builder()
                .outcomeId(1)
                .sourceGameId(5001)
                .canonicalId("MLB-778899")
                .actionNetworkGameId("AN-9001")
                .awayTeam("Yankees")
                .homeTeam("Red Sox")
                .homeScore(7)
                .awayScore(4)
                .gameDate(LocalDate.of(2024, 8, 15));
    }
}
