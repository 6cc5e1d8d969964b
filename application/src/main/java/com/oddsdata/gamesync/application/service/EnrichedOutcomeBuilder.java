package com.oddsdata.gamesync.application.service;

import com.oddsdata.gamesync.domain.enums.GameStatus;
import com.oddsdata.gamesync.domain.exception.InvalidArgumentException;
import com.oddsdata.gamesync.domain.model.EnrichedOutcomeRecord;
import com.oddsdata.gamesync.domain.model.OutcomeSourceRow;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds enriched outcome records from authoritative outcome rows.
 * Output depends only on the input row, so rebuilding an unchanged outcome yields an equal record.
 */
@Component
public class EnrichedOutcomeBuilder {
    
    static final String FEATURE_VERSION = "1.0";
    static final String PRODUCER = "outcome_sync";
    
    public EnrichedOutcomeRecord build(OutcomeSourceRow row) {
        if (!row.hasCompleteScores()) {
            throw new InvalidArgumentException("Outcome " + row.getOutcomeId() + " has no complete score");
        }
        boolean hasCanonical = row.getCanonicalId() != null && !row.getCanonicalId().isBlank();
        boolean hasActionNetwork = row.getActionNetworkGameId() != null && !row.getActionNetworkGameId().isBlank();
        if (!hasCanonical && !hasActionNetwork) {
            throw new InvalidArgumentException("Outcome " + row.getOutcomeId() + " has neither canonical nor Action Network id");
        }
        
        int homeScore = row.getHomeScore();
        int awayScore = row.getAwayScore();
        boolean homeWin = row.getHomeWin() != null ? row.getHomeWin() : homeScore > awayScore;
        
        EnrichedOutcomeRecord record = EnrichedOutcomeRecord.builder()
                .canonicalId(hasCanonical ? row.getCanonicalId() : null)
                .actionNetworkGameId(hasActionNetwork ? row.getActionNetworkGameId() : null)
                .homeTeam(row.getHomeTeam())
                .awayTeam(row.getAwayTeam())
                .gameDate(row.getGameDate())
                .gameDatetime(row.getGameDatetime())
                .season(season(row))
                .gameStatus(GameStatus.FINAL)
                .homeScore(homeScore)
                .awayScore(awayScore)
                .winningTeam(homeWin ? row.getHomeTeam() : row.getAwayTeam())
                .homeWin(homeWin)
                .over(row.getOver())
                .homeCoverSpread(row.getHomeCoverSpread())
                .totalLine(row.getTotalLine())
                .homeSpreadLine(row.getHomeSpreadLine())
                .build();
        
        Map<String, Object> qualityChecks = qualityChecks(record);
        record.setDataQualityScore(qualityScore(qualityChecks));
        record.setFeatureData(featureData(record));
        record.setMlMetadata(mlMetadata(record, row, qualityChecks));
        return record;
    }
    
    private static Integer season(OutcomeSourceRow row) {
        if (row.getSeason() != null) {
            return row.getSeason();
        }
        if (row.getGameDatetime() != null) {
            return row.getGameDatetime().getYear();
        }
        return row.getGameDate() != null ? row.getGameDate().getYear() : null;
    }
    
    private static Map<String, Object> qualityChecks(EnrichedOutcomeRecord record) {
        Map<String, Object> checks = new LinkedHashMap<>();
        checks.put("has_teams", notBlank(record.getHomeTeam()) && notBlank(record.getAwayTeam()));
        checks.put("has_date", record.getGameDate() != null);
        checks.put("has_datetime", record.getGameDatetime() != null);
        checks.put("has_scores", true);
        checks.put("has_betting_lines", record.getTotalLine() != null || record.getHomeSpreadLine() != null);
        return checks;
    }
    
    /**
     * Share of passed quality checks, rounded to two decimals
     */
    static double qualityScore(Map<String, Object> checks) {
        long passed = checks.values().stream().filter(Boolean.TRUE::equals).count();
        return Math.round(passed * 100.0 / checks.size()) / 100.0;
    }
    
    private static Map<String, Object> featureData(EnrichedOutcomeRecord record) {
        Map<String, Object> outcome = new LinkedHashMap<>();
        outcome.put("home_score", record.getHomeScore());
        outcome.put("away_score", record.getAwayScore());
        outcome.put("total_runs", record.getHomeScore() + record.getAwayScore());
        outcome.put("home_win", record.isHomeWin());
        outcome.put("margin", Math.abs(record.getHomeScore() - record.getAwayScore()));
        
        Map<String, Object> betting = new LinkedHashMap<>();
        betting.put("has_total_line", record.getTotalLine() != null);
        betting.put("has_spread_line", record.getHomeSpreadLine() != null);
        betting.put("over_result", record.getOver());
        betting.put("spread_cover", record.getHomeCoverSpread());
        
        Map<String, Object> featureData = new LinkedHashMap<>();
        featureData.put("source", PRODUCER);
        featureData.put("version", FEATURE_VERSION);
        featureData.put("ml_training_ready", true);
        featureData.put("outcome_summary", outcome);
        featureData.put("betting_summary", betting);
        return featureData;
    }
    
    private static Map<String, Object> mlMetadata(EnrichedOutcomeRecord record, OutcomeSourceRow row,
                                                  Map<String, Object> qualityChecks) {
        Map<String, Object> outcomeMetadata = new LinkedHashMap<>();
        outcomeMetadata.put("original_game_id", String.valueOf(row.getSourceGameId()));
        outcomeMetadata.put("outcome_source", "game_outcomes");
        outcomeMetadata.put("has_betting_lines", qualityChecks.get("has_betting_lines"));
        outcomeMetadata.put("total_runs", record.getHomeScore() + record.getAwayScore());
        
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("data_sources", List.of("game_outcomes", "games_complete"));
        metadata.put("feature_version", FEATURE_VERSION);
        metadata.put("producer", PRODUCER);
        metadata.put("has_complete_outcome", true);
        metadata.put("quality_checks", qualityChecks);
        metadata.put("outcome_metadata", outcomeMetadata);
        return metadata;
    }
    
    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
