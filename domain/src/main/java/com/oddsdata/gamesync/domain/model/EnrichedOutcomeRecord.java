package com.oddsdata.gamesync.domain.model;

import com.oddsdata.gamesync.domain.enums.GameStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Read-optimized final outcome of a game, keyed by canonical id
 * or by the Action Network id while no canonical id exists.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class EnrichedOutcomeRecord {
    
    private String canonicalId;
    private String actionNetworkGameId;
    
    private String homeTeam;
    private String awayTeam;
    private LocalDate gameDate;
    private OffsetDateTime gameDatetime;
    private Integer season;
    private GameStatus gameStatus;
    
    private int homeScore;
    private int awayScore;
    private String winningTeam;
    private boolean homeWin;
    private Boolean over;
    private Boolean homeCoverSpread;
    private Double totalLine;
    private Double homeSpreadLine;
    
    private double dataQualityScore;
    
    @Builder.Default
    private Map<String, Object> featureData = new LinkedHashMap<>();
    
    @Builder.Default
    private Map<String, Object> mlMetadata = new LinkedHashMap<>();
    
    /**
     * Upsert key, canonical id first
     */
    public String recordKey() {
        if (canonicalId != null && !canonicalId.isBlank()) {
            return canonicalId;
        }
        return "action_network:" + actionNetworkGameId;
    }
    
    public boolean hasIdentity() {
        return (canonicalId != null && !canonicalId.isBlank())
                || (actionNetworkGameId != null && !actionNetworkGameId.isBlank());
    }
    
    /**
     * Compare the fields an upsert may overwrite
     */
    public boolean sameOutcomeAs(EnrichedOutcomeRecord other) {
        return other != null
                && homeScore == other.homeScore
                && awayScore == other.awayScore
                && homeWin == other.homeWin
                && Objects.equals(winningTeam, other.winningTeam)
                && Objects.equals(over, other.over)
                && Objects.equals(homeCoverSpread, other.homeCoverSpread)
                && Objects.equals(totalLine, other.totalLine)
                && Objects.equals(homeSpreadLine, other.homeSpreadLine)
                && gameStatus == other.gameStatus
                && Double.compare(dataQualityScore, other.dataQualityScore) == 0
                && Objects.equals(featureData, other.featureData)
                && Objects.equals(mlMetadata, other.mlMetadata);
    }
}
