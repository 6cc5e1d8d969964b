package com.oddsdata.gamesync.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.Map;

/**
 * JPA entity for enriched game outcomes read by the feature pipelines
 */
@Entity
@Table(name = "enhanced_games", indexes = {
    @Index(name = "idx_enhanced_games_action_network", columnList = "action_network_game_id"),
    @Index(name = "idx_enhanced_games_game_date", columnList = "game_date")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnhancedGameEntity {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    
    @Column(name = "canonical_game_id", length = 50)
    private String canonicalGameId;
    
    @Column(name = "action_network_game_id")
    private String actionNetworkGameId;
    
    @Column(name = "home_team", nullable = false, length = 100)
    private String homeTeam;
    
    @Column(name = "away_team", nullable = false, length = 100)
    private String awayTeam;
    
    @Column(name = "game_datetime")
    private OffsetDateTime gameDatetime;
    
    @Column(name = "game_date")
    private LocalDate gameDate;
    
    @Column(name = "season")
    private Integer season;
    
    @Column(name = "game_status", length = 20, nullable = false)
    private String gameStatus;
    
    @Column(name = "home_score")
    private Integer homeScore;
    
    @Column(name = "away_score")
    private Integer awayScore;
    
    @Column(name = "winning_team", length = 100)
    private String winningTeam;
    
    @Column(name = "home_win")
    private Boolean homeWin;
    
    @Column(name = "over_result")
    private Boolean overResult;
    
    @Column(name = "home_cover_spread")
    private Boolean homeCoverSpread;
    
    @Column(name = "total_line")
    private Double totalLine;
    
    @Column(name = "home_spread_line")
    private Double homeSpreadLine;
    
    @Column(name = "data_quality_score", nullable = false)
    private Double dataQualityScore;
    
    @Column(name = "feature_data", columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> featureData;
    
    @Column(name = "ml_metadata", columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> mlMetadata;
    
    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;
    
    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;
}
