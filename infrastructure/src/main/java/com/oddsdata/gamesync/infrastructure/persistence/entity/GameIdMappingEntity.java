package com.oddsdata.gamesync.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.OffsetDateTime;

/**
 * JPA entity for the cross-source game identity mapping table
 */
@Entity
@Table(name = "game_id_mappings")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GameIdMappingEntity {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    
    @Column(name = "canonical_game_id", nullable = false, unique = true, length = 50)
    private String canonicalGameId;
    
    @Column(name = "action_network_game_id")
    private String actionNetworkGameId;
    
    @Column(name = "vsin_game_id")
    private String vsinGameId;
    
    @Column(name = "sbd_game_id")
    private String sbdGameId;
    
    @Column(name = "sbr_game_id")
    private String sbrGameId;
    
    @Column(name = "home_team", nullable = false, length = 100)
    private String homeTeam;
    
    @Column(name = "away_team", nullable = false, length = 100)
    private String awayTeam;
    
    @Column(name = "game_date", nullable = false)
    private LocalDate gameDate;
    
    @Column(name = "game_datetime")
    private OffsetDateTime gameDatetime;
    
    @Column(name = "resolution_confidence", nullable = false)
    private Double resolutionConfidence;
    
    @Column(name = "primary_source", length = 50)
    private String primarySource;
    
    @Column(name = "last_verified_at")
    private OffsetDateTime lastVerifiedAt;
    
    @Column(name = "verification_attempts", nullable = false)
    private Integer verificationAttempts;
    
    @Column(name = "created_at", nullable = false, insertable = false, updatable = false)
    private OffsetDateTime createdAt;
    
    @Column(name = "updated_at", nullable = false, insertable = false, updatable = false)
    private OffsetDateTime updatedAt;
}
