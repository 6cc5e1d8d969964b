package com.oddsdata.gamesync.infrastructure.persistence.repository;

import com.oddsdata.gamesync.infrastructure.persistence.entity.GameIdMappingEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for the identity mapping table.
 * Each source column has a partial unique index, so the point lookups return at most one row.
 */
@Repository
public interface GameIdMappingRepository extends JpaRepository<GameIdMappingEntity, Long> {
    
    Optional<GameIdMappingEntity> findByCanonicalGameId(String canonicalGameId);
    
    Optional<GameIdMappingEntity> findByActionNetworkGameId(String actionNetworkGameId);
    
    Optional<GameIdMappingEntity> findByVsinGameId(String vsinGameId);
    
    Optional<GameIdMappingEntity> findBySbdGameId(String sbdGameId);
    
    Optional<GameIdMappingEntity> findBySbrGameId(String sbrGameId);
    
    List<GameIdMappingEntity> findByActionNetworkGameIdIn(Collection<String> ids);
    
    List<GameIdMappingEntity> findByVsinGameIdIn(Collection<String> ids);
    
    List<GameIdMappingEntity> findBySbdGameIdIn(Collection<String> ids);
    
    List<GameIdMappingEntity> findBySbrGameIdIn(Collection<String> ids);
    
    /**
     * Insert or merge by canonical id.
     * External ids are only filled in, never cleared; confidence only increases.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = "INSERT INTO game_id_mappings (canonical_game_id, action_network_game_id, vsin_game_id, " +
            "sbd_game_id, sbr_game_id, home_team, away_team, game_date, game_datetime, resolution_confidence, " +
            "primary_source, last_verified_at, verification_attempts, created_at, updated_at) " +
            "VALUES (:canonicalGameId, :actionNetworkGameId, :vsinGameId, :sbdGameId, :sbrGameId, " +
            ":homeTeam, :awayTeam, :gameDate, CAST(:gameDatetime AS TIMESTAMPTZ), :confidence, :primarySource, " +
            "now(), 0, now(), now()) " +
            "ON CONFLICT (canonical_game_id) DO UPDATE SET " +
            "action_network_game_id = COALESCE(EXCLUDED.action_network_game_id, game_id_mappings.action_network_game_id), " +
            "vsin_game_id = COALESCE(EXCLUDED.vsin_game_id, game_id_mappings.vsin_game_id), " +
            "sbd_game_id = COALESCE(EXCLUDED.sbd_game_id, game_id_mappings.sbd_game_id), " +
            "sbr_game_id = COALESCE(EXCLUDED.sbr_game_id, game_id_mappings.sbr_game_id), " +
            "game_datetime = COALESCE(game_id_mappings.game_datetime, EXCLUDED.game_datetime), " +
            "resolution_confidence = GREATEST(game_id_mappings.resolution_confidence, EXCLUDED.resolution_confidence), " +
            "last_verified_at = now(), " +
            "verification_attempts = game_id_mappings.verification_attempts + 1, " +
            "updated_at = now()",
            nativeQuery = true)
    int upsert(@Param("canonicalGameId") String canonicalGameId,
               @Param("actionNetworkGameId") String actionNetworkGameId,
               @Param("vsinGameId") String vsinGameId,
               @Param("sbdGameId") String sbdGameId,
               @Param("sbrGameId") String sbrGameId,
               @Param("homeTeam") String homeTeam,
               @Param("awayTeam") String awayTeam,
               @Param("gameDate") LocalDate gameDate,
               @Param("gameDatetime") OffsetDateTime gameDatetime,
               @Param("confidence") double confidence,
               @Param("primarySource") String primarySource);
    
    /**
     * Row count, per-source counts, average confidence and last update in one pass
     */
    @Query("SELECT COUNT(m), COUNT(m.actionNetworkGameId), COUNT(m.vsinGameId), COUNT(m.sbdGameId), " +
           "COUNT(m.sbrGameId), AVG(m.resolutionConfidence), MAX(m.updatedAt) FROM GameIdMappingEntity m")
    List<Object[]> aggregateStats();
    
    long countByResolutionConfidenceLessThan(double threshold);
    
    @Query("SELECT m.canonicalGameId FROM GameIdMappingEntity m WHERE m.resolutionConfidence < :threshold " +
           "ORDER BY m.resolutionConfidence ASC, m.canonicalGameId ASC")
    List<String> findLowConfidenceCanonicalIds(@Param("threshold") double threshold, Pageable pageable);
    
    @Query("SELECT COUNT(m) FROM GameIdMappingEntity m " +
           "WHERE m.lastVerifiedAt IS NULL OR m.lastVerifiedAt < :threshold")
    long countStale(@Param("threshold") OffsetDateTime threshold);
    
    @Query("SELECT m.canonicalGameId FROM GameIdMappingEntity m " +
           "WHERE m.lastVerifiedAt IS NULL OR m.lastVerifiedAt < :threshold ORDER BY m.canonicalGameId ASC")
    List<String> findStaleCanonicalIds(@Param("threshold") OffsetDateTime threshold, Pageable pageable);
    
    /**
     * Groups of distinct canonical ids sharing teams and date, with the smallest canonical id as sample
     */
    @Query("SELECT m.homeTeam, m.awayTeam, m.gameDate, COUNT(m), MIN(m.canonicalGameId) " +
           "FROM GameIdMappingEntity m GROUP BY m.homeTeam, m.awayTeam, m.gameDate HAVING COUNT(m) > 1 " +
           "ORDER BY MIN(m.canonicalGameId)")
    List<Object[]> findDuplicateGameGroups();
}
