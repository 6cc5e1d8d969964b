package com.oddsdata.gamesync.infrastructure.persistence.repository;

import com.oddsdata.gamesync.infrastructure.persistence.entity.EnhancedGameEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for enriched outcome rows
 */
@Repository
public interface EnhancedGameRepository extends JpaRepository<EnhancedGameEntity, Long> {
    
    Optional<EnhancedGameEntity> findByCanonicalGameId(String canonicalGameId);
    
    /**
     * Fallback key for outcomes whose game has no canonical id yet
     */
    Optional<EnhancedGameEntity> findFirstByActionNetworkGameIdOrderByIdAsc(String actionNetworkGameId);
    
    @Query("SELECT COUNT(e) FROM EnhancedGameEntity e WHERE e.homeScore IS NOT NULL AND e.awayScore IS NOT NULL")
    long countWithScores();
}
