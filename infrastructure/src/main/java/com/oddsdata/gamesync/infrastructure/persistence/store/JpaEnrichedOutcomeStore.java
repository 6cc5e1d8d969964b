package com.oddsdata.gamesync.infrastructure.persistence.store;

import com.oddsdata.gamesync.domain.enums.GameStatus;
import com.oddsdata.gamesync.domain.enums.WriteOutcome;
import com.oddsdata.gamesync.domain.exception.InvalidArgumentException;
import com.oddsdata.gamesync.domain.exception.StoreUnavailableException;
import com.oddsdata.gamesync.domain.model.EnrichedOutcomeRecord;
import com.oddsdata.gamesync.domain.outcome.EnrichedOutcomeStore;
import com.oddsdata.gamesync.infrastructure.persistence.entity.EnhancedGameEntity;
import com.oddsdata.gamesync.infrastructure.persistence.repository.EnhancedGameRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Enriched outcome store backed by Spring Data JPA.
 * Rows are matched by canonical id first, then by Action Network id.
 */
@Component
public class JpaEnrichedOutcomeStore implements EnrichedOutcomeStore {
    
    private static final Logger log = LoggerFactory.getLogger(JpaEnrichedOutcomeStore.class);
    
    private final EnhancedGameRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    
    public JpaEnrichedOutcomeStore(EnhancedGameRepository repository, TransactionTemplate transactionTemplate,
                                   Clock clock) {
        this.repository = repository;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }
    
    @Override
    public WriteOutcome classify(EnrichedOutcomeRecord record) {
        requireIdentity(record);
        try {
            return findExisting(record)
                    .map(existing -> isUnchanged(existing, record) ? WriteOutcome.UNCHANGED : WriteOutcome.UPDATED)
                    .orElse(WriteOutcome.CREATED);
        } catch (DataAccessException | TransactionException e) {
            throw new StoreUnavailableException("Failed to read enriched outcome " + record.recordKey(), e);
        }
    }
    
    @Override
    public WriteOutcome upsert(EnrichedOutcomeRecord record) {
        requireIdentity(record);
        try {
            return transactionTemplate.execute(status -> write(record));
        } catch (DataAccessException | TransactionException e) {
            throw new StoreUnavailableException("Failed to write enriched outcome " + record.recordKey(), e);
        }
    }
    
    @Override
    public List<WriteOutcome> upsertAll(List<EnrichedOutcomeRecord> records) {
        records.forEach(JpaEnrichedOutcomeStore::requireIdentity);
        try {
            return transactionTemplate.execute(status -> {
                List<WriteOutcome> outcomes = new ArrayList<>(records.size());
                for (EnrichedOutcomeRecord record : records) {
                    outcomes.add(write(record));
                }
                repository.flush();
                return outcomes;
            });
        } catch (DataAccessException | TransactionException e) {
            throw new StoreUnavailableException("Failed to write batch of " + records.size() + " enriched outcomes", e);
        }
    }
    
    @Override
    public long countWithScores() {
        try {
            return repository.countWithScores();
        } catch (DataAccessException | TransactionException e) {
            throw new StoreUnavailableException("Failed to count enriched outcomes", e);
        }
    }
    
    private WriteOutcome write(EnrichedOutcomeRecord record) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        Optional<EnhancedGameEntity> existing = findExisting(record);
        if (existing.isEmpty()) {
            EnhancedGameEntity entity = new EnhancedGameEntity();
            apply(entity, record);
            entity.setCreatedAt(now);
            entity.setUpdatedAt(now);
            repository.save(entity);
            log.debug("Created enriched outcome {}", record.recordKey());
            return WriteOutcome.CREATED;
        }
        EnhancedGameEntity entity = existing.get();
        if (isUnchanged(entity, record)) {
            return WriteOutcome.UNCHANGED;
        }
        apply(entity, record);
        entity.setUpdatedAt(now);
        repository.save(entity);
        log.debug("Updated enriched outcome {}", record.recordKey());
        return WriteOutcome.UPDATED;
    }
    
    private Optional<EnhancedGameEntity> findExisting(EnrichedOutcomeRecord record) {
        if (record.getCanonicalId() != null && !record.getCanonicalId().isBlank()) {
            Optional<EnhancedGameEntity> byCanonical = repository.findByCanonicalGameId(record.getCanonicalId());
            if (byCanonical.isPresent()) {
                return byCanonical;
            }
        }
        if (record.getActionNetworkGameId() != null && !record.getActionNetworkGameId().isBlank()) {
            return repository.findFirstByActionNetworkGameIdOrderByIdAsc(record.getActionNetworkGameId())
                    .filter(row -> row.getCanonicalGameId() == null
                            || Objects.equals(row.getCanonicalGameId(), record.getCanonicalId()));
        }
        return Optional.empty();
    }
    
    private static boolean isUnchanged(EnhancedGameEntity entity, EnrichedOutcomeRecord record) {
        boolean keyUnchanged = record.getCanonicalId() == null
                || record.getCanonicalId().equals(entity.getCanonicalGameId());
        return keyUnchanged && toRecord(entity).sameOutcomeAs(record);
    }
    
    private static void apply(EnhancedGameEntity entity, EnrichedOutcomeRecord record) {
        if (record.getCanonicalId() != null) {
            entity.setCanonicalGameId(record.getCanonicalId());
        }
        if (record.getActionNetworkGameId() != null) {
            entity.setActionNetworkGameId(record.getActionNetworkGameId());
        }
        entity.setHomeTeam(record.getHomeTeam());
        entity.setAwayTeam(record.getAwayTeam());
        entity.setGameDate(record.getGameDate());
        entity.setGameDatetime(record.getGameDatetime());
        entity.setSeason(record.getSeason());
        entity.setGameStatus(record.getGameStatus() != null ? record.getGameStatus().getValue() : null);
        entity.setHomeScore(record.getHomeScore());
        entity.setAwayScore(record.getAwayScore());
        entity.setWinningTeam(record.getWinningTeam());
        entity.setHomeWin(record.isHomeWin());
        entity.setOverResult(record.getOver());
        entity.setHomeCoverSpread(record.getHomeCoverSpread());
        entity.setTotalLine(record.getTotalLine());
        entity.setHomeSpreadLine(record.getHomeSpreadLine());
        entity.setDataQualityScore(record.getDataQualityScore());
        entity.setFeatureData(new LinkedHashMap<>(record.getFeatureData()));
        entity.setMlMetadata(new LinkedHashMap<>(record.getMlMetadata()));
    }
    
    static EnrichedOutcomeRecord toRecord(EnhancedGameEntity entity) {
        return EnrichedOutcomeRecord.builder()
                .canonicalId(entity.getCanonicalGameId())
                .actionNetworkGameId(entity.getActionNetworkGameId())
                .homeTeam(entity.getHomeTeam())
                .awayTeam(entity.getAwayTeam())
                .gameDate(entity.getGameDate())
                .gameDatetime(entity.getGameDatetime())
                .season(entity.getSeason())
                .gameStatus(GameStatus.fromValue(entity.getGameStatus()))
                .homeScore(entity.getHomeScore() != null ? entity.getHomeScore() : -1)
                .awayScore(entity.getAwayScore() != null ? entity.getAwayScore() : -1)
                .winningTeam(entity.getWinningTeam())
                .homeWin(Boolean.TRUE.equals(entity.getHomeWin()))
                .over(entity.getOverResult())
                .homeCoverSpread(entity.getHomeCoverSpread())
                .totalLine(entity.getTotalLine())
                .homeSpreadLine(entity.getHomeSpreadLine())
                .dataQualityScore(entity.getDataQualityScore() != null ? entity.getDataQualityScore() : 0.0)
                .featureData(entity.getFeatureData() != null ? entity.getFeatureData() : new LinkedHashMap<>())
                .mlMetadata(entity.getMlMetadata() != null ? entity.getMlMetadata() : new LinkedHashMap<>())
                .build();
    }
    
    private static void requireIdentity(EnrichedOutcomeRecord record) {
        if (record == null || !record.hasIdentity()) {
            throw new InvalidArgumentException("Enriched outcome needs a canonical id or an Action Network id");
        }
    }
}
