package com.oddsdata.gamesync.infrastructure.persistence.store;

import com.oddsdata.gamesync.domain.enums.GameSource;
import com.oddsdata.gamesync.domain.enums.MappingIssueType;
import com.oddsdata.gamesync.domain.enums.PrimarySource;
import com.oddsdata.gamesync.domain.exception.MappingConflictException;
import com.oddsdata.gamesync.domain.exception.StoreUnavailableException;
import com.oddsdata.gamesync.domain.mapping.IdentityMappingStore;
import com.oddsdata.gamesync.domain.model.GameIdentityMapping;
import com.oddsdata.gamesync.domain.model.MappingStats;
import com.oddsdata.gamesync.domain.model.MappingValidationIssue;
import com.oddsdata.gamesync.infrastructure.persistence.entity.GameIdMappingEntity;
import com.oddsdata.gamesync.infrastructure.persistence.repository.GameIdMappingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Identity mapping store backed by Spring Data JPA.
 * Spring data access errors are translated into domain exceptions at this boundary.
 */
@Component
public class JpaIdentityMappingStore implements IdentityMappingStore {
    
    private static final Logger log = LoggerFactory.getLogger(JpaIdentityMappingStore.class);
    
    private final GameIdMappingRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    
    public JpaIdentityMappingStore(GameIdMappingRepository repository, TransactionTemplate transactionTemplate,
                                   Clock clock) {
        this.repository = repository;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }
    
    @Override
    public Optional<String> findCanonicalId(GameSource source, String externalId) {
        return translate("lookup " + source + ":" + externalId, () -> {
            Optional<GameIdMappingEntity> row = switch (source) {
                case ACTION_NETWORK -> repository.findByActionNetworkGameId(externalId);
                case VSIN -> repository.findByVsinGameId(externalId);
                case SBD -> repository.findBySbdGameId(externalId);
                case SBR -> repository.findBySbrGameId(externalId);
            };
            return row.map(GameIdMappingEntity::getCanonicalGameId);
        });
    }
    
    @Override
    public Map<String, String> findCanonicalIds(GameSource source, Collection<String> externalIds) {
        if (externalIds.isEmpty()) {
            return Map.of();
        }
        return translate("bulk lookup of " + externalIds.size() + " " + source + " ids", () -> {
            List<GameIdMappingEntity> rows = switch (source) {
                case ACTION_NETWORK -> repository.findByActionNetworkGameIdIn(externalIds);
                case VSIN -> repository.findByVsinGameIdIn(externalIds);
                case SBD -> repository.findBySbdGameIdIn(externalIds);
                case SBR -> repository.findBySbrGameIdIn(externalIds);
            };
            Map<String, String> found = new LinkedHashMap<>();
            for (GameIdMappingEntity row : rows) {
                found.put(externalIdOf(row, source), row.getCanonicalGameId());
            }
            return found;
        });
    }
    
    @Override
    public Optional<GameIdentityMapping> findByCanonicalId(String canonicalId) {
        return translate("load mapping " + canonicalId,
                () -> repository.findByCanonicalGameId(canonicalId).map(JpaIdentityMappingStore::toDomain));
    }
    
    @Override
    public GameIdentityMapping upsert(GameIdentityMapping mapping) {
        mapping.validate();
        Map<GameSource, String> ids = mapping.getExternalIds();
        PrimarySource primarySource = mapping.getPrimarySource() != null
                ? mapping.getPrimarySource() : PrimarySource.MANUAL;
        try {
            GameIdMappingEntity stored = transactionTemplate.execute(status -> {
                repository.upsert(
                        mapping.getCanonicalId(),
                        blankToNull(ids.get(GameSource.ACTION_NETWORK)),
                        blankToNull(ids.get(GameSource.VSIN)),
                        blankToNull(ids.get(GameSource.SBD)),
                        blankToNull(ids.get(GameSource.SBR)),
                        mapping.getHomeTeam(),
                        mapping.getAwayTeam(),
                        mapping.getGameDate(),
                        mapping.getGameDatetime(),
                        mapping.getResolutionConfidence(),
                        primarySource.getTag());
                return repository.findByCanonicalGameId(mapping.getCanonicalId())
                        .orElseThrow(() -> new StoreUnavailableException(
                                "Mapping " + mapping.getCanonicalId() + " not visible after upsert", null));
            });
            log.debug("Upserted mapping {} (attempts={})", stored.getCanonicalGameId(), stored.getVerificationAttempts());
            return toDomain(stored);
        } catch (DataIntegrityViolationException e) {
            throw new MappingConflictException("Mapping " + mapping.getCanonicalId()
                    + " conflicts with an existing external id", e);
        } catch (DataAccessException | TransactionException e) {
            throw new StoreUnavailableException("Failed to upsert mapping " + mapping.getCanonicalId(), e);
        }
    }
    
    @Override
    public MappingStats stats() {
        return translate("mapping stats", () -> {
            Object[] row = repository.aggregateStats().get(0);
            Map<GameSource, Long> bySource = new EnumMap<>(GameSource.class);
            bySource.put(GameSource.ACTION_NETWORK, toLong(row[1]));
            bySource.put(GameSource.VSIN, toLong(row[2]));
            bySource.put(GameSource.SBD, toLong(row[3]));
            bySource.put(GameSource.SBR, toLong(row[4]));
            return MappingStats.builder()
                    .totalMappings(toLong(row[0]))
                    .mappedBySource(bySource)
                    .averageConfidence(row[5] != null ? ((Number) row[5]).doubleValue() : 0.0)
                    .lastUpdated((OffsetDateTime) row[6])
                    .build();
        });
    }
    
    @Override
    public List<MappingValidationIssue> validate(double minConfidence, int staleAfterDays) {
        OffsetDateTime staleThreshold = OffsetDateTime.now(clock).minusDays(staleAfterDays);
        return translate("mapping validation", () -> {
            List<MappingValidationIssue> issues = new ArrayList<>();
            
            long lowConfidence = repository.countByResolutionConfidenceLessThan(minConfidence);
            if (lowConfidence > 0) {
                issues.add(new MappingValidationIssue(MappingIssueType.LOW_CONFIDENCE, lowConfidence,
                        first(repository.findLowConfidenceCanonicalIds(minConfidence, PageRequest.of(0, 1)))));
            }
            
            long stale = repository.countStale(staleThreshold);
            if (stale > 0) {
                issues.add(new MappingValidationIssue(MappingIssueType.STALE_VERIFICATION, stale,
                        first(repository.findStaleCanonicalIds(staleThreshold, PageRequest.of(0, 1)))));
            }
            
            List<Object[]> duplicates = repository.findDuplicateGameGroups();
            if (!duplicates.isEmpty()) {
                issues.add(new MappingValidationIssue(MappingIssueType.DUPLICATE_GAME, duplicates.size(),
                        (String) duplicates.get(0)[4]));
            }
            return issues;
        });
    }
    
    static GameIdentityMapping toDomain(GameIdMappingEntity entity) {
        Map<GameSource, String> ids = new EnumMap<>(GameSource.class);
        for (GameSource source : GameSource.values()) {
            String id = externalIdOf(entity, source);
            if (id != null) {
                ids.put(source, id);
            }
        }
        return GameIdentityMapping.builder()
                .canonicalId(entity.getCanonicalGameId())
                .externalIds(ids)
                .homeTeam(entity.getHomeTeam())
                .awayTeam(entity.getAwayTeam())
                .gameDate(entity.getGameDate())
                .gameDatetime(entity.getGameDatetime())
                .resolutionConfidence(entity.getResolutionConfidence() != null ? entity.getResolutionConfidence() : 1.0)
                .primarySource(entity.getPrimarySource() != null ? PrimarySource.fromTag(entity.getPrimarySource()) : null)
                .lastVerifiedAt(entity.getLastVerifiedAt())
                .verificationAttempts(entity.getVerificationAttempts() != null ? entity.getVerificationAttempts() : 0)
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
    
    private static String externalIdOf(GameIdMappingEntity entity, GameSource source) {
        return switch (source) {
            case ACTION_NETWORK -> entity.getActionNetworkGameId();
            case VSIN -> entity.getVsinGameId();
            case SBD -> entity.getSbdGameId();
            case SBR -> entity.getSbrGameId();
        };
    }
    
    private static <T> T translate(String operation, Supplier<T> query) {
        try {
            return query.get();
        } catch (DataAccessException | TransactionException e) {
            throw new StoreUnavailableException("Identity mapping store failed during " + operation, e);
        }
    }
    
    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
    
    private static long toLong(Object value) {
        return value != null ? ((Number) value).longValue() : 0L;
    }
    
    private static String first(List<String> values) {
        return values.isEmpty() ? null : values.get(0);
    }
}
