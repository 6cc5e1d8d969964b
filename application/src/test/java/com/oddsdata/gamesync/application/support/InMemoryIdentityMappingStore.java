package com.oddsdata.gamesync.application.support;

import com.oddsdata.gamesync.domain.enums.GameSource;
import com.oddsdata.gamesync.domain.exception.MappingConflictException;
import com.oddsdata.gamesync.domain.exception.StoreUnavailableException;
import com.oddsdata.gamesync.domain.mapping.IdentityMappingStore;
import com.oddsdata.gamesync.domain.model.GameIdentityMapping;
import com.oddsdata.gamesync.domain.model.MappingStats;
import com.oddsdata.gamesync.domain.model.MappingValidationIssue;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Mapping store backed by a map, with the same merge rules as the SQL upsert
 */
public class InMemoryIdentityMappingStore implements IdentityMappingStore {
    
    private final Map<String, GameIdentityMapping> rows = new LinkedHashMap<>();
    private final Set<GameSource> failingSources = EnumSet.noneOf(GameSource.class);
    private final AtomicInteger lookups = new AtomicInteger();
    private final AtomicInteger bulkQueries = new AtomicInteger();
    private final AtomicInteger writes = new AtomicInteger();
    private boolean unavailable;
    
    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }
    
    public void failSource(GameSource source) {
        failingSources.add(source);
    }
    
    public int lookups() {
        return lookups.get();
    }
    
    public int bulkQueries() {
        return bulkQueries.get();
    }
    
    public int writes() {
        return writes.get();
    }
    
    public int size() {
        return rows.size();
    }
    
    /**
     * Uncounted check used by the raw catalog fake
     */
    public synchronized boolean isMapped(GameSource source, String externalId) {
        return rows.values().stream().anyMatch(row -> externalId.equals(row.getExternalIds().get(source)));
    }
    
    @Override
    public synchronized Optional<String> findCanonicalId(GameSource source, String externalId) {
        lookups.incrementAndGet();
        check(source);
        return rows.values().stream()
                .filter(row -> externalId.equals(row.getExternalIds().get(source)))
                .map(GameIdentityMapping::getCanonicalId)
                .findFirst();
    }
    
    @Override
    public synchronized Map<String, String> findCanonicalIds(GameSource source, Collection<String> externalIds) {
        bulkQueries.incrementAndGet();
        check(source);
        Map<String, String> found = new LinkedHashMap<>();
        for (GameIdentityMapping row : rows.values()) {
            String id = row.getExternalIds().get(source);
            if (id != null && externalIds.contains(id)) {
                found.put(id, row.getCanonicalId());
            }
        }
        return found;
    }
    
    @Override
    public synchronized Optional<GameIdentityMapping> findByCanonicalId(String canonicalId) {
        check(null);
        return Optional.ofNullable(rows.get(canonicalId));
    }
    
    @Override
    public synchronized GameIdentityMapping upsert(GameIdentityMapping mapping) {
        mapping.validate();
        check(null);
        for (Map.Entry<GameSource, String> entry : mapping.getExternalIds().entrySet()) {
            rows.values().stream()
                    .filter(row -> !row.getCanonicalId().equals(mapping.getCanonicalId()))
                    .filter(row -> entry.getValue().equals(row.getExternalIds().get(entry.getKey())))
                    .findFirst()
                    .ifPresent(row -> {
                        throw new MappingConflictException(entry.getKey() + " id " + entry.getValue()
                                + " already mapped to " + row.getCanonicalId(), null);
                    });
        }
        writes.incrementAndGet();
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        GameIdentityMapping existing = rows.get(mapping.getCanonicalId());
        GameIdentityMapping stored;
        if (existing == null) {
            stored = mapping.toBuilder()
                    .externalIds(new EnumMap<>(mapping.getExternalIds()))
                    .lastVerifiedAt(now)
                    .verificationAttempts(0)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
        } else {
            stored = merge(existing, mapping, now);
        }
        rows.put(stored.getCanonicalId(), stored);
        return stored;
    }
    
    @Override
    public synchronized MappingStats stats() {
        check(null);
        Map<GameSource, Long> bySource = new EnumMap<>(GameSource.class);
        for (GameSource source : GameSource.values()) {
            bySource.put(source, rows.values().stream().filter(row -> row.getExternalIds().get(source) != null).count());
        }
        return MappingStats.builder()
                .totalMappings(rows.size())
                .mappedBySource(bySource)
                .averageConfidence(rows.values().stream()
                        .mapToDouble(GameIdentityMapping::getResolutionConfidence).average().orElse(0.0))
                .lastUpdated(rows.values().stream().map(GameIdentityMapping::getUpdatedAt)
                        .max(OffsetDateTime::compareTo).orElse(null))
                .build();
    }
    
    @Override
    public List<MappingValidationIssue> validate(double minConfidence, int staleAfterDays) {
        check(null);
        return List.of();
    }
    
    private static GameIdentityMapping merge(GameIdentityMapping existing, GameIdentityMapping incoming,
                                             OffsetDateTime now) {
        Map<GameSource, String> merged = new EnumMap<>(existing.getExternalIds());
        incoming.getExternalIds().forEach((source, id) -> {
            if (id != null) {
                merged.put(source, id);
            }
        });
        return existing.toBuilder()
                .externalIds(merged)
                .gameDatetime(existing.getGameDatetime() != null ? existing.getGameDatetime() : incoming.getGameDatetime())
                .resolutionConfidence(Math.max(existing.getResolutionConfidence(), incoming.getResolutionConfidence()))
                .lastVerifiedAt(now)
                .verificationAttempts(existing.getVerificationAttempts() + 1)
                .updatedAt(now)
                .build();
    }
    
    private void check(GameSource source) {
        if (unavailable || (source != null && failingSources.contains(source))) {
            throw new StoreUnavailableException("mapping store is down", null);
        }
    }
}
