package com.oddsdata.gamesync.application.service;

import com.oddsdata.gamesync.domain.enums.GameSource;
import com.oddsdata.gamesync.domain.enums.PrimarySource;
import com.oddsdata.gamesync.domain.exception.InvalidArgumentException;
import com.oddsdata.gamesync.domain.exception.MappingConflictException;
import com.oddsdata.gamesync.domain.exception.StoreUnavailableException;
import com.oddsdata.gamesync.domain.ingest.RawGameCatalog;
import com.oddsdata.gamesync.domain.mapping.IdentityMappingStore;
import com.oddsdata.gamesync.domain.model.BulkResolutionResult;
import com.oddsdata.gamesync.domain.model.ExternalGameRef;
import com.oddsdata.gamesync.domain.model.GameIdentityMapping;
import com.oddsdata.gamesync.domain.model.RawGameInfo;
import com.oddsdata.gamesync.domain.model.ResolutionResult;
import com.oddsdata.gamesync.domain.model.ResolverMatch;
import com.oddsdata.gamesync.domain.model.UnmappedCandidate;
import com.oddsdata.gamesync.domain.resolver.ExternalGameResolver;
import com.oddsdata.gamesync.domain.validation.Arguments;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Cache-first resolution of external game ids to canonical ids.
 * <p>
 * Lookups hit the identity mapping table first and never call the external resolver on a hit.
 * On a miss with creation enabled the resolver is consulted and a positive match is written back
 * with a merging upsert. Store failures degrade to {@code UNAVAILABLE} misses instead of propagating,
 * so pipelines keep running while the store is down.
 */
@Service
public class GameIdResolutionService {
    
    private static final Logger log = LoggerFactory.getLogger(GameIdResolutionService.class);
    
    private final IdentityMappingStore mappingStore;
    private final RawGameCatalog rawGameCatalog;
    private final ExternalGameResolver resolver;
    private final MetricsService metricsService;
    
    public GameIdResolutionService(IdentityMappingStore mappingStore,
                                   RawGameCatalog rawGameCatalog,
                                   ExternalGameResolver resolver,
                                   MetricsService metricsService) {
        this.mappingStore = mappingStore;
        this.rawGameCatalog = rawGameCatalog;
        this.resolver = resolver;
        this.metricsService = metricsService;
    }
    
    /**
     * Lookup only, never calls the external resolver
     */
    public ResolutionResult resolve(String externalId, GameSource source) {
        return resolve(externalId, source, false);
    }
    
    /**
     * Resolve using a source tag such as {@code vsin}
     */
    public ResolutionResult resolve(String externalId, String sourceTag, boolean createIfMissing) {
        Arguments.requireNonBlank(externalId, "externalId");
        return resolve(externalId, GameSource.fromTag(sourceTag), createIfMissing);
    }
    
    /**
     * Resolve an external id, optionally creating the mapping on a miss.
     * Team names and date for the resolver are read from the source's raw ingestion table.
     */
    public ResolutionResult resolve(String externalId, GameSource source, boolean createIfMissing) {
        String id = Arguments.requireNonBlank(externalId, "externalId");
        Arguments.requirePresent(source, "source");
        
        Optional<ResolutionResult> cached = lookup(id, source);
        if (cached.isPresent() || !createIfMissing) {
            return cached.orElseGet(() -> ResolutionResult.notFound(id, source));
        }
        
        Optional<RawGameInfo> info;
        try {
            info = rawGameCatalog.findGameInfo(source, id);
        } catch (StoreUnavailableException e) {
            log.warn("Raw game info unavailable for {}:{}: {}", source, id, e.getMessage());
            return ResolutionResult.unavailable(id, source);
        }
        if (info.isEmpty()) {
            log.debug("No raw game info for {}:{}, cannot resolve", source, id);
            return ResolutionResult.notFound(id, source);
        }
        
        RawGameInfo game = info.get();
        UnmappedCandidate candidate = UnmappedCandidate.builder()
                .externalId(id)
                .source(source)
                .homeTeam(game.getHomeTeam())
                .awayTeam(game.getAwayTeam())
                .gameDate(game.getGameDate())
                .build();
        return matchAndStore(candidate, game.getGameDatetime());
    }
    
    /**
     * Resolve a discovered candidate, using the team names and date it carries
     */
    public ResolutionResult resolve(UnmappedCandidate candidate, boolean createIfMissing) {
        Arguments.requirePresent(candidate, "candidate");
        String id = Arguments.requireNonBlank(candidate.getExternalId(), "externalId");
        GameSource source = Arguments.requirePresent(candidate.getSource(), "source");
        
        Optional<ResolutionResult> cached = lookup(id, source);
        if (cached.isPresent() || !createIfMissing) {
            return cached.orElseGet(() -> ResolutionResult.notFound(id, source));
        }
        return matchAndStore(candidate, null);
    }
    
    /**
     * Resolve many external ids with one store query per distinct source.
     * Every distinct input pair appears in the result; misses map to no canonical id.
     */
    public BulkResolutionResult resolveBulk(Collection<ExternalGameRef> refs) {
        Arguments.requirePresent(refs, "refs");
        Map<GameSource, Set<String>> bySource = new EnumMap<>(GameSource.class);
        for (ExternalGameRef ref : refs) {
            Arguments.requirePresent(ref, "ref");
            Arguments.requirePresent(ref.getSource(), "source");
            String id = Arguments.requireNonBlank(ref.getExternalId(), "externalId");
            bySource.computeIfAbsent(ref.getSource(), s -> new LinkedHashSet<>()).add(id);
        }
        
        Timer.Sample sample = metricsService.startTimer();
        BulkResolutionResult result = new BulkResolutionResult();
        Map<GameSource, Map<String, String>> foundBySource = new EnumMap<>(GameSource.class);
        for (Map.Entry<GameSource, Set<String>> group : bySource.entrySet()) {
            GameSource source = group.getKey();
            Map<String, String> found;
            try {
                found = mappingStore.findCanonicalIds(source, group.getValue());
            } catch (StoreUnavailableException e) {
                log.warn("Bulk lookup of {} {} ids failed, reporting them as misses: {}",
                        group.getValue().size(), source, e.getMessage());
                metricsService.recordBulkDegraded();
                result.markDegraded();
                found = Map.of();
            }
            for (String externalId : group.getValue()) {
                metricsService.recordLookup(source, found.containsKey(externalId) ? "hit" : "miss");
            }
            foundBySource.put(source, found);
        }
        
        for (ExternalGameRef ref : refs) {
            if (!result.contains(ref)) {
                result.put(ref, foundBySource.get(ref.getSource()).get(ref.getExternalId().trim()));
            }
        }
        metricsService.recordBulkResolution(sample);
        log.debug("Bulk resolved {}/{} ids across {} sources", result.resolvedCount(), result.size(), bySource.size());
        return result;
    }
    
    /**
     * Ask the external resolver for a match without writing anything.
     * Resolver failures propagate to the caller.
     */
    public ResolverMatch match(UnmappedCandidate candidate) {
        ResolverMatch match = resolver.resolve(candidate.getExternalId(), candidate.getSource(),
                candidate.getHomeTeam(), candidate.getAwayTeam(), candidate.getGameDate());
        return match != null ? match : ResolverMatch.none("no_response");
    }
    
    /**
     * Persist a positive resolver match for a candidate
     */
    public ResolutionResult store(UnmappedCandidate candidate, ResolverMatch match) {
        return store(candidate, match, null);
    }
    
    private ResolutionResult matchAndStore(UnmappedCandidate candidate, OffsetDateTime gameDatetime) {
        ResolverMatch match;
        try {
            match = match(candidate);
        } catch (RuntimeException e) {
            log.warn("External resolver failed for {}: {}", candidate.toRef(), e.getMessage());
            return ResolutionResult.notFound(candidate.getExternalId(), candidate.getSource());
        }
        if (!match.isMatch()) {
            log.debug("No resolver match for {} ({})", candidate.toRef(), match.getMatchMethod());
            return ResolutionResult.notFound(candidate.getExternalId(), candidate.getSource());
        }
        return store(candidate, match, gameDatetime);
    }
    
    private ResolutionResult store(UnmappedCandidate candidate, ResolverMatch match,
                                   OffsetDateTime gameDatetime) {
        String externalId = candidate.getExternalId();
        GameSource source = candidate.getSource();
        if (match == null || !match.isMatch()) {
            return ResolutionResult.notFound(externalId, source);
        }
        
        GameIdentityMapping mapping = GameIdentityMapping.builder()
                .canonicalId(match.getCanonicalId())
                .homeTeam(candidate.getHomeTeam())
                .awayTeam(candidate.getAwayTeam())
                .gameDate(candidate.getGameDate())
                .gameDatetime(gameDatetime)
                .resolutionConfidence(match.getConfidence().getScore())
                .primarySource(PrimarySource.of(source))
                .build()
                .withExternalId(source, externalId);
        
        try {
            mappingStore.upsert(mapping);
        } catch (InvalidArgumentException e) {
            log.warn("Incomplete game data for {}, mapping not stored: {}", candidate.toRef(), e.getMessage());
            return ResolutionResult.notFound(externalId, source);
        } catch (MappingConflictException e) {
            // Another writer mapped this id first; its row wins
            log.warn("Mapping conflict for {} -> {}: {}", candidate.toRef(), match.getCanonicalId(), e.getMessage());
            return lookup(externalId, source).orElseGet(() -> ResolutionResult.notFound(externalId, source));
        } catch (StoreUnavailableException e) {
            log.warn("Could not store mapping {} -> {}: {}", candidate.toRef(), match.getCanonicalId(), e.getMessage());
            return ResolutionResult.unavailable(externalId, source);
        }
        
        metricsService.recordMappingCreated(source);
        log.info("Resolved {} -> {} ({}, {})", candidate.toRef(), match.getCanonicalId(), match.getConfidence(),
                match.getMatchMethod());
        return ResolutionResult.mapped(externalId, source, match.getCanonicalId(), match.getConfidence());
    }
    
    private Optional<ResolutionResult> lookup(String externalId, GameSource source) {
        try {
            Optional<String> canonicalId = mappingStore.findCanonicalId(source, externalId);
            if (canonicalId.isPresent()) {
                metricsService.recordLookup(source, "hit");
                log.debug("Cache hit {}:{} -> {}", source, externalId, canonicalId.get());
                return Optional.of(ResolutionResult.cached(externalId, source, canonicalId.get()));
            }
            metricsService.recordLookup(source, "miss");
            return Optional.empty();
        } catch (StoreUnavailableException e) {
            metricsService.recordLookup(source, "unavailable");
            log.warn("Mapping lookup failed for {}:{}, treating as unresolved: {}", source, externalId, e.getMessage());
            return Optional.of(ResolutionResult.unavailable(externalId, source));
        }
    }
}
