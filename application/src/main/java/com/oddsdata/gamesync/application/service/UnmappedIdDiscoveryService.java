package com.oddsdata.gamesync.application.service;

import com.oddsdata.gamesync.domain.enums.GameSource;
import com.oddsdata.gamesync.domain.exception.StoreUnavailableException;
import com.oddsdata.gamesync.domain.ingest.RawGameCatalog;
import com.oddsdata.gamesync.domain.model.ResolutionResult;
import com.oddsdata.gamesync.domain.model.ResolverMatch;
import com.oddsdata.gamesync.domain.model.UnmappedCandidate;
import com.oddsdata.gamesync.domain.model.UnmappedResolutionResult;
import com.oddsdata.gamesync.domain.validation.Arguments;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Finds external ids present in raw ingestion tables but missing from the mapping table,
 * and backfills them through the resolution service.
 */
@Service
public class UnmappedIdDiscoveryService {
    
    private static final Logger log = LoggerFactory.getLogger(UnmappedIdDiscoveryService.class);
    
    static final int LARGE_PAGE_WARNING = 1000;
    
    private final RawGameCatalog rawGameCatalog;
    private final GameIdResolutionService resolutionService;
    private final int defaultLimit;
    private final int pageSize;
    
    public UnmappedIdDiscoveryService(
            RawGameCatalog rawGameCatalog,
            GameIdResolutionService resolutionService,
            @Value("${app.discovery.default-limit:100}") int defaultLimit,
            @Value("${app.discovery.page-size:100}") int pageSize) {
        this.rawGameCatalog = rawGameCatalog;
        this.resolutionService = resolutionService;
        this.defaultLimit = Arguments.requirePositive(defaultLimit, "app.discovery.default-limit");
        this.pageSize = Arguments.requirePositive(pageSize, "app.discovery.page-size");
    }
    
    /**
     * One page of unmapped candidates, ordered by source then external id.
     * A page shorter than {@code pageSize} is the last one.
     * @param sourceTag Source tag to restrict to, null or blank for all sources
     */
    public List<UnmappedCandidate> findUnmapped(String sourceTag, int pageSize, int offset) {
        Optional<GameSource> source = sourceTag == null || sourceTag.isBlank()
                ? Optional.empty() : Optional.of(GameSource.fromTag(sourceTag));
        return findUnmapped(source, pageSize, offset);
    }
    
    public List<UnmappedCandidate> findUnmapped(Optional<GameSource> source, int pageSize, int offset) {
        Arguments.requirePresent(source, "source filter");
        Arguments.requireNonNegative(pageSize, "pageSize");
        Arguments.requireNonNegative(offset, "offset");
        if (pageSize > LARGE_PAGE_WARNING) {
            log.warn("Large discovery page requested (pageSize={}), consider smaller pages", pageSize);
        }
        if (pageSize == 0) {
            return List.of();
        }
        return rawGameCatalog.findUnmapped(source, pageSize, offset);
    }
    
    public long countUnmapped(Optional<GameSource> source) {
        return rawGameCatalog.countUnmapped(source);
    }
    
    /**
     * Resolve up to {@code limit} unmapped ids.
     * Mapped ids drop out of the unmapped set, so the scan offset only advances past ids that stay unmapped.
     * A failing candidate is recorded and never stops the run.
     * @param limit Maximum candidates to process, null for the configured default
     * @param dryRun Consult the resolver but write nothing
     */
    public UnmappedResolutionResult resolveUnmapped(Optional<GameSource> source, Integer limit, boolean dryRun) {
        Arguments.requirePresent(source, "source filter");
        int max = limit != null ? Arguments.requirePositive(limit, "limit") : defaultLimit;
        if (max > LARGE_PAGE_WARNING) {
            log.warn("Large unmapped resolution requested (limit={})", max);
        }
        
        log.info("Starting unmapped id resolution: source={}, limit={}, dryRun={}",
                source.map(GameSource::getTag).orElse("all"), max, dryRun);
        UnmappedResolutionResult result = new UnmappedResolutionResult(dryRun);
        int offset = 0;
        
        while (result.getUnmappedFound() < max) {
            int size = Math.min(pageSize, max - result.getUnmappedFound());
            List<UnmappedCandidate> page;
            try {
                page = rawGameCatalog.findUnmapped(source, size, offset);
            } catch (StoreUnavailableException e) {
                log.error("Unmapped id discovery failed at offset {}", offset, e);
                result.getErrors().add("Discovery failed: " + e.getMessage());
                break;
            }
            
            result.setUnmappedFound(result.getUnmappedFound() + page.size());
            int stillUnmapped = 0;
            for (UnmappedCandidate candidate : page) {
                if (!processCandidate(candidate, dryRun, result)) {
                    stillUnmapped++;
                }
            }
            
            if (page.size() < size) {
                break;
            }
            offset += dryRun ? page.size() : stillUnmapped;
        }
        
        log.info("Unmapped id resolution completed: found={}, resolved={}, failed={}, dryRun={}",
                result.getUnmappedFound(), result.getResolved(), result.getFailed(), dryRun);
        return result;
    }
    
    public UnmappedResolutionResult resolveUnmapped(String sourceTag, Integer limit, boolean dryRun) {
        Optional<GameSource> source = sourceTag == null || sourceTag.isBlank()
                ? Optional.empty() : Optional.of(GameSource.fromTag(sourceTag));
        return resolveUnmapped(source, limit, dryRun);
    }
    
    /**
     * @return true when the candidate is no longer unmapped (always false in a dry run)
     */
    private boolean processCandidate(UnmappedCandidate candidate, boolean dryRun, UnmappedResolutionResult result) {
        try {
            // Another writer may have mapped it since the page was read
            ResolutionResult existing = resolutionService.resolve(candidate, false);
            if (existing.isResolved()) {
                log.debug("{} already mapped to {}, skipping resolver", candidate.toRef(), existing.getCanonicalId());
                result.addResolution(new UnmappedResolutionResult.Resolution(candidate.getExternalId(),
                        candidate.getSource(), existing.getCanonicalId(), null, "already_mapped"));
                return !dryRun;
            }
            
            ResolverMatch match = resolutionService.match(candidate);
            if (!match.isMatch()) {
                log.warn("Failed to resolve {} ({} @ {}, {})", candidate.toRef(), candidate.getAwayTeam(),
                        candidate.getHomeTeam(), candidate.getGameDate());
                result.addFailure(null);
                return false;
            }
            if (dryRun) {
                result.addResolution(new UnmappedResolutionResult.Resolution(candidate.getExternalId(),
                        candidate.getSource(), match.getCanonicalId(), match.getConfidence(), match.getMatchMethod()));
                log.info("Dry run: would map {} -> {}", candidate.toRef(), match.getCanonicalId());
                return false;
            }
            
            ResolutionResult stored = resolutionService.store(candidate, match);
            if (!stored.isResolved()) {
                result.addFailure(String.format("Could not store mapping for %s (%s)", candidate.toRef(),
                        stored.getStatus()));
                return false;
            }
            result.addResolution(new UnmappedResolutionResult.Resolution(candidate.getExternalId(),
                    candidate.getSource(), stored.getCanonicalId(), match.getConfidence(), match.getMatchMethod()));
            return true;
        } catch (RuntimeException e) {
            log.error("Error resolving {}: {}", candidate.toRef(), e.getMessage(), e);
            result.addFailure("Error resolving " + candidate.getExternalId() + ": " + e.getMessage());
            return false;
        }
    }
}
