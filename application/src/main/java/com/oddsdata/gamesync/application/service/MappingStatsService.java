package com.oddsdata.gamesync.application.service;

import com.oddsdata.gamesync.domain.ingest.RawGameCatalog;
import com.oddsdata.gamesync.domain.mapping.IdentityMappingStore;
import com.oddsdata.gamesync.domain.model.MappingStats;
import com.oddsdata.gamesync.domain.model.MappingValidationIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Coverage and quality reporting over the identity mapping table
 */
@Service
public class MappingStatsService {
    
    private static final Logger log = LoggerFactory.getLogger(MappingStatsService.class);
    
    private final IdentityMappingStore mappingStore;
    private final RawGameCatalog rawGameCatalog;
    private final double minConfidence;
    private final int staleAfterDays;
    
    public MappingStatsService(
            IdentityMappingStore mappingStore,
            RawGameCatalog rawGameCatalog,
            @Value("${app.mapping.validation.min-confidence:0.8}") double minConfidence,
            @Value("${app.mapping.validation.stale-after-days:30}") int staleAfterDays) {
        this.mappingStore = mappingStore;
        this.rawGameCatalog = rawGameCatalog;
        this.minConfidence = minConfidence;
        this.staleAfterDays = staleAfterDays;
    }
    
    /**
     * Mapping counts plus coverage of the external ids seen in raw ingestion tables
     */
    public MappingStats stats() {
        MappingStats stats = mappingStore.stats();
        long unmapped = rawGameCatalog.countUnmapped(Optional.empty());
        long mapped = stats.mappedExternalIds();
        double coverage = mapped + unmapped == 0 ? 0.0 : (double) mapped / (mapped + unmapped) * 100.0;
        return stats.toBuilder()
                .unmappedCount(unmapped)
                .coveragePercent(Math.round(coverage * 100.0) / 100.0)
                .build();
    }
    
    /**
     * Flag low-confidence, stale and duplicate mappings. Nothing is deleted.
     */
    public List<MappingValidationIssue> validate() {
        List<MappingValidationIssue> issues = mappingStore.validate(minConfidence, staleAfterDays);
        if (!issues.isEmpty()) {
            log.warn("Mapping validation found {} issue type(s): {}", issues.size(), issues);
        }
        return issues;
    }
}
