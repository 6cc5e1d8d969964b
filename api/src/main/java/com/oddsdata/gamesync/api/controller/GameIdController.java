package com.oddsdata.gamesync.api.controller;

import com.oddsdata.gamesync.application.service.GameIdResolutionService;
import com.oddsdata.gamesync.application.service.MappingStatsService;
import com.oddsdata.gamesync.application.service.UnmappedIdDiscoveryService;
import com.oddsdata.gamesync.domain.enums.GameSource;
import com.oddsdata.gamesync.domain.model.BulkResolutionResult;
import com.oddsdata.gamesync.domain.model.ExternalGameRef;
import com.oddsdata.gamesync.domain.model.MappingStats;
import com.oddsdata.gamesync.domain.model.MappingValidationIssue;
import com.oddsdata.gamesync.domain.model.ResolutionResult;
import com.oddsdata.gamesync.domain.model.UnmappedCandidate;
import com.oddsdata.gamesync.domain.model.UnmappedResolutionResult;
import com.oddsdata.gamesync.domain.validation.Arguments;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for game id resolution, discovery and mapping reports
 */
@RestController
@RequestMapping("/api/game-ids")
public class GameIdController {
    
    private static final Logger log = LoggerFactory.getLogger(GameIdController.class);
    
    private final GameIdResolutionService resolutionService;
    private final UnmappedIdDiscoveryService discoveryService;
    private final MappingStatsService mappingStatsService;
    
    public GameIdController(GameIdResolutionService resolutionService,
                            UnmappedIdDiscoveryService discoveryService,
                            MappingStatsService mappingStatsService) {
        this.resolutionService = resolutionService;
        this.discoveryService = discoveryService;
        this.mappingStatsService = mappingStatsService;
    }
    
    @GetMapping("/{source}/{externalId}")
    public ResponseEntity<Map<String, Object>> resolve(@PathVariable String source,
                                                       @PathVariable String externalId,
                                                       @RequestParam(required = false, defaultValue = "false") boolean create) {
        ResolutionResult result = resolutionService.resolve(externalId, source, create);
        
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("externalId", result.getExternalId());
        response.put("source", result.getSource().getTag());
        response.put("status", result.getStatus().name());
        response.put("canonicalId", result.getCanonicalId());
        response.put("newlyMapped", result.isNewlyMapped());
        if (result.getConfidence() != null) {
            response.put("confidence", result.getConfidence().name());
        }
        return ResponseEntity.ok(response);
    }
    
    /**
     * One entry per distinct {@code source:externalId}, misses mapped to null
     */
    @PostMapping("/bulk")
    public ResponseEntity<Map<String, Object>> resolveBulk(@RequestBody List<BulkLookupRequest> requests) {
        Arguments.requirePresent(requests, "request body");
        List<ExternalGameRef> refs = new ArrayList<>(requests.size());
        for (BulkLookupRequest request : requests) {
            Arguments.requirePresent(request, "lookup entry");
            refs.add(ExternalGameRef.of(
                    Arguments.requireNonBlank(request.getExternalId(), "externalId"),
                    GameSource.fromTag(request.getSource())));
        }
        
        BulkResolutionResult result = resolutionService.resolveBulk(refs);
        log.debug("Bulk lookup of {} ids resolved {}", result.size(), result.resolvedCount());
        
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("mappings", result.asTaggedMap());
        response.put("requested", result.size());
        response.put("resolved", result.resolvedCount());
        response.put("degraded", result.isDegraded());
        return ResponseEntity.ok(response);
    }
    
    @GetMapping("/unmapped")
    public ResponseEntity<Map<String, Object>> findUnmapped(
            @RequestParam(required = false) String source,
            @RequestParam(required = false, defaultValue = "100") int pageSize,
            @RequestParam(required = false, defaultValue = "0") int offset) {
        List<UnmappedCandidate> page = discoveryService.findUnmapped(source, pageSize, offset);
        
        List<Map<String, Object>> content = new ArrayList<>(page.size());
        for (UnmappedCandidate candidate : page) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("externalId", candidate.getExternalId());
            item.put("source", candidate.getSource().getTag());
            item.put("homeTeam", candidate.getHomeTeam());
            item.put("awayTeam", candidate.getAwayTeam());
            item.put("gameDate", candidate.getGameDate());
            item.put("originTable", candidate.getOriginTable());
            content.add(item);
        }
        
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("content", content);
        response.put("pageSize", pageSize);
        response.put("offset", offset);
        response.put("last", page.size() < pageSize);
        return ResponseEntity.ok(response);
    }
    
    @PostMapping("/unmapped/resolve")
    public ResponseEntity<UnmappedResolutionResult> resolveUnmapped(
            @RequestParam(required = false) String source,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false, defaultValue = "false") boolean dryRun) {
        return ResponseEntity.ok(discoveryService.resolveUnmapped(source, limit, dryRun));
    }
    
    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> stats() {
        MappingStats stats = mappingStatsService.stats();
        
        Map<String, Long> bySource = new LinkedHashMap<>();
        stats.getMappedBySource().forEach((source, count) -> bySource.put(source.getTag(), count));
        
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("totalMappings", stats.getTotalMappings());
        response.put("mappedBySource", bySource);
        response.put("averageConfidence", stats.getAverageConfidence());
        response.put("lastUpdated", stats.getLastUpdated());
        response.put("unmappedCount", stats.getUnmappedCount());
        response.put("coveragePercent", stats.getCoveragePercent());
        return ResponseEntity.ok(response);
    }
    
    @GetMapping("/validation")
    public ResponseEntity<Map<String, Object>> validation() {
        List<MappingValidationIssue> issues = mappingStatsService.validate();
        
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("valid", issues.isEmpty());
        response.put("issues", issues);
        return ResponseEntity.ok(response);
    }
    
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BulkLookupRequest {
        private String externalId;
        private String source;
    }
}
