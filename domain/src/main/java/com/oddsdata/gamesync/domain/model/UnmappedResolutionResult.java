package com.oddsdata.gamesync.domain.model;

import com.oddsdata.gamesync.domain.enums.GameSource;
import com.oddsdata.gamesync.domain.enums.MatchConfidence;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a backfill run over unmapped external ids
 */
@Data
@NoArgsConstructor
public class UnmappedResolutionResult {
    
    private boolean dryRun;
    private int unmappedFound;
    private int resolved;
    private int failed;
    private List<String> errors = new ArrayList<>();
    private List<Resolution> resolutions = new ArrayList<>();
    
    public UnmappedResolutionResult(boolean dryRun) {
        this.dryRun = dryRun;
    }
    
    public void addResolution(Resolution resolution) {
        resolved++;
        resolutions.add(resolution);
    }
    
    public void addFailure(String error) {
        failed++;
        if (error != null) {
            errors.add(error);
        }
    }
    
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Resolution {
        private String externalId;
        private GameSource source;
        private String canonicalId;
        private MatchConfidence confidence;
        private String matchMethod;
    }
}
