package com.oddsdata.gamesync.domain.model;

import com.oddsdata.gamesync.domain.enums.MatchConfidence;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Answer of the external resolver for one external id
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResolverMatch {
    private String canonicalId;
    private MatchConfidence confidence;
    private String matchMethod;
    
    public static ResolverMatch none(String matchMethod) {
        return new ResolverMatch(null, MatchConfidence.NONE, matchMethod);
    }
    
    public boolean isMatch() {
        return canonicalId != null && !canonicalId.isBlank()
                && confidence != null && confidence.isMatch();
    }
}
