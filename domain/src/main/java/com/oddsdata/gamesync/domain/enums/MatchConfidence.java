package com.oddsdata.gamesync.domain.enums;

/**
 * Confidence grade returned by the external resolver.
 * NONE means the resolver found no match.
 */
public enum MatchConfidence {
    HIGH(1.0),
    MEDIUM(0.8),
    LOW(0.6),
    NONE(0.0);
    
    private final double score;
    
    MatchConfidence(double score) {
        this.score = score;
    }
    
    public double getScore() {
        return score;
    }
    
    public boolean isMatch() {
        return score > 0.0;
    }
}
