package com.oddsdata.gamesync.domain.enums;

/**
 * Source that first produced a mapping row
 */
public enum PrimarySource {
    ACTION_NETWORK("action_network"),
    VSIN("vsin"),
    SBD("sbd"),
    SBR("sbr"),
    MANUAL("manual");
    
    private final String tag;
    
    PrimarySource(String tag) {
        this.tag = tag;
    }
    
    public String getTag() {
        return tag;
    }
    
    public static PrimarySource of(GameSource source) {
        return switch (source) {
            case ACTION_NETWORK -> ACTION_NETWORK;
            case VSIN -> VSIN;
            case SBD -> SBD;
            case SBR -> SBR;
        };
    }
    
    public static PrimarySource fromTag(String tag) {
        for (PrimarySource source : values()) {
            if (source.tag.equalsIgnoreCase(tag)) {
                return source;
            }
        }
        throw new IllegalStateException("Unknown primary source stored: " + tag);
    }
}
