package com.oddsdata.gamesync.domain.enums;

import com.oddsdata.gamesync.domain.exception.InvalidArgumentException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * External odds sources that identify games with their own ids.
 * Each source owns one external id column in the mapping table and one raw ingestion table.
 */
public enum GameSource {
    ACTION_NETWORK("action_network"),
    VSIN("vsin"),
    SBD("sbd"),
    SBR("sbr");
    
    private final String tag;
    
    GameSource(String tag) {
        this.tag = tag;
    }
    
    public String getTag() {
        return tag;
    }
    
    /**
     * Parse a source tag such as {@code action_network}
     * @throws InvalidArgumentException for blank or unknown tags
     */
    public static GameSource fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new InvalidArgumentException("Source is required");
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (GameSource source : values()) {
            if (source.tag.equals(normalized)) {
                return source;
            }
        }
        throw new InvalidArgumentException(String.format("Unknown source '%s', expected one of %s",
                tag, Arrays.stream(values()).map(GameSource::getTag).collect(Collectors.joining(", "))));
    }
    
    @Override
    public String toString() {
        return tag;
    }
}
