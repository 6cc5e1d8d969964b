package com.oddsdata.gamesync.domain.model;

import com.oddsdata.gamesync.domain.enums.GameSource;
import lombok.Value;

/**
 * A source-specific game identifier
 */
@Value(staticConstructor = "of")
public class ExternalGameRef {
    String externalId;
    GameSource source;
    
    @Override
    public String toString() {
        return source.getTag() + ":" + externalId;
    }
}
