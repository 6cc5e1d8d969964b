package com.oddsdata.gamesync.domain.resolver;

import com.oddsdata.gamesync.domain.enums.GameSource;
import com.oddsdata.gamesync.domain.model.ResolverMatch;

import java.time.LocalDate;

/**
 * Abstraction for the external game resolver that matches a source game to a canonical game.
 * Allows switching between the resolver service and an unconfigured fallback.
 */
public interface ExternalGameResolver {
    
    /**
     * Match a source game by teams and date
     * @return The match; confidence NONE when no canonical game fits
     */
    ResolverMatch resolve(String externalId, GameSource source, String homeTeam, String awayTeam,
                          LocalDate gameDate);
}
