package com.oddsdata.gamesync.infrastructure.resolver;

import com.oddsdata.gamesync.domain.enums.GameSource;
import com.oddsdata.gamesync.domain.model.ResolverMatch;
import com.oddsdata.gamesync.domain.resolver.ExternalGameResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Resolver used when no resolver service is configured. Never matches, so lookups stay read-only.
 */
@Component
@ConditionalOnProperty(
        name = "app.resolver.type",
        havingValue = "none",
        matchIfMissing = true
)
public class UnconfiguredGameResolver implements ExternalGameResolver {
    
    private static final Logger log = LoggerFactory.getLogger(UnconfiguredGameResolver.class);
    
    private final AtomicBoolean warned = new AtomicBoolean();
    
    @Override
    public ResolverMatch resolve(String externalId, GameSource source, String homeTeam, String awayTeam,
                                 LocalDate gameDate) {
        if (warned.compareAndSet(false, true)) {
            log.warn("No external resolver configured (app.resolver.type), unmapped ids will not be resolved");
        }
        return ResolverMatch.none("unconfigured");
    }
}
