package com.oddsdata.gamesync.integration;

import com.oddsdata.gamesync.application.service.GameIdResolutionService;
import com.oddsdata.gamesync.application.service.MappingStatsService;
import com.oddsdata.gamesync.application.service.OutcomeSyncService;
import com.oddsdata.gamesync.application.service.UnmappedIdDiscoveryService;
import com.oddsdata.gamesync.domain.enums.GameSource;
import com.oddsdata.gamesync.domain.enums.MatchConfidence;
import com.oddsdata.gamesync.domain.mapping.IdentityMappingStore;
import com.oddsdata.gamesync.domain.model.ExternalGameRef;
import com.oddsdata.gamesync.domain.model.GameIdentityMapping;
import com.oddsdata.gamesync.domain.model.ResolutionResult;
import com.oddsdata.gamesync.domain.model.ResolverMatch;
import com.oddsdata.gamesync.domain.model.SyncResult;
import com.oddsdata.gamesync.domain.model.UnmappedCandidate;
import com.oddsdata.gamesync.domain.model.UnmappedResolutionResult;
import com.oddsdata.gamesync.domain.resolver.ExternalGameResolver;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * End-to-end run against PostgreSQL:
 * 1. Unmapped id discovered in a raw table and resolved through the external resolver
 * 2. Later lookups served from the mapping table
 * 3. Mapping from a second source merged into the same row
 * 4. Finalized outcome synced into enhanced_games, then re-runs are no-ops
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class GameSyncScenarioIntegrationTest {
    
    private static final LocalDate GAME_DATE = LocalDate.of(2024, 8, 15);
    
    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>(
            DockerImageName.parse("postgres:15-alpine"))
            .withDatabaseName("mlb_betting")
            .withUsername("postgres")
            .withPassword("postgres");
    
    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }
    
    @MockBean
    private ExternalGameResolver resolver;
    
    @Autowired
    private JdbcTemplate jdbcTemplate;
    
    @Autowired
    private UnmappedIdDiscoveryService discoveryService;
    
    @Autowired
    private GameIdResolutionService resolutionService;
    
    @Autowired
    private IdentityMappingStore mappingStore;
    
    @Autowired
    private MappingStatsService mappingStatsService;
    
    @Autowired
    private OutcomeSyncService outcomeSyncService;
    
    @Test
    void testUnmappedIdResolvedThenOutcomeSyncedOnce() {
        jdbcTemplate.update("INSERT INTO raw_action_network_games (external_game_id, home_team, away_team, game_date) "
                + "VALUES (?, ?, ?, ?)", "AN-9001", "Red Sox", "Yankees", GAME_DATE);
        when(resolver.resolve("AN-9001", GameSource.ACTION_NETWORK, "Red Sox", "Yankees", GAME_DATE))
                .thenReturn(new ResolverMatch("MLB-778899", MatchConfidence.HIGH, "exact"));
        
        List<UnmappedCandidate> unmapped = discoveryService.findUnmapped("action_network", 10, 0);
        assertEquals(1, unmapped.size());
        assertEquals("raw_action_network_games", unmapped.get(0).getOriginTable());
        
        UnmappedResolutionResult backfill = discoveryService.resolveUnmapped("action_network", 10, false);
        assertEquals(1, backfill.getResolved());
        assertEquals(0, backfill.getFailed());
        
        ResolutionResult lookup = resolutionService.resolve("AN-9001", GameSource.ACTION_NETWORK);
        assertEquals("MLB-778899", lookup.getCanonicalId());
        verify(resolver, times(1)).resolve(anyString(), any(), any(), any(), any());
        assertTrue(discoveryService.findUnmapped("action_network", 10, 0).isEmpty());
        
        // A second source for the same game merges into the existing row
        UnmappedCandidate vsin = UnmappedCandidate.builder()
                .externalId("V-501")
                .source(GameSource.VSIN)
                .homeTeam("Red Sox")
                .awayTeam("Yankees")
                .gameDate(GAME_DATE)
                .build();
        resolutionService.store(vsin, new ResolverMatch("MLB-778899", MatchConfidence.LOW, "team_date"));
        GameIdentityMapping merged = mappingStore.findByCanonicalId("MLB-778899").orElseThrow();
        assertEquals("AN-9001", merged.getExternalIds().get(GameSource.ACTION_NETWORK));
        assertEquals("V-501", merged.getExternalIds().get(GameSource.VSIN));
        assertEquals(1.0, merged.getResolutionConfidence(), 1e-9);
        assertEquals(1, merged.getVerificationAttempts());
        
        assertEquals(2, resolutionService.resolveBulk(List.of(
                ExternalGameRef.of("AN-9001", GameSource.ACTION_NETWORK),
                ExternalGameRef.of("V-501", GameSource.VSIN))).resolvedCount());
        assertEquals(100.0, mappingStatsService.stats().getCoveragePercent(), 1e-9);
        
        Long gameId = jdbcTemplate.queryForObject("INSERT INTO games_complete "
                        + "(canonical_game_id, action_network_game_id, game_date, season, game_status) "
                        + "VALUES (?, ?, ?, ?, ?) RETURNING id",
                Long.class, "MLB-778899", "AN-9001", GAME_DATE, 2024, "final");
        jdbcTemplate.update("INSERT INTO game_outcomes (game_id, home_team, away_team, home_score, away_score, "
                + "home_win, total_line, over_result, game_date) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
                gameId, "Red Sox", "Yankees", 7, 4, true, 8.5, true, GAME_DATE);
        
        SyncResult first = outcomeSyncService.syncAllMissing(false, null);
        assertEquals(1, first.getOutcomesFound());
        assertEquals(1, first.getCreated());
        assertEquals(0, first.getFailures());
        
        SyncResult second = outcomeSyncService.syncAllMissing(false, null);
        assertEquals(0, second.getOutcomesFound());
        assertEquals(0, second.getCreated());
        assertEquals(0, second.getUpdated());
        
        // Re-reading the stored row, including its JSON payloads, finds nothing to change
        int daysBack = (int) ChronoUnit.DAYS.between(GAME_DATE, LocalDate.now()) + 1;
        SyncResult recent = outcomeSyncService.syncRecent(daysBack, false);
        assertEquals(1, recent.getOutcomesFound());
        assertEquals(1, recent.getUnchanged());
        assertEquals(0, recent.getUpdated());
        
        Integer homeScore = jdbcTemplate.queryForObject(
                "SELECT home_score FROM enhanced_games WHERE canonical_game_id = ?", Integer.class, "MLB-778899");
        assertEquals(7, homeScore);
        assertEquals(1, outcomeSyncService.stats().getEnrichedWithScores());
    }
}
