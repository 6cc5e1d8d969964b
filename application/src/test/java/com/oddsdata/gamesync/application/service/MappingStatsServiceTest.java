package com.oddsdata.gamesync.application.service;

import com.oddsdata.gamesync.domain.enums.GameSource;
import com.oddsdata.gamesync.domain.enums.MappingIssueType;
import com.oddsdata.gamesync.domain.ingest.RawGameCatalog;
import com.oddsdata.gamesync.domain.mapping.IdentityMappingStore;
import com.oddsdata.gamesync.domain.model.MappingStats;
import com.oddsdata.gamesync.domain.model.MappingValidationIssue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MappingStatsServiceTest {
    
    @Mock
    private IdentityMappingStore mappingStore;
    
    @Mock
    private RawGameCatalog rawGameCatalog;
    
    private MappingStatsService service;
    
    @BeforeEach
    void setUp() {
        service = new MappingStatsService(mappingStore, rawGameCatalog, 0.8, 30);
    }
    
    @Test
    void testCoverageCountsMappedAgainstUnmappedIds() {
        Map<GameSource, Long> bySource = new EnumMap<>(GameSource.class);
        bySource.put(GameSource.ACTION_NETWORK, 6L);
        bySource.put(GameSource.VSIN, 2L);
        when(mappingStore.stats()).thenReturn(MappingStats.builder()
                .totalMappings(6)
                .mappedBySource(bySource)
                .averageConfidence(0.9)
                .build());
        when(rawGameCatalog.countUnmapped(Optional.empty())).thenReturn(4L);
        
        MappingStats stats = service.stats();
        
        assertEquals(6, stats.getTotalMappings());
        assertEquals(4, stats.getUnmappedCount());
        assertEquals(66.67, stats.getCoveragePercent(), 1e-9);
    }
    
    @Test
    void testCoverageIsZeroWithoutAnyIds() {
        when(mappingStore.stats()).thenReturn(MappingStats.empty());
        when(rawGameCatalog.countUnmapped(Optional.empty())).thenReturn(0L);
        
        assertEquals(0.0, service.stats().getCoveragePercent(), 1e-9);
    }
    
    @Test
    void testValidationUsesConfiguredThresholds() {
        List<MappingValidationIssue> issues = List.of(
                new MappingValidationIssue(MappingIssueType.LOW_CONFIDENCE, 3, "MLB-4"));
        when(mappingStore.validate(0.8, 30)).thenReturn(issues);
        
        assertEquals(issues, service.validate());
        verify(mappingStore).validate(0.8, 30);
    }
}
