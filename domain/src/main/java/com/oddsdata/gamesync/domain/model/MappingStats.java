package com.oddsdata.gamesync.domain.model;

import com.oddsdata.gamesync.domain.enums.GameSource;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.EnumMap;
import java.util.Map;

/**
 * Coverage and quality figures of the identity mapping table
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MappingStats {
    private long totalMappings;
    
    @Builder.Default
    private Map<GameSource, Long> mappedBySource = new EnumMap<>(GameSource.class);
    
    private double averageConfidence;
    private OffsetDateTime lastUpdated;
    private long unmappedCount;
    private double coveragePercent;
    
    public static MappingStats empty() {
        return MappingStats.builder().build();
    }
    
    public long mappedExternalIds() {
        return mappedBySource.values().stream().mapToLong(Long::longValue).sum();
    }
}
