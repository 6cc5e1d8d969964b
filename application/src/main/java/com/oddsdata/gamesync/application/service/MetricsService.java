package com.oddsdata.gamesync.application.service;

import com.oddsdata.gamesync.domain.enums.GameSource;
import com.oddsdata.gamesync.domain.enums.WriteOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

/**
 * Service for recording resolution and synchronization metrics
 */
@Service
public class MetricsService {
    
    private final MeterRegistry meterRegistry;
    
    // Counters
    private final Counter syncFailuresCounter;
    private final Counter syncAbortsCounter;
    private final Counter bulkDegradedCounter;
    
    // Timers
    private final Timer bulkResolutionTimer;
    private final Timer syncRunTimer;
    
    public MetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        
        this.syncFailuresCounter = Counter.builder("gamesync.sync.failures")
                .description("Outcome records that failed to build or persist")
                .register(meterRegistry);
        
        this.syncAbortsCounter = Counter.builder("gamesync.sync.aborts")
                .description("Synchronization runs stopped by an open breaker or store outage")
                .register(meterRegistry);
        
        this.bulkDegradedCounter = Counter.builder("gamesync.resolution.bulk.degraded")
                .description("Bulk lookups where a source group was reported as misses after a store error")
                .register(meterRegistry);
        
        this.bulkResolutionTimer = Timer.builder("gamesync.resolution.bulk.time")
                .description("Bulk resolution time")
                .register(meterRegistry);
        
        this.syncRunTimer = Timer.builder("gamesync.sync.run.time")
                .description("Outcome synchronization run time")
                .register(meterRegistry);
    }
    
    /**
     * @param result hit, miss or unavailable
     */
    public void recordLookup(GameSource source, String result) {
        meterRegistry.counter("gamesync.resolution.lookups", "source", source.getTag(), "result", result).increment();
    }
    
    public void recordMappingCreated(GameSource source) {
        meterRegistry.counter("gamesync.resolution.mapped", "source", source.getTag()).increment();
    }
    
    public void recordBulkDegraded() {
        bulkDegradedCounter.increment();
    }
    
    public void recordSyncWrite(WriteOutcome outcome) {
        meterRegistry.counter("gamesync.sync.records", "outcome", outcome.name().toLowerCase()).increment();
    }
    
    public void recordSyncFailure() {
        syncFailuresCounter.increment();
    }
    
    public void recordSyncAbort() {
        syncAbortsCounter.increment();
    }
    
    public Timer.Sample startTimer() {
        return Timer.start(meterRegistry);
    }
    
    public void recordBulkResolution(Timer.Sample sample) {
        sample.stop(bulkResolutionTimer);
    }
    
    public void recordSyncRun(Timer.Sample sample) {
        sample.stop(syncRunTimer);
    }
}
