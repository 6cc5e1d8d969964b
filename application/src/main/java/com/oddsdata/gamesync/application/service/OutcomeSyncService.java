package com.oddsdata.gamesync.application.service;

import com.oddsdata.gamesync.application.resilience.SyncCircuitBreaker;
import com.oddsdata.gamesync.domain.enums.CircuitState;
import com.oddsdata.gamesync.domain.enums.SyncAbortReason;
import com.oddsdata.gamesync.domain.enums.WriteOutcome;
import com.oddsdata.gamesync.domain.exception.CircuitOpenException;
import com.oddsdata.gamesync.domain.exception.InvalidArgumentException;
import com.oddsdata.gamesync.domain.exception.StoreUnavailableException;
import com.oddsdata.gamesync.domain.model.EnrichedOutcomeRecord;
import com.oddsdata.gamesync.domain.model.OutcomeQuery;
import com.oddsdata.gamesync.domain.model.OutcomeSourceRow;
import com.oddsdata.gamesync.domain.model.OutcomeSyncStats;
import com.oddsdata.gamesync.domain.model.SyncHealth;
import com.oddsdata.gamesync.domain.model.SyncResult;
import com.oddsdata.gamesync.domain.outcome.EnrichedOutcomeStore;
import com.oddsdata.gamesync.domain.outcome.OutcomeSourceReader;
import com.oddsdata.gamesync.domain.validation.Arguments;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Copies finalized game outcomes into the enriched outcome table.
 * <p>
 * Pages are fetched by outcome id through the synchronization circuit breaker and written in
 * sub-batches, each in its own transaction. A failing record is reported in the result and the run
 * carries on. An open breaker or an unreachable store stops the run with an abort reason.
 */
@Service
public class OutcomeSyncService {
    
    private static final Logger log = LoggerFactory.getLogger(OutcomeSyncService.class);
    
    static final int SUB_BATCH_SIZE = 50;
    static final int ML_TRAINING_THRESHOLD = 50;
    
    private final OutcomeSourceReader outcomeReader;
    private final EnrichedOutcomeStore enrichedStore;
    private final EnrichedOutcomeBuilder builder;
    private final SyncCircuitBreaker circuitBreaker;
    private final MetricsService metricsService;
    private final Clock clock;
    private final int defaultPageSize;
    
    private final AtomicLong totalSynced = new AtomicLong();
    private final AtomicLong totalCreated = new AtomicLong();
    private final AtomicLong totalUpdated = new AtomicLong();
    private final AtomicReference<OffsetDateTime> lastSync = new AtomicReference<>();
    
    public OutcomeSyncService(
            OutcomeSourceReader outcomeReader,
            EnrichedOutcomeStore enrichedStore,
            EnrichedOutcomeBuilder builder,
            @Qualifier("outcomeSyncCircuitBreaker") SyncCircuitBreaker circuitBreaker,
            MetricsService metricsService,
            Clock clock,
            @Value("${app.sync.page-size:1000}") int defaultPageSize) {
        this.outcomeReader = outcomeReader;
        this.enrichedStore = enrichedStore;
        this.builder = builder;
        this.circuitBreaker = circuitBreaker;
        this.metricsService = metricsService;
        this.clock = clock;
        this.defaultPageSize = Arguments.requirePositive(defaultPageSize, "app.sync.page-size");
    }
    
    public SyncResult syncAllMissing(boolean dryRun, Integer limit) {
        return syncAllMissing(dryRun, limit, defaultPageSize);
    }
    
    /**
     * Sync every complete outcome whose enriched row is absent or lacks scores
     * @param limit Maximum outcomes to process, null for no cap
     * @param pageSize Rows fetched per page
     */
    public SyncResult syncAllMissing(boolean dryRun, Integer limit, int pageSize) {
        if (limit != null) {
            Arguments.requirePositive(limit, "limit");
        }
        Arguments.requirePositive(pageSize, "pageSize");
        
        OutcomeQuery query = OutcomeQuery.builder()
                .onlyMissing(true)
                .pageSize(pageSize)
                .build();
        return run("all_missing", query, limit, dryRun);
    }
    
    /**
     * Sync every complete outcome dated within the last {@code daysBack} days, so corrected scores propagate
     */
    public SyncResult syncRecent(int daysBack, boolean dryRun) {
        Arguments.requirePositive(daysBack, "daysBack");
        
        OutcomeQuery query = OutcomeQuery.builder()
                .onlyMissing(false)
                .since(LocalDate.now(clock).minusDays(daysBack))
                .pageSize(defaultPageSize)
                .build();
        return run("recent_" + daysBack + "_days", query, null, dryRun);
    }
    
    /**
     * Page through the outcome source. An open breaker or store outage on a page fetch ends the whole run
     * with {@code CIRCUIT_OPEN} or {@code STORE_UNAVAILABLE}, keeping the counts of pages already written.
     */
    private SyncResult run(String syncType, OutcomeQuery firstPage, Integer limit, boolean dryRun) {
        SyncResult result = new SyncResult(syncType, dryRun);
        Timer.Sample sample = metricsService.startTimer();
        long startNanos = System.nanoTime();
        log.info("Starting outcome sync: type={}, dryRun={}, limit={}, pageSize={}",
                syncType, dryRun, limit, firstPage.getPageSize());
        
        OutcomeQuery query = firstPage;
        while (true) {
            int requested = limit == null
                    ? firstPage.getPageSize()
                    : Math.min(firstPage.getPageSize(), limit - result.getOutcomesFound());
            if (requested <= 0) {
                break;
            }
            OutcomeQuery pageQuery = query.toBuilder().pageSize(requested).build();
            
            List<OutcomeSourceRow> page;
            try {
                page = circuitBreaker.execute(() -> outcomeReader.findOutcomes(pageQuery));
            } catch (CircuitOpenException e) {
                log.warn("Outcome sync {} stopped: circuit '{}' open until {}", syncType, e.getBreakerName(),
                        e.getRetryAfter());
                result.abort(SyncAbortReason.CIRCUIT_OPEN, e.getMessage(), e.getRetryAfter());
                metricsService.recordSyncAbort();
                break;
            } catch (StoreUnavailableException e) {
                log.error("Outcome sync {} stopped: outcome query failed", syncType, e);
                result.abort(SyncAbortReason.STORE_UNAVAILABLE, "Outcome query failed: " + e.getMessage(), null);
                metricsService.recordSyncAbort();
                break;
            }
            
            if (page.isEmpty()) {
                break;
            }
            result.setOutcomesFound(result.getOutcomesFound() + page.size());
            processPage(page, dryRun, result);
            
            if (page.size() < requested) {
                break;
            }
            query = pageQuery.next(page.get(page.size() - 1).getOutcomeId());
        }
        
        result.setDurationSeconds((System.nanoTime() - startNanos) / 1_000_000_000.0);
        metricsService.recordSyncRun(sample);
        if (!dryRun) {
            totalSynced.addAndGet(result.getCreated() + result.getUpdated());
            totalCreated.addAndGet(result.getCreated());
            totalUpdated.addAndGet(result.getUpdated());
            lastSync.set(OffsetDateTime.now(clock));
        }
        
        log.info("Outcome sync {} finished: found={}, created={}, updated={}, unchanged={}, failures={}, aborted={}, {}s",
                syncType, result.getOutcomesFound(), result.getCreated(), result.getUpdated(),
                result.getUnchanged(), result.getFailures(), result.getAbortReason(),
                String.format("%.2f", result.getDurationSeconds()));
        return result;
    }
    
    private void processPage(List<OutcomeSourceRow> page, boolean dryRun, SyncResult result) {
        List<EnrichedOutcomeRecord> batch = new ArrayList<>(SUB_BATCH_SIZE);
        for (OutcomeSourceRow row : page) {
            EnrichedOutcomeRecord record;
            try {
                record = builder.build(row);
            } catch (RuntimeException e) {
                fail(result, "Outcome " + row.getOutcomeId() + ": " + e.getMessage(), e);
                continue;
            }
            batch.add(record);
            if (batch.size() == SUB_BATCH_SIZE) {
                writeBatch(batch, dryRun, result);
                batch = new ArrayList<>(SUB_BATCH_SIZE);
            }
        }
        if (!batch.isEmpty()) {
            writeBatch(batch, dryRun, result);
        }
    }
    
    private void writeBatch(List<EnrichedOutcomeRecord> batch, boolean dryRun, SyncResult result) {
        if (dryRun) {
            batch.forEach(record -> writeOne(record, true, result));
            return;
        }
        try {
            List<WriteOutcome> outcomes = enrichedStore.upsertAll(batch);
            outcomes.forEach(outcome -> recordWrite(outcome, result));
        } catch (RuntimeException e) {
            log.warn("Sub-batch of {} outcomes failed ({}), retrying record by record", batch.size(), e.getMessage());
            batch.forEach(record -> writeOne(record, false, result));
        }
    }
    
    private void writeOne(EnrichedOutcomeRecord record, boolean dryRun, SyncResult result) {
        try {
            WriteOutcome outcome = dryRun ? enrichedStore.classify(record) : enrichedStore.upsert(record);
            recordWrite(outcome, result);
        } catch (RuntimeException e) {
            fail(result, "Outcome " + record.recordKey() + ": " + e.getMessage(), e);
        }
    }
    
    private void recordWrite(WriteOutcome outcome, SyncResult result) {
        result.record(outcome);
        metricsService.recordSyncWrite(outcome);
    }
    
    private void fail(SyncResult result, String error, RuntimeException e) {
        if (e instanceof InvalidArgumentException) {
            log.warn("Skipping outcome: {}", error);
        } else {
            log.error("Failed to sync outcome: {}", error, e);
        }
        result.recordFailure(error);
        metricsService.recordSyncFailure();
    }
    
    /**
     * Completion of the enriched table against the outcome source plus this process's run counters
     */
    public OutcomeSyncStats stats() {
        long enriched = enrichedStore.countWithScores();
        long total = outcomeReader.countCompleteOutcomes();
        long missing = outcomeReader.countMissing();
        double completion = total == 0 ? 0.0 : Math.round(enriched * 10000.0 / total) / 100.0;
        
        return OutcomeSyncStats.builder()
                .enrichedWithScores(enriched)
                .totalCompleteOutcomes(total)
                .missingEnriched(missing)
                .completionRatePercent(completion)
                .mlTrainingReady(enriched >= ML_TRAINING_THRESHOLD)
                .totalSynced(totalSynced.get())
                .totalCreated(totalCreated.get())
                .totalUpdated(totalUpdated.get())
                .lastSync(lastSync.get())
                .build();
    }
    
    public SyncHealth health() {
        CircuitState circuitState = circuitBreaker.getState();
        try {
            OutcomeSyncStats stats = stats();
            boolean syncNeeded = stats.getMissingEnriched() > 0;
            String status;
            if (circuitState == CircuitState.OPEN) {
                status = SyncHealth.UNHEALTHY;
            } else {
                status = syncNeeded ? SyncHealth.NEEDS_SYNC : SyncHealth.HEALTHY;
            }
            return SyncHealth.builder()
                    .status(status)
                    .databaseConnected(true)
                    .enrichedWithScores(stats.getEnrichedWithScores())
                    .missingEnriched(stats.getMissingEnriched())
                    .mlTrainingReady(stats.isMlTrainingReady())
                    .syncNeeded(syncNeeded)
                    .circuitState(circuitState)
                    .build();
        } catch (StoreUnavailableException e) {
            log.warn("Outcome sync health check failed: {}", e.getMessage());
            return SyncHealth.builder()
                    .status(SyncHealth.UNHEALTHY)
                    .databaseConnected(false)
                    .circuitState(circuitState)
                    .error(e.getMessage())
                    .build();
        }
    }
    
    public CircuitState circuitState() {
        return circuitBreaker.getState();
    }
}
