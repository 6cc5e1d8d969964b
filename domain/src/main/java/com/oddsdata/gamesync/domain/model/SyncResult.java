package com.oddsdata.gamesync.domain.model;

import com.oddsdata.gamesync.domain.enums.SyncAbortReason;
import com.oddsdata.gamesync.domain.enums.WriteOutcome;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Counts and errors of one synchronization run.
 * Returned even on partial failure; callers never infer success from the absence of an exception.
 */
@Data
public class SyncResult {
    
    private String syncType;
    private boolean dryRun;
    private int outcomesFound;
    private int created;
    private int updated;
    private int unchanged;
    private int failures;
    private double durationSeconds;
    private List<String> errors = new ArrayList<>();
    private SyncAbortReason abortReason = SyncAbortReason.NONE;
    private Instant retryAfter;
    
    public SyncResult(String syncType, boolean dryRun) {
        this.syncType = syncType;
        this.dryRun = dryRun;
    }
    
    public void record(WriteOutcome outcome) {
        switch (outcome) {
            case CREATED -> created++;
            case UPDATED -> updated++;
            case UNCHANGED -> unchanged++;
        }
    }
    
    public void recordFailure(String error) {
        failures++;
        errors.add(error);
    }
    
    public void abort(SyncAbortReason reason, String error, Instant retryAfter) {
        this.abortReason = reason;
        this.retryAfter = retryAfter;
        errors.add(error);
    }
    
    public boolean isAborted() {
        return abortReason != SyncAbortReason.NONE;
    }
}
