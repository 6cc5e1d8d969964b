package com.oddsdata.gamesync.domain.model;

import com.oddsdata.gamesync.domain.enums.SyncAbortReason;
import com.oddsdata.gamesync.domain.enums.WriteOutcome;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SyncResultTest {
    
    @Test
    void testCountsPerWriteOutcome() {
        SyncResult result = new SyncResult("all_missing", false);
        result.record(WriteOutcome.CREATED);
        result.record(WriteOutcome.CREATED);
        result.record(WriteOutcome.UPDATED);
        result.record(WriteOutcome.UNCHANGED);
        result.recordFailure("Outcome MLB-3: timeout");
        
        assertEquals(2, result.getCreated());
        assertEquals(1, result.getUpdated());
        assertEquals(1, result.getUnchanged());
        assertEquals(1, result.getFailures());
        assertFalse(result.isAborted());
    }
    
    @Test
    void testAbortKeepsCountsAndRetryTime() {
        SyncResult result = new SyncResult("recent_7_days", false);
        result.record(WriteOutcome.CREATED);
        Instant retryAfter = Instant.parse("2024-08-20T12:01:00Z");
        
        result.abort(SyncAbortReason.CIRCUIT_OPEN, "Circuit breaker 'outcomeSync' is open", retryAfter);
        
        assertTrue(result.isAborted());
        assertEquals(1, result.getCreated());
        assertEquals(retryAfter, result.getRetryAfter());
        assertEquals(1, result.getErrors().size());
    }
}
