package com.oddsdata.gamesync.api.controller;

import com.oddsdata.gamesync.application.service.OutcomeSyncService;
import com.oddsdata.gamesync.domain.model.OutcomeSyncStats;
import com.oddsdata.gamesync.domain.model.SyncHealth;
import com.oddsdata.gamesync.domain.model.SyncResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for triggering outcome synchronization.
 * Runs always answer with their result body; an aborted run is reported with 503.
 */
@RestController
@RequestMapping("/api/outcomes/sync")
public class OutcomeSyncController {
    
    private final OutcomeSyncService outcomeSyncService;
    
    public OutcomeSyncController(OutcomeSyncService outcomeSyncService) {
        this.outcomeSyncService = outcomeSyncService;
    }
    
    @PostMapping("/missing")
    public ResponseEntity<SyncResult> syncMissing(
            @RequestParam(required = false, defaultValue = "false") boolean dryRun,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer pageSize) {
        SyncResult result = pageSize == null
                ? outcomeSyncService.syncAllMissing(dryRun, limit)
                : outcomeSyncService.syncAllMissing(dryRun, limit, pageSize);
        return respond(result);
    }
    
    @PostMapping("/recent")
    public ResponseEntity<SyncResult> syncRecent(
            @RequestParam(required = false, defaultValue = "7") int daysBack,
            @RequestParam(required = false, defaultValue = "false") boolean dryRun) {
        return respond(outcomeSyncService.syncRecent(daysBack, dryRun));
    }
    
    @GetMapping("/stats")
    public ResponseEntity<OutcomeSyncStats> stats() {
        return ResponseEntity.ok(outcomeSyncService.stats());
    }
    
    @GetMapping("/health")
    public ResponseEntity<SyncHealth> health() {
        SyncHealth health = outcomeSyncService.health();
        if (SyncHealth.UNHEALTHY.equals(health.getStatus())) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(health);
        }
        return ResponseEntity.ok(health);
    }
    
    private static ResponseEntity<SyncResult> respond(SyncResult result) {
        if (result.isAborted()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(result);
        }
        return ResponseEntity.ok(result);
    }
}
