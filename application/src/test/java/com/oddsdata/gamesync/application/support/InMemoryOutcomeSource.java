package com.oddsdata.gamesync.application.support;

import com.oddsdata.gamesync.domain.exception.StoreUnavailableException;
import com.oddsdata.gamesync.domain.model.OutcomeQuery;
import com.oddsdata.gamesync.domain.model.OutcomeSourceRow;
import com.oddsdata.gamesync.domain.outcome.OutcomeSourceReader;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Outcome rows in memory; the missing filter consults the enriched store fake
 */
public class InMemoryOutcomeSource implements OutcomeSourceReader {
    
    private final InMemoryEnrichedOutcomeStore enrichedStore;
    private final List<OutcomeSourceRow> rows = new ArrayList<>();
    private final AtomicInteger queries = new AtomicInteger();
    private int failuresToInject;
    
    public InMemoryOutcomeSource(InMemoryEnrichedOutcomeStore enrichedStore) {
        this.enrichedStore = enrichedStore;
    }
    
    /**
     * Add a row, replacing any row with the same outcome id
     */
    public synchronized InMemoryOutcomeSource add(OutcomeSourceRow row) {
        rows.removeIf(existing -> existing.getOutcomeId() == row.getOutcomeId());
        rows.add(row);
        rows.sort(Comparator.comparingLong(OutcomeSourceRow::getOutcomeId));
        return this;
    }
    
    /**
     * Fail the next {@code count} page queries
     */
    public void failNext(int count) {
        this.failuresToInject = count;
    }
    
    public int queries() {
        return queries.get();
    }
    
    public static OutcomeSourceRow row(long outcomeId, String canonicalId, String actionNetworkId,
                                       String awayTeam, String homeTeam, Integer homeScore, Integer awayScore,
                                       LocalDate gameDate) {
        return OutcomeSourceRow.builder()
                .outcomeId(outcomeId)
                .sourceGameId(outcomeId + 1000)
                .canonicalId(canonicalId)
                .actionNetworkGameId(actionNetworkId)
                .awayTeam(awayTeam)
                .homeTeam(homeTeam)
                .homeScore(homeScore)
                .awayScore(awayScore)
                .gameDate(gameDate)
                .build();
    }
    
    @Override
    public synchronized List<OutcomeSourceRow> findOutcomes(OutcomeQuery query) {
        queries.incrementAndGet();
        if (failuresToInject > 0) {
            failuresToInject--;
            throw new StoreUnavailableException("outcome query timed out", null);
        }
        return rows.stream()
                .filter(row -> row.getOutcomeId() > query.getAfterOutcomeId())
                .filter(OutcomeSourceRow::hasCompleteScores)
                .filter(row -> !query.isOnlyMissing()
                        || !enrichedStore.hasScores(row.getCanonicalId(), row.getActionNetworkGameId()))
                .filter(row -> query.getSince() == null
                        || (row.getGameDate() != null && !row.getGameDate().isBefore(query.getSince())))
                .limit(query.getPageSize())
                .toList();
    }
    
    @Override
    public synchronized long countCompleteOutcomes() {
        return rows.stream().filter(OutcomeSourceRow::hasCompleteScores).count();
    }
    
    @Override
    public synchronized long countMissing() {
        return rows.stream()
                .filter(OutcomeSourceRow::hasCompleteScores)
                .filter(row -> !enrichedStore.hasScores(row.getCanonicalId(), row.getActionNetworkGameId()))
                .count();
    }
}
