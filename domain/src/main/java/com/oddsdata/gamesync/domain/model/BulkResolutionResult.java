package com.oddsdata.gamesync.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Canonical ids for a set of external ids, one entry per distinct input pair
 */
public class BulkResolutionResult {
    
    private final Map<ExternalGameRef, String> entries = new LinkedHashMap<>();
    private boolean degraded;
    
    public void put(ExternalGameRef ref, String canonicalId) {
        entries.put(ref, canonicalId);
    }
    
    public void markDegraded() {
        this.degraded = true;
    }
    
    public Optional<String> canonicalIdFor(ExternalGameRef ref) {
        return Optional.ofNullable(entries.get(ref));
    }
    
    public boolean contains(ExternalGameRef ref) {
        return entries.containsKey(ref);
    }
    
    public Set<ExternalGameRef> refs() {
        return Collections.unmodifiableSet(entries.keySet());
    }
    
    public int size() {
        return entries.size();
    }
    
    public long resolvedCount() {
        return entries.values().stream().filter(id -> id != null).count();
    }
    
    /**
     * True when at least one source group could not be queried and was reported as misses
     */
    public boolean isDegraded() {
        return degraded;
    }
    
    /**
     * Entries keyed by {@code source:externalId}, misses mapped to null
     */
    public Map<String, String> asTaggedMap() {
        Map<String, String> view = new LinkedHashMap<>();
        entries.forEach((ref, id) -> view.put(ref.toString(), id));
        return view;
    }
}
