package com.patentintel.status.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Last known record for an identifier plus popularity and freshness bookkeeping.
 *
 * @param fetchCount  incremented on every lookup that touches the entry
 * @param lastFetched when the record was last refreshed from upstream
 */
public record CacheEntry(PatentRecord record, long fetchCount, Instant lastFetched) {

    /** Stale once strictly more than {@code ttl} has passed since the last refresh. */
    public boolean isStale(Instant now, Duration ttl) {
        return Duration.between(lastFetched, now).compareTo(ttl) > 0;
    }
}
