package com.patentintel.status.cache;

import com.patentintel.status.model.CacheEntry;
import com.patentintel.status.model.CanonicalIdentifier;
import com.patentintel.status.model.PatentRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistent store of the last known record per identifier.
 * Implementations throw {@link com.patentintel.status.exception.CacheUnavailableException}
 * when the backing store cannot be reached.
 */
public interface PatentCacheStore {

    /** Pure read. Counts nothing. */
    Optional<CacheEntry> get(CanonicalIdentifier id);

    /**
     * Upsert a freshly fetched record: replaces the record, resets {@code last_fetched}
     * and increments {@code fetch_count} by one. A record with an older {@code fetched_at}
     * than the stored one never overwrites it.
     */
    void put(CanonicalIdentifier id, PatentRecord record);

    /** Like {@link #put} but leaves {@code fetch_count} alone. Used by background refresh. */
    void replace(CanonicalIdentifier id, PatentRecord record);

    /** Count a lookup served from the cache. */
    void recordRead(CanonicalIdentifier id);

    /** Entries last refreshed before {@code cutoff}, most popular first. */
    List<CacheEntry> findStale(Instant cutoff, int limit);
}
