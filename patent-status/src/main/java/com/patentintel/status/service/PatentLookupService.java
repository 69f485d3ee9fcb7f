package com.patentintel.status.service;

import com.patentintel.status.cache.PatentCacheStore;
import com.patentintel.status.exception.CacheUnavailableException;
import com.patentintel.status.exception.PatentNotFoundException;
import com.patentintel.status.exception.ServiceDegradedException;
import com.patentintel.status.exception.UpstreamUnavailableException;
import com.patentintel.status.model.CacheEntry;
import com.patentintel.status.model.CanonicalIdentifier;
import com.patentintel.status.model.LookupPath;
import com.patentintel.status.model.LookupResult;
import com.patentintel.status.model.PatentRecord;
import com.patentintel.status.source.FetchResult;
import com.patentintel.status.source.SourceAdapter;
import com.patentintel.status.source.SourceRouter;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Cache-first lookup of one identifier.
 *
 * <ul>
 *   <li>fresh hit: served from the cache, no upstream call</li>
 *   <li>miss: one adapter, transient failures retried once after a fixed backoff</li>
 *   <li>stale hit: refreshed inline; if the refresh fails the stale record is served as degraded</li>
 * </ul>
 *
 * Exactly one adapter is consulted per lookup, chosen by jurisdiction. Negative results are never cached.
 */
@Slf4j
public class PatentLookupService {

    private final PatentCacheStore cache;
    private final SourceRouter router;
    private final Retry missRetry;
    private final Clock clock;
    private final Duration ttl;

    public PatentLookupService(PatentCacheStore cache, SourceRouter router, Retry missRetry,
                               Clock clock, Duration ttl) {
        this.cache = cache;
        this.router = router;
        this.missRetry = missRetry;
        this.clock = clock;
        this.ttl = ttl;
    }

    public LookupResult lookup(CanonicalIdentifier id) {
        Optional<CacheEntry> cached;
        boolean cacheReadable = true;
        try {
            cached = cache.get(id);
        } catch (CacheUnavailableException e) {
            log.warn("Cache unavailable for {}, going straight to upstream: {}", id, e.getMessage());
            cached = Optional.empty();
            cacheReadable = false;
        }

        if (cached.isEmpty()) {
            log.info("Cache MISS for {}", id);
            return miss(id, cacheReadable);
        }

        CacheEntry entry = cached.get();
        if (!entry.isStale(clock.instant(), ttl)) {
            log.info("Cache HIT for {}", id);
            countRead(id);
            return new LookupResult(entry.record(), LookupPath.HIT_FRESH);
        }

        log.info("Cache STALE for {} (last fetched {}), refreshing", id, entry.lastFetched());
        return staleRefresh(id, entry);
    }

    /**
     * Refresh one entry from upstream without counting it as a read.
     *
     * @return true if the stored record was replaced
     */
    public boolean refresh(CanonicalIdentifier id) {
        SourceAdapter adapter = router.adapterFor(id);
        FetchResult result = adapter.fetch(id);
        if (!result.isSuccess()) {
            log.warn("Background refresh of {} via {} failed: {} ({})",
                    id, adapter.source(), result.outcome(), result.detail());
            return false;
        }
        cache.replace(id, result.record());
        return true;
    }

    // ── Branches ──────────────────────────────────────────────────────────────

    private LookupResult miss(CanonicalIdentifier id, boolean writeBack) {
        SourceAdapter adapter = router.adapterFor(id);
        FetchResult result = missRetry.executeSupplier(() -> adapter.fetch(id));

        return switch (result.outcome()) {
            case SUCCESS -> {
                if (writeBack) store(id, result.record());
                yield new LookupResult(result.record(), LookupPath.MISS);
            }
            case NOT_FOUND -> throw new PatentNotFoundException(id.display(), adapter.source());
            case TRANSIENT_FAILURE -> throw new UpstreamUnavailableException(adapter.source(), id.display(), result.detail());
            case AUTH_FAILURE -> throw new ServiceDegradedException(adapter.source(), id.display(), result.detail());
        };
    }

    private LookupResult staleRefresh(CanonicalIdentifier id, CacheEntry stale) {
        SourceAdapter adapter = router.adapterFor(id);
        FetchResult result = adapter.fetch(id);

        return switch (result.outcome()) {
            case SUCCESS -> {
                store(id, result.record());
                yield new LookupResult(result.record(), LookupPath.STALE_REFRESHED);
            }
            case NOT_FOUND -> throw new PatentNotFoundException(id.display(), adapter.source());
            case TRANSIENT_FAILURE, AUTH_FAILURE -> {
                log.warn("Refresh of {} via {} failed ({}), serving stale record from {}",
                        id, adapter.source(), result.outcome(), stale.lastFetched());
                countRead(id);
                yield new LookupResult(stale.record(), LookupPath.STALE_DEGRADED);
            }
        };
    }

    // ── Cache writes (never fatal) ────────────────────────────────────────────

    private void store(CanonicalIdentifier id, PatentRecord record) {
        try {
            cache.put(id, record);
        } catch (CacheUnavailableException e) {
            log.warn("Cache write failed for {}, returning fresh result anyway: {}", id, e.getMessage());
        }
    }

    private void countRead(CanonicalIdentifier id) {
        try {
            cache.recordRead(id);
        } catch (CacheUnavailableException e) {
            log.warn("Could not update fetch count for {}: {}", id, e.getMessage());
        }
    }
}
