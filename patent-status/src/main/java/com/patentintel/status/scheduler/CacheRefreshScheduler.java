package com.patentintel.status.scheduler;

import com.patentintel.status.cache.JdbcPatentCacheStore;
import com.patentintel.status.cache.PatentCacheStore;
import com.patentintel.status.config.PatentStatusProperties;
import com.patentintel.status.model.CacheEntry;
import com.patentintel.status.model.CanonicalIdentifier;
import com.patentintel.status.output.JdbcUsageLogWriter;
import com.patentintel.status.service.PatentLookupService;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Startup schema creation and the nightly refresh of popular stale cache entries.
 *
 * Default schedule: every day at 03:00 UTC. Override with patent-status.cache.refresh-cron.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CacheRefreshScheduler {

    private final JdbcPatentCacheStore cacheSchema;
    private final JdbcUsageLogWriter usageLogSchema;
    private final PatentCacheStore cacheStore;
    private final PatentLookupService lookupService;
    private final PatentStatusProperties properties;
    private final Clock clock;

    @PostConstruct
    public void onStartup() {
        try {
            cacheSchema.ensureSchema();
            usageLogSchema.ensureSchema();
        } catch (Exception e) {
            log.warn("Could not initialise database schema (database down?): {}", e.getMessage());
        }

        if (properties.getCache().isRefreshEnabled()) {
            log.info("Cache refresh ready. Schedule: {}", properties.getCache().getRefreshCron());
        } else {
            log.info("Scheduled cache refresh disabled");
        }
    }

    @Scheduled(cron = "${patent-status.cache.refresh-cron:0 0 3 * * *}", zone = "UTC")
    public void scheduledRefresh() {
        if (!properties.getCache().isRefreshEnabled()) return;
        log.info("Scheduled cache refresh triggered");
        try {
            refreshStale();
        } catch (Exception e) {
            log.error("Scheduled cache refresh failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Refresh up to {@code refresh-top-n} stale entries, most requested first.
     *
     * @return number of entries actually refreshed
     */
    public int refreshStale() {
        Instant cutoff = clock.instant().minus(properties.getCache().getTtl());
        List<CacheEntry> stale = cacheStore.findStale(cutoff, properties.getCache().getRefreshTopN());
        log.info("Found {} stale entries to refresh", stale.size());

        int refreshed = 0;
        for (CacheEntry entry : stale) {
            CanonicalIdentifier id = entry.record().identifier();
            try {
                if (lookupService.refresh(id)) refreshed++;
            } catch (Exception e) {
                log.warn("Refresh of {} failed: {}", id, e.getMessage());
            }
        }

        log.info("Cache refresh complete: {}/{} entries refreshed", refreshed, stale.size());
        return refreshed;
    }
}
