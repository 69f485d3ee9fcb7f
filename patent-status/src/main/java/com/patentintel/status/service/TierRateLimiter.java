package com.patentintel.status.service;

import com.patentintel.status.model.RateLimitDecision;
import com.patentintel.status.model.RateLimitStatus;
import com.patentintel.status.model.RateLimitWindow;
import com.patentintel.status.model.Tier;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-client monthly request quota.
 *
 * One {@link RateLimitWindow} per client key; every check-and-increment happens while holding
 * that window's monitor, so two requests at {@code limit - 1} cannot both be admitted.
 * Windows are calendar months in UTC and roll over lazily on the first request of a new month.
 * That first request also evicts every window left over from earlier months, so keys that are
 * never seen again do not accumulate.
 */
@Slf4j
public class TierRateLimiter {

    private final Map<Tier, Integer> limits;
    private final Clock clock;
    private final ConcurrentHashMap<String, RateLimitWindow> windows = new ConcurrentHashMap<>();
    private final AtomicReference<LocalDate> sweptMonth = new AtomicReference<>();

    public TierRateLimiter(Map<Tier, Integer> limits, Clock clock) {
        this.limits = Map.copyOf(limits);
        this.clock = clock;
    }

    public RateLimitDecision admit(String clientKey, Tier tier) {
        LocalDate monthStart = LocalDate.now(clock).withDayOfMonth(1);
        LocalDate nextMonth = monthStart.plusMonths(1);

        LocalDate swept = sweptMonth.get();
        if (!monthStart.equals(swept) && sweptMonth.compareAndSet(swept, monthStart)) {
            evictBefore(monthStart);
        }

        if (tier.isUnlimited()) {
            return RateLimitDecision.allowed(new RateLimitStatus(tier, RateLimitStatus.UNLIMITED,
                    RateLimitStatus.UNLIMITED, resetAt(nextMonth)));
        }

        int limit = limitFor(tier);
        while (true) {
            RateLimitWindow window = windows.computeIfAbsent(clientKey,
                    k -> new RateLimitWindow(k, tier, monthStart, 0));

            synchronized (window) {
                if (windows.get(clientKey) != window) {
                    // evicted between lookup and lock, start over with a fresh window
                    continue;
                }
                if (!monthStart.isBefore(window.getWindowStart().plusMonths(1))) {
                    log.debug("Rolling over quota window for {} ({} -> {})",
                            clientKey, window.getWindowStart(), monthStart);
                    window.setWindowStart(monthStart);
                    window.setRequestCount(0);
                }
                // a plan change applies from the next request on, counter carries over
                window.setTier(tier);

                int used = window.getRequestCount();
                if (used >= limit) {
                    log.info("Rate limit exceeded for {} ({}, {}/{})", clientKey, tier, used, limit);
                    return RateLimitDecision.denied(new RateLimitStatus(tier, limit, 0, resetAt(nextMonth)));
                }

                window.setRequestCount(used + 1);
                return RateLimitDecision.allowed(new RateLimitStatus(tier, limit, limit - (used + 1), resetAt(nextMonth)));
            }
        }
    }

    /** Number of client windows currently held. */
    int windowCount() {
        return windows.size();
    }

    /** Requests counted in the client's current window, 0 if the client has none. */
    int requestCount(String clientKey) {
        RateLimitWindow window = windows.get(clientKey);
        if (window == null) return 0;
        synchronized (window) {
            return window.getRequestCount();
        }
    }

    private int evictBefore(LocalDate monthStart) {
        int evicted = 0;
        for (Map.Entry<String, RateLimitWindow> entry : windows.entrySet()) {
            RateLimitWindow window = entry.getValue();
            synchronized (window) {
                if (window.getWindowStart().isBefore(monthStart) && windows.remove(entry.getKey(), window)) {
                    evicted++;
                }
            }
        }
        if (evicted > 0) {
            log.info("Evicted {} quota window(s) from before {}", evicted, monthStart);
        }
        return evicted;
    }

    private int limitFor(Tier tier) {
        Integer limit = limits.get(tier);
        if (limit == null) {
            throw new IllegalStateException("No monthly limit configured for tier " + tier);
        }
        return limit;
    }

    private static Instant resetAt(LocalDate nextMonth) {
        return nextMonth.atStartOfDay(ZoneOffset.UTC).toInstant();
    }
}
