package com.patentintel.status.model;

import java.time.Instant;

/**
 * Quota metadata for one admission decision, used for X-RateLimit-* headers.
 * {@code limit} and {@code remaining} are {@link #UNLIMITED} for tiers without a numeric quota.
 */
public record RateLimitStatus(Tier tier, long limit, long remaining, Instant resetAt) {

    public static final long UNLIMITED = -1;

    public boolean unlimited() {
        return limit == UNLIMITED;
    }
}
