package com.patentintel.status.model;

import java.time.Instant;

public record RateLimitDecision(boolean allowed, RateLimitStatus status) {

    public static RateLimitDecision allowed(RateLimitStatus status) {
        return new RateLimitDecision(true, status);
    }

    public static RateLimitDecision denied(RateLimitStatus status) {
        return new RateLimitDecision(false, status);
    }

    public Instant resetAt() {
        return status.resetAt();
    }
}
