package com.patentintel.status.exception;

import com.patentintel.status.model.RateLimitStatus;

import java.time.Instant;

public class RateLimitExceededException extends PatentLookupException {

    private final RateLimitStatus status;

    public RateLimitExceededException(RateLimitStatus status) {
        super("RATE_LIMIT_EXCEEDED", 429,
                "Monthly limit of " + status.limit() + " requests exceeded for tier "
                        + status.tier() + ". Resets at " + status.resetAt());
        this.status = status;
    }

    public RateLimitStatus status() { return status; }
    public Instant resetAt() { return status.resetAt(); }
}
