package com.patentintel.status.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One completed request, appended to the request log for later aggregation.
 */
@Value
@Builder
public class UsageLogEntry {

    String entryId;         // UUID
    String patentNumber;    // raw input when it could not be normalised
    String clientKeyHash;   // SHA-256 of the caller key, never the key itself
    Tier tier;
    boolean cacheHit;
    boolean degraded;
    PatentSource source;    // null when no record was served
    long durationMs;
    int outcomeCode;        // HTTP-style: 200, 400, 404, 429, 503, 500
    Instant createdAt;
}
