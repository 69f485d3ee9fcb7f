package com.patentintel.status.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Response produced for a successful lookup.
 */
public record PatentStatusResponse(
        String patent,
        PatentStatus status,
        @JsonProperty("expiry_date") LocalDate expiryDate,
        List<String> jurisdictions,
        @JsonProperty("primary_jurisdiction") String primaryJurisdiction,
        @JsonProperty("lapse_reason") String lapseReason,
        PatentSource source,
        @JsonProperty("fetched_at") Instant fetchedAt,
        @JsonProperty("cache_hit") boolean cacheHit,
        boolean degraded) {

    public static PatentStatusResponse from(LookupResult result) {
        PatentRecord r = result.record();
        return new PatentStatusResponse(
                r.identifier().display(),
                r.status(),
                r.expiryDate(),
                r.jurisdictions().codes(),
                r.jurisdictions().primary(),
                r.lapseReason(),
                r.source(),
                r.fetchedAt(),
                result.cacheHit(),
                result.degraded());
    }
}
