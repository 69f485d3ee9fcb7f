package com.patentintel.status.model;

import lombok.Builder;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Normalised legal-status record produced by a source adapter.
 *
 * A refresh produces a new record; records are never mutated once fetched.
 */
@Builder(toBuilder = true)
public record PatentRecord(
        CanonicalIdentifier identifier,
        PatentStatus status,
        LocalDate expiryDate,
        Jurisdictions jurisdictions,
        String lapseReason,
        PatentSource source,
        Instant fetchedAt) {

    public PatentRecord {
        if (identifier == null) throw new IllegalArgumentException("identifier is required");
        if (status == null) throw new IllegalArgumentException("status is required");
        if (source == null) throw new IllegalArgumentException("source is required");
        if (fetchedAt == null) throw new IllegalArgumentException("fetchedAt is required");
        if (jurisdictions == null) jurisdictions = Jurisdictions.of(identifier.jurisdiction());
        if (lapseReason != null && lapseReason.isBlank()) lapseReason = null;
        if (status.isInactive() && expiryDate == null && lapseReason == null) {
            throw new IllegalArgumentException(
                    status + " record for " + identifier + " needs an expiry date or a lapse reason");
        }
    }
}
