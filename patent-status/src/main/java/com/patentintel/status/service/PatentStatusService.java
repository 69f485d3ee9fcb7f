package com.patentintel.status.service;

import com.patentintel.status.exception.PatentLookupException;
import com.patentintel.status.exception.RateLimitExceededException;
import com.patentintel.status.model.CanonicalIdentifier;
import com.patentintel.status.model.LookupResult;
import com.patentintel.status.model.PatentSource;
import com.patentintel.status.model.PatentStatusResponse;
import com.patentintel.status.model.RateLimitDecision;
import com.patentintel.status.model.StatusLookupResponse;
import com.patentintel.status.model.Tier;
import com.patentintel.status.model.UsageLogEntry;
import com.patentintel.status.output.UsageRecorder;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * One inbound status request end to end: quota check, identifier validation, lookup,
 * and a usage log entry whatever the outcome.
 */
@Service
@RequiredArgsConstructor
public class PatentStatusService {

    private final TierRateLimiter rateLimiter;
    private final IdentifierNormalizer normalizer;
    private final PatentLookupService lookupService;
    private final UsageRecorder usageRecorder;
    private final Clock clock;

    public StatusLookupResponse getStatus(String rawPatent, String clientKey, Tier tier) {
        long started = System.nanoTime();
        String patentLabel = rawPatent;
        LookupResult result = null;
        int outcome = 500;

        try {
            RateLimitDecision decision = rateLimiter.admit(clientKey, tier);
            if (!decision.allowed()) {
                throw new RateLimitExceededException(decision.status());
            }

            CanonicalIdentifier id = normalizer.normalize(rawPatent);
            patentLabel = id.display();

            result = lookupService.lookup(id);
            outcome = 200;
            return new StatusLookupResponse(PatentStatusResponse.from(result), decision.status());
        } catch (PatentLookupException e) {
            outcome = e.outcomeCode();
            throw e;
        } catch (IllegalArgumentException e) {
            // answered as 400 by the exception advice
            outcome = 400;
            throw e;
        } finally {
            record(patentLabel, clientKey, tier, result, outcome, started);
        }
    }

    private void record(String patent, String clientKey, Tier tier, LookupResult result, int outcome, long started) {
        PatentSource source = result != null ? result.record().source() : null;
        usageRecorder.record(UsageLogEntry.builder()
                .entryId(UUID.randomUUID().toString())
                .patentNumber(patent)
                .clientKeyHash(hashKey(clientKey))
                .tier(tier)
                .cacheHit(result != null && result.cacheHit())
                .degraded(result != null && result.degraded())
                .source(source)
                .durationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started))
                .outcomeCode(outcome)
                .createdAt(clock.instant())
                .build());
    }

    static String hashKey(String clientKey) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(clientKey.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
