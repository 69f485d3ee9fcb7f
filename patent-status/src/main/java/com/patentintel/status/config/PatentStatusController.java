package com.patentintel.status.config;

import com.patentintel.status.model.PatentStatusResponse;
import com.patentintel.status.model.RateLimitStatus;
import com.patentintel.status.model.StatusLookupResponse;
import com.patentintel.status.model.Tier;
import com.patentintel.status.service.PatentStatusService;
import com.patentintel.status.service.UsageStatsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1")
@Slf4j
@RequiredArgsConstructor
public class PatentStatusController {

    static final String ANONYMOUS = "anonymous";

    private final PatentStatusService statusService;
    private final UsageStatsService statsService;
    private final JdbcTemplate jdbcTemplate;

    // ── Status lookup ─────────────────────────────────────────────────────────

    /**
     * GET /api/v1/status?patent=EP1234567
     *
     * Client key from X-API-Key (or X-RapidAPI-Key), tier from X-RapidAPI-Subscription.
     */
    @GetMapping("/status")
    public ResponseEntity<PatentStatusResponse> status(
            @RequestParam String patent,
            @RequestHeader(value = "X-API-Key", required = false) String apiKey,
            @RequestHeader(value = "X-RapidAPI-Key", required = false) String rapidApiKey,
            @RequestHeader(value = "X-RapidAPI-Subscription", required = false) String subscription) {

        String clientKey = firstNonBlank(apiKey, rapidApiKey);
        Tier tier = Tier.fromHeader(subscription);

        StatusLookupResponse response = statusService.getStatus(patent, clientKey, tier);
        return ResponseEntity.ok()
                .headers(rateLimitHeaders(response.rateLimit()))
                .body(response.body());
    }

    // ── Usage statistics ──────────────────────────────────────────────────────

    @GetMapping("/stats/overview")
    public ResponseEntity<Map<String, Object>> overview(@RequestParam(defaultValue = "30") int days) {
        return ResponseEntity.ok(statsService.overview(days));
    }

    @GetMapping("/stats/by-tier")
    public ResponseEntity<List<Map<String, Object>>> byTier(@RequestParam(defaultValue = "30") int days) {
        return ResponseEntity.ok(statsService.byTier(days));
    }

    @GetMapping("/stats/by-source")
    public ResponseEntity<List<Map<String, Object>>> bySource(@RequestParam(defaultValue = "30") int days) {
        return ResponseEntity.ok(statsService.bySource(days));
    }

    @GetMapping("/stats/timeline")
    public ResponseEntity<List<Map<String, Object>>> timeline(@RequestParam(defaultValue = "7") int days) {
        return ResponseEntity.ok(statsService.timeline(days));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        String database;
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            database = "connected";
        } catch (Exception e) {
            log.warn("Health check could not reach the database: {}", e.getMessage());
            database = "unavailable";
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", "patent-status");
        body.put("version", "1.0.0");
        body.put("status", "connected".equals(database) ? "healthy" : "degraded");
        body.put("database", database);
        return ResponseEntity.ok(body);
    }

    static HttpHeaders rateLimitHeaders(RateLimitStatus status) {
        HttpHeaders headers = new HttpHeaders();
        if (status.unlimited()) {
            headers.set("X-RateLimit-Limit", "unlimited");
            headers.set("X-RateLimit-Remaining", "unlimited");
        } else {
            headers.set("X-RateLimit-Limit", String.valueOf(status.limit()));
            headers.set("X-RateLimit-Remaining", String.valueOf(status.remaining()));
        }
        headers.set("X-RateLimit-Reset", String.valueOf(status.resetAt().getEpochSecond()));
        return headers;
    }

    private static String firstNonBlank(String a, String b) {
        if (a != null && !a.isBlank()) return a.trim();
        if (b != null && !b.isBlank()) return b.trim();
        return ANONYMOUS;
    }
}
