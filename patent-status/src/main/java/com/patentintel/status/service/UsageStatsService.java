package com.patentintel.status.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only aggregations over the request log and the cache table.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class UsageStatsService {

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    /**
     * Totals, cache hit rate, average response time, outcome breakdown and most-requested patents
     * over the last {@code days} days.
     */
    public Map<String, Object> overview(int days) {
        Timestamp since = since(days);
        log.info("Usage overview for the last {} days", days);

        Map<String, Object> totals = jdbcTemplate.queryForMap("""
            SELECT
                COUNT(*) AS total_requests,
                COALESCE(SUM(CASE WHEN cache_hit THEN 1 ELSE 0 END), 0) AS cache_hits,
                COALESCE(AVG(duration_ms), 0) AS avg_response_ms
            FROM request_log
            WHERE created_at >= ?
            """, since);

        long total = ((Number) totals.get("total_requests")).longValue();
        long hits = ((Number) totals.get("cache_hits")).longValue();

        List<Map<String, Object>> byOutcome = jdbcTemplate.queryForList("""
            SELECT outcome_code, COUNT(*) AS total
            FROM request_log
            WHERE created_at >= ?
            GROUP BY outcome_code
            ORDER BY outcome_code
            """, since);

        List<Map<String, Object>> topPatents = jdbcTemplate.queryForList("""
            SELECT patent_number, status, fetch_count
            FROM patent_cache
            ORDER BY fetch_count DESC, patent_number
            LIMIT 10
            """);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("periodDays", days);
        result.put("totalRequests", total);
        result.put("cacheHits", hits);
        result.put("cacheHitRate", hitRate(hits, total));
        result.put("avgResponseMs", round(((Number) totals.get("avg_response_ms")).doubleValue()));
        result.put("byOutcome", byOutcome);
        result.put("topPatents", topPatents);
        return result;
    }

    /** Requests and distinct clients per tier. */
    public List<Map<String, Object>> byTier(int days) {
        return jdbcTemplate.queryForList("""
            SELECT
                user_tier,
                COUNT(*) AS requests,
                COUNT(DISTINCT client_key_hash) AS unique_clients
            FROM request_log
            WHERE created_at >= ?
            GROUP BY user_tier
            ORDER BY requests DESC
            """, since(days));
    }

    /**
     * Requests, cache hits and average response time per data source, with the number of patents
     * each source currently holds in the cache. Requests answered without a source are left out.
     */
    public List<Map<String, Object>> bySource(int days) {
        Map<String, Long> cached = new HashMap<>();
        for (Map<String, Object> row : jdbcTemplate.queryForList(
                "SELECT source, COUNT(*) AS patents FROM patent_cache GROUP BY source")) {
            cached.put((String) row.get("source"), ((Number) row.get("patents")).longValue());
        }

        return jdbcTemplate.query("""
            SELECT
                source,
                COUNT(*) AS requests,
                SUM(CASE WHEN cache_hit THEN 1 ELSE 0 END) AS cache_hits,
                AVG(duration_ms) AS avg_response_ms
            FROM request_log
            WHERE created_at >= ? AND source IS NOT NULL
            GROUP BY source
            ORDER BY requests DESC, source
            """, (rs, rowNum) -> {
                String source = rs.getString("source");
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("source", source);
                row.put("requests", rs.getLong("requests"));
                row.put("cacheHits", rs.getLong("cache_hits"));
                row.put("avgResponseMs", round(rs.getDouble("avg_response_ms")));
                row.put("cachedPatents", cached.getOrDefault(source, 0L));
                return row;
            }, since(days));
    }

    /** Requests and cache hits per calendar day, oldest first. */
    public List<Map<String, Object>> timeline(int days) {
        return jdbcTemplate.query("""
            SELECT
                CAST(created_at AS DATE) AS log_date,
                COUNT(*) AS requests,
                SUM(CASE WHEN cache_hit THEN 1 ELSE 0 END) AS cache_hits
            FROM request_log
            WHERE created_at >= ?
            GROUP BY CAST(created_at AS DATE)
            ORDER BY log_date
            """, (rs, rowNum) -> {
                long requests = rs.getLong("requests");
                long hits = rs.getLong("cache_hits");
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("date", rs.getDate("log_date").toLocalDate().toString());
                row.put("requests", requests);
                row.put("cacheHits", hits);
                row.put("cacheHitRate", hitRate(hits, requests));
                return row;
            }, since(days));
    }

    private Timestamp since(int days) {
        if (days <= 0) {
            throw new IllegalArgumentException("days must be positive");
        }
        return Timestamp.from(clock.instant().minus(Duration.ofDays(days)));
    }

    static double hitRate(long hits, long total) {
        if (total == 0) return 0.0;
        return round(hits * 100.0 / total);
    }

    private static double round(double val) {
        return BigDecimal.valueOf(val).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
