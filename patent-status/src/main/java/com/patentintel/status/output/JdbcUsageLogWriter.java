package com.patentintel.status.output;

import com.patentintel.status.model.UsageLogEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;

@Component
@Slf4j
@RequiredArgsConstructor
public class JdbcUsageLogWriter {

    private final JdbcTemplate jdbcTemplate;

    public void ensureSchema() {
        log.info("Ensuring request_log schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS request_log
            (
                entry_id          VARCHAR(36)  PRIMARY KEY,
                patent_number     VARCHAR(64),
                client_key_hash   VARCHAR(64)  NOT NULL,
                user_tier         VARCHAR(16)  NOT NULL,
                cache_hit         BOOLEAN      NOT NULL,
                degraded          BOOLEAN      NOT NULL,
                source            VARCHAR(16),
                duration_ms       BIGINT       NOT NULL,
                outcome_code      INT          NOT NULL,
                created_at        TIMESTAMP    NOT NULL
            )
        """);
        jdbcTemplate.execute(
                "CREATE INDEX IF NOT EXISTS idx_request_log_created_at ON request_log (created_at)");

        log.info("request_log schema ready.");
    }

    public void write(UsageLogEntry e) {
        jdbcTemplate.update("""
            INSERT INTO request_log
            (entry_id, patent_number, client_key_hash, user_tier, cache_hit, degraded,
             source, duration_ms, outcome_code, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """,
                e.getEntryId(),
                truncate(e.getPatentNumber(), 64),
                e.getClientKeyHash(),
                e.getTier().name(),
                e.isCacheHit(),
                e.isDegraded(),
                e.getSource() != null ? e.getSource().name() : null,
                e.getDurationMs(),
                e.getOutcomeCode(),
                Timestamp.from(e.getCreatedAt()));
    }

    private static String truncate(String val, int max) {
        if (val == null || val.length() <= max) return val;
        return val.substring(0, max);
    }
}
