package com.patentintel.status.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.patentintel.status.exception.CacheUnavailableException;
import com.patentintel.status.model.CacheEntry;
import com.patentintel.status.model.CanonicalIdentifier;
import com.patentintel.status.model.Jurisdictions;
import com.patentintel.status.model.PatentRecord;
import com.patentintel.status.model.PatentSource;
import com.patentintel.status.model.PatentStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link PatentCacheStore} over the {@code patent_cache} table.
 *
 * Upserts are last-writer-wins on {@code fetched_at}: an UPDATE guarded by the stored timestamp,
 * falling back to INSERT when no row exists yet. Losing the INSERT race re-runs the guarded UPDATE.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class JdbcPatentCacheStore implements PatentCacheStore {

    private static final TypeReference<List<String>> CODE_LIST = new TypeReference<>() {};

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public void ensureSchema() {
        log.info("Ensuring patent_cache schema exists...");
        jdbc.getJdbcTemplate().execute("""
            CREATE TABLE IF NOT EXISTS patent_cache
            (
                patent_number   VARCHAR(32)   PRIMARY KEY,
                jurisdiction    VARCHAR(2)    NOT NULL,
                doc_number      VARCHAR(16)   NOT NULL,
                kind            VARCHAR(4),
                status          VARCHAR(16)   NOT NULL,
                expiry_date     DATE,
                jurisdictions   VARCHAR(2000) NOT NULL,
                lapse_reason    VARCHAR(500),
                source          VARCHAR(16)   NOT NULL,
                fetched_at      TIMESTAMP     NOT NULL,
                last_fetched    TIMESTAMP     NOT NULL,
                fetch_count     BIGINT        NOT NULL DEFAULT 0,
                created_at      TIMESTAMP     NOT NULL,
                updated_at      TIMESTAMP     NOT NULL
            )
        """);
        jdbc.getJdbcTemplate().execute(
                "CREATE INDEX IF NOT EXISTS idx_patent_cache_last_fetched ON patent_cache (last_fetched)");
        log.info("patent_cache schema ready.");
    }

    @Override
    public Optional<CacheEntry> get(CanonicalIdentifier id) {
        try {
            List<CacheEntry> rows = jdbc.query(
                    "SELECT * FROM patent_cache WHERE patent_number = :key",
                    Map.of("key", id.key()),
                    this::mapRow);
            return rows.stream().findFirst();
        } catch (DataAccessException e) {
            throw new CacheUnavailableException("Cache read failed for " + id, e);
        }
    }

    @Override
    public void put(CanonicalIdentifier id, PatentRecord record) {
        upsert(id, record, 1);
    }

    @Override
    public void replace(CanonicalIdentifier id, PatentRecord record) {
        upsert(id, record, 0);
    }

    @Override
    public void recordRead(CanonicalIdentifier id) {
        try {
            jdbc.update("""
                UPDATE patent_cache
                SET fetch_count = fetch_count + 1
                WHERE patent_number = :key
                """, Map.of("key", id.key()));
        } catch (DataAccessException e) {
            throw new CacheUnavailableException("Cache counter update failed for " + id, e);
        }
    }

    @Override
    public List<CacheEntry> findStale(Instant cutoff, int limit) {
        try {
            return jdbc.query("""
                SELECT * FROM patent_cache
                WHERE last_fetched < :cutoff
                ORDER BY fetch_count DESC, patent_number
                LIMIT :limit
                """,
                    new MapSqlParameterSource()
                            .addValue("cutoff", Timestamp.from(cutoff))
                            .addValue("limit", limit),
                    this::mapRow);
        } catch (DataAccessException e) {
            throw new CacheUnavailableException("Stale entry scan failed", e);
        }
    }

    private void upsert(CanonicalIdentifier id, PatentRecord record, int increment) {
        MapSqlParameterSource params = toParams(id, record).addValue("inc", increment);
        try {
            if (updateIfNotNewer(params) > 0) return;

            try {
                jdbc.update("""
                    INSERT INTO patent_cache
                    (patent_number, jurisdiction, doc_number, kind, status, expiry_date, jurisdictions,
                     lapse_reason, source, fetched_at, last_fetched, fetch_count, created_at, updated_at)
                    VALUES
                    (:key, :jurisdiction, :docNumber, :kind, :status, :expiryDate, :jurisdictions,
                     :lapseReason, :source, :fetchedAt, :now, :inc, :now, :now)
                    """, params);
            } catch (DuplicateKeyException e) {
                // another writer inserted the row first, its record may be older than ours
                if (updateIfNotNewer(params) > 0) return;
                log.debug("Newer cache record already stored for {}, keeping it", id);
                if (increment > 0) recordRead(id);
            }
        } catch (DataAccessException e) {
            throw new CacheUnavailableException("Cache write failed for " + id, e);
        }
    }

    private int updateIfNotNewer(MapSqlParameterSource params) {
        return jdbc.update("""
            UPDATE patent_cache SET
                kind = :kind, status = :status, expiry_date = :expiryDate,
                jurisdictions = :jurisdictions, lapse_reason = :lapseReason, source = :source,
                fetched_at = :fetchedAt, last_fetched = :now,
                fetch_count = fetch_count + :inc, updated_at = :now
            WHERE patent_number = :key AND fetched_at <= :fetchedAt
            """, params);
    }

    private MapSqlParameterSource toParams(CanonicalIdentifier id, PatentRecord r) {
        return new MapSqlParameterSource()
                .addValue("key", id.key())
                .addValue("jurisdiction", id.jurisdiction())
                .addValue("docNumber", id.number())
                .addValue("kind", r.identifier().kind())
                .addValue("status", r.status().name())
                .addValue("expiryDate", r.expiryDate() != null ? Date.valueOf(r.expiryDate()) : null)
                .addValue("jurisdictions", writeCodes(r.jurisdictions()))
                .addValue("lapseReason", r.lapseReason())
                .addValue("source", r.source().name())
                .addValue("fetchedAt", Timestamp.from(r.fetchedAt()))
                .addValue("now", Timestamp.from(clock.instant().truncatedTo(ChronoUnit.MILLIS)));
    }

    private CacheEntry mapRow(ResultSet rs, int rowNum) throws SQLException {
        CanonicalIdentifier id = new CanonicalIdentifier(
                rs.getString("jurisdiction"), rs.getString("doc_number"), rs.getString("kind"));
        Date expiry = rs.getDate("expiry_date");

        PatentRecord record = PatentRecord.builder()
                .identifier(id)
                .status(PatentStatus.valueOf(rs.getString("status")))
                .expiryDate(expiry != null ? expiry.toLocalDate() : null)
                .jurisdictions(readCodes(id.jurisdiction(), rs.getString("jurisdictions")))
                .lapseReason(rs.getString("lapse_reason"))
                .source(PatentSource.valueOf(rs.getString("source")))
                .fetchedAt(rs.getTimestamp("fetched_at").toInstant())
                .build();

        return new CacheEntry(record, rs.getLong("fetch_count"), rs.getTimestamp("last_fetched").toInstant());
    }

    private String writeCodes(Jurisdictions jurisdictions) {
        try {
            return objectMapper.writeValueAsString(jurisdictions.codes());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise jurisdictions " + jurisdictions, e);
        }
    }

    private Jurisdictions readCodes(String primary, String json) throws SQLException {
        try {
            return new Jurisdictions(primary, objectMapper.readValue(json, CODE_LIST));
        } catch (JsonProcessingException e) {
            throw new SQLException("Corrupt jurisdictions column: " + json, e);
        }
    }
}
