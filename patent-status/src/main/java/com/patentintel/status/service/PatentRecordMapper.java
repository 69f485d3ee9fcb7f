package com.patentintel.status.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.patentintel.status.model.CanonicalIdentifier;
import com.patentintel.status.model.Jurisdictions;
import com.patentintel.status.model.PatentRecord;
import com.patentintel.status.model.PatentSource;
import com.patentintel.status.model.PatentStatus;
import com.patentintel.status.model.UsptoSearchResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Maps raw EPO and USPTO responses to the normalised PatentRecord domain model.
 *
 * Neither upstream reports an expiry date directly, so it is derived as
 * filing date + 20 years (standard utility term).
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PatentRecordMapper {

    static final int UTILITY_TERM_YEARS = 20;

    private static final DateTimeFormatter BASIC = DateTimeFormatter.BASIC_ISO_DATE;
    private static final DateTimeFormatter US_DASH = DateTimeFormatter.ofPattern("MM-dd-yyyy");
    private static final DateTimeFormatter US_SLASH = DateTimeFormatter.ofPattern("MM/dd/yyyy");

    private final Clock clock;

    // ── EPO ──────────────────────────────────────────────────────────────────

    /**
     * Convert an OPS published-data JSON document.
     *
     * Structure (simplified):
     *   ops:world-patent-data / exchange-documents / exchange-document (object or array)
     *     @country, @kind, bibliographic-data / publication-reference, application-reference
     *
     * A B-kind publication is grant evidence.
     *
     * @return empty when the document list is empty
     */
    public Optional<PatentRecord> fromEpo(CanonicalIdentifier id, JsonNode root) {
        List<JsonNode> documents = asList(root.path("ops:world-patent-data")
                .path("exchange-documents")
                .path("exchange-document"));
        if (documents.isEmpty()) {
            return Optional.empty();
        }

        LocalDate applicationDate = null;
        LocalDate grantDate = null;
        List<String> countries = new ArrayList<>();

        for (JsonNode doc : documents) {
            JsonNode biblio = doc.path("bibliographic-data");

            if (applicationDate == null) {
                applicationDate = findDate(biblio.path("application-reference"), "epodoc");
            }

            String kind = doc.path("@kind").asText("");
            if (grantDate == null && kind.startsWith("B")) {
                grantDate = findDate(biblio.path("publication-reference"), null);
                if (grantDate != null) {
                    log.debug("Found grant date {} in {} document kind {}", grantDate, id, kind);
                }
            }

            addText(countries, doc.path("@country"));
            for (JsonNode country : biblio.path("designation-of-states").findValues("country")) {
                for (JsonNode c : asList(country)) {
                    addText(countries, c);
                }
            }
        }

        LocalDate expiry = expiryFrom(applicationDate);
        PatentStatus status;
        if (grantDate == null) {
            status = PatentStatus.UNKNOWN;
        } else if (expiry != null && expiry.isBefore(today())) {
            status = PatentStatus.EXPIRED;
        } else {
            status = PatentStatus.GRANTED;
        }

        return Optional.of(PatentRecord.builder()
                .identifier(id)
                .status(status)
                .expiryDate(expiry)
                .jurisdictions(Jurisdictions.normalized(id.jurisdiction(), countries))
                .source(PatentSource.EPO)
                .fetchedAt(now())
                .build());
    }

    // ── USPTO ────────────────────────────────────────────────────────────────

    /**
     * Convert one USPTO search result. The free-text status decides the state:
     * "expired" is expired, "abandoned"/"withdrawn"/"lapsed" is lapsed,
     * "patented"/"granted"/"issued" is granted unless the derived term has run out.
     */
    public PatentRecord fromUspto(CanonicalIdentifier id, UsptoSearchResponse.Result raw) {
        LocalDate expiry = expiryFrom(parseDate(raw.getFilingDate()));
        String statusText = emptyToNull(raw.getPatentStatus());
        String lower = statusText == null ? "" : statusText.toLowerCase(Locale.ROOT);

        PatentStatus status;
        String lapseReason = null;
        if (lower.contains("expired")) {
            status = PatentStatus.EXPIRED;
            lapseReason = statusText;
        } else if (lower.contains("abandoned") || lower.contains("withdrawn") || lower.contains("lapsed")) {
            status = PatentStatus.LAPSED;
            lapseReason = statusText;
        } else if (lower.contains("patented") || lower.contains("granted") || lower.contains("issued")) {
            status = expiry != null && expiry.isBefore(today()) ? PatentStatus.EXPIRED : PatentStatus.GRANTED;
        } else {
            status = PatentStatus.UNKNOWN;
        }

        return PatentRecord.builder()
                .identifier(id)
                .status(status)
                .expiryDate(expiry)
                .jurisdictions(Jurisdictions.of("US"))
                .lapseReason(lapseReason)
                .source(PatentSource.USPTO)
                .fetchedAt(now())
                .build();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    static LocalDate expiryFrom(LocalDate filingDate) {
        return filingDate == null ? null : filingDate.plusYears(UTILITY_TERM_YEARS);
    }

    /** Accepts 20001104, 2000-11-04, 2000-11-04T00:00:00Z, 11-04-2000 and 11/04/2000. */
    static LocalDate parseDate(String val) {
        if (val == null || val.isBlank()) return null;
        String v = val.trim();
        try {
            if (v.matches("\\d{8}")) return LocalDate.parse(v, BASIC);
            if (v.matches("\\d{4}-\\d{2}-\\d{2}.*")) return LocalDate.parse(v.substring(0, 10));
            if (v.matches("\\d{2}-\\d{2}-\\d{4}")) return LocalDate.parse(v, US_DASH);
            if (v.matches("\\d{2}/\\d{2}/\\d{4}")) return LocalDate.parse(v, US_SLASH);
        } catch (DateTimeParseException e) {
            log.warn("Could not parse date: {}", val);
            return null;
        }
        log.warn("Unrecognised date format: {}", val);
        return null;
    }

    /** Date of the first document-id (optionally of the given id type) under a reference node. */
    private LocalDate findDate(JsonNode reference, String idType) {
        for (JsonNode docId : asList(reference.path("document-id"))) {
            if (idType != null && !idType.equals(docId.path("@document-id-type").asText())) {
                continue;
            }
            JsonNode date = docId.path("date");
            String text = date.isObject() ? date.path("$").asText(null) : date.asText(null);
            LocalDate parsed = parseDate(text);
            if (parsed != null) return parsed;
        }
        return null;
    }

    /** OPS serialises single children as objects and repeated children as arrays. */
    private static List<JsonNode> asList(JsonNode node) {
        List<JsonNode> out = new ArrayList<>();
        if (node == null || node.isMissingNode() || node.isNull()) return out;
        if (node.isArray()) {
            node.forEach(out::add);
        } else {
            out.add(node);
        }
        return out;
    }

    private static void addText(List<String> target, JsonNode node) {
        String text = node.isObject() ? node.path("$").asText("") : node.asText("");
        if (!text.isBlank()) target.add(text);
    }

    private static String emptyToNull(String val) {
        return (val == null || val.isBlank()) ? null : val.trim();
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
