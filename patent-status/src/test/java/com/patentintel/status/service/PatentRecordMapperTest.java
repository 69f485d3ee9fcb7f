package com.patentintel.status.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.patentintel.status.model.CanonicalIdentifier;
import com.patentintel.status.model.PatentRecord;
import com.patentintel.status.model.PatentStatus;
import com.patentintel.status.model.UsptoSearchResponse;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class PatentRecordMapperTest {

    private static final Instant NOW = Instant.parse("2026-10-18T12:00:00Z");

    private final PatentRecordMapper mapper = new PatentRecordMapper(Clock.fixed(NOW, ZoneOffset.UTC));
    private final ObjectMapper json = new ObjectMapper();

    @Test
    void epoWithoutGrantEvidenceIsUnknown() throws Exception {
        CanonicalIdentifier id = CanonicalIdentifier.of("EP", "3000000");
        var root = json.readTree("""
                {"ops:world-patent-data": {"exchange-documents": {"exchange-document":
                  {"@country": "EP", "@kind": "A1", "bibliographic-data": {
                    "application-reference": {"document-id":
                      {"@document-id-type": "epodoc", "date": {"$": "20150601"}}}}}}}}
                """);

        PatentRecord record = mapper.fromEpo(id, root).orElseThrow();

        assertThat(record.status()).isEqualTo(PatentStatus.UNKNOWN);
        assertThat(record.expiryDate()).isEqualTo(LocalDate.of(2035, 6, 1));
        assertThat(record.fetchedAt()).isEqualTo(NOW);
    }

    @Test
    void epoGrantedAndInTermIsGranted() throws Exception {
        CanonicalIdentifier id = CanonicalIdentifier.of("EP", "3000000");
        var root = json.readTree("""
                {"ops:world-patent-data": {"exchange-documents": {"exchange-document":
                  {"@country": "EP", "@kind": "B1", "bibliographic-data": {
                    "publication-reference": {"document-id": {"date": {"$": "20190102"}}},
                    "application-reference": {"document-id":
                      {"@document-id-type": "epodoc", "date": {"$": "20150601"}}}}}}}}
                """);

        assertThat(mapper.fromEpo(id, root).orElseThrow().status()).isEqualTo(PatentStatus.GRANTED);
    }

    @Test
    void epoWithoutDocumentsIsEmpty() throws Exception {
        Optional<PatentRecord> record = mapper.fromEpo(CanonicalIdentifier.of("EP", "3000000"),
                json.readTree("{\"ops:world-patent-data\": {}}"));

        assertThat(record).isEmpty();
    }

    @Test
    void usptoStatusTextDecidesTheState() {
        CanonicalIdentifier id = CanonicalIdentifier.of("US", "7654321");

        assertThat(uspto(id, "Patent Expired Due to NonPayment of Maintenance Fees", "2005-01-01").status())
                .isEqualTo(PatentStatus.EXPIRED);
        assertThat(uspto(id, "Abandoned -- Failure to Respond to an Office Action", "2012-01-01").status())
                .isEqualTo(PatentStatus.LAPSED);
        assertThat(uspto(id, "Patented Case", "2012-01-01").status()).isEqualTo(PatentStatus.GRANTED);
        assertThat(uspto(id, "Patented Case", "2001-01-01").status()).isEqualTo(PatentStatus.EXPIRED);
        assertThat(uspto(id, "Docketed New Case - Ready for Examination", "2024-01-01").status())
                .isEqualTo(PatentStatus.UNKNOWN);
    }

    @Test
    void lapsedRecordCarriesTheStatusTextAsReason() {
        PatentRecord record = uspto(CanonicalIdentifier.of("US", "7654321"), "Abandoned", null);

        assertThat(record.lapseReason()).isEqualTo("Abandoned");
        assertThat(record.expiryDate()).isNull();
    }

    @Test
    void parsesTheUpstreamDateFormats() {
        LocalDate expected = LocalDate.of(2000, 11, 4);

        assertThat(PatentRecordMapper.parseDate("20001104")).isEqualTo(expected);
        assertThat(PatentRecordMapper.parseDate("2000-11-04")).isEqualTo(expected);
        assertThat(PatentRecordMapper.parseDate("2000-11-04T00:00:00Z")).isEqualTo(expected);
        assertThat(PatentRecordMapper.parseDate("11-04-2000")).isEqualTo(expected);
        assertThat(PatentRecordMapper.parseDate("11/04/2000")).isEqualTo(expected);
        assertThat(PatentRecordMapper.parseDate("04.11.2000")).isNull();
        assertThat(PatentRecordMapper.parseDate("")).isNull();
    }

    private PatentRecord uspto(CanonicalIdentifier id, String status, String filingDate) {
        UsptoSearchResponse.Result raw = new UsptoSearchResponse.Result();
        raw.setPatentNumber(id.number());
        raw.setPatentStatus(status);
        raw.setFilingDate(filingDate);
        return mapper.fromUspto(id, raw);
    }
}
