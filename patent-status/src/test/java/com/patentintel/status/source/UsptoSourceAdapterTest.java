package com.patentintel.status.source;

import com.patentintel.status.config.PatentStatusProperties;
import com.patentintel.status.model.CanonicalIdentifier;
import com.patentintel.status.model.PatentSource;
import com.patentintel.status.model.PatentStatus;
import com.patentintel.status.service.PatentRecordMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class UsptoSourceAdapterTest {

    private static final String SEARCH_URL = "http://uspto.test/ds-api/patent/application?searchText=10000000";

    private MockRestServiceServer server;
    private UsptoSourceAdapter adapter;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();

        PatentStatusProperties properties = new PatentStatusProperties();
        properties.getUspto().setBaseUrl("http://uspto.test/ds-api");
        properties.getUspto().setApiKey("uspto-key");

        Clock clock = Clock.fixed(Instant.parse("2026-10-18T12:00:00Z"), ZoneOffset.UTC);
        adapter = new UsptoSourceAdapter(restTemplate, properties, new PatentRecordMapper(clock));
    }

    @Test
    void mapsAPatentedCase() {
        server.expect(requestTo(SEARCH_URL))
                .andExpect(header("X-Api-Key", "uspto-key"))
                .andRespond(withSuccess("""
                        {"recordTotalQuantity": 2, "results": [
                          {"patentNumber": "9999999", "patentStatus": "Abandoned", "filingDate": "2014-01-01"},
                          {"patentNumber": "10,000,000", "patentStatus": "Patented Case", "filingDate": "2015-03-11"}
                        ]}
                        """, MediaType.APPLICATION_JSON));

        FetchResult result = adapter.fetch(CanonicalIdentifier.of("US", "10000000"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.record().status()).isEqualTo(PatentStatus.GRANTED);
        assertThat(result.record().expiryDate()).isEqualTo(LocalDate.of(2035, 3, 11));
        assertThat(result.record().source()).isEqualTo(PatentSource.USPTO);
        assertThat(result.record().jurisdictions().codes()).containsExactly("US");
        server.verify();
    }

    @Test
    void unrelatedHitIsNotFound() {
        server.expect(requestTo(SEARCH_URL))
                .andRespond(withSuccess("""
                        {"recordTotalQuantity": 1, "results": [
                          {"patentNumber": "7654321", "patentStatus": "Abandoned"}
                        ]}
                        """, MediaType.APPLICATION_JSON));

        FetchResult result = adapter.fetch(CanonicalIdentifier.of("US", "10000000"));

        assertThat(result.outcome()).isEqualTo(FetchResult.Outcome.NOT_FOUND);
        assertThat(result.record()).isNull();
        server.verify();
    }

    @Test
    void emptyResultsAreNotFound() {
        server.expect(requestTo(SEARCH_URL))
                .andRespond(withSuccess("{\"recordTotalQuantity\": 0, \"results\": []}", MediaType.APPLICATION_JSON));

        assertThat(adapter.fetch(CanonicalIdentifier.of("US", "10000000")).outcome())
                .isEqualTo(FetchResult.Outcome.NOT_FOUND);
    }

    @Test
    void notFoundStatusIsNotFound() {
        server.expect(requestTo(SEARCH_URL)).andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThat(adapter.fetch(CanonicalIdentifier.of("US", "10000000")).outcome())
                .isEqualTo(FetchResult.Outcome.NOT_FOUND);
    }

    @Test
    void serviceUnavailableIsTransient() {
        server.expect(requestTo(SEARCH_URL)).andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThat(adapter.fetch(CanonicalIdentifier.of("US", "10000000")).isTransient()).isTrue();
        server.verify();
    }

    @Test
    void tooManyRequestsIsTransient() {
        server.expect(requestTo(SEARCH_URL)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        assertThat(adapter.fetch(CanonicalIdentifier.of("US", "10000000")).isTransient()).isTrue();
    }

    @Test
    void rejectedKeyIsRetriedOnceThenAuthFailure() {
        server.expect(ExpectedCount.twice(), requestTo(SEARCH_URL)).andRespond(withStatus(HttpStatus.FORBIDDEN));

        assertThat(adapter.fetch(CanonicalIdentifier.of("US", "10000000")).outcome())
                .isEqualTo(FetchResult.Outcome.AUTH_FAILURE);
        server.verify();
    }
}
