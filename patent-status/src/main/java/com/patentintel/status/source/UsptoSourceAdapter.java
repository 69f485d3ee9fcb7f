package com.patentintel.status.source;

import com.patentintel.status.config.PatentStatusProperties;
import com.patentintel.status.model.CanonicalIdentifier;
import com.patentintel.status.model.PatentSource;
import com.patentintel.status.model.UsptoSearchResponse;
import com.patentintel.status.service.PatentRecordMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.List;
import java.util.Optional;

/**
 * US patents via the USPTO application search API. Authenticates with a static API key.
 * An empty result list is an authoritative "not found".
 */
@Component
@Slf4j
public class UsptoSourceAdapter extends AbstractSourceAdapter {

    static final String API_KEY_HEADER = "X-Api-Key";

    private final RestTemplate restTemplate;
    private final PatentStatusProperties properties;
    private final PatentRecordMapper mapper;

    public UsptoSourceAdapter(RestTemplate restTemplate,
                              PatentStatusProperties properties,
                              PatentRecordMapper mapper) {
        super(new StaticApiKeyCredentials(properties.getUspto().getApiKey()));
        this.restTemplate = restTemplate;
        this.properties = properties;
        this.mapper = mapper;
    }

    @Override
    public PatentSource source() {
        return PatentSource.USPTO;
    }

    @Override
    protected FetchResult doFetch(CanonicalIdentifier id, String credential) {
        String url = UriComponentsBuilder
                .fromHttpUrl(properties.getUspto().getBaseUrl() + "/patent/application")
                .queryParam("searchText", id.number())
                .toUriString();

        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (!credential.isBlank()) {
            headers.set(API_KEY_HEADER, credential);
        }

        UsptoSearchResponse response = restTemplate.exchange(
                url, HttpMethod.GET, new HttpEntity<>(headers), UsptoSearchResponse.class).getBody();

        if (response == null || response.getResults() == null || response.getResults().isEmpty()) {
            return FetchResult.notFound("no USPTO results");
        }

        // searchText is a free-text search, hits for other numbers are not this patent
        Optional<UsptoSearchResponse.Result> match = response.getResults().stream()
                .filter(r -> id.number().equals(digits(r.getPatentNumber())))
                .findFirst();

        log.debug("USPTO returned {} result(s) for {}", response.getResults().size(), id);
        if (match.isEmpty()) {
            return FetchResult.notFound("no USPTO result for " + id);
        }
        return FetchResult.success(mapper.fromUspto(id, match.get()));
    }

    private static String digits(String val) {
        return val == null ? "" : val.replaceAll("\\D", "");
    }
}
