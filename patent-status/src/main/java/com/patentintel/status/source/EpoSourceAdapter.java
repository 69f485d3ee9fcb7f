package com.patentintel.status.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.patentintel.status.config.PatentStatusProperties;
import com.patentintel.status.model.CanonicalIdentifier;
import com.patentintel.status.model.PatentSource;
import com.patentintel.status.service.PatentRecordMapper;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * European patents via EPO Open Patent Services (published-data, epodoc format).
 */
@Component
public class EpoSourceAdapter extends AbstractSourceAdapter {

    private final RestTemplate restTemplate;
    private final PatentStatusProperties properties;
    private final PatentRecordMapper mapper;
    private final ObjectMapper objectMapper;

    public EpoSourceAdapter(RestTemplate restTemplate,
                            PatentStatusProperties properties,
                            EpoTokenProvider tokenProvider,
                            PatentRecordMapper mapper,
                            ObjectMapper objectMapper) {
        super(tokenProvider);
        this.restTemplate = restTemplate;
        this.properties = properties;
        this.mapper = mapper;
        this.objectMapper = objectMapper;
    }

    @Override
    public PatentSource source() {
        return PatentSource.EPO;
    }

    @Override
    protected FetchResult doFetch(CanonicalIdentifier id, String credential) {
        String url = properties.getEpo().getBaseUrl()
                + "/rest-services/published-data/publication/epodoc/" + id.key();

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(credential);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        ResponseEntity<String> response = restTemplate.exchange(
                url, HttpMethod.GET, new HttpEntity<>(headers), String.class);

        String body = response.getBody();
        if (body == null || body.isBlank()) {
            return FetchResult.transientFailure("EPO returned an empty body");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new RestClientException("EPO JSON parse failed for " + id, e);
        }

        return mapper.fromEpo(id, root)
                .map(FetchResult::success)
                .orElseGet(() -> FetchResult.notFound("no exchange documents"));
    }
}
