package com.patentintel.status.source;

import com.patentintel.status.config.PatentStatusProperties;
import com.patentintel.status.model.EpoTokenResponse;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * OAuth2 client-credentials bearer token for EPO Open Patent Services.
 *
 * OPS tokens live about 20 minutes; we keep one for the configured TTL (15 minutes by default)
 * and fetch a new one when it runs out or an API call is rejected.
 * Token endpoint 5xx/timeouts are retried by the "epoAuth" Resilience4j instance.
 */
@Component
@Slf4j
public class EpoTokenProvider implements UpstreamCredentials {

    private final RestTemplate restTemplate;
    private final PatentStatusProperties properties;
    private final Clock clock;

    private String token;
    private Instant tokenExpiry;

    public EpoTokenProvider(RestTemplate restTemplate, PatentStatusProperties properties, Clock clock) {
        this.restTemplate = restTemplate;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    @Retry(name = "epoAuth")
    public synchronized String current() {
        if (token != null && tokenExpiry != null && clock.instant().isBefore(tokenExpiry)) {
            return token;
        }
        return requestToken();
    }

    @Override
    @Retry(name = "epoAuth")
    public synchronized void refresh() {
        token = null;
        tokenExpiry = null;
        requestToken();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private String requestToken() {
        PatentStatusProperties.Epo epo = properties.getEpo();

        HttpHeaders headers = new HttpHeaders();
        headers.setBasicAuth(epo.getConsumerKey(), epo.getConsumerSecret());
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "client_credentials");

        EpoTokenResponse response;
        try {
            response = restTemplate.postForObject(
                    epo.getBaseUrl() + "/auth/accesstoken",
                    new HttpEntity<>(form, headers),
                    EpoTokenResponse.class);
        } catch (HttpClientErrorException e) {
            throw new CredentialRejectedException(
                    "EPO token request rejected: HTTP " + e.getStatusCode().value(), e);
        }

        if (response == null || response.getAccessToken() == null || response.getAccessToken().isBlank()) {
            throw new CredentialRejectedException("EPO token response carried no access_token", null);
        }

        token = response.getAccessToken();
        tokenExpiry = clock.instant().plus(effectiveTtl(response.getExpiresIn(), epo.getTokenTtl()));
        log.info("EPO OAuth2 token obtained, valid until {}", tokenExpiry);
        return token;
    }

    /** Never trust a token for longer than the upstream says it lives. */
    private static Duration effectiveTtl(String expiresIn, Duration configured) {
        if (expiresIn == null || expiresIn.isBlank()) return configured;
        try {
            Duration upstream = Duration.ofSeconds(Long.parseLong(expiresIn.trim()));
            return upstream.compareTo(configured) < 0 ? upstream : configured;
        } catch (NumberFormatException e) {
            return configured;
        }
    }
}
