package com.patentintel.status.source;

import lombok.extern.slf4j.Slf4j;

/**
 * Fixed API key. There is nothing to refresh, so a rejected key stays rejected.
 */
@Slf4j
public class StaticApiKeyCredentials implements UpstreamCredentials {

    private final String apiKey;

    public StaticApiKeyCredentials(String apiKey) {
        this.apiKey = apiKey == null ? "" : apiKey;
    }

    @Override
    public String current() {
        return apiKey;
    }

    @Override
    public void refresh() {
        log.debug("Static API key cannot be refreshed");
    }
}
