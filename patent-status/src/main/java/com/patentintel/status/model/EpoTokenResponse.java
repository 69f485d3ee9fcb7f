package com.patentintel.status.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/** OAuth2 client-credentials response from the EPO OPS token endpoint. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class EpoTokenResponse {

    @JsonProperty("access_token")
    private String accessToken;

    /** Seconds, sent as a string by OPS. */
    @JsonProperty("expires_in")
    private String expiresIn;
}
