package com.patentintel.status.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

/**
 * Raw DTO matching the USPTO application search JSON.
 * Kept separate from the domain model to isolate API coupling.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class UsptoSearchResponse {

    private Integer recordTotalQuantity;

    private List<Result> results;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Result {
        private String patentNumber;
        private String patentStatus;
        private String filingDate;
        private String grantDate;
        private String inventionTitle;
    }
}
