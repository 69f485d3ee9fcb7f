package com.patentintel.status.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.LocalDate;

/**
 * Monthly request counter for one client key.
 * Guarded by the rate limiter; never shared outside it.
 */
@Data
@AllArgsConstructor
public class RateLimitWindow {

    private final String clientKey;
    private Tier tier;
    private LocalDate windowStart;  // first day of the counted month (UTC)
    private int requestCount;
}
