package com.patentintel.status.model;

/** Lookup response together with the quota state of the admitted request. */
public record StatusLookupResponse(PatentStatusResponse body, RateLimitStatus rateLimit) {}
