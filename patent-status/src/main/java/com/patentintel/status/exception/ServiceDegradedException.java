package com.patentintel.status.exception;

import com.patentintel.status.model.PatentSource;

/** Upstream kept rejecting our credentials after a refresh. */
public class ServiceDegradedException extends PatentLookupException {

    public ServiceDegradedException(PatentSource source, String patent, String detail) {
        super("SERVICE_DEGRADED", 503,
                source + " rejected credentials while looking up " + patent + (detail != null ? ": " + detail : ""));
    }
}
