package com.patentintel.status.exception;

import com.patentintel.status.model.PatentSource;

/** Transient upstream failure that persisted through the retry, with no cached data to fall back on. */
public class UpstreamUnavailableException extends PatentLookupException {

    private final PatentSource source;

    public UpstreamUnavailableException(PatentSource source, String patent, String detail) {
        super("UPSTREAM_UNAVAILABLE", 503,
                source + " unavailable while looking up " + patent + (detail != null ? ": " + detail : ""));
        this.source = source;
    }

    public PatentSource source() { return source; }
}
