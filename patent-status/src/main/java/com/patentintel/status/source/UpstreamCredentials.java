package com.patentintel.status.source;

/** Credential presented to an upstream on every call. */
public interface UpstreamCredentials {

    String current();

    /** Discard the current credential and acquire a new one where the upstream supports it. */
    void refresh();
}
