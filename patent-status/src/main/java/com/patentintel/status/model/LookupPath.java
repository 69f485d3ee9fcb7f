package com.patentintel.status.model;

/** Which branch of the lookup state machine produced a result. */
public enum LookupPath {
    HIT_FRESH,
    MISS,
    STALE_REFRESHED,
    STALE_DEGRADED
}
