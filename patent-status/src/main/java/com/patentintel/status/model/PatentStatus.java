package com.patentintel.status.model;

public enum PatentStatus {
    GRANTED,
    EXPIRED,
    LAPSED,
    UNKNOWN;

    /** Expired and lapsed records must carry an expiry date or a lapse reason. */
    public boolean isInactive() {
        return this == EXPIRED || this == LAPSED;
    }
}
