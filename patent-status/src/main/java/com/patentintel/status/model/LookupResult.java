package com.patentintel.status.model;

public record LookupResult(PatentRecord record, LookupPath path) {

    /** True whenever the cache answered, including a stale entry that was refreshed or served degraded. */
    public boolean cacheHit() {
        return path != LookupPath.MISS;
    }

    /** True only when a stale entry was served because the refresh failed. */
    public boolean degraded() {
        return path == LookupPath.STALE_DEGRADED;
    }
}
