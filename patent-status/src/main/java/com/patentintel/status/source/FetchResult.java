package com.patentintel.status.source;

import com.patentintel.status.model.PatentRecord;

/**
 * Uniform outcome of one adapter fetch, whatever shape the upstream error had.
 */
public record FetchResult(Outcome outcome, PatentRecord record, String detail) {

    public enum Outcome {
        SUCCESS,
        /** Authoritative "this identifier does not exist". */
        NOT_FOUND,
        /** Rate limited, 5xx or timed out. Retry policy belongs to the caller. */
        TRANSIENT_FAILURE,
        /** Credential invalid or expired, even after one refresh. */
        AUTH_FAILURE
    }

    public static FetchResult success(PatentRecord record) {
        return new FetchResult(Outcome.SUCCESS, record, null);
    }

    public static FetchResult notFound(String detail) {
        return new FetchResult(Outcome.NOT_FOUND, null, detail);
    }

    public static FetchResult transientFailure(String detail) {
        return new FetchResult(Outcome.TRANSIENT_FAILURE, null, detail);
    }

    public static FetchResult authFailure(String detail) {
        return new FetchResult(Outcome.AUTH_FAILURE, null, detail);
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }

    public boolean isTransient() {
        return outcome == Outcome.TRANSIENT_FAILURE;
    }
}
