package com.patentintel.status.exception;

/**
 * Base for every per-request failure of a lookup. Carries a stable error code and the
 * HTTP-style outcome code that is written to the request log.
 */
public abstract class PatentLookupException extends RuntimeException {

    private final String errorCode;
    private final int outcomeCode;

    protected PatentLookupException(String errorCode, int outcomeCode, String message) {
        super(message);
        this.errorCode = errorCode;
        this.outcomeCode = outcomeCode;
    }

    protected PatentLookupException(String errorCode, int outcomeCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.outcomeCode = outcomeCode;
    }

    public String errorCode() { return errorCode; }
    public int outcomeCode() { return outcomeCode; }
}
