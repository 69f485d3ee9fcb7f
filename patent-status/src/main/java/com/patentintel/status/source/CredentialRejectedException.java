package com.patentintel.status.source;

/** The upstream token endpoint refused the configured client credentials. */
public class CredentialRejectedException extends RuntimeException {

    public CredentialRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
