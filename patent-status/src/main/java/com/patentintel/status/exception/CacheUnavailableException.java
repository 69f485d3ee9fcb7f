package com.patentintel.status.exception;

/**
 * The cache store could not be read or written. Never surfaced to callers;
 * lookups degrade around it.
 */
public class CacheUnavailableException extends RuntimeException {

    public CacheUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
