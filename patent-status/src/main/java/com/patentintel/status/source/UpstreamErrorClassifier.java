package com.patentintel.status.source;

import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Maps upstream exceptions onto the adapter failure taxonomy.
 *
 * 404/400/410 are authoritative absence, 401/403 are credential problems,
 * everything else (429, 5xx, timeouts, unreadable bodies) is transient.
 */
public final class UpstreamErrorClassifier {

    private UpstreamErrorClassifier() {}

    public static FetchResult classify(Throwable e) {
        if (e instanceof CredentialRejectedException) {
            return FetchResult.authFailure(e.getMessage());
        }
        if (e instanceof HttpClientErrorException.NotFound
                || e instanceof HttpClientErrorException.BadRequest
                || e instanceof HttpClientErrorException.Gone) {
            return FetchResult.notFound("HTTP " + status(e));
        }
        if (e instanceof HttpClientErrorException.Unauthorized
                || e instanceof HttpClientErrorException.Forbidden) {
            return FetchResult.authFailure("HTTP " + status(e));
        }
        if (e instanceof HttpClientErrorException.TooManyRequests) {
            return FetchResult.transientFailure("rate limited (HTTP 429)");
        }
        if (e instanceof HttpServerErrorException) {
            return FetchResult.transientFailure("HTTP " + status(e));
        }
        if (e instanceof ResourceAccessException) {
            // connect/read timeouts and I/O errors
            return FetchResult.transientFailure("I/O: " + e.getMessage());
        }
        if (e instanceof RestClientResponseException) {
            return FetchResult.transientFailure("HTTP " + status(e));
        }
        return FetchResult.transientFailure(e.getClass().getSimpleName() + ": " + e.getMessage());
    }

    private static int status(Throwable e) {
        return ((RestClientResponseException) e).getStatusCode().value();
    }
}
