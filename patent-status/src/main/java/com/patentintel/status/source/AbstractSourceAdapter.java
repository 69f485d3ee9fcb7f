package com.patentintel.status.source;

import com.patentintel.status.model.CanonicalIdentifier;
import lombok.extern.slf4j.Slf4j;

/**
 * Shared fetch flow: call upstream with the current credential, translate errors,
 * and on a credential rejection refresh it and try exactly once more.
 * Transient failures are returned as-is; retrying them is the orchestrator's job.
 */
@Slf4j
public abstract class AbstractSourceAdapter implements SourceAdapter {

    private final UpstreamCredentials credentials;

    protected AbstractSourceAdapter(UpstreamCredentials credentials) {
        this.credentials = credentials;
    }

    @Override
    public FetchResult fetch(CanonicalIdentifier id) {
        FetchResult result = attempt(id);
        if (result.outcome() != FetchResult.Outcome.AUTH_FAILURE) {
            return result;
        }

        log.info("{} rejected credentials for {} ({}), refreshing and retrying once",
                source(), id, result.detail());
        try {
            credentials.refresh();
        } catch (RuntimeException e) {
            log.warn("{} credential refresh failed: {}", source(), e.getMessage());
            return UpstreamErrorClassifier.classify(e);
        }
        return attempt(id);
    }

    /**
     * Perform one upstream call. Return {@link FetchResult#success} or {@link FetchResult#notFound};
     * throw for HTTP and I/O errors.
     */
    protected abstract FetchResult doFetch(CanonicalIdentifier id, String credential);

    private FetchResult attempt(CanonicalIdentifier id) {
        try {
            log.debug("Calling {} for {}", source(), id);
            return doFetch(id, credentials.current());
        } catch (RuntimeException e) {
            FetchResult failure = UpstreamErrorClassifier.classify(e);
            if (failure.outcome() == FetchResult.Outcome.NOT_FOUND) {
                log.debug("{} has no record of {} ({})", source(), id, failure.detail());
            } else {
                log.warn("{} call failed for {}: {} ({})", source(), id, failure.outcome(), failure.detail());
            }
            return failure;
        }
    }
}
