package com.patentintel.status.source;

import com.patentintel.status.model.CanonicalIdentifier;
import com.patentintel.status.model.PatentSource;

/**
 * Fetches legal-status data for one identifier from one patent office.
 * Implementations never throw for upstream errors; they report them as a {@link FetchResult}.
 */
public interface SourceAdapter {

    PatentSource source();

    FetchResult fetch(CanonicalIdentifier id);
}
