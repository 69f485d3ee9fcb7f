package com.patentintel.status.exception;

import com.patentintel.status.model.PatentSource;

/** The upstream authoritatively reported that the identifier does not exist. */
public class PatentNotFoundException extends PatentLookupException {

    public PatentNotFoundException(String patent, PatentSource source) {
        super("NOT_FOUND_UPSTREAM", 404, "Patent " + patent + " not found at " + source);
    }
}
