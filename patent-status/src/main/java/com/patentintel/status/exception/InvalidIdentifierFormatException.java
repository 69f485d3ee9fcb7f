package com.patentintel.status.exception;

public class InvalidIdentifierFormatException extends PatentLookupException {

    private final String rawIdentifier;

    public InvalidIdentifierFormatException(String rawIdentifier, String reason) {
        super("INVALID_IDENTIFIER_FORMAT", 400,
                "Patent '" + rawIdentifier + "' has invalid format: " + reason
                        + ". Expected e.g. EP1234567 or US7654321");
        this.rawIdentifier = rawIdentifier;
    }

    public String rawIdentifier() { return rawIdentifier; }
}
