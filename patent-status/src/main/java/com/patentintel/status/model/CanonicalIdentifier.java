package com.patentintel.status.model;

/**
 * Validated patent identifier: two-letter jurisdiction, numeric document number
 * and an optional kind code (e.g. "B1").
 *
 * The cache key ignores the kind code so "EP1234567" and "EP1234567B1" share an entry.
 */
public record CanonicalIdentifier(String jurisdiction, String number, String kind) {

    public CanonicalIdentifier {
        if (jurisdiction == null || jurisdiction.length() != 2) {
            throw new IllegalArgumentException("jurisdiction must be a two-letter code");
        }
        if (number == null || number.isEmpty()) {
            throw new IllegalArgumentException("number is required");
        }
        if (kind != null && kind.isEmpty()) {
            kind = null;
        }
    }

    public static CanonicalIdentifier of(String jurisdiction, String number) {
        return new CanonicalIdentifier(jurisdiction, number, null);
    }

    /** Storage key, e.g. "EP1234567". */
    public String key() {
        return jurisdiction + number;
    }

    /** Display form, e.g. "EP1234567B1". Feeding it back through the normalizer yields an equal identifier. */
    public String display() {
        return kind == null ? key() : key() + kind;
    }

    @Override
    public String toString() {
        return display();
    }
}
