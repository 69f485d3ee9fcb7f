package com.patentintel.status.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Ordered, duplicate-free set of jurisdiction codes with a designated primary.
 * The primary is always the first code.
 */
public record Jurisdictions(String primary, List<String> codes) {

    private static final Map<String, String> ALIASES = Map.of(
            "EPO", "EP",
            "EUROPEAN PATENT OFFICE", "EP",
            "UNITED STATES", "US",
            "USA", "US",
            "DEUTSCHLAND", "DE",
            "GERMANY", "DE",
            "FRANCE", "FR",
            "FRANKREICH", "FR"
    );

    public Jurisdictions {
        if (primary == null || primary.isBlank()) {
            throw new IllegalArgumentException("primary jurisdiction is required");
        }
        Set<String> ordered = new LinkedHashSet<>();
        ordered.add(primary);
        if (codes != null) ordered.addAll(codes);
        codes = List.copyOf(ordered);
    }

    public static Jurisdictions of(String primary) {
        return new Jurisdictions(primary, List.of());
    }

    /**
     * Build from raw upstream values, mapping country names to codes and dropping duplicates.
     */
    public static Jurisdictions normalized(String primary, Collection<String> raw) {
        List<String> codes = new ArrayList<>();
        if (raw != null) {
            for (String value : raw) {
                if (value == null || value.isBlank()) continue;
                String upper = value.trim().toUpperCase(Locale.ROOT);
                codes.add(ALIASES.getOrDefault(upper, upper));
            }
        }
        return new Jurisdictions(normalizeCode(primary), codes);
    }

    public static String normalizeCode(String value) {
        String upper = value.trim().toUpperCase(Locale.ROOT);
        return ALIASES.getOrDefault(upper, upper);
    }
}
