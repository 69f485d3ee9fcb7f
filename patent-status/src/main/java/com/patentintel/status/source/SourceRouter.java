package com.patentintel.status.source;

import com.patentintel.status.model.CanonicalIdentifier;
import com.patentintel.status.model.PatentSource;

import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Jurisdiction dispatch table: each jurisdiction maps to exactly one adapter.
 * There is no cross-source fallback.
 */
public class SourceRouter {

    private final Map<String, SourceAdapter> byJurisdiction;

    public SourceRouter(Map<String, PatentSource> routing, Collection<? extends SourceAdapter> adapters) {
        Map<PatentSource, SourceAdapter> bySource = new EnumMap<>(PatentSource.class);
        for (SourceAdapter adapter : adapters) {
            bySource.put(adapter.source(), adapter);
        }

        Map<String, SourceAdapter> table = new HashMap<>();
        routing.forEach((jurisdiction, source) -> {
            SourceAdapter adapter = bySource.get(source);
            if (adapter == null) {
                throw new IllegalStateException("No adapter registered for " + source
                        + " (routed from " + jurisdiction + ")");
            }
            table.put(jurisdiction.toUpperCase(), adapter);
        });
        this.byJurisdiction = Map.copyOf(table);
    }

    public SourceAdapter adapterFor(CanonicalIdentifier id) {
        SourceAdapter adapter = byJurisdiction.get(id.jurisdiction());
        if (adapter == null) {
            throw new IllegalStateException("No source routed for jurisdiction " + id.jurisdiction());
        }
        return adapter;
    }
}
