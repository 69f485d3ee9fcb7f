package com.patentintel.status.model;

import java.util.Locale;

/**
 * Contracted monthly quota class of a client.
 * Enterprise quotas are contractual and not enforced numerically.
 */
public enum Tier {
    FREE,
    STARTER,
    PRO,
    ENTERPRISE;

    public boolean isUnlimited() {
        return this == ENTERPRISE;
    }

    /**
     * Resolve the subscription header value. Missing or unknown values fall back to FREE;
     * "basic" is the marketplace name for STARTER.
     */
    public static Tier fromHeader(String value) {
        if (value == null || value.isBlank()) return FREE;
        String v = value.trim().toUpperCase(Locale.ROOT);
        if (v.equals("BASIC")) return STARTER;
        for (Tier tier : values()) {
            if (tier.name().equals(v)) return tier;
        }
        return FREE;
    }
}
