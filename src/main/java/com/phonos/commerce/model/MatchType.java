package com.phonos.commerce.model;

/**
 * How closely a store's offer matches the researched product. Declaration order is the
 * ranking tier used when presenting options.
 */
public enum MatchType {
    EXACT,
    ALTERNATIVE,
    NONE;

    public static MatchType fromAnalysis(String raw) {
        if (raw == null) {
            return NONE;
        }
        switch (raw.trim().toLowerCase()) {
            case "exact":
                return EXACT;
            case "close":
            case "alternative":
                return ALTERNATIVE;
            default:
                return NONE;
        }
    }

    public String wireName() {
        return name().toLowerCase();
    }
}
