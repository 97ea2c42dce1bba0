package com.example.talentengine.predicate;

/**
 * Kind tag of a predicate record.
 */
public enum PredicateType {
    BY_TARGET_ALTITUDE("ByTargetAltitude"),
    BY_TARGET_HP_RATIO("ByTargetHPRatio");

    private final String configName;

    PredicateType(String configName) {
        this.configName = configName;
    }

    public String getConfigName() { return configName; }

    public static PredicateType fromString(String s) {
        if (s == null) return null;
        String trimmed = s.trim();
        for (PredicateType t : values()) {
            if (t.configName.equalsIgnoreCase(trimmed) || t.name().equalsIgnoreCase(trimmed)) {
                return t;
            }
        }
        return null;
    }
}
