package com.example.talentengine.model;

/**
 * Skill slots that can receive extra talent levels.
 */
public enum TalentType {
    NORMAL_ATTACK("NormalAttack"),
    SKILL("Skill"),
    BURST("Burst");

    private final String configName;

    TalentType(String configName) {
        this.configName = configName;
    }

    public String getConfigName() { return configName; }

    /**
     * Accepts the config spelling ("NormalAttack") or the enum name ("NORMAL_ATTACK").
     * Returns null for anything else.
     */
    public static TalentType fromString(String s) {
        if (s == null) return null;
        String trimmed = s.trim();
        for (TalentType t : values()) {
            if (t.configName.equalsIgnoreCase(trimmed) || t.name().equalsIgnoreCase(trimmed)) {
                return t;
            }
        }
        return null;
    }
}
