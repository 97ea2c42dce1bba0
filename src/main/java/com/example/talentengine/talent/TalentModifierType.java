package com.example.talentengine.talent;

/**
 * Kind tag of a talent modifier record ({@code kind} field in config).
 */
public enum TalentModifierType {
    MODIFY_ABILITY("ModifyAbility"),
    ADD_TALENT_EXTRA_LEVEL("AddTalentExtraLevel"),
    UNLOCK_TALENT_PARAM("UnlockTalentParam");

    private final String configName;

    TalentModifierType(String configName) {
        this.configName = configName;
    }

    public String getConfigName() { return configName; }

    public static TalentModifierType fromString(String s) {
        if (s == null) return null;
        String trimmed = s.trim();
        for (TalentModifierType t : values()) {
            if (t.configName.equalsIgnoreCase(trimmed) || t.name().equalsIgnoreCase(trimmed)) {
                return t;
            }
        }
        return null;
    }
}
