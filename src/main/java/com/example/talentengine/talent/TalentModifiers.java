package com.example.talentengine.talent;

import com.example.talentengine.model.ConfigException;
import com.example.talentengine.model.TalentType;

import java.util.Map;

/**
 * Builds {@link TalentModifier} variants from raw config records.
 */
public final class TalentModifiers {

    private TalentModifiers() {
    }

    /**
     * @param record a map with a {@code kind} tag plus the variant's fields
     * @throws ConfigException for an unknown kind or a missing required field
     */
    public static TalentModifier fromConfig(Map<String, Object> record) {
        if (record == null) throw new ConfigException("null modifier record");
        String kindStr = str(record.get("kind"));
        TalentModifierType type = TalentModifierType.fromString(kindStr);
        if (type == null) {
            throw new ConfigException("unknown talent modifier kind: " + kindStr);
        }
        return switch (type) {
            case MODIFY_ABILITY -> new ModifyAbility(
                    required(record, "abilityName"),
                    required(record, "paramSpecial"),
                    ParamReference.fromConfig(record.get("paramDelta")),
                    ParamReference.fromConfig(record.get("paramRatio")));
            case ADD_TALENT_EXTRA_LEVEL -> {
                String typeStr = required(record, "talentType");
                TalentType talentType = TalentType.fromString(typeStr);
                if (talentType == null) {
                    throw new ConfigException("unknown talentType: " + typeStr);
                }
                yield new AddTalentExtraLevel(talentType, ParamReference.fromConfig(record.get("extraLevel")));
            }
            case UNLOCK_TALENT_PARAM -> new UnlockTalentParam(
                    required(record, "abilityName"),
                    required(record, "talentParam"));
        };
    }

    private static String required(Map<String, Object> record, String key) {
        String v = str(record.get(key));
        if (v == null || v.isEmpty()) {
            throw new ConfigException("missing required field '" + key + "' in " + record.get("kind") + " record");
        }
        return v;
    }

    private static String str(Object o) {
        return o == null ? null : String.valueOf(o);
    }
}
