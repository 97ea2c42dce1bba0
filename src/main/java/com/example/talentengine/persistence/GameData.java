package com.example.talentengine.persistence;

import com.example.talentengine.avatar.AvatarDefinition;
import com.example.talentengine.model.AbilityConfig;
import com.example.talentengine.talent.TalentData;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Everything loaded from the data resources, keyed for lookup.
 * Ability configs keep load order so the hash index sees them in file order.
 */
public record GameData(
    Map<String, AbilityConfig> abilities,
    Map<Integer, TalentData> talents,
    Map<Integer, AvatarDefinition> avatars
) {
    public GameData {
        abilities = abilities == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(abilities));
        talents = talents == null ? Collections.emptyMap() : Collections.unmodifiableMap(new TreeMap<>(talents));
        avatars = avatars == null ? Collections.emptyMap() : Collections.unmodifiableMap(new TreeMap<>(avatars));
    }
}
