package com.example.talentengine.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * One loaded ability configuration: its name, default specials and the names of the
 * modifiers it declares. Modifier bodies are not needed by this engine, only their keys.
 */
public record AbilityConfig(
    String abilityName,
    Map<String, Double> abilitySpecials,
    Set<String> modifierNames
) {
    public AbilityConfig {
        if (abilityName == null || abilityName.isBlank()) {
            throw new ConfigException("abilityName is required");
        }
        abilitySpecials = abilitySpecials == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(abilitySpecials));
        modifierNames = modifierNames == null
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(modifierNames));
    }

    public AbilityConfig(String abilityName, Map<String, Double> abilitySpecials) {
        this(abilityName, abilitySpecials, null);
    }
}
