package com.example.talentengine.model;

import com.example.talentengine.talent.EngineError;
import com.example.talentengine.talent.EngineException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Per-character store of ability specials: ability name -> (special name -> value).
 *
 * A depot is owned by one character and is not thread-safe; callers keep a single
 * writer per instance. Use {@link #copy()} to hand an independent depot to each live character.
 */
public class SkillDepot {
    private final Map<String, Map<String, Float>> abilitySpecials = new LinkedHashMap<>();
    private final Map<String, Set<String>> unlockedTalentParams = new LinkedHashMap<>();
    private final Map<TalentType, Integer> extraTalentLevels = new EnumMap<>(TalentType.class);

    public SkillDepot() {
    }

    /**
     * Register an ability with its default specials. An ability that is already present keeps
     * its current values; defaults only fill in specials it does not have yet.
     */
    public void addAbility(String abilityName, Map<String, ? extends Number> defaults) {
        if (abilityName == null) return;
        Map<String, Float> specials = abilitySpecials.computeIfAbsent(abilityName, k -> new LinkedHashMap<>());
        if (defaults != null) {
            for (Map.Entry<String, ? extends Number> e : defaults.entrySet()) {
                if (e.getKey() == null || e.getValue() == null) continue;
                specials.putIfAbsent(e.getKey(), e.getValue().floatValue());
            }
        }
    }

    public boolean hasAbility(String abilityName) {
        return abilitySpecials.containsKey(abilityName);
    }

    public boolean hasSpecial(String abilityName, String specialName) {
        Map<String, Float> specials = abilitySpecials.get(abilityName);
        return specials != null && specials.containsKey(specialName);
    }

    /**
     * @throws EngineException UNKNOWN_ABILITY or UNKNOWN_SPECIAL when the entry is missing
     */
    public float getSpecial(String abilityName, String specialName) {
        return specialsOrThrow(abilityName, specialName).get(specialName);
    }

    /**
     * Overwrite an existing special. Only existing entries can be written.
     *
     * @throws EngineException UNKNOWN_ABILITY or UNKNOWN_SPECIAL when the entry is missing
     */
    public void setSpecial(String abilityName, String specialName, float value) {
        specialsOrThrow(abilityName, specialName).put(specialName, value);
    }

    /**
     * Insert or overwrite a special on an existing ability. Used when restoring snapshots.
     */
    public void putSpecial(String abilityName, String specialName, float value) {
        Map<String, Float> specials = abilitySpecials.get(abilityName);
        if (specials == null) {
            throw new EngineException(EngineError.UNKNOWN_ABILITY, "unknown ability: " + abilityName);
        }
        specials.put(specialName, value);
    }

    private Map<String, Float> specialsOrThrow(String abilityName, String specialName) {
        Map<String, Float> specials = abilitySpecials.get(abilityName);
        if (specials == null) {
            throw new EngineException(EngineError.UNKNOWN_ABILITY, "unknown ability: " + abilityName);
        }
        if (!specials.containsKey(specialName)) {
            throw new EngineException(EngineError.UNKNOWN_SPECIAL,
                    "unknown special '" + specialName + "' on ability " + abilityName);
        }
        return specials;
    }

    /** Read-only view of the specials table. */
    public Map<String, Map<String, Float>> getAbilitySpecials() {
        Map<String, Map<String, Float>> view = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, Float>> e : abilitySpecials.entrySet()) {
            view.put(e.getKey(), Collections.unmodifiableMap(e.getValue()));
        }
        return Collections.unmodifiableMap(view);
    }

    public Set<String> getAbilityNames() {
        return Collections.unmodifiableSet(abilitySpecials.keySet());
    }

    // ========== Talent params ==========

    /**
     * @throws EngineException UNKNOWN_ABILITY when the ability is not in the depot
     */
    public void unlockTalentParam(String abilityName, String talentParam) {
        if (!abilitySpecials.containsKey(abilityName)) {
            throw new EngineException(EngineError.UNKNOWN_ABILITY, "unknown ability: " + abilityName);
        }
        unlockedTalentParams.computeIfAbsent(abilityName, k -> new LinkedHashSet<>()).add(talentParam);
    }

    public boolean isTalentParamUnlocked(String abilityName, String talentParam) {
        Set<String> params = unlockedTalentParams.get(abilityName);
        return params != null && params.contains(talentParam);
    }

    public Map<String, Set<String>> getUnlockedTalentParams() {
        Map<String, Set<String>> view = new LinkedHashMap<>();
        for (Map.Entry<String, Set<String>> e : unlockedTalentParams.entrySet()) {
            view.put(e.getKey(), Collections.unmodifiableSet(e.getValue()));
        }
        return Collections.unmodifiableMap(view);
    }

    // ========== Extra talent levels ==========

    public void addExtraTalentLevel(TalentType type, int amount) {
        if (type == null) return;
        extraTalentLevels.merge(type, amount, Integer::sum);
    }

    public int getExtraTalentLevel(TalentType type) {
        return extraTalentLevels.getOrDefault(type, 0);
    }

    public Map<TalentType, Integer> getExtraTalentLevels() {
        return Collections.unmodifiableMap(extraTalentLevels);
    }

    /**
     * Deep copy; the returned depot shares no mutable state with this one.
     */
    public SkillDepot copy() {
        SkillDepot out = new SkillDepot();
        for (Map.Entry<String, Map<String, Float>> e : abilitySpecials.entrySet()) {
            out.abilitySpecials.put(e.getKey(), new LinkedHashMap<>(e.getValue()));
        }
        for (Map.Entry<String, Set<String>> e : unlockedTalentParams.entrySet()) {
            out.unlockedTalentParams.put(e.getKey(), new LinkedHashSet<>(e.getValue()));
        }
        out.extraTalentLevels.putAll(extraTalentLevels);
        return out;
    }

    @Override
    public String toString() {
        return "SkillDepot{abilities=" + abilitySpecials.size() + ", extraLevels=" + extraTalentLevels + "}";
    }
}
