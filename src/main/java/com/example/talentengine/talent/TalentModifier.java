package com.example.talentengine.talent;

import com.example.talentengine.model.ParamList;
import com.example.talentengine.model.SkillDepot;

/**
 * One mutation of a skill depot, described by config.
 * Implementations are immutable; all state lives in the depot.
 */
public interface TalentModifier {

    TalentModifierType type();

    /**
     * Apply to the depot. On failure the depot must be left untouched.
     *
     * @throws EngineException when the target is missing or a reference cannot be resolved
     */
    void apply(SkillDepot depot, ParamList params);
}
