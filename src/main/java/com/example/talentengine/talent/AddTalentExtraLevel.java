package com.example.talentengine.talent;

import com.example.talentengine.model.ParamList;
import com.example.talentengine.model.SkillDepot;
import com.example.talentengine.model.TalentType;

/**
 * Grants extra levels to one skill slot (constellation-style "+3 to Burst").
 * The resolved amount is truncated toward zero.
 */
public record AddTalentExtraLevel(
    TalentType talentType,
    ParamReference extraLevel
) implements TalentModifier {

    public AddTalentExtraLevel {
        extraLevel = extraLevel == null ? ParamReference.ABSENT : extraLevel;
    }

    @Override
    public TalentModifierType type() {
        return TalentModifierType.ADD_TALENT_EXTRA_LEVEL;
    }

    @Override
    public void apply(SkillDepot depot, ParamList params) {
        Float amount = ParamReferenceResolver.resolve(extraLevel, params);
        if (amount == null) return;
        depot.addExtraTalentLevel(talentType, (int) amount.floatValue());
    }
}
