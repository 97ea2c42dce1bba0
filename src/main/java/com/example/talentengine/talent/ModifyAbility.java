package com.example.talentengine.talent;

import com.example.talentengine.model.ParamList;
import com.example.talentengine.model.SkillDepot;

/**
 * Adds a delta to one ability special, then multiplies it by a ratio.
 *
 * Both fields may be literal, indexed or absent. A literal zero ratio is skipped, while an
 * indexed ratio that resolves to zero is applied. The result overwrites the special, so
 * applying the same modifier twice compounds.
 */
public record ModifyAbility(
    String abilityName,
    String paramSpecial,
    ParamReference paramDelta,
    ParamReference paramRatio
) implements TalentModifier {

    public ModifyAbility {
        paramDelta = paramDelta == null ? ParamReference.ABSENT : paramDelta;
        paramRatio = paramRatio == null ? ParamReference.ABSENT : paramRatio;
    }

    @Override
    public TalentModifierType type() {
        return TalentModifierType.MODIFY_ABILITY;
    }

    @Override
    public void apply(SkillDepot depot, ParamList params) {
        float special = depot.getSpecial(abilityName, paramSpecial);

        Float delta = ParamReferenceResolver.resolve(paramDelta, params);
        if (delta != null) {
            special += delta;
        }

        Float ratio = ParamReferenceResolver.resolveRatio(paramRatio, params);
        if (ratio != null) {
            special *= ratio;
        }

        depot.setSpecial(abilityName, paramSpecial, special);
    }
}
