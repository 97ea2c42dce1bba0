package com.example.talentengine.talent;

import com.example.talentengine.model.ParamList;
import com.example.talentengine.model.SkillDepot;

/**
 * Marks a named talent parameter of an ability as unlocked.
 */
public record UnlockTalentParam(
    String abilityName,
    String talentParam
) implements TalentModifier {

    @Override
    public TalentModifierType type() {
        return TalentModifierType.UNLOCK_TALENT_PARAM;
    }

    @Override
    public void apply(SkillDepot depot, ParamList params) {
        depot.unlockTalentParam(abilityName, talentParam);
    }
}
