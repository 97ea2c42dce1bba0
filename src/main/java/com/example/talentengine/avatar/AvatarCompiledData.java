package com.example.talentengine.avatar;

import com.example.talentengine.model.AbilityConfig;
import com.example.talentengine.model.SkillDepot;
import com.example.talentengine.talent.BatchResult;
import com.example.talentengine.talent.TalentData;
import com.example.talentengine.talent.TalentModifierEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-avatar data compiled once from configs: a template skill depot seeded with the
 * default specials of the avatar's abilities, plus the talents it can unlock.
 *
 * The template is never handed out; {@link #newDepot(Collection)} returns copies.
 */
public class AvatarCompiledData {
    private static final Logger logger = LoggerFactory.getLogger(AvatarCompiledData.class);

    private final AvatarDefinition definition;
    private final SkillDepot template;
    private final Map<Integer, TalentData> talents;
    private final TalentModifierEngine engine;

    public AvatarCompiledData(AvatarDefinition definition,
                              Map<String, AbilityConfig> abilities,
                              Map<Integer, TalentData> allTalents,
                              TalentModifierEngine engine) {
        this.definition = definition;
        this.engine = engine;
        this.template = new SkillDepot();
        for (String abilityName : definition.abilityNames()) {
            AbilityConfig config = abilities.get(abilityName);
            if (config == null) {
                logger.warn("Avatar {} ({}): no ability config named '{}'", definition.id(), definition.name(), abilityName);
                continue;
            }
            template.addAbility(abilityName, config.abilitySpecials());
        }
        Map<Integer, TalentData> own = new LinkedHashMap<>();
        for (Integer talentId : definition.talentIds()) {
            TalentData talent = allTalents.get(talentId);
            if (talent == null) {
                logger.warn("Avatar {} ({}): unknown talent id {}", definition.id(), definition.name(), talentId);
                continue;
            }
            own.put(talentId, talent);
        }
        this.talents = Collections.unmodifiableMap(own);
    }

    public int getAvatarId() { return definition.id(); }
    public AvatarDefinition getDefinition() { return definition; }
    public Map<Integer, TalentData> getTalents() { return talents; }

    /** Independent copy of the default depot, no talents applied. */
    public SkillDepot newDepot() {
        return template.copy();
    }

    /**
     * Copy of the default depot with the given talents applied in the given order.
     * Talents this avatar does not have are logged and ignored.
     */
    public SkillDepot newDepot(Collection<Integer> unlockedTalentIds) {
        SkillDepot depot = template.copy();
        if (unlockedTalentIds == null) return depot;
        for (Integer talentId : unlockedTalentIds) {
            applyTalent(depot, talentId);
        }
        return depot;
    }

    /**
     * Apply one of this avatar's talents to a live depot, e.g. when a talent is unlocked in play.
     *
     * @return the batch result, or null when the talent does not belong to this avatar
     */
    public BatchResult applyTalent(SkillDepot depot, int talentId) {
        TalentData talent = talents.get(talentId);
        if (talent == null) {
            logger.warn("Avatar {}: talent {} is not available", definition.id(), talentId);
            return null;
        }
        return engine.applyTalent(talent, depot);
    }
}
