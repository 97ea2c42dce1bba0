package com.example.talentengine.tools;

import com.example.talentengine.TalentEngine;
import com.example.talentengine.avatar.AvatarCompiledData;
import com.example.talentengine.model.SkillDepot;
import com.example.talentengine.util.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Prints an avatar's ability specials after applying talents.
 * Usage: TalentPreviewTool &lt;avatarId&gt; [talentId...]
 */
public class TalentPreviewTool {
    private static final Logger logger = LoggerFactory.getLogger(TalentPreviewTool.class);

    public static void main(String[] args) {
        if (args.length == 0) {
            System.out.println("usage: TalentPreviewTool <avatarId> [talentId...]");
            return;
        }
        TalentEngine engine = TalentEngine.start(EngineConfig.load());
        int avatarId;
        List<Integer> talentIds = new ArrayList<>();
        try {
            avatarId = Integer.parseInt(args[0]);
            for (int i = 1; i < args.length; i++) talentIds.add(Integer.parseInt(args[i]));
        } catch (NumberFormatException e) {
            logger.error("Arguments must be numeric ids: {}", e.getMessage());
            return;
        }

        AvatarCompiledData avatar = engine.getAvatars().get(avatarId);
        if (avatar == null) {
            logger.error("Unknown avatar id {}", avatarId);
            return;
        }
        SkillDepot depot = avatar.newDepot(talentIds);
        System.out.println("Avatar " + avatarId + " (" + avatar.getDefinition().name() + ") talents " + talentIds);
        for (Map.Entry<String, Map<String, Float>> ability : depot.getAbilitySpecials().entrySet()) {
            System.out.println("  " + ability.getKey());
            for (Map.Entry<String, Float> special : ability.getValue().entrySet()) {
                System.out.println("    " + special.getKey() + " = " + special.getValue());
            }
        }
        if (!depot.getExtraTalentLevels().isEmpty()) {
            System.out.println("  extra levels: " + depot.getExtraTalentLevels());
        }
    }
}
