package com.example.talentengine.avatar;

import java.util.Collections;
import java.util.List;

/**
 * Static avatar definition: which abilities it owns and which talents it can unlock.
 */
public record AvatarDefinition(
    int id,
    String name,
    List<String> abilityNames,
    List<Integer> talentIds
) {
    public AvatarDefinition {
        abilityNames = abilityNames == null ? Collections.emptyList() : List.copyOf(abilityNames);
        talentIds = talentIds == null ? Collections.emptyList() : List.copyOf(talentIds);
    }
}
