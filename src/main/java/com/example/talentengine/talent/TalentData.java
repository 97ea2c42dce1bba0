package com.example.talentengine.talent;

import com.example.talentengine.model.ParamList;

import java.util.Collections;
import java.util.List;

/**
 * A talent or proud-skill level: its parameter list and the modifiers it opens,
 * in declaration order.
 */
public record TalentData(
    int id,
    ParamList paramList,
    List<TalentModifier> openConfigs
) {
    public TalentData {
        paramList = paramList == null ? ParamList.EMPTY : paramList;
        openConfigs = openConfigs == null ? Collections.emptyList() : List.copyOf(openConfigs);
    }
}
