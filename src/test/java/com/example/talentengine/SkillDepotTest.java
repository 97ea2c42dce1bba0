package com.example.talentengine;

import com.example.talentengine.model.SkillDepot;
import com.example.talentengine.model.TalentType;
import com.example.talentengine.talent.EngineError;
import com.example.talentengine.talent.EngineException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the per-character ability specials store.
 */
@DisplayName("SkillDepot Tests")
public class SkillDepotTest {

    @Test
    @DisplayName("Reading a missing ability or special throws the matching error")
    void missingEntries() {
        SkillDepot depot = new SkillDepot();
        depot.addAbility("A", Map.of("S", 1.0));

        EngineException e = assertThrows(EngineException.class, () -> depot.getSpecial("B", "S"));
        assertEquals(EngineError.UNKNOWN_ABILITY, e.getError());
        e = assertThrows(EngineException.class, () -> depot.setSpecial("A", "T", 2.0f));
        assertEquals(EngineError.UNKNOWN_SPECIAL, e.getError());
        assertFalse(depot.hasSpecial("A", "T"));
    }

    @Test
    @DisplayName("addAbility keeps existing values")
    void addAbilityKeepsValues() {
        SkillDepot depot = new SkillDepot();
        depot.addAbility("A", Map.of("S", 1.0));
        depot.setSpecial("A", "S", 5.0f);
        depot.addAbility("A", Map.of("S", 1.0, "T", 2.0));

        assertEquals(5.0f, depot.getSpecial("A", "S"));
        assertEquals(2.0f, depot.getSpecial("A", "T"));
    }

    @Test
    @DisplayName("copy shares no mutable state")
    void deepCopy() {
        SkillDepot original = new SkillDepot();
        original.addAbility("A", Map.of("S", 1.0));
        original.unlockTalentParam("A", "P1");
        original.addExtraTalentLevel(TalentType.BURST, 3);

        SkillDepot copy = original.copy();
        copy.setSpecial("A", "S", 9.0f);
        copy.unlockTalentParam("A", "P2");
        copy.addExtraTalentLevel(TalentType.BURST, 1);

        assertEquals(1.0f, original.getSpecial("A", "S"));
        assertFalse(original.isTalentParamUnlocked("A", "P2"));
        assertEquals(3, original.getExtraTalentLevel(TalentType.BURST));
        assertEquals(9.0f, copy.getSpecial("A", "S"));
        assertTrue(copy.isTalentParamUnlocked("A", "P1"));
        assertEquals(4, copy.getExtraTalentLevel(TalentType.BURST));
    }

    @Test
    @DisplayName("Views are read-only")
    void readOnlyViews() {
        SkillDepot depot = new SkillDepot();
        depot.addAbility("A", Map.of("S", 1.0));
        assertThrows(UnsupportedOperationException.class, () -> depot.getAbilitySpecials().get("A").put("S", 2.0f));
        assertThrows(UnsupportedOperationException.class, () -> depot.getAbilitySpecials().remove("A"));
    }
}
