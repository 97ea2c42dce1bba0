package com.example.talentengine;

import com.example.talentengine.model.ConfigException;
import com.example.talentengine.predicate.ByTargetAltitude;
import com.example.talentengine.predicate.ByTargetHpRatio;
import com.example.talentengine.predicate.LogicType;
import com.example.talentengine.predicate.Predicate;
import com.example.talentengine.predicate.PredicateType;
import com.example.talentengine.predicate.Predicates;
import com.example.talentengine.predicate.TargetState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for predicate evaluation and parsing.
 */
@DisplayName("Predicate Tests")
public class PredicateTest {

    @Test
    @DisplayName("GreaterAndEqual 5.0 passes at 5.0 and fails at 4.999")
    void altitudeGreaterOrEqualBoundary() {
        Predicate p = new ByTargetAltitude(LogicType.GREATER_AND_EQUAL, 5.0);
        assertTrue(p.evaluate(TargetState.atAltitude(5.0)));
        assertFalse(p.evaluate(TargetState.atAltitude(4.999)));
        assertTrue(p.evaluate(TargetState.atAltitude(12.0)));
    }

    @ParameterizedTest
    @CsvSource({
        "EQUAL,             3.0, 3.0, true",
        "EQUAL,             3.1, 3.0, false",
        "NOT_EQUAL,         3.1, 3.0, true",
        "NOT_EQUAL,         3.0, 3.0, false",
        "GREATER,           3.0, 3.0, false",
        "GREATER,           3.5, 3.0, true",
        "GREATER_AND_EQUAL, 3.0, 3.0, true",
        "LESS,              2.0, 3.0, true",
        "LESS,              3.0, 3.0, false",
        "LESS_AND_EQUAL,    3.0, 3.0, true",
        "LESS_AND_EQUAL,    3.5, 3.0, false"
    })
    @DisplayName("Each operator compares context value against threshold")
    void operators(LogicType logic, double altitude, double threshold, boolean expected) {
        assertEquals(expected, new ByTargetAltitude(logic, threshold).evaluate(TargetState.atAltitude(altitude)));
    }

    @Test
    @DisplayName("Absent logic operator always passes")
    void absentLogicIsTrue() {
        Predicate p = new ByTargetAltitude(null, 100.0);
        assertTrue(p.evaluate(TargetState.atAltitude(0.0)));
        assertTrue(new ByTargetHpRatio(null, 0.5).evaluate(new TargetState(0, 0.1)));
    }

    @Test
    @DisplayName("HP ratio predicate reads the HP ratio, not altitude")
    void hpRatio() {
        Predicate lowHp = new ByTargetHpRatio(LogicType.LESS, 0.5);
        assertTrue(lowHp.evaluate(new TargetState(100.0, 0.3)));
        assertFalse(lowHp.evaluate(new TargetState(0.0, 0.8)));
    }

    @Test
    @DisplayName("Repeated evaluation gives the same answer")
    void pureEvaluation() {
        Predicate p = new ByTargetAltitude(LogicType.GREATER, 2.0);
        TargetState ctx = TargetState.atAltitude(3.0);
        for (int i = 0; i < 5; i++) {
            assertTrue(p.evaluate(ctx));
        }
    }

    @ParameterizedTest
    @CsvSource({
        "Equal,           EQUAL",
        "NotEqual,        NOT_EQUAL",
        "Greater,         GREATER",
        "GreaterAndEqual, GREATER_AND_EQUAL",
        "Lesser,          LESS",
        "Less,            LESS",
        "LesserAndEqual,  LESS_AND_EQUAL",
        "less_and_equal,  LESS_AND_EQUAL"
    })
    @DisplayName("Config spellings of operators parse")
    void logicSpellings(String spelling, LogicType expected) {
        assertEquals(expected, LogicType.fromString(spelling));
    }

    @Test
    @DisplayName("fromConfig builds the tagged variant")
    void fromConfig() {
        Map<String, Object> record = new HashMap<>();
        record.put("kind", "ByTargetAltitude");
        record.put("logic", "GreaterAndEqual");
        record.put("value", 5);

        Predicate p = Predicates.fromConfig(record);

        assertEquals(PredicateType.BY_TARGET_ALTITUDE, p.type());
        assertEquals(new ByTargetAltitude(LogicType.GREATER_AND_EQUAL, 5.0), p);
    }

    @Test
    @DisplayName("fromConfig without logic yields an always-true predicate")
    void fromConfigWithoutLogic() {
        Predicate p = Predicates.fromConfig(Map.of("kind", "ByTargetHPRatio", "value", 0.25));
        assertEquals(PredicateType.BY_TARGET_HP_RATIO, p.type());
        assertTrue(p.evaluate(new TargetState(0.0, 0.9)));
    }

    @Test
    @DisplayName("fromConfig rejects unknown kinds and operators")
    void fromConfigRejects() {
        assertThrows(ConfigException.class, () -> Predicates.fromConfig(Map.of("kind", "ByMoonPhase", "value", 1)));
        assertThrows(ConfigException.class,
                () -> Predicates.fromConfig(Map.of("kind", "ByTargetAltitude", "logic", "Roughly", "value", 1)));
    }

    @Test
    @DisplayName("evaluateAll requires every predicate to pass")
    void evaluateAll() {
        TargetState ctx = new TargetState(6.0, 0.2);
        List<Predicate> both = List.of(
                new ByTargetAltitude(LogicType.GREATER, 5.0),
                new ByTargetHpRatio(LogicType.LESS, 0.5));
        assertTrue(Predicates.evaluateAll(both, ctx));
        assertFalse(Predicates.evaluateAll(List.of(new ByTargetAltitude(LogicType.LESS, 5.0)), ctx));
        assertTrue(Predicates.evaluateAll(List.of(), ctx));
        assertTrue(Predicates.evaluate(null, ctx));
    }
}
