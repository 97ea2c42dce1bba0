package com.example.talentengine;

import com.example.talentengine.model.ConfigException;
import com.example.talentengine.model.ParamList;
import com.example.talentengine.talent.EngineError;
import com.example.talentengine.talent.EngineException;
import com.example.talentengine.talent.ParamReference;
import com.example.talentengine.talent.ParamReferenceResolver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for resolving literal and indexed parameter references.
 */
@DisplayName("ParamReferenceResolver Tests")
public class ParamReferenceResolverTest {

    private static final ParamList PARAMS = ParamList.of(0.5, 2.0, -3.25, 0.0);

    @Test
    @DisplayName("Absent reference resolves to null")
    void absentResolvesToNull() {
        assertNull(ParamReferenceResolver.resolve(ParamReference.ABSENT, PARAMS));
        assertNull(ParamReferenceResolver.resolve(null, PARAMS));
        assertNull(ParamReferenceResolver.resolve(ParamReference.fromConfig(null), ParamList.EMPTY));
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0, 5.0, -1.5, 100.25, 0.125})
    @DisplayName("Literal values resolve unchanged for any list, including an empty one")
    void literalIgnoresParamList(double value) {
        ParamReference ref = ParamReference.literal(value);
        assertEquals((float) value, ParamReferenceResolver.resolve(ref, PARAMS));
        assertEquals((float) value, ParamReferenceResolver.resolve(ref, ParamList.EMPTY));
        assertEquals((float) value, ParamReferenceResolver.resolve(ref, null));
    }

    @ParameterizedTest
    @CsvSource({
        "%0, 0.5",
        "%1, 2.0",
        "%2, -3.25",
        "%3, 0.0",
        "+%1, 2.0",
        "%%1, 2.0",
        "' %2 ', -3.25"
    })
    @DisplayName("Indexed references return the referenced parameter")
    void indexedReturnsParam(String expression, double expected) {
        Float resolved = ParamReferenceResolver.resolve(ParamReference.indexed(expression), PARAMS);
        assertNotNull(resolved);
        assertEquals((float) expected, resolved);
    }

    @Test
    @DisplayName("Indexed reference past the end fails with INDEX_OUT_OF_RANGE")
    void indexPastEnd() {
        EngineException e = assertThrows(EngineException.class,
                () -> ParamReferenceResolver.resolve(ParamReference.indexed("%4"), PARAMS));
        assertEquals(EngineError.INDEX_OUT_OF_RANGE, e.getError());

        e = assertThrows(EngineException.class,
                () -> ParamReferenceResolver.resolve(ParamReference.indexed("%0"), ParamList.EMPTY));
        assertEquals(EngineError.INDEX_OUT_OF_RANGE, e.getError());
    }

    @Test
    @DisplayName("Negative index parses but is out of range")
    void negativeIndex() {
        EngineException e = assertThrows(EngineException.class,
                () -> ParamReferenceResolver.resolve(ParamReference.indexed("-%1"), PARAMS));
        assertEquals(EngineError.INDEX_OUT_OF_RANGE, e.getError());
    }

    @ParameterizedTest
    @ValueSource(strings = {"abc", "%", "", "%1.5", "%x2", "1e3", "%\u0661", "%\uFF12"})
    @DisplayName("Non-numeric reference strings fail with MALFORMED_REFERENCE")
    void malformed(String expression) {
        EngineException e = assertThrows(EngineException.class,
                () -> ParamReferenceResolver.resolve(ParamReference.indexed(expression), PARAMS));
        assertEquals(EngineError.MALFORMED_REFERENCE, e.getError());
    }

    @Test
    @DisplayName("Literal zero ratio is suppressed, indexed zero ratio is not")
    void ratioZeroAsymmetry() {
        assertNull(ParamReferenceResolver.resolveRatio(ParamReference.literal(0.0), PARAMS));
        assertEquals(0.0f, ParamReferenceResolver.resolveRatio(ParamReference.indexed("%3"), PARAMS));
        assertEquals(2.0f, ParamReferenceResolver.resolveRatio(ParamReference.literal(2.0), PARAMS));
        assertNull(ParamReferenceResolver.resolveRatio(ParamReference.ABSENT, PARAMS));
    }

    @Test
    @DisplayName("fromConfig maps raw config values to reference kinds")
    void fromConfigKinds() {
        assertTrue(ParamReference.fromConfig(null).isAbsent());
        assertTrue(ParamReference.fromConfig(3).isLiteral());
        assertEquals(3.0, ParamReference.fromConfig(3).literal());
        assertTrue(ParamReference.fromConfig(1.5).isLiteral());
        assertTrue(ParamReference.fromConfig("%1").isIndexed());
        assertEquals("%1", ParamReference.fromConfig("%1").expression());
        assertThrows(ConfigException.class, () -> ParamReference.fromConfig(true));
    }
}
