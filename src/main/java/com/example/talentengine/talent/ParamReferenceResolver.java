package com.example.talentengine.talent;

import com.example.talentengine.model.ParamList;

import java.util.regex.Pattern;

/**
 * Resolves {@link ParamReference}s against a parameter list. Shared by every modifier variant.
 *
 * Values are narrowed to float, the precision ability specials are stored in.
 */
public final class ParamReferenceResolver {
    private static final String INDEX_MARKER = "%";
    // ASCII only; Integer.parseInt would also take other Unicode digits
    private static final Pattern INDEX_PATTERN = Pattern.compile("[+-]?[0-9]+");

    private ParamReferenceResolver() {
    }

    /**
     * @return the resolved value, or null when the reference is absent
     * @throws EngineException MALFORMED_REFERENCE or INDEX_OUT_OF_RANGE
     */
    public static Float resolve(ParamReference ref, ParamList params) {
        if (ref == null || ref.isAbsent()) return null;
        if (ref.isLiteral()) return (float) ref.literal();
        ParamList list = params == null ? ParamList.EMPTY : params;
        return (float) list.get(parseIndex(ref.expression()));
    }

    /**
     * Resolve a ratio. A literal zero ratio resolves to null so it is never multiplied in;
     * an indexed ratio is returned as-is even when the referenced value is zero.
     */
    public static Float resolveRatio(ParamReference ref, ParamList params) {
        if (ref != null && ref.isLiteralZero()) return null;
        return resolve(ref, params);
    }

    /**
     * Every '%' is removed and the remainder parsed as an int. A leading sign is accepted by the
     * parse; a negative result is then rejected by the list bounds check.
     *
     * @throws EngineException MALFORMED_REFERENCE when the remainder is not an integer
     */
    public static int parseIndex(String expression) {
        if (expression == null) {
            throw new EngineException(EngineError.MALFORMED_REFERENCE, "null param reference");
        }
        String digits = expression.replace(INDEX_MARKER, "").trim();
        if (!INDEX_PATTERN.matcher(digits).matches()) {
            throw new EngineException(EngineError.MALFORMED_REFERENCE,
                    "malformed param reference: '" + expression + "'");
        }
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new EngineException(EngineError.MALFORMED_REFERENCE,
                    "malformed param reference: '" + expression + "'", e);
        }
    }
}
