package com.example.talentengine.talent;

import com.example.talentengine.model.ConfigException;

import java.util.Objects;

/**
 * A delta or ratio field of a modifier config: absent, a literal number, or an indexed
 * reference such as {@code "%2"} into the talent's parameter list.
 *
 * Indexed strings are kept raw; they are parsed when resolved so a malformed reference
 * fails the single modifier that uses it instead of the whole config load.
 */
public final class ParamReference {
    public enum Kind { ABSENT, LITERAL, INDEXED }

    public static final ParamReference ABSENT = new ParamReference(Kind.ABSENT, 0.0, null);

    private final Kind kind;
    private final double literal;
    private final String expression;

    private ParamReference(Kind kind, double literal, String expression) {
        this.kind = kind;
        this.literal = literal;
        this.expression = expression;
    }

    public static ParamReference literal(double value) {
        return new ParamReference(Kind.LITERAL, value, null);
    }

    public static ParamReference indexed(String expression) {
        if (expression == null) return ABSENT;
        return new ParamReference(Kind.INDEXED, 0.0, expression);
    }

    /**
     * Build from a raw config value: null, a {@link Number} or a {@link String}.
     *
     * @throws ConfigException for any other value type
     */
    public static ParamReference fromConfig(Object raw) {
        if (raw == null) return ABSENT;
        if (raw instanceof Number) return literal(((Number) raw).doubleValue());
        if (raw instanceof String) return indexed((String) raw);
        throw new ConfigException("unsupported param reference type: " + raw.getClass().getSimpleName());
    }

    public Kind kind() { return kind; }
    public boolean isAbsent() { return kind == Kind.ABSENT; }
    public boolean isLiteral() { return kind == Kind.LITERAL; }
    public boolean isIndexed() { return kind == Kind.INDEXED; }

    /** Literal value; 0 unless {@link #isLiteral()}. */
    public double literal() { return literal; }

    /** Raw reference string; null unless {@link #isIndexed()}. */
    public String expression() { return expression; }

    public boolean isLiteralZero() {
        return kind == Kind.LITERAL && literal == 0.0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParamReference)) return false;
        ParamReference other = (ParamReference) o;
        return kind == other.kind
                && Double.compare(literal, other.literal) == 0
                && Objects.equals(expression, other.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, literal, expression);
    }

    @Override
    public String toString() {
        switch (kind) {
            case LITERAL:
                return Double.toString(literal);
            case INDEXED:
                return "\"" + expression + "\"";
            default:
                return "absent";
        }
    }
}
