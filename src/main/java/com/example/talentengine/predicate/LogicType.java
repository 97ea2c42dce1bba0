package com.example.talentengine.predicate;

/**
 * Comparison operator of a predicate: {@code lhs <op> rhs}, where lhs is the
 * contextual quantity and rhs the configured threshold.
 */
public enum LogicType {
    EQUAL("Equal"),
    NOT_EQUAL("NotEqual"),
    GREATER("Greater"),
    GREATER_AND_EQUAL("GreaterAndEqual", "GreaterOrEqual", "GreaterEqual"),
    LESS("Lesser", "Less"),
    LESS_AND_EQUAL("LesserAndEqual", "LessAndEqual", "LesserOrEqual", "LessOrEqual", "LessEqual");

    private final String[] aliases;

    LogicType(String... aliases) {
        this.aliases = aliases;
    }

    public boolean compare(double lhs, double rhs) {
        switch (this) {
            case EQUAL:
                return lhs == rhs;
            case NOT_EQUAL:
                return lhs != rhs;
            case GREATER:
                return lhs > rhs;
            case GREATER_AND_EQUAL:
                return lhs >= rhs;
            case LESS:
                return lhs < rhs;
            case LESS_AND_EQUAL:
                return lhs <= rhs;
            default:
                throw new IllegalStateException("unhandled logic type " + this);
        }
    }

    /**
     * Parse a config spelling ("GreaterAndEqual", "Lesser", ...) or the enum name.
     * Returns null when unrecognised.
     */
    public static LogicType fromString(String s) {
        if (s == null) return null;
        String trimmed = s.trim();
        for (LogicType t : values()) {
            if (t.name().equalsIgnoreCase(trimmed)) return t;
            for (String alias : t.aliases) {
                if (alias.equalsIgnoreCase(trimmed)) return t;
            }
        }
        return null;
    }
}
