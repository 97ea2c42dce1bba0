package com.example.talentengine.predicate;

/**
 * Compares the target's altitude with {@code value}. A null {@code logic} always passes.
 */
public record ByTargetAltitude(LogicType logic, double value) implements Predicate {

    @Override
    public PredicateType type() {
        return PredicateType.BY_TARGET_ALTITUDE;
    }

    @Override
    public boolean evaluate(PredicateContext context) {
        if (logic == null) return true;
        return logic.compare(context.targetAltitude(), value);
    }
}
