package com.example.talentengine.predicate;

/**
 * Compares the target's HP ratio with {@code value}. A null {@code logic} always passes.
 */
public record ByTargetHpRatio(LogicType logic, double value) implements Predicate {

    @Override
    public PredicateType type() {
        return PredicateType.BY_TARGET_HP_RATIO;
    }

    @Override
    public boolean evaluate(PredicateContext context) {
        if (logic == null) return true;
        return logic.compare(context.targetHpRatio(), value);
    }
}
