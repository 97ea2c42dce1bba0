package com.example.talentengine.predicate;

/**
 * Boolean gate over world or character state. Implementations are pure and hold no
 * mutable state, so they can be evaluated repeatedly from any thread.
 */
public interface Predicate {

    PredicateType type();

    boolean evaluate(PredicateContext context);
}
