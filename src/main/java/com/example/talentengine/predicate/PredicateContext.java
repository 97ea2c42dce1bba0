package com.example.talentengine.predicate;

/**
 * World/character quantities predicates are evaluated against.
 * Supplied by the caller; predicates only read it.
 */
public interface PredicateContext {

    /** Altitude of the predicate's target above the ground. */
    double targetAltitude();

    /** Current HP of the target divided by its max HP, 0.0 to 1.0. */
    double targetHpRatio();
}
