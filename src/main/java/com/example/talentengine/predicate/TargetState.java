package com.example.talentengine.predicate;

/**
 * Immutable snapshot of a target's state.
 */
public record TargetState(double targetAltitude, double targetHpRatio) implements PredicateContext {

    public static TargetState atAltitude(double altitude) {
        return new TargetState(altitude, 1.0);
    }
}
