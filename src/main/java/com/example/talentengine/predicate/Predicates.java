package com.example.talentengine.predicate;

import com.example.talentengine.model.ConfigException;

import java.util.Collection;
import java.util.Map;

/**
 * Parsing and evaluation helpers for {@link Predicate}s.
 */
public final class Predicates {

    private Predicates() {
    }

    /**
     * Evaluate a predicate. A null predicate (ungated) passes.
     */
    public static boolean evaluate(Predicate predicate, PredicateContext context) {
        if (predicate == null) return true;
        return predicate.evaluate(context);
    }

    /**
     * True when every predicate passes; an empty or null collection passes.
     */
    public static boolean evaluateAll(Collection<? extends Predicate> predicates, PredicateContext context) {
        if (predicates == null) return true;
        for (Predicate p : predicates) {
            if (!evaluate(p, context)) return false;
        }
        return true;
    }

    /**
     * Build a predicate from a raw config record with {@code kind}, optional {@code logic}
     * and {@code value}.
     *
     * @throws ConfigException for an unknown kind or logic operator
     */
    public static Predicate fromConfig(Map<String, Object> record) {
        if (record == null) throw new ConfigException("null predicate record");
        Object kindObj = record.get("kind");
        PredicateType type = PredicateType.fromString(kindObj == null ? null : String.valueOf(kindObj));
        if (type == null) {
            throw new ConfigException("unknown predicate kind: " + kindObj);
        }

        LogicType logic = null;
        Object logicObj = record.get("logic");
        if (logicObj != null) {
            logic = LogicType.fromString(String.valueOf(logicObj));
            if (logic == null) {
                throw new ConfigException("unknown logic operator: " + logicObj);
            }
        }

        double value = 0.0;
        Object valueObj = record.get("value");
        if (valueObj instanceof Number) {
            value = ((Number) valueObj).doubleValue();
        } else if (valueObj != null) {
            try {
                value = Double.parseDouble(String.valueOf(valueObj).trim());
            } catch (NumberFormatException e) {
                throw new ConfigException("predicate value is not a number: " + valueObj, e);
            }
        }

        return switch (type) {
            case BY_TARGET_ALTITUDE -> new ByTargetAltitude(logic, value);
            case BY_TARGET_HP_RATIO -> new ByTargetHpRatio(logic, value);
        };
    }
}
