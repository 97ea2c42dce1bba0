package com.example.talentengine.model;

import com.example.talentengine.talent.EngineError;
import com.example.talentengine.talent.EngineException;

import java.util.Arrays;
import java.util.List;

/**
 * Ordered parameter values of one talent or proud-skill level.
 * Indexed references in modifier configs point into this list (0-based).
 */
public final class ParamList {
    public static final ParamList EMPTY = new ParamList(new double[0]);

    private final double[] values;

    private ParamList(double[] values) {
        this.values = values;
    }

    public static ParamList of(double... values) {
        if (values == null || values.length == 0) return EMPTY;
        return new ParamList(values.clone());
    }

    public static ParamList fromNumbers(List<? extends Number> numbers) {
        if (numbers == null || numbers.isEmpty()) return EMPTY;
        double[] out = new double[numbers.size()];
        for (int i = 0; i < out.length; i++) {
            Number n = numbers.get(i);
            out[i] = n == null ? 0.0 : n.doubleValue();
        }
        return new ParamList(out);
    }

    /**
     * @throws EngineException with {@link EngineError#INDEX_OUT_OF_RANGE} for a negative or too large index
     */
    public double get(int index) {
        if (index < 0 || index >= values.length) {
            throw new EngineException(EngineError.INDEX_OUT_OF_RANGE,
                    "param index " + index + " out of range for list of size " + values.length);
        }
        return values[index];
    }

    public int size() { return values.length; }

    public boolean isEmpty() { return values.length == 0; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParamList)) return false;
        return Arrays.equals(values, ((ParamList) o).values);
    }

    @Override
    public int hashCode() { return Arrays.hashCode(values); }

    @Override
    public String toString() { return Arrays.toString(values); }
}
