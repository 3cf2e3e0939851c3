package com.fuzzy.matching.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A sequence paired with its multiplicity in a median computation.
 *
 * <p>A weight of zero is legal: the string stays in the input but does not influence the result.</p>
 *
 * @param text   the sequence
 * @param weight the multiplicity, finite and non-negative
 */
public record WeightedString<S extends SymbolSequence<S>>(S text, double weight) {

    public static final double DEFAULT_WEIGHT = 1.0;

    public WeightedString {
        Objects.requireNonNull(text, "text is required");
        if (!Double.isFinite(weight) || weight < 0.0) {
            throw new IllegalArgumentException("Weight must be finite and non-negative, got " + weight);
        }
    }

    /**
     * Creates an entry with the default weight of 1.0.
     */
    public static <S extends SymbolSequence<S>> WeightedString<S> of(S text) {
        return new WeightedString<>(text, DEFAULT_WEIGHT);
    }

    /**
     * Pairs every string with the default weight.
     */
    public static <S extends SymbolSequence<S>> List<WeightedString<S>> uniform(List<S> strings) {
        Objects.requireNonNull(strings, "strings is required");
        List<WeightedString<S>> result = new ArrayList<>(strings.size());
        for (S s : strings) {
            result.add(of(s));
        }
        return result;
    }

    /**
     * Pairs strings with weights by index.
     *
     * @throws IllegalArgumentException if the counts differ or a weight is invalid
     */
    public static <S extends SymbolSequence<S>> List<WeightedString<S>> zip(List<S> strings, double[] weights) {
        Objects.requireNonNull(strings, "strings is required");
        Objects.requireNonNull(weights, "weights is required");
        if (strings.size() != weights.length) {
            throw new IllegalArgumentException("Expected the same number of strings and weights, got "
                    + strings.size() + " strings and " + weights.length + " weights");
        }
        List<WeightedString<S>> result = new ArrayList<>(strings.size());
        for (int i = 0; i < weights.length; i++) {
            result.add(new WeightedString<>(strings.get(i), weights[i]));
        }
        return result;
    }
}
