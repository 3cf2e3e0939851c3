package com.fuzzy.matching.median;

import com.fuzzy.matching.core.model.SymbolSequence;
import com.fuzzy.matching.core.model.WeightedString;

import java.util.List;
import java.util.Objects;

/**
 * Validated input of the median operations: the strings, their weights, and a symbol-array view
 * of the strings for the inner loops.
 */
public final class MedianInput<S extends SymbolSequence<S>> {

    private final List<WeightedString<S>> entries;
    private final int[][] symbols;
    private final double[] weights;

    private MedianInput(List<WeightedString<S>> entries) {
        this.entries = List.copyOf(entries);
        this.symbols = new int[this.entries.size()][];
        this.weights = new double[this.entries.size()];
        for (int i = 0; i < this.entries.size(); i++) {
            WeightedString<S> entry = this.entries.get(i);
            symbols[i] = entry.text().toSymbolArray();
            weights[i] = entry.weight();
        }
    }

    /**
     * Uses every string with weight 1.0.
     */
    public static <S extends SymbolSequence<S>> MedianInput<S> of(List<S> strings) {
        return new MedianInput<>(WeightedString.uniform(strings));
    }

    /**
     * Pairs strings with weights by index.
     *
     * @throws IllegalArgumentException if the counts differ or a weight is negative or not finite
     */
    public static <S extends SymbolSequence<S>> MedianInput<S> of(List<S> strings, double[] weights) {
        return new MedianInput<>(WeightedString.zip(strings, weights));
    }

    public static <S extends SymbolSequence<S>> MedianInput<S> weighted(List<WeightedString<S>> entries) {
        Objects.requireNonNull(entries, "entries is required");
        return new MedianInput<>(entries);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public S text(int index) {
        return entries.get(index).text();
    }

    public double weight(int index) {
        return weights[index];
    }

    public List<WeightedString<S>> entries() {
        return entries;
    }

    int[][] symbols() {
        return symbols;
    }

    double[] weights() {
        return weights;
    }
}
