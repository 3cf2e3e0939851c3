package com.fuzzy.matching.similarity;

import com.fuzzy.matching.core.model.SymbolSequence;

/**
 * Jaro-Winkler similarity algorithm.
 * Gives higher scores to strings that match from the beginning.
 */
public class JaroWinklerSimilarity implements SimilarityAlgorithm {

    public static final double DEFAULT_PREFIX_WEIGHT = 0.1;
    private static final int MAX_PREFIX_LENGTH = 4;

    private final double prefixWeight;

    public JaroWinklerSimilarity() {
        this(DEFAULT_PREFIX_WEIGHT);
    }

    public JaroWinklerSimilarity(double prefixWeight) {
        checkPrefixWeight(prefixWeight);
        this.prefixWeight = prefixWeight;
    }

    @Override
    public double compute(SymbolSequence<?> s1, SymbolSequence<?> s2) {
        return jaroWinkler(s1, s2, prefixWeight);
    }

    @Override
    public String getName() {
        return "Jaro-Winkler";
    }

    public double getPrefixWeight() {
        return prefixWeight;
    }

    /**
     * Computes the Jaro-Winkler similarity with the default prefix weight of 0.1.
     */
    public static double jaroWinkler(SymbolSequence<?> s1, SymbolSequence<?> s2) {
        return jaroWinkler(s1, s2, DEFAULT_PREFIX_WEIGHT);
    }

    /**
     * Computes the Jaro-Winkler similarity.
     * The result is capped at 1.0, which large prefix weights would otherwise exceed.
     *
     * @param prefixWeight weight of each common prefix symbol (at most 4 count), must be {@code >= 0}
     * @throws IllegalArgumentException if {@code prefixWeight} is negative
     */
    public static double jaroWinkler(SymbolSequence<?> s1, SymbolSequence<?> s2, double prefixWeight) {
        checkPrefixWeight(prefixWeight);
        double jaroSimilarity = JaroSimilarity.jaro(s1, s2);

        // Calculate common prefix length (up to MAX_PREFIX_LENGTH)
        int prefixLength = 0;
        int maxPrefixLength = Math.min(MAX_PREFIX_LENGTH, Math.min(s1.length(), s2.length()));
        while (prefixLength < maxPrefixLength && s1.symbolAt(prefixLength) == s2.symbolAt(prefixLength)) {
            prefixLength++;
        }

        // Jaro-Winkler formula: jw = jaro + (prefix * prefixWeight * (1 - jaro))
        double score = jaroSimilarity + (prefixLength * prefixWeight * (1.0 - jaroSimilarity));
        return Math.min(1.0, score);
    }

    private static void checkPrefixWeight(double prefixWeight) {
        if (Double.isNaN(prefixWeight) || prefixWeight < 0) {
            throw new IllegalArgumentException("Prefix weight must be non-negative, got " + prefixWeight);
        }
    }
}
