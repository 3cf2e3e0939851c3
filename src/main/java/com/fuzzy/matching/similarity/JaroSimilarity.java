package com.fuzzy.matching.similarity;

import com.fuzzy.matching.core.model.SymbolSequence;

/**
 * Jaro similarity, intended for short strings such as personal names.
 */
public class JaroSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(SymbolSequence<?> s1, SymbolSequence<?> s2) {
        return jaro(s1, s2);
    }

    @Override
    public String getName() {
        return "Jaro";
    }

    /**
     * Computes the Jaro similarity between two sequences.
     * Each symbol of {@code s1} is matched with the earliest unmatched equal symbol of {@code s2}
     * inside the search window; two empty sequences are identical.
     */
    public static double jaro(SymbolSequence<?> s1, SymbolSequence<?> s2) {
        int s1Length = s1.length();
        int s2Length = s2.length();
        if (s1Length == 0 && s2Length == 0) {
            return 1.0;
        }
        if (s1Length == 0 || s2Length == 0) {
            return 0.0;
        }

        int matchWindow = Math.max(0, Math.max(s1Length, s2Length) / 2 - 1);

        boolean[] s1Matches = new boolean[s1Length];
        boolean[] s2Matches = new boolean[s2Length];

        int matches = 0;
        int transpositions = 0;

        // Find matches
        for (int i = 0; i < s1Length; i++) {
            int start = Math.max(0, i - matchWindow);
            int end = Math.min(i + matchWindow + 1, s2Length);
            int symbol = s1.symbolAt(i);

            for (int j = start; j < end; j++) {
                if (s2Matches[j] || symbol != s2.symbolAt(j)) {
                    continue;
                }
                s1Matches[i] = true;
                s2Matches[j] = true;
                matches++;
                break;
            }
        }

        if (matches == 0) {
            return 0.0;
        }

        // Count transpositions
        int k = 0;
        for (int i = 0; i < s1Length; i++) {
            if (!s1Matches[i]) {
                continue;
            }
            while (!s2Matches[k]) {
                k++;
            }
            if (s1.symbolAt(i) != s2.symbolAt(k)) {
                transpositions++;
            }
            k++;
        }

        // Jaro formula: (m/|s1| + m/|s2| + (m-t/2)/m) / 3
        double m = matches;
        double t = transpositions / 2.0;
        return ((m / s1Length) + (m / s2Length) + ((m - t) / m)) / 3.0;
    }
}
