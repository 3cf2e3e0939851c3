package com.fuzzy.matching.similarity;

import com.fuzzy.matching.core.model.CodePointSequence;
import com.fuzzy.matching.core.model.SymbolSequence;

/**
 * Interface for similarity computation algorithms.
 * All implementations return a score between 0.0 (no similarity) and 1.0 (identical).
 */
public interface SimilarityAlgorithm {

    /**
     * Computes the similarity between two symbol sequences.
     *
     * @param s1 first sequence
     * @param s2 second sequence
     * @return similarity score between 0.0 and 1.0
     */
    double compute(SymbolSequence<?> s1, SymbolSequence<?> s2);

    /**
     * Computes the similarity between two strings compared code point by code point.
     * A null argument scores 0.0.
     */
    default double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        return compute(CodePointSequence.of(s1), CodePointSequence.of(s2));
    }

    /**
     * Returns the name of this algorithm.
     */
    String getName();
}
