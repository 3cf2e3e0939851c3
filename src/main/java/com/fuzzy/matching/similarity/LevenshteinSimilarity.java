package com.fuzzy.matching.similarity;

import com.fuzzy.matching.core.model.SymbolSequence;

/**
 * Levenshtein ratio as a {@link SimilarityAlgorithm}, see {@link Levenshtein#ratio}.
 */
public class LevenshteinSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(SymbolSequence<?> s1, SymbolSequence<?> s2) {
        return Levenshtein.ratio(s1, s2);
    }

    @Override
    public String getName() {
        return "Levenshtein";
    }
}
