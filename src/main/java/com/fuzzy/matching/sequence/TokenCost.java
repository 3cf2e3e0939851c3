package com.fuzzy.matching.sequence;

import com.fuzzy.matching.core.model.SymbolSequence;
import com.fuzzy.matching.similarity.Levenshtein;
import com.fuzzy.matching.similarity.SubstitutionCost;

/**
 * Cost of substituting one token for another: {@code 2 * (1 - ratio)}, i.e. the normalized
 * double-cost distance scaled to {@code [0, 2]}, so a substitution never costs more than a
 * deletion plus an insertion.
 */
final class TokenCost {

    private TokenCost() {
    }

    static double of(SymbolSequence<?> a, SymbolSequence<?> b) {
        int lengthSum = a.length() + b.length();
        if (lengthSum == 0) {
            return 0.0;
        }
        return 2.0 * Levenshtein.distance(a, b, SubstitutionCost.DOUBLE) / lengthSum;
    }

    /**
     * Normalizes a token-level distance to a similarity in {@code [0, 1]}.
     */
    static double ratio(int size1, int size2, double distance) {
        int sizeSum = size1 + size2;
        if (sizeSum == 0) {
            return 1.0;
        }
        if (size1 == 0 || size2 == 0) {
            return 0.0;
        }
        return (sizeSum - distance) / sizeSum;
    }
}
