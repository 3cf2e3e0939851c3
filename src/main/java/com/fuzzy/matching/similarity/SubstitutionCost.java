package com.fuzzy.matching.similarity;

/**
 * Cost of substituting one symbol by a different one in the Levenshtein dynamic program.
 * Insertions and deletions always cost 1.
 */
public enum SubstitutionCost {
    /**
     * Classic Levenshtein distance, a substitution costs 1.
     */
    UNIT(1),

    /**
     * A substitution costs as much as a deletion plus an insertion. Used by similarity ratios so
     * that they are comparable with block-matching measures.
     */
    DOUBLE(2);

    private final int weight;

    SubstitutionCost(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }
}
