package com.fuzzy.matching.sequence;

import com.fuzzy.matching.core.ScratchBuffers;
import com.fuzzy.matching.core.model.SymbolSequence;

import java.util.List;
import java.util.Objects;

/**
 * Levenshtein distance between ordered token lists. Tokens are inserted or deleted at cost 1 and
 * substituted at a cost given by their own string similarity.
 */
public final class SequenceDistance {

    private SequenceDistance() {
    }

    /**
     * Computes the token-level edit distance. Common leading and trailing tokens are skipped.
     */
    public static double distance(List<? extends SymbolSequence<?>> tokens1,
                                  List<? extends SymbolSequence<?>> tokens2) {
        Objects.requireNonNull(tokens1, "tokens1 is required");
        Objects.requireNonNull(tokens2, "tokens2 is required");

        int prefix = 0;
        int n1 = tokens1.size();
        int n2 = tokens2.size();
        while (prefix < n1 && prefix < n2 && tokens1.get(prefix).contentEquals(tokens2.get(prefix))) {
            prefix++;
        }
        while (n1 > prefix && n2 > prefix && tokens1.get(n1 - 1).contentEquals(tokens2.get(n2 - 1))) {
            n1--;
            n2--;
        }
        n1 -= prefix;
        n2 -= prefix;
        if (n1 == 0) {
            return n2;
        }
        if (n2 == 0) {
            return n1;
        }

        List<? extends SymbolSequence<?>> shorter = tokens1.subList(prefix, prefix + n1);
        List<? extends SymbolSequence<?>> longer = tokens2.subList(prefix, prefix + n2);
        if (n1 > n2) {
            List<? extends SymbolSequence<?>> temp = shorter;
            shorter = longer;
            longer = temp;
            int swap = n1;
            n1 = n2;
            n2 = swap;
        }

        double[] row = ScratchBuffers.doubleBuffer(n1 + 1L);
        for (int j = 0; j <= n1; j++) {
            row[j] = j;
        }
        for (int i = 1; i <= n2; i++) {
            SymbolSequence<?> token = longer.get(i - 1);
            double diagonal = i - 1;
            double x = i;
            for (int j = 1; j <= n1; j++) {
                double above = row[j];
                x = Math.min(x + 1, diagonal + TokenCost.of(shorter.get(j - 1), token));
                x = Math.min(x, above + 1);
                row[j] = x;
                diagonal = above;
            }
        }
        return row[n1];
    }

    /**
     * Similarity of two token lists: 1.0 if both are empty, 0.0 if only one is, otherwise
     * {@code (n1 + n2 - distance) / (n1 + n2)}.
     */
    public static double ratio(List<? extends SymbolSequence<?>> tokens1,
                               List<? extends SymbolSequence<?>> tokens2) {
        Objects.requireNonNull(tokens1, "tokens1 is required");
        Objects.requireNonNull(tokens2, "tokens2 is required");
        if (tokens1.isEmpty() || tokens2.isEmpty()) {
            return TokenCost.ratio(tokens1.size(), tokens2.size(), 0.0);
        }
        return TokenCost.ratio(tokens1.size(), tokens2.size(), distance(tokens1, tokens2));
    }
}
