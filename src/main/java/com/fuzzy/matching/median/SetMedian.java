package com.fuzzy.matching.median;

import com.fuzzy.matching.core.ScratchBuffers;
import com.fuzzy.matching.core.model.SymbolSequence;
import com.fuzzy.matching.similarity.Levenshtein;

import java.util.Arrays;

/**
 * Set median: the input string with the smallest weighted sum of unit-cost distances to all
 * inputs. Pairwise distances are cached in a triangular table and a candidate is abandoned as
 * soon as its partial sum reaches the best sum so far.
 */
final class SetMedian {

    private SetMedian() {
    }

    /**
     * @return index of the set median, the earliest one on ties, or -1 for an empty input
     */
    static <S extends SymbolSequence<S>> int index(MedianInput<S> input) {
        int n = input.size();
        if (n == 0) {
            return -1;
        }
        int[] distances = ScratchBuffers.intBuffer((long) n * (n - 1) / 2);
        Arrays.fill(distances, -1);

        int minIndex = 0;
        double minDistance = Double.POSITIVE_INFINITY;
        for (int i = 0; i < n; i++) {
            double distance = 0.0;
            for (int j = 0; j < n && distance < minDistance; j++) {
                if (j == i) {
                    continue;
                }
                int slot = slot(i, j);
                if (distances[slot] < 0) {
                    distances[slot] = Levenshtein.distance(input.text(i), input.text(j));
                }
                distance += input.weight(j) * distances[slot];
            }
            if (distance < minDistance) {
                minDistance = distance;
                minIndex = i;
            }
        }
        return minIndex;
    }

    /**
     * Index of the pair {@code (i, j)}, {@code i != j}, in the lower-triangular distance table.
     */
    static int slot(int i, int j) {
        int hi = Math.max(i, j);
        int lo = Math.min(i, j);
        return (int) ((long) hi * (hi - 1) / 2 + lo);
    }
}
