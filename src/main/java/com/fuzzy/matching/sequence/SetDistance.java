package com.fuzzy.matching.sequence;

import com.fuzzy.matching.core.ScratchBuffers;
import com.fuzzy.matching.core.model.SymbolSequence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Distance between unordered token sets: the cheapest one-to-one pairing of tokens, where a pair
 * costs the token substitution cost and an unpaired token costs 1.
 */
public final class SetDistance {

    private static final Logger log = LoggerFactory.getLogger(SetDistance.class);

    private static final double UNPAIRED_COST = 1.0;

    private SetDistance() {
    }

    public static double distance(List<? extends SymbolSequence<?>> tokens1,
                                  List<? extends SymbolSequence<?>> tokens2) {
        Objects.requireNonNull(tokens1, "tokens1 is required");
        Objects.requireNonNull(tokens2, "tokens2 is required");
        int n1 = tokens1.size();
        int n2 = tokens2.size();
        if (n1 == 0) {
            return n2;
        }
        if (n2 == 0) {
            return n1;
        }

        // Square matrix, dummy rows and columns price the unpaired tokens
        int n = Math.max(n1, n2);
        double[] costs = ScratchBuffers.doubleMatrix(n, n);
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                costs[i * n + j] = i < n1 && j < n2
                        ? TokenCost.of(tokens1.get(i), tokens2.get(j))
                        : UNPAIRED_COST;
            }
        }

        int[] assignment = HungarianAlgorithm.assign(costs, n, n);
        double sum = 0.0;
        for (int i = 0; i < n; i++) {
            sum += costs[i * n + assignment[i]];
        }
        log.debug("Assigned {} x {} tokens at total cost {}", n1, n2, sum);
        return sum;
    }

    /**
     * Similarity of two token sets, normalized like {@link SequenceDistance#ratio}.
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
