package com.fuzzy.matching.median;

import com.fuzzy.matching.core.model.ByteSequence;
import com.fuzzy.matching.core.model.CodePointSequence;
import com.fuzzy.matching.core.model.SequenceFactory;
import com.fuzzy.matching.core.model.SymbolSequence;
import com.fuzzy.matching.similarity.Levenshtein;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Approximate generalized median strings and set medians over one symbol kind.
 *
 * <p>Every operation comes in three shapes: a plain list (weight 1.0 each), a list with a
 * parallel weight array, and a prepared {@link MedianInput}. An empty input always yields an
 * empty sequence.</p>
 *
 * <p>Instances are stateless and thread-safe.</p>
 *
 * @param <S> the sequence type
 */
public class MedianEngine<S extends SymbolSequence<S>> {

    private static final Logger log = LoggerFactory.getLogger(MedianEngine.class);

    private final SequenceFactory<S> factory;

    public MedianEngine(SequenceFactory<S> factory) {
        this.factory = Objects.requireNonNull(factory, "factory is required");
    }

    public static MedianEngine<CodePointSequence> forCodePoints() {
        return new MedianEngine<>(CodePointSequence.FACTORY);
    }

    public static MedianEngine<ByteSequence> forBytes() {
        return new MedianEngine<>(ByteSequence.FACTORY);
    }

    // ========== Greedy median ==========

    public S greedyMedian(List<S> strings) {
        return greedyMedian(MedianInput.of(strings));
    }

    public S greedyMedian(List<S> strings, double[] weights) {
        return greedyMedian(MedianInput.of(strings, weights));
    }

    /**
     * Builds a generalized median symbol by symbol, see {@link GreedyMedian}.
     */
    public S greedyMedian(MedianInput<S> input) {
        if (input.isEmpty()) {
            return factory.empty();
        }
        S median = factory.fromSymbols(GreedyMedian.compute(input.symbols(), input.weights()));
        log.debug("Greedy median of {} strings has length {}", input.size(), median.length());
        return median;
    }

    // ========== Quick median ==========

    public S quickMedian(List<S> strings) {
        return quickMedian(MedianInput.of(strings));
    }

    public S quickMedian(List<S> strings, double[] weights) {
        return quickMedian(MedianInput.of(strings, weights));
    }

    public S quickMedian(MedianInput<S> input) {
        if (input.isEmpty()) {
            return factory.empty();
        }
        S median = factory.fromSymbols(QuickMedian.compute(input.symbols(), input.weights()));
        log.debug("Quick median of {} strings has length {}", input.size(), median.length());
        return median;
    }

    // ========== Set median ==========

    public S setMedian(List<S> strings) {
        return setMedian(MedianInput.of(strings));
    }

    public S setMedian(List<S> strings, double[] weights) {
        return setMedian(MedianInput.of(strings, weights));
    }

    /**
     * Returns the input string minimizing the weighted sum of distances to all inputs.
     */
    public S setMedian(MedianInput<S> input) {
        int index = setMedianIndex(input);
        return index < 0 ? factory.empty() : input.text(index);
    }

    public int setMedianIndex(List<S> strings) {
        return setMedianIndex(MedianInput.of(strings));
    }

    public int setMedianIndex(List<S> strings, double[] weights) {
        return setMedianIndex(MedianInput.of(strings, weights));
    }

    /**
     * @return index of the set median (earliest on ties), or -1 when the input is empty
     */
    public int setMedianIndex(MedianInput<S> input) {
        int index = SetMedian.index(input);
        log.debug("Set median of {} strings is at index {}", input.size(), index);
        return index;
    }

    // ========== Improvement ==========

    public S medianImprove(S candidate, List<S> strings) {
        return medianImprove(candidate, MedianInput.of(strings));
    }

    public S medianImprove(S candidate, List<S> strings, double[] weights) {
        return medianImprove(candidate, MedianInput.of(strings, weights));
    }

    /**
     * Runs one perturbation pass over {@code candidate}. The result never has a larger weighted
     * sum of distances than the candidate; call again for further improvement.
     */
    public S medianImprove(S candidate, MedianInput<S> input) {
        Objects.requireNonNull(candidate, "candidate is required");
        if (input.isEmpty()) {
            return factory.empty();
        }
        S improved = factory.fromSymbols(
                MedianImprover.improve(candidate.toSymbolArray(), input.symbols(), input.weights()));
        log.debug("Improved median candidate of length {} to length {}", candidate.length(), improved.length());
        return improved;
    }

    /**
     * Weighted sum of unit-cost distances between {@code candidate} and every input string.
     */
    public double sumOfDistances(S candidate, MedianInput<S> input) {
        Objects.requireNonNull(candidate, "candidate is required");
        double sum = 0.0;
        for (int i = 0; i < input.size(); i++) {
            sum += input.weight(i) * Levenshtein.distance(candidate, input.text(i));
        }
        return sum;
    }

    public SequenceFactory<S> getFactory() {
        return factory;
    }
}
