package com.fuzzy.matching.api;

import com.fuzzy.matching.core.model.EditOp;
import com.fuzzy.matching.core.model.MatchingBlock;
import com.fuzzy.matching.core.model.OpCode;
import com.fuzzy.matching.core.model.SymbolSequence;
import com.fuzzy.matching.editops.EditOps;
import com.fuzzy.matching.editops.EditOpsFinder;
import com.fuzzy.matching.editops.InvalidEditOpsException;
import com.fuzzy.matching.editops.OpCodes;
import com.fuzzy.matching.logging.LogContext;
import com.fuzzy.matching.median.MedianEngine;
import com.fuzzy.matching.median.MedianInput;
import com.fuzzy.matching.metrics.MetricsService;
import com.fuzzy.matching.metrics.NoOpMetricsService;
import com.fuzzy.matching.metrics.Operation;
import com.fuzzy.matching.sequence.SequenceDistance;
import com.fuzzy.matching.sequence.SetDistance;
import com.fuzzy.matching.similarity.Hamming;
import com.fuzzy.matching.similarity.JaroSimilarity;
import com.fuzzy.matching.similarity.JaroWinklerSimilarity;
import com.fuzzy.matching.similarity.Levenshtein;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * String-level entry point to the library.
 *
 * <p>Strings are turned into symbol sequences according to {@link MatcherOptions#getSymbolEncoding()},
 * so positions in edit operations and matching blocks count code points or UTF-8 bytes
 * accordingly. Every call is timed and reported to the configured {@link MetricsService}.</p>
 *
 * <p>Usage:</p>
 * <pre>
 * FuzzyMatcher matcher = FuzzyMatcher.builder()
 *         .options(MatcherOptions.defaults())
 *         .metricsService(new MicrometerMetricsService(registry))
 *         .build();
 *
 * int d = matcher.distance("Levenshtein", "Lenvinsten");
 * String median = matcher.median(List.of("SpSm", "mpamm", "Spam", "Spa", "Sua", "hSam"));
 * </pre>
 *
 * <p>Instances are immutable and thread-safe.</p>
 */
public class FuzzyMatcher {

    private static final Logger log = LoggerFactory.getLogger(FuzzyMatcher.class);

    private final MatcherOptions options;
    private final MetricsService metricsService;
    private final StringCodec<?> codec;

    private FuzzyMatcher(Builder builder) {
        this.options = builder.options;
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.codec = StringCodec.forEncoding(options.getSymbolEncoding());
        log.info("FuzzyMatcher initialized with encoding {} and prefix weight {}",
                options.getSymbolEncoding(), options.getPrefixWeight());
    }

    /**
     * Creates a matcher with default options and no metrics.
     */
    public static FuzzyMatcher create() {
        return builder().build();
    }

    public MatcherOptions getOptions() {
        return options;
    }

    // ========== Distances ==========

    /**
     * Unit-cost Levenshtein distance.
     */
    public int distance(String s1, String s2) {
        return timed(Operation.DISTANCE, () -> Levenshtein.distance(encode(s1), encode(s2)));
    }

    /**
     * Levenshtein similarity ratio in {@code [0, 1]}, substitutions counting twice.
     */
    public double ratio(String s1, String s2) {
        return score(timed(Operation.RATIO, () -> Levenshtein.ratio(encode(s1), encode(s2))));
    }

    /**
     * Number of differing positions of two equal-length strings.
     *
     * @throws com.fuzzy.matching.similarity.LengthMismatchException if the lengths differ
     */
    public int hamming(String s1, String s2) {
        return timed(Operation.HAMMING, () -> Hamming.distance(encode(s1), encode(s2)));
    }

    public double jaro(String s1, String s2) {
        return score(timed(Operation.JARO, () -> JaroSimilarity.jaro(encode(s1), encode(s2))));
    }

    /**
     * Jaro-Winkler similarity with the configured prefix weight.
     */
    public double jaroWinkler(String s1, String s2) {
        return jaroWinkler(s1, s2, options.getPrefixWeight());
    }

    public double jaroWinkler(String s1, String s2, double prefixWeight) {
        return score(timed(Operation.JARO_WINKLER,
                () -> JaroWinklerSimilarity.jaroWinkler(encode(s1), encode(s2), prefixWeight)));
    }

    // ========== Medians ==========

    /**
     * Greedy generalized median of the strings, each weighted 1.0.
     */
    public String median(List<String> strings) {
        return median(strings, null);
    }

    /**
     * Greedy generalized median of weighted strings.
     *
     * @param weights one finite, non-negative weight per string, or null for 1.0 each
     */
    public String median(List<String> strings, double[] weights) {
        return medianOperation(Operation.MEDIAN, null, strings, weights);
    }

    /**
     * Runs one improvement pass of {@code candidate} towards the median of the strings.
     */
    public String medianImprove(String candidate, List<String> strings) {
        return medianImprove(candidate, strings, null);
    }

    public String medianImprove(String candidate, List<String> strings, double[] weights) {
        Objects.requireNonNull(candidate, "candidate is required");
        return medianOperation(Operation.MEDIAN_IMPROVE, candidate, strings, weights);
    }

    public String quickMedian(List<String> strings) {
        return quickMedian(strings, null);
    }

    public String quickMedian(List<String> strings, double[] weights) {
        return medianOperation(Operation.QUICK_MEDIAN, null, strings, weights);
    }

    /**
     * Returns the input string closest to all others.
     */
    public String setMedian(List<String> strings) {
        return setMedian(strings, null);
    }

    public String setMedian(List<String> strings, double[] weights) {
        return medianOperation(Operation.SET_MEDIAN, null, strings, weights);
    }

    // ========== Edit operations ==========

    /**
     * Atomic edit operations turning {@code s1} into {@code s2}, without KEEPs.
     */
    public List<EditOp> editOps(String s1, String s2) {
        return timed(Operation.EDIT_OPS, () -> EditOpsFinder.find(encode(s1), encode(s2)));
    }

    /**
     * Expands block operations into atomic ones, dropping KEEPs.
     */
    public List<EditOp> editOps(List<OpCode> opCodes, int len1, int len2) {
        return validated(Operation.EDIT_OPS, () -> OpCodes.toAtomicOps(opCodes, len1, len2, false));
    }

    /**
     * Block operations turning {@code s1} into {@code s2}, covering both strings.
     */
    public List<OpCode> opCodes(String s1, String s2) {
        return timed(Operation.OP_CODES, () -> EditOpsFinder.findBlocks(encode(s1), encode(s2)));
    }

    public List<OpCode> opCodes(List<EditOp> editOps, int len1, int len2) {
        return validated(Operation.OP_CODES, () -> EditOps.toBlockOps(editOps, len1, len2));
    }

    /**
     * Swaps the roles of source and destination.
     */
    public List<EditOp> inverse(List<EditOp> editOps) {
        return validated(Operation.INVERSE, () -> EditOps.invert(editOps));
    }

    public List<OpCode> inverseOpCodes(List<OpCode> opCodes) {
        return validated(Operation.INVERSE, () -> OpCodes.invert(opCodes));
    }

    /**
     * Applies the operations to {@code source}, taking inserted symbols from {@code destination}.
     */
    public String applyEdit(List<EditOp> editOps, String source, String destination) {
        return validated(Operation.APPLY_EDIT, () -> applyEdit(codec, editOps, source, destination));
    }

    public String applyOpCodes(List<OpCode> opCodes, String source, String destination) {
        return validated(Operation.APPLY_EDIT, () -> applyOpCodes(codec, opCodes, source, destination));
    }

    public List<MatchingBlock> matchingBlocks(List<EditOp> editOps, String s1, String s2) {
        return matchingBlocks(editOps, encode(s1).length(), encode(s2).length());
    }

    /**
     * Blocks of symbols left untouched by the operations, ending with {@code (len1, len2, 0)}.
     */
    public List<MatchingBlock> matchingBlocks(List<EditOp> editOps, int len1, int len2) {
        return validated(Operation.MATCHING_BLOCKS, () -> EditOps.matchingBlocks(editOps, len1, len2));
    }

    public List<MatchingBlock> opCodeMatchingBlocks(List<OpCode> opCodes, int len1, int len2) {
        return validated(Operation.MATCHING_BLOCKS, () -> OpCodes.matchingBlocks(opCodes, len1, len2));
    }

    /**
     * Removes an ordered subsequence of already applied operations, so the rest can be applied to
     * the partially edited string.
     */
    public List<EditOp> subtractEdit(List<EditOp> editOps, List<EditOp> subsequence) {
        return validated(Operation.SUBTRACT_EDIT, () -> EditOps.subtract(editOps, subsequence));
    }

    // ========== Token lists ==========

    /**
     * Similarity of two ordered token lists.
     */
    public double seqRatio(List<String> tokens1, List<String> tokens2) {
        return score(timed(Operation.SEQ_RATIO,
                () -> SequenceDistance.ratio(codec.encodeAll(tokens1), codec.encodeAll(tokens2))));
    }

    /**
     * Similarity of two token sets, order ignored.
     */
    public double setRatio(List<String> tokens1, List<String> tokens2) {
        return score(timed(Operation.SET_RATIO,
                () -> SetDistance.ratio(codec.encodeAll(tokens1), codec.encodeAll(tokens2))));
    }

    // ========== Internal ==========

    private String medianOperation(Operation operation, String candidate, List<String> strings, double[] weights) {
        Objects.requireNonNull(strings, "strings is required");
        try (LogContext ctx = LogContext.forOperation(operation, LogContext.generateCorrelationId())
                .with("stringCount", String.valueOf(strings.size()))) {
            return timed(operation, () -> runMedian(codec, operation, candidate, strings, weights));
        }
    }

    private <S extends SymbolSequence<S>> String runMedian(StringCodec<S> codec, Operation operation,
                                                          String candidate, List<String> strings, double[] weights) {
        List<S> encoded = codec.encodeAll(strings);
        MedianInput<S> input = weights == null ? MedianInput.of(encoded) : MedianInput.of(encoded, weights);
        MedianEngine<S> engine = codec.medianEngine();
        S median = switch (operation) {
            case MEDIAN -> engine.greedyMedian(input);
            case QUICK_MEDIAN -> engine.quickMedian(input);
            case SET_MEDIAN -> engine.setMedian(input);
            case MEDIAN_IMPROVE -> engine.medianImprove(codec.encode(candidate), input);
            default -> throw new IllegalStateException("Not a median operation: " + operation);
        };
        log.debug("{} over {} strings has length {}", operation, strings.size(), median.length());
        if (options.isMetricsEnabled()) {
            metricsService.recordMedianLength(median.length());
        }
        return codec.decode(median);
    }

    private static <S extends SymbolSequence<S>> String applyEdit(StringCodec<S> codec, List<EditOp> editOps,
                                                                 String source, String destination) {
        return codec.decode(EditOps.apply(editOps, codec.encode(source), codec.encode(destination)));
    }

    private static <S extends SymbolSequence<S>> String applyOpCodes(StringCodec<S> codec, List<OpCode> opCodes,
                                                                    String source, String destination) {
        return codec.decode(OpCodes.apply(opCodes, codec.encode(source), codec.encode(destination)));
    }

    private SymbolSequence<?> encode(String text) {
        Objects.requireNonNull(text, "text is required");
        return codec.encode(text);
    }

    private double score(double value) {
        if (options.isMetricsEnabled()) {
            metricsService.recordSimilarityScore(value);
        }
        return value;
    }

    private <T> T timed(Operation operation, Supplier<T> call) {
        long start = System.nanoTime();
        try {
            return call.get();
        } finally {
            if (options.isMetricsEnabled()) {
                metricsService.recordOperationDuration(operation, Duration.ofNanos(System.nanoTime() - start));
            }
        }
    }

    /**
     * Times a call that validates edit operations, counting rejected inputs by error kind.
     */
    private <T> T validated(Operation operation, Supplier<T> call) {
        try {
            return timed(operation, call);
        } catch (InvalidEditOpsException e) {
            log.debug("{} rejected edit operations: {}", operation, e.getMessage());
            if (options.isMetricsEnabled()) {
                metricsService.incrementInvalidEditOps(e.getError());
            }
            throw e;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private MatcherOptions options = MatcherOptions.defaults();
        private MetricsService metricsService;

        public Builder options(MatcherOptions options) {
            this.options = Objects.requireNonNull(options, "options is required");
            return this;
        }

        /**
         * Sets the metrics service. Defaults to {@link NoOpMetricsService}.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public FuzzyMatcher build() {
            return new FuzzyMatcher(this);
        }
    }
}
