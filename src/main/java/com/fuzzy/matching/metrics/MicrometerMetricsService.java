package com.fuzzy.matching.metrics;

import com.fuzzy.matching.core.model.EditOpError;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code fuzzy.operation.duration}: Timer (tag: operation)</li>
 *   <li>{@code fuzzy.similarity.score}: DistributionSummary</li>
 *   <li>{@code fuzzy.median.length}: DistributionSummary</li>
 *   <li>{@code fuzzy.editops.invalid}: Counter (tag: error)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<Operation, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<EditOpError, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary similarityScoreSummary;
    private final DistributionSummary medianLengthSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.similarityScoreSummary = DistributionSummary.builder("fuzzy.similarity.score")
                .description("Distribution of similarity scores returned by the matcher")
                .register(registry);
        this.medianLengthSummary = DistributionSummary.builder("fuzzy.median.length")
                .description("Distribution of computed median string lengths")
                .register(registry);
    }

    @Override
    public void recordOperationDuration(Operation operation, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(operation, op ->
                Timer.builder("fuzzy.operation.duration")
                        .description("Duration of string matching operations")
                        .tag("operation", op.tagValue())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordSimilarityScore(double score) {
        similarityScoreSummary.record(score);
    }

    @Override
    public void recordMedianLength(int length) {
        medianLengthSummary.record(length);
    }

    @Override
    public void incrementInvalidEditOps(EditOpError error) {
        Counter counter = counterCache.computeIfAbsent(error, e ->
                Counter.builder("fuzzy.editops.invalid")
                        .description("Number of rejected edit operation lists")
                        .tag("error", e.name())
                        .register(registry));
        counter.increment();
    }
}
