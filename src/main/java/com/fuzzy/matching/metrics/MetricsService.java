package com.fuzzy.matching.metrics;

import com.fuzzy.matching.core.model.EditOpError;

import java.time.Duration;

/**
 * Interface for recording string matching metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, ensuring the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordOperationDuration(Operation operation, Duration duration);

    void recordSimilarityScore(double score);

    void recordMedianLength(int length);

    void incrementInvalidEditOps(EditOpError error);
}
