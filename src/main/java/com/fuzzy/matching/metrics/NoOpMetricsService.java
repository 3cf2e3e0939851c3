package com.fuzzy.matching.metrics;

import com.fuzzy.matching.core.model.EditOpError;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordOperationDuration(Operation operation, Duration duration) {
    }

    @Override
    public void recordSimilarityScore(double score) {
    }

    @Override
    public void recordMedianLength(int length) {
    }

    @Override
    public void incrementInvalidEditOps(EditOpError error) {
    }
}
