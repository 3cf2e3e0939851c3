package com.fuzzy.matching.metrics;

import com.fuzzy.matching.core.model.EditOpError;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordOperationDuration(Operation.DISTANCE, Duration.ofMillis(1));
                noOp.recordSimilarityScore(0.85);
                noOp.recordMedianLength(7);
                noOp.incrementInvalidEditOps(EditOpError.NOT_ORDERED);
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record operation duration per operation tag")
        void recordOperationDuration() {
            metrics.recordOperationDuration(Operation.DISTANCE, Duration.ofMillis(3));
            metrics.recordOperationDuration(Operation.DISTANCE, Duration.ofMillis(5));
            metrics.recordOperationDuration(Operation.JARO_WINKLER, Duration.ofMillis(2));

            Timer distance = registry.find("fuzzy.operation.duration").tag("operation", "distance").timer();
            Timer jaroWinkler = registry.find("fuzzy.operation.duration").tag("operation", "jaro_winkler").timer();

            assertNotNull(distance);
            assertEquals(2, distance.count());
            assertNotNull(jaroWinkler);
            assertEquals(1, jaroWinkler.count());
        }

        @Test
        @DisplayName("Should record similarity scores")
        void recordSimilarityScore() {
            metrics.recordSimilarityScore(0.5);
            metrics.recordSimilarityScore(1.0);

            DistributionSummary summary = registry.find("fuzzy.similarity.score").summary();

            assertNotNull(summary);
            assertEquals(2, summary.count());
            assertEquals(1.5, summary.totalAmount(), 0.001);
        }

        @Test
        @DisplayName("Should record median lengths")
        void recordMedianLength() {
            metrics.recordMedianLength(4);

            DistributionSummary summary = registry.find("fuzzy.median.length").summary();

            assertNotNull(summary);
            assertEquals(1, summary.count());
            assertEquals(4.0, summary.max(), 0.001);
        }

        @Test
        @DisplayName("Should count rejected edit operations per error")
        void incrementInvalidEditOps() {
            metrics.incrementInvalidEditOps(EditOpError.OUT_OF_BOUNDS);
            metrics.incrementInvalidEditOps(EditOpError.OUT_OF_BOUNDS);
            metrics.incrementInvalidEditOps(EditOpError.BAD_KIND);

            Counter outOfBounds = registry.find("fuzzy.editops.invalid").tag("error", "OUT_OF_BOUNDS").counter();
            Counter badKind = registry.find("fuzzy.editops.invalid").tag("error", "BAD_KIND").counter();

            assertNotNull(outOfBounds);
            assertEquals(2.0, outOfBounds.count());
            assertNotNull(badKind);
            assertEquals(1.0, badKind.count());
        }
    }

    @Test
    @DisplayName("Operation tag values are lower case names")
    void operationTagValues() {
        assertEquals("median_improve", Operation.MEDIAN_IMPROVE.tagValue());
        assertEquals("seq_ratio", Operation.SEQ_RATIO.tagValue());
    }
}
