package com.fuzzy.matching.logging;

import com.fuzzy.matching.metrics.Operation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forOperation should set correlationId and operation in MDC")
    void forOperationSetsMDC() {
        try (LogContext ctx = LogContext.forOperation(Operation.QUICK_MEDIAN, "corr-123")) {
            assertEquals("corr-123", MDC.get("correlationId"));
            assertEquals("quick_median", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("MDC should be cleared on close")
    void mdcClearedOnClose() {
        LogContext ctx = LogContext.forOperation(Operation.MEDIAN, "corr-123");
        assertNotNull(MDC.get("correlationId"));

        ctx.close();

        assertNull(MDC.get("correlationId"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("with() should add additional keys to MDC")
    void withAddsKeys() {
        try (LogContext ctx = LogContext.forOperation(Operation.SET_MEDIAN, "corr-123")
                .with("stringCount", "6")) {
            assertEquals("corr-123", MDC.get("correlationId"));
            assertEquals("6", MDC.get("stringCount"));
        }
        assertNull(MDC.get("correlationId"));
        assertNull(MDC.get("stringCount"));
    }

    @Test
    @DisplayName("Keys set outside the context survive close")
    void unrelatedKeysSurvive() {
        MDC.put("requestId", "req-1");
        try (LogContext ctx = LogContext.forOperation(Operation.DISTANCE, "corr-1")) {
            assertEquals("req-1", MDC.get("requestId"));
        }
        assertEquals("req-1", MDC.get("requestId"));
    }

    @Test
    @DisplayName("generateCorrelationId should return unique UUIDs")
    void generateCorrelationIdReturnsUniqueIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateCorrelationId());
        }
        assertEquals(100, ids.size());
        assertTrue(LogContext.generateCorrelationId()
                .matches("[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}"));
    }
}
