package com.search.negatives.logging;

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
    @DisplayName("forBatch should set batchId and operation in MDC")
    void forBatchSetsMDC() {
        try (LogContext ctx = LogContext.forBatch("batch-456")) {
            assertEquals("batch-456", MDC.get("batchId"));
            assertEquals("batch", MDC.get("operation"));
            assertNull(MDC.get("unitId"));
        }
    }

    @Test
    @DisplayName("forUnit should set batchId, unitId and operation in MDC")
    void forUnitSetsMDC() {
        try (LogContext ctx = LogContext.forUnit("batch-1", "campaign-7")) {
            assertEquals("batch-1", MDC.get("batchId"));
            assertEquals("campaign-7", MDC.get("unitId"));
            assertEquals("unit", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("with() should add keys that are removed on close")
    void withAddsKeys() {
        try (LogContext ctx = LogContext.forUnit("batch-1", "campaign-7").with("stage", "matching")) {
            assertEquals("matching", MDC.get("stage"));
        }
        assertNull(MDC.get("stage"));
        assertNull(MDC.get("unitId"));
        assertNull(MDC.get("batchId"));
    }

    @Test
    @DisplayName("Closing a unit context leaves unrelated keys alone")
    void unrelatedKeysKept() {
        MDC.put("requestId", "r-1");
        LogContext ctx = LogContext.forUnit("batch-1", "u");
        ctx.close();
        ctx.close();

        assertEquals("r-1", MDC.get("requestId"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("generateCorrelationId should return unique UUIDs")
    void generateCorrelationIdReturnsUniqueIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateCorrelationId());
        }
        assertEquals(100, ids.size());
        assertTrue(ids.iterator().next()
                .matches("[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}"));
    }
}
