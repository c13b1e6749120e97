package com.planlens.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("Operation sets both plan and operation keys")
    void setOperation() {
        MdcContext.setOperation("plan-7", "risks");

        assertEquals("plan-7", MDC.get("planId"));
        assertEquals("risks", MDC.get("operation"));
    }

    @Test
    @DisplayName("Null plan id leaves the key unset")
    void nullPlan() {
        MdcContext.setOperation(null, "graph");

        assertNull(MDC.get("planId"));
        assertEquals("graph", MDC.get("operation"));
    }

    @Test
    @DisplayName("Clear removes only Planlens keys")
    void clear() {
        MDC.put("requestId", "r-1");
        MdcContext.setOperation("plan-7", "health");
        MdcContext.clear();

        assertNull(MDC.get("planId"));
        assertNull(MDC.get("operation"));
        assertEquals("r-1", MDC.get("requestId"));
    }
}
