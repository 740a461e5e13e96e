package com.foundry.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setPipeline puts pipelineId in MDC")
    void setPipeline() {
        MdcContext.setPipeline("FNDY-2026-0001");
        assertEquals("FNDY-2026-0001", MDC.get("pipelineId"));
    }

    @Test
    @DisplayName("setWorkItem puts pipelineId, workItemId, and executorId in MDC")
    void setWorkItem() {
        MdcContext.setWorkItem("FNDY-2026-0001", "T-001", "worker-001");
        assertEquals("FNDY-2026-0001", MDC.get("pipelineId"));
        assertEquals("T-001", MDC.get("workItemId"));
        assertEquals("worker-001", MDC.get("executorId"));
    }

    @Test
    @DisplayName("clearMilestone keeps the pipeline id")
    void clearMilestone() {
        MdcContext.setMilestone("FNDY-2026-0001", "M-1");
        MdcContext.clearMilestone();
        assertEquals("FNDY-2026-0001", MDC.get("pipelineId"));
        assertNull(MDC.get("milestoneId"));
    }

    @Test
    @DisplayName("clearWorkItem keeps the pipeline id")
    void clearWorkItem() {
        MdcContext.setWorkItem("FNDY-2026-0001", "T-001", "worker-001");
        MdcContext.clearWorkItem();
        assertEquals("FNDY-2026-0001", MDC.get("pipelineId"));
        assertNull(MDC.get("workItemId"));
        assertNull(MDC.get("executorId"));
    }

    @Test
    @DisplayName("clear removes all foundry MDC keys")
    void clear() {
        MdcContext.setMilestone("FNDY-2026-0001", "M-1");
        MdcContext.setWorkItem("FNDY-2026-0001", "T-001", "worker-001");
        MdcContext.clear();
        assertNull(MDC.get("pipelineId"));
        assertNull(MDC.get("milestoneId"));
        assertNull(MDC.get("workItemId"));
        assertNull(MDC.get("executorId"));
    }
}
