package com.foundry.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Foundry-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String PIPELINE_ID = "pipelineId";
    public static final String MILESTONE_ID = "milestoneId";
    public static final String WORK_ITEM_ID = "workItemId";
    public static final String EXECUTOR_ID = "executorId";

    private MdcContext() {}

    public static void setPipeline(String pipelineId) {
        MDC.put(PIPELINE_ID, pipelineId);
    }

    public static void setMilestone(String pipelineId, String milestoneId) {
        MDC.put(PIPELINE_ID, pipelineId);
        MDC.put(MILESTONE_ID, milestoneId);
    }

    public static void setWorkItem(String pipelineId, String workItemId, String executorId) {
        MDC.put(PIPELINE_ID, pipelineId);
        MDC.put(WORK_ITEM_ID, workItemId);
        MDC.put(EXECUTOR_ID, executorId);
    }

    public static void clearMilestone() {
        MDC.remove(MILESTONE_ID);
    }

    /** Removes only the work item keys, leaving the pipeline context in place. */
    public static void clearWorkItem() {
        MDC.remove(WORK_ITEM_ID);
        MDC.remove(EXECUTOR_ID);
    }

    public static void clear() {
        MDC.remove(PIPELINE_ID);
        MDC.remove(MILESTONE_ID);
        MDC.remove(WORK_ITEM_ID);
        MDC.remove(EXECUTOR_ID);
    }
}
