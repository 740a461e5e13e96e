package com.foundry.core.scheduler;

import com.foundry.core.engine.PipelineStateMachine;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * State shared by all milestones of one pipeline run.
 * <p>
 * The completed and failed sets are only touched by the control loop thread.
 */
public final class RunContext {

    private final String pipelineId;
    private final PipelineStateMachine stateMachine;
    private final Set<String> completed = new LinkedHashSet<>();
    private final Set<String> failed = new LinkedHashSet<>();

    public RunContext(String pipelineId, PipelineStateMachine stateMachine) {
        this.pipelineId = pipelineId;
        this.stateMachine = stateMachine;
    }

    public String pipelineId() { return pipelineId; }
    public PipelineStateMachine stateMachine() { return stateMachine; }

    /** Ids of MERGED work items, across milestones. */
    public Set<String> completed() { return completed; }

    /** Ids of BLOCKED or FAILED work items, across milestones. */
    public Set<String> failed() { return failed; }
}
