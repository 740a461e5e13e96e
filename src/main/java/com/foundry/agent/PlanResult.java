package com.foundry.agent;

import com.foundry.core.model.Milestone;

import java.util.List;

/**
 * Outcome of a planning call.
 *
 * @param milestones planned milestones, empty when invalid
 * @param valid      whether the plan passed the planner's own checks
 * @param reason     why the plan is invalid, null otherwise
 */
public record PlanResult(List<Milestone> milestones, boolean valid, String reason) {

    public PlanResult {
        milestones = milestones == null ? List.of() : List.copyOf(milestones);
    }

    public static PlanResult valid(List<Milestone> milestones) {
        return new PlanResult(milestones, true, null);
    }

    public static PlanResult invalid(String reason) {
        return new PlanResult(List.of(), false, reason);
    }
}
