package com.foundry.agent;

/**
 * Turns requirements into an ordered list of milestones.
 */
public interface Planner {

    /**
     * @param requirements free-form requirements, interpreted by the implementation
     * @return the plan, or an invalid result with a reason
     */
    PlanResult plan(String requirements);
}
