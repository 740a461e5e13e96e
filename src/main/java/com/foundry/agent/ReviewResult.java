package com.foundry.agent;

/**
 * @param approved whether the work item may be merged
 * @param feedback reviewer notes, used as the failure reason on rejection
 */
public record ReviewResult(boolean approved, String feedback) {

    public static ReviewResult approve(String feedback) {
        return new ReviewResult(true, feedback);
    }

    public static ReviewResult reject(String feedback) {
        return new ReviewResult(false, feedback);
    }
}
