package com.foundry.agent;

/**
 * @param success      whether the work completed
 * @param resourceUsed resource units consumed by this attempt, non-negative
 * @param output       summary output or failure reason
 */
public record ExecutionResult(boolean success, long resourceUsed, String output) {

    public static ExecutionResult succeeded(long resourceUsed, String output) {
        return new ExecutionResult(true, resourceUsed, output);
    }

    public static ExecutionResult failed(long resourceUsed, String output) {
        return new ExecutionResult(false, resourceUsed, output);
    }
}
