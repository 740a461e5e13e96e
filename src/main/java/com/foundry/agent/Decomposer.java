package com.foundry.agent;

import com.foundry.core.model.Milestone;
import com.foundry.core.model.WorkItem;

import java.util.List;

/**
 * Breaks a milestone into work items with dependencies.
 */
public interface Decomposer {

    /**
     * Returns the work items of a milestone. Returned items are PENDING and not yet persisted.
     */
    List<WorkItem> decompose(Milestone milestone);

    /**
     * Gives the decomposer the requirements when planning was skipped on recovery.
     */
    default void prepare(String requirements) {
    }
}
