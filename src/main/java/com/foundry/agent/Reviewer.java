package com.foundry.agent;

import com.foundry.core.model.WorkItem;

/**
 * Approves or rejects the result of an executed work item.
 * <p>
 * A rejection is a failed attempt of the item. An exception thrown by the
 * reviewer aborts the whole pipeline.
 */
public interface Reviewer {

    ReviewResult review(WorkItem item);
}
