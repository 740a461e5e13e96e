package com.foundry.agent;

import com.foundry.core.model.WorkItem;

/**
 * Performs the actual work of an item. Called on a worker thread.
 * Any exception thrown is treated as a failed attempt of the item.
 */
public interface ExecutionSession {

    ExecutionResult run(WorkItem item, String executorId);
}
