package com.foundry.core.scheduler;

import com.foundry.core.model.WorkItem;
import com.foundry.core.model.WorkItemStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Selects the work items whose dependencies are all satisfied.
 * <p>
 * A dependency naming an id that never completes (unknown id, cycle, escalated item)
 * is never satisfied; the scheduler loop reports such items as stalled.
 */
@Service
public class DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    /**
     * @param items     candidate items
     * @param completed ids of completed items
     * @return PENDING items whose every dependency is completed, in input order
     */
    public List<WorkItem> readyItems(Collection<WorkItem> items, Set<String> completed) {
        var ready = new ArrayList<WorkItem>();
        for (var item : items) {
            if (item.status() != WorkItemStatus.PENDING) {
                continue;
            }
            if (!allDependenciesSatisfied(item, completed)) {
                log.debug("  {}: deps unsatisfied: {}", item.id(), item.dependencies());
                continue;
            }
            ready.add(item);
        }
        return ready;
    }

    private boolean allDependenciesSatisfied(WorkItem item, Set<String> completed) {
        for (var dep : item.dependencies()) {
            if (!completed.contains(dep)) {
                return false;
            }
        }
        return true;
    }
}
