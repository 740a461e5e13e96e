package com.foundry.agent;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.foundry.core.model.Milestone;
import com.foundry.core.model.WorkItem;
import com.foundry.core.model.WorkItemStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link Planner} and {@link Decomposer} backed by a JSON plan file.
 * <p>
 * The requirements string is the path of the plan:
 * <pre>
 * {
 *   "milestones": [
 *     { "id": "M-1", "name": "Foundation", "phase": 1,
 *       "tasks": [
 *         { "id": "T-001", "description": "Create schema", "dependencies": [],
 *           "command": "make schema", "reviewCommand": "make check", "cost": 10 }
 *       ] }
 *   ]
 * }
 * </pre>
 * Tasks are kept per milestone after planning and handed out by {@link #decompose}.
 */
@Component
public class PlanFileLoader implements Planner, Decomposer {

    private static final Logger log = LoggerFactory.getLogger(PlanFileLoader.class);

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PlanDocument(List<MilestoneEntry> milestones) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record MilestoneEntry(String id, String name, String description, Integer phase,
                          Long estimatedUsage, List<TaskEntry> tasks) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TaskEntry(String id, String description, List<String> dependencies, String command,
                     String reviewCommand, Long cost, Map<String, Object> metadata) {}

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Map<String, List<WorkItem>> tasksByMilestone = new ConcurrentHashMap<>();

    @Override
    public PlanResult plan(String requirements) {
        PlanDocument document;
        try {
            document = read(requirements);
        } catch (IllegalArgumentException e) {
            log.warn("Plan rejected: {}", e.getMessage());
            return PlanResult.invalid(e.getMessage());
        }

        String problem = validate(document);
        if (problem != null) {
            log.warn("Plan rejected: {}", problem);
            return PlanResult.invalid(problem);
        }

        tasksByMilestone.clear();
        var milestones = new ArrayList<Milestone>();
        List<MilestoneEntry> entries = document.milestones();
        for (int i = 0; i < entries.size(); i++) {
            MilestoneEntry entry = entries.get(i);
            int phase = entry.phase() != null ? entry.phase() : i + 1;
            String name = entry.name() != null ? entry.name() : entry.id();
            long estimate = entry.estimatedUsage() != null ? entry.estimatedUsage() : 0L;
            milestones.add(new Milestone(entry.id(), name, entry.description(), phase,
                    WorkItemStatus.PENDING, List.of(), estimate, Instant.now()));
            tasksByMilestone.put(entry.id(), toWorkItems(entry.tasks()));
        }
        log.info("Loaded plan from {}: {} milestone(s)", requirements, milestones.size());
        return PlanResult.valid(milestones);
    }

    @Override
    public List<WorkItem> decompose(Milestone milestone) {
        List<WorkItem> items = tasksByMilestone.get(milestone.id());
        if (items == null) {
            throw new IllegalStateException("No tasks loaded for milestone " + milestone.id());
        }
        return items;
    }

    @Override
    public void prepare(String requirements) {
        PlanResult result = plan(requirements);
        if (!result.valid()) {
            throw new IllegalStateException("Cannot load plan " + requirements + ": " + result.reason());
        }
    }

    private PlanDocument read(String requirements) {
        if (requirements == null || requirements.isBlank()) {
            throw new IllegalArgumentException("No plan file given");
        }
        Path path = Path.of(requirements);
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Plan file not found: " + path);
        }
        try {
            return objectMapper.readValue(path.toFile(), PlanDocument.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Plan file is not valid JSON: " + e.getMessage(), e);
        }
    }

    private static String validate(PlanDocument document) {
        if (document == null || document.milestones() == null) {
            return "Plan has no 'milestones' array";
        }
        Set<String> milestoneIds = new HashSet<>();
        Set<String> taskIds = new HashSet<>();
        for (MilestoneEntry entry : document.milestones()) {
            if (entry == null || entry.id() == null || entry.id().isBlank()) {
                return "Milestone without id";
            }
            if (!milestoneIds.add(entry.id())) {
                return "Duplicate milestone id " + entry.id();
            }
            if (entry.tasks() == null) {
                continue;
            }
            for (TaskEntry task : entry.tasks()) {
                if (task == null || task.id() == null || task.id().isBlank()) {
                    return "Task without id in milestone " + entry.id();
                }
                if (!taskIds.add(task.id())) {
                    return "Duplicate task id " + task.id();
                }
                if (task.dependencies() != null
                        && task.dependencies().stream().anyMatch(dep -> dep == null || dep.isBlank())) {
                    return "Task " + task.id() + " has an empty dependency id";
                }
            }
        }
        return null;
    }

    private static List<WorkItem> toWorkItems(List<TaskEntry> tasks) {
        if (tasks == null) {
            return List.of();
        }
        var items = new ArrayList<WorkItem>();
        for (TaskEntry task : tasks) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            if (task.metadata() != null) {
                task.metadata().forEach((key, value) -> {
                    if (value != null) {
                        metadata.put(key, value);
                    }
                });
            }
            if (task.command() != null) metadata.put(CommandExecutionSession.COMMAND_KEY, task.command());
            if (task.reviewCommand() != null) metadata.put(CommandReviewer.REVIEW_COMMAND_KEY, task.reviewCommand());
            if (task.cost() != null) metadata.put(CommandExecutionSession.COST_KEY, task.cost());
            String description = task.description() != null ? task.description() : task.id();
            items.add(WorkItem.pending(task.id(), description, task.dependencies(), metadata));
        }
        return items;
    }
}
