package com.foundry.agent;

import com.foundry.core.model.Milestone;
import com.foundry.core.model.WorkItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PlanFileLoaderTest {

    private static final String PLAN = """
            {
              "milestones": [
                { "id": "M-1", "name": "Foundation", "description": "Base layer",
                  "tasks": [
                    { "id": "T-001", "description": "Create schema", "command": "make schema", "cost": 10 },
                    { "id": "T-002", "description": "Seed data", "dependencies": ["T-001"],
                      "reviewCommand": "make check", "metadata": { "owner": "data" } }
                  ] },
                { "id": "M-2", "phase": 5, "estimatedUsage": 40, "unknownField": true,
                  "tasks": [ { "id": "T-003", "dependencies": ["T-002"] } ] }
              ]
            }
            """;

    @TempDir
    Path tempDir;

    private PlanFileLoader loader;

    @BeforeEach
    void setUp() {
        loader = new PlanFileLoader();
    }

    private String write(String json) throws IOException {
        Path file = tempDir.resolve("plan.json");
        Files.writeString(file, json);
        return file.toString();
    }

    @Nested
    @DisplayName("plan")
    class Plan {

        @Test
        @DisplayName("reads milestones with defaults for name and phase")
        void readsMilestones() throws IOException {
            PlanResult result = loader.plan(write(PLAN));

            assertTrue(result.valid());
            List<Milestone> milestones = result.milestones();
            assertEquals(2, milestones.size());
            assertEquals("Foundation", milestones.get(0).name());
            assertEquals(1, milestones.get(0).phase());
            assertEquals("M-2", milestones.get(1).name());
            assertEquals(5, milestones.get(1).phase());
            assertEquals(40, milestones.get(1).estimatedUsage());
            assertTrue(milestones.get(0).memberIds().isEmpty());
        }

        @Test
        @DisplayName("missing file is an invalid plan")
        void missingFile() {
            PlanResult result = loader.plan(tempDir.resolve("nope.json").toString());
            assertFalse(result.valid());
            assertTrue(result.reason().contains("not found"));
        }

        @Test
        @DisplayName("malformed JSON is an invalid plan")
        void malformedJson() throws IOException {
            PlanResult result = loader.plan(write("{ milestones: "));
            assertFalse(result.valid());
            assertTrue(result.reason().contains("not valid JSON"));
        }

        @Test
        @DisplayName("duplicate task ids across milestones are rejected")
        void duplicateTaskIds() throws IOException {
            PlanResult result = loader.plan(write("""
                    { "milestones": [
                        { "id": "M-1", "tasks": [ { "id": "T-1" } ] },
                        { "id": "M-2", "tasks": [ { "id": "T-1" } ] } ] }
                    """));
            assertFalse(result.valid());
            assertEquals("Duplicate task id T-1", result.reason());
        }

        @Test
        @DisplayName("null or blank dependency ids are rejected")
        void emptyDependencyIds() throws IOException {
            PlanResult withNull = loader.plan(write("""
                    { "milestones": [ { "id": "M-1", "tasks": [
                        { "id": "T-1" }, { "id": "T-2", "dependencies": [null] } ] } ] }
                    """));
            assertFalse(withNull.valid());
            assertEquals("Task T-2 has an empty dependency id", withNull.reason());

            PlanResult withBlank = loader.plan(write("""
                    { "milestones": [ { "id": "M-1", "tasks": [ { "id": "T-1", "dependencies": [" "] } ] } ] }
                    """));
            assertFalse(withBlank.valid());
        }

        @Test
        @DisplayName("a null task entry is rejected")
        void nullTask() throws IOException {
            PlanResult result = loader.plan(write("{ \"milestones\": [ { \"id\": \"M-1\", \"tasks\": [null] } ] }"));
            assertFalse(result.valid());
            assertEquals("Task without id in milestone M-1", result.reason());
        }

        @Test
        @DisplayName("a plan without milestones is rejected")
        void noMilestones() throws IOException {
            PlanResult result = loader.plan(write("{}"));
            assertFalse(result.valid());
        }

        @Test
        @DisplayName("blank requirements are rejected")
        void blankRequirements() {
            assertFalse(loader.plan(" ").valid());
        }
    }

    @Nested
    @DisplayName("decompose")
    class Decompose {

        @Test
        @DisplayName("hands out the tasks of a planned milestone as PENDING items")
        void decomposesPlannedMilestone() throws IOException {
            List<Milestone> milestones = loader.plan(write(PLAN)).milestones();

            List<WorkItem> items = loader.decompose(milestones.get(0));

            assertEquals(List.of("T-001", "T-002"), items.stream().map(WorkItem::id).toList());
            WorkItem first = items.get(0);
            assertEquals("make schema", first.metadataString(CommandExecutionSession.COMMAND_KEY));
            assertEquals(10L, CommandExecutionSession.cost(first));
            WorkItem second = items.get(1);
            assertEquals(List.of("T-001"), second.dependencies());
            assertEquals("make check", second.metadataString(CommandReviewer.REVIEW_COMMAND_KEY));
            assertEquals("data", second.metadataString("owner"));
            assertNull(second.milestoneId());
        }

        @Test
        @DisplayName("task description defaults to its id")
        void descriptionDefault() throws IOException {
            List<Milestone> milestones = loader.plan(write(PLAN)).milestones();
            assertEquals("T-003", loader.decompose(milestones.get(1)).get(0).description());
        }

        @Test
        @DisplayName("an unknown milestone cannot be decomposed")
        void unknownMilestone() {
            assertThrows(IllegalStateException.class,
                    () -> loader.decompose(Milestone.pending("M-9", "Ghost", "", 1)));
        }

        @Test
        @DisplayName("prepare reloads the plan so a fresh instance can decompose")
        void prepareReloads() throws IOException {
            String path = write(PLAN);

            loader.prepare(path);

            assertEquals(1, loader.decompose(Milestone.pending("M-2", "M-2", "", 5)).size());
        }

        @Test
        @DisplayName("prepare with an invalid plan fails")
        void prepareInvalid() {
            assertThrows(IllegalStateException.class, () -> loader.prepare(tempDir.resolve("missing.json").toString()));
        }
    }
}
