package com.foundry.core.scheduler;

import com.foundry.core.model.WorkItem;
import com.foundry.core.model.WorkItemStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DependencyResolverTest {

    private DependencyResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new DependencyResolver();
    }

    private WorkItem item(String id, List<String> deps) {
        return WorkItem.pending(id, "Do " + id, deps, Map.of());
    }

    private List<String> ids(List<WorkItem> items) {
        return items.stream().map(WorkItem::id).toList();
    }

    @Test
    @DisplayName("3 independent items -> all ready")
    void independentItems() {
        var items = List.of(item("A", List.of()), item("B", List.of()), item("C", List.of()));
        assertEquals(List.of("A", "B", "C"), ids(resolver.readyItems(items, Set.of())));
    }

    @Test
    @DisplayName("B depends on A -> B not ready until A completed")
    void dependentItemWaitsForDependency() {
        var items = List.of(item("A", List.of()), item("B", List.of("A")));

        assertEquals(List.of("A"), ids(resolver.readyItems(items, Set.of())));
        assertEquals(List.of("A", "B"), ids(resolver.readyItems(items, Set.of("A"))));
    }

    @Test
    @DisplayName("Diamond A->{B,C}->D needs both B and C")
    void diamondDependency() {
        var items = List.of(
                item("B", List.of("A")),
                item("C", List.of("A")),
                item("D", List.of("B", "C"))
        );

        assertEquals(List.of("B", "C"), ids(resolver.readyItems(items, Set.of("A"))));
        assertEquals(List.of("B", "C"), ids(resolver.readyItems(items, Set.of("A", "B"))));
        assertEquals(List.of("B", "C", "D"), ids(resolver.readyItems(items, Set.of("A", "B", "C"))));
    }

    @Test
    @DisplayName("Only PENDING items are ready")
    void onlyPendingItemsAreReady() {
        var items = List.of(
                item("A", List.of()).withStatus(WorkItemStatus.IN_PROGRESS),
                item("B", List.of()).withStatus(WorkItemStatus.MERGED),
                item("C", List.of()).withStatus(WorkItemStatus.BLOCKED),
                item("D", List.of())
        );
        assertEquals(List.of("D"), ids(resolver.readyItems(items, Set.of())));
    }

    @Test
    @DisplayName("Dependency on an unknown id is never satisfied")
    void unknownDependencyNeverReady() {
        var items = List.of(item("A", List.of("GHOST")));
        assertTrue(resolver.readyItems(items, Set.of()).isEmpty());
        assertTrue(resolver.readyItems(items, Set.of("B", "C")).isEmpty());
    }

    @Test
    @DisplayName("Cycle A<->B starves both items")
    void cycleStarves() {
        var items = List.of(item("A", List.of("B")), item("B", List.of("A")));
        assertTrue(resolver.readyItems(items, Set.of()).isEmpty());
    }

    @Test
    @DisplayName("Empty input -> empty result")
    void emptyInput() {
        assertTrue(resolver.readyItems(List.of(), Set.of("A")).isEmpty());
    }
}
