package com.foundry.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    // -- PipelineEvent record tests --------------------------------------------

    @Nested
    @DisplayName("PipelineEvent")
    class PipelineEventTests {

        @Test
        @DisplayName("forWorkItem fills milestone and work item ids")
        void forWorkItem() {
            var event = PipelineEvent.forWorkItem(EventType.TASK_STARTED, "FNDY-2026-0001", "M-1", "T-1",
                    Map.of("executorId", "worker-001"));

            assertEquals(EventType.TASK_STARTED, event.type());
            assertEquals("FNDY-2026-0001", event.pipelineId());
            assertEquals("M-1", event.milestoneId());
            assertEquals("T-1", event.workItemId());
            assertEquals("worker-001", event.payload().get("executorId"));
            assertNotNull(event.timestamp());
        }

        @Test
        @DisplayName("pipeline-level events have no milestone or work item")
        void pipelineLevel() {
            var event = PipelineEvent.of(EventType.PIPELINE_STARTED, "FNDY-2026-0001", null);

            assertNull(event.milestoneId());
            assertNull(event.workItemId());
            assertTrue(event.payload().isEmpty());
        }

        @Test
        @DisplayName("wire names are dotted lowercase")
        void wireNames() {
            assertEquals("task.completed", EventType.TASK_COMPLETED.wireName());
            assertEquals("milestone.stalled", EventType.MILESTONE_STALLED.wireName());
            assertEquals("escalation", EventType.ESCALATION.wireName());
        }
    }

    // -- Subscribe and publish tests -------------------------------------------

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("listener receives every event in publish order")
        void listenerReceivesAll() {
            List<PipelineEvent> received = new ArrayList<>();
            eventBus.subscribe(received::add);

            eventBus.publish(PipelineEvent.of(EventType.PIPELINE_STARTED, "P-1", Map.of()));
            eventBus.publish(PipelineEvent.of(EventType.PAUSED, "P-2", Map.of()));

            assertEquals(List.of(EventType.PIPELINE_STARTED, EventType.PAUSED),
                    received.stream().map(PipelineEvent::type).toList());
        }

        @Test
        @DisplayName("event without pipeline id is still delivered")
        void nullPipelineId() {
            List<PipelineEvent> received = new ArrayList<>();
            eventBus.subscribe(received::add);

            assertDoesNotThrow(() -> eventBus.publish(PipelineEvent.of(EventType.RESUMED, null, Map.of())));
            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("unsubscribe stops delivery")
        void unsubscribe() {
            List<PipelineEvent> received = new ArrayList<>();
            var first = eventBus.subscribe(received::add);
            var second = eventBus.subscribe(received::add);

            first.unsubscribe();
            second.unsubscribe();
            eventBus.publish(PipelineEvent.of(EventType.PIPELINE_STARTED, "P-1", Map.of()));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("failing listener does not affect the others")
        void failingListenerIsolated() {
            List<PipelineEvent> received = new ArrayList<>();
            eventBus.subscribe(e -> { throw new RuntimeException("boom"); });
            eventBus.subscribe(received::add);

            assertDoesNotThrow(() -> eventBus.publish(PipelineEvent.of(EventType.PIPELINE_STARTED, "P-1", Map.of())));
            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("events published from several threads are all delivered")
        void concurrentPublish() throws Exception {
            List<PipelineEvent> received = new CopyOnWriteArrayList<>();
            eventBus.subscribe(received::add);
            var latch = new CountDownLatch(4);

            for (int t = 0; t < 4; t++) {
                new Thread(() -> {
                    for (int i = 0; i < 25; i++) {
                        eventBus.publish(PipelineEvent.of(EventType.TASK_COMPLETED, "P-1", Map.of()));
                    }
                    latch.countDown();
                }).start();
            }

            assertTrue(latch.await(5, TimeUnit.SECONDS));
            assertEquals(100, received.size());
        }
    }
}
