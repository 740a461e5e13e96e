package com.foundry.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Synchronous in-process fan-out of {@link PipelineEvent}s.
 * <p>
 * Only one pipeline runs per process, so every listener sees every event. Delivery
 * happens on the publishing thread, which is often a worker thread, in subscription
 * order. A listener that throws is logged and skipped.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final List<Consumer<PipelineEvent>> listeners = new CopyOnWriteArrayList<>();

    public void publish(PipelineEvent event) {
        log.debug("{} [{}] item={}", event.type().wireName(), event.pipelineId(), event.workItemId());
        for (Consumer<PipelineEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.warn("Listener failed on {}: {}", event.type().wireName(), e.getMessage(), e);
            }
        }
    }

    /**
     * Registers a listener for all subsequent events.
     *
     * @return handle that removes the listener again
     */
    public Subscription subscribe(Consumer<PipelineEvent> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }
}
