package com.foundry.core.model;

import java.time.Instant;
import java.util.Map;

/**
 * Append-only log record written by executors. Never mutated once stored.
 */
public record LogEntry(
    long id,
    String executorId,
    String level,
    String message,
    Map<String, Object> metadata,
    Instant timestamp
) {

    public LogEntry {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
