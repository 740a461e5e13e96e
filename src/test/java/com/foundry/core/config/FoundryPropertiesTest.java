package com.foundry.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class FoundryPropertiesTest {

    @Test
    @DisplayName("defaults match the documented configuration")
    void defaults() {
        var props = new FoundryProperties();
        assertEquals(5, props.getMaxWorkers());
        assertEquals(3, props.getMaxRetries());
        assertEquals(Duration.ofMillis(50), props.getPollInterval());
        assertEquals(Duration.ofSeconds(5), props.getGracefulTimeout());
        assertEquals(Duration.ofSeconds(600), props.getTaskTimeout());
        assertEquals(Path.of(".", ".foundry", "state.db"), props.getDatabasePath());
    }

    @Test
    @DisplayName("worker and retry limits are clamped to their ranges")
    void clamping() {
        var props = new FoundryProperties();
        props.getPool().setMaxWorkers(50);
        props.getRetry().setMaxRetries(0);
        assertEquals(10, props.getMaxWorkers());
        assertEquals(1, props.getMaxRetries());

        props.getPool().setMaxWorkers(-3);
        props.getRetry().setMaxRetries(9);
        assertEquals(1, props.getMaxWorkers());
        assertEquals(5, props.getMaxRetries());
    }

    @Test
    @DisplayName("database path follows project root and state dir")
    void databasePath() {
        var props = new FoundryProperties();
        props.setProjectRoot("/work/app");
        props.setStateDir("state");
        assertEquals(Path.of("/work/app/state/state.db"), props.getDatabasePath());
    }
}
