package com.foundry.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "foundry")
public class FoundryProperties {

    private String projectRoot = ".";
    private String stateDir = ".foundry";
    private Pool pool = new Pool();
    private Retry retry = new Retry();
    private Scheduler scheduler = new Scheduler();
    private Shutdown shutdown = new Shutdown();
    private Execution execution = new Execution();

    // -- Derived accessors --

    /** Location of the SQLite database file, {@code <projectRoot>/<stateDir>/state.db}. */
    public Path getDatabasePath() {
        return Path.of(projectRoot).resolve(stateDir).resolve("state.db");
    }

    public int getMaxWorkers() { return clamp(pool.maxWorkers, 1, 10); }
    public int getMaxRetries() { return clamp(retry.maxRetries, 1, 5); }
    public Duration getPollInterval() { return Duration.ofMillis(Math.max(1, scheduler.pollIntervalMs)); }
    public Duration getGracefulTimeout() { return Duration.ofSeconds(shutdown.gracefulTimeoutSeconds); }
    public Duration getTaskTimeout() { return Duration.ofSeconds(execution.taskTimeoutSeconds); }

    public String getProjectRoot() { return projectRoot; }
    public void setProjectRoot(String projectRoot) { this.projectRoot = projectRoot; }
    public String getStateDir() { return stateDir; }
    public void setStateDir(String stateDir) { this.stateDir = stateDir; }
    public Pool getPool() { return pool; }
    public void setPool(Pool pool) { this.pool = pool; }
    public Retry getRetry() { return retry; }
    public void setRetry(Retry retry) { this.retry = retry; }
    public Scheduler getScheduler() { return scheduler; }
    public void setScheduler(Scheduler scheduler) { this.scheduler = scheduler; }
    public Shutdown getShutdown() { return shutdown; }
    public void setShutdown(Shutdown shutdown) { this.shutdown = shutdown; }
    public Execution getExecution() { return execution; }
    public void setExecution(Execution execution) { this.execution = execution; }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    public static class Pool {
        private int maxWorkers = 5;

        public int getMaxWorkers() { return maxWorkers; }
        public void setMaxWorkers(int maxWorkers) { this.maxWorkers = maxWorkers; }
    }

    public static class Retry {
        private int maxRetries = 3;

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    }

    public static class Scheduler {
        private long pollIntervalMs = 50;

        public long getPollIntervalMs() { return pollIntervalMs; }
        public void setPollIntervalMs(long pollIntervalMs) { this.pollIntervalMs = pollIntervalMs; }
    }

    public static class Shutdown {
        private long gracefulTimeoutSeconds = 5;

        public long getGracefulTimeoutSeconds() { return gracefulTimeoutSeconds; }
        public void setGracefulTimeoutSeconds(long gracefulTimeoutSeconds) { this.gracefulTimeoutSeconds = gracefulTimeoutSeconds; }
    }

    public static class Execution {
        private long taskTimeoutSeconds = 600;

        public long getTaskTimeoutSeconds() { return taskTimeoutSeconds; }
        public void setTaskTimeoutSeconds(long taskTimeoutSeconds) { this.taskTimeoutSeconds = taskTimeoutSeconds; }
    }
}
