package com.foundry.core.model;

/**
 * Lifecycle status of an executor instance.
 */
public enum ExecutorStatus {
    IDLE,
    RUNNING,
    WAITING,
    ERROR,
    TERMINATED
}
