package com.foundry.core.pool;

/**
 * Thrown when a worker is requested while every slot is occupied.
 */
public class PoolAtCapacityException extends RuntimeException {

    public PoolAtCapacityException(int capacity) {
        super("Worker pool at capacity (" + capacity + " workers)");
    }
}
