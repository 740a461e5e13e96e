package com.foundry.core.engine;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Open/closed gate controlling admission of new work. Starts open.
 * <p>
 * Closing the gate never interrupts work that is already running.
 */
public class PauseGate {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition opened = lock.newCondition();
    private boolean open = true;

    public void close() {
        lock.lock();
        try {
            open = false;
        } finally {
            lock.unlock();
        }
    }

    public void open() {
        lock.lock();
        try {
            open = true;
            opened.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isOpen() {
        lock.lock();
        try {
            return open;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until the gate is open or the timeout elapses.
     *
     * @return true if the gate is open
     */
    public boolean awaitOpen(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (!open) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = opened.awaitNanos(remaining);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }
}
