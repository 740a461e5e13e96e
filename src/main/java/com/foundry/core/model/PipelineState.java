package com.foundry.core.model;

/**
 * States of the pipeline state machine.
 * <p>
 * Pausing is not a state: it gates admission of new work without
 * discarding whichever state the pipeline was in.
 */
public enum PipelineState {
    IDLE,
    PLANNING,
    EXECUTING,
    REVIEWING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
