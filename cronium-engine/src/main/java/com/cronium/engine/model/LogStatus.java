package com.cronium.engine.model;

/**
 * Status of an execution record. PAUSED marks the notice written when an
 * event is paused automatically.
 */
public enum LogStatus {
    RUNNING,
    SUCCESS,
    FAILURE,
    TIMEOUT,
    PARTIAL,
    PAUSED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
