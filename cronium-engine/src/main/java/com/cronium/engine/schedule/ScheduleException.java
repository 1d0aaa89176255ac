package com.cronium.engine.schedule;

/**
 * Schedule configuration that cannot be turned into a recurrence rule.
 */
public class ScheduleException extends RuntimeException {

    public ScheduleException(String message) {
        super(message);
    }

    public ScheduleException(String message, Throwable cause) {
        super(message, cause);
    }
}
