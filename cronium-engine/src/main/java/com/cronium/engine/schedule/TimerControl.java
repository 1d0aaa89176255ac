package com.cronium.engine.schedule;

/**
 * Handle on the live timers, for code that pauses events mid-dispatch.
 */
public interface TimerControl {

    /** Cancel future fires of {@code eventId}; an in-flight execution is left alone. */
    void cancel(long eventId);

    TimerControl NONE = eventId -> {
    };
}
