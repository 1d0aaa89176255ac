package com.cronium.engine.store;

import com.cronium.engine.model.Event;
import com.cronium.engine.model.ExecutionLog;
import com.cronium.engine.model.LogStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Source of truth for events and their execution records. Returned objects
 * are detached copies: callers mutate through {@link #updateEvent}.
 */
public interface EventStore {

    Optional<Event> getEvent(long id);

    List<Event> listEvents();

    List<Event> listActiveEvents();

    /** Insert (assigning an id) or replace an event. */
    Event saveEvent(Event event);

    /** Apply {@code mutation} atomically to the stored event. */
    Optional<Event> updateEvent(long id, Consumer<Event> mutation);

    boolean deleteEvent(long id);

    // ── Execution records ──

    ExecutionLog createLog(ExecutionLog log);

    /**
     * Move a running record to its terminal state.
     *
     * @throws IllegalStateException if the record is missing or already terminal
     */
    ExecutionLog completeLog(long logId, LogStatus status, String output, String error, Instant endTime);

    Optional<ExecutionLog> getLog(long logId);

    Optional<ExecutionLog> latestLog(long eventId);

    /** Newest first. */
    List<ExecutionLog> listLogs(long eventId, int limit);
}
