package com.cronium.engine.lifecycle;

import com.cronium.engine.action.ActionValidator;
import com.cronium.engine.dispatch.DispatchOutcome;
import com.cronium.engine.model.Event;
import com.cronium.engine.model.EventStatus;
import com.cronium.engine.model.ExecutionLog;
import com.cronium.engine.schedule.JobScheduler;
import com.cronium.engine.store.EventStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Create, change and remove events while keeping the scheduler's timers in
 * step with the store. Every mutation validates conditional actions first.
 */
@Slf4j
public class EventLifecycleService {

    private final EventStore store;
    private final JobScheduler scheduler;
    private final ActionValidator validator;
    private final Clock clock;

    public EventLifecycleService(EventStore store, JobScheduler scheduler, ActionValidator validator, Clock clock) {
        this.store = store;
        this.scheduler = scheduler;
        this.validator = validator;
        this.clock = clock;
    }

    public List<Event> list() {
        return store.listEvents();
    }

    public Event get(long eventId) {
        return store.getEvent(eventId).orElseThrow(() -> new EventNotFoundException(eventId));
    }

    public Event create(Event event) {
        Instant now = clock.instant();
        Event draft = event.toBuilder()
                .id(null)
                .executionCount(0)
                .failureCount(0)
                .successCount(0)
                .lastRunAt(null)
                .nextRunAt(null)
                .createdAt(now)
                .updatedAt(now)
                .build();
        if (draft.getStatus() == null)
            draft.setStatus(EventStatus.DRAFT);
        validator.validate(draft);

        Event saved = store.saveEvent(draft);
        log.info("Created event {} ({})", saved.getId(), saved.getName());
        scheduler.schedule(saved.getId());
        return get(saved.getId());
    }

    /**
     * Replace an event's configuration. Counters, run times and the creation
     * time are kept; a null status keeps the current one.
     */
    public Event update(long eventId, Event changes) {
        Event existing = get(eventId);
        Event updated = changes.toBuilder()
                .id(eventId)
                .status(changes.getStatus() != null ? changes.getStatus() : existing.getStatus())
                .executionCount(existing.getExecutionCount())
                .failureCount(existing.getFailureCount())
                .successCount(existing.getSuccessCount())
                .lastRunAt(existing.getLastRunAt())
                .nextRunAt(existing.getNextRunAt())
                .createdAt(existing.getCreatedAt())
                .updatedAt(clock.instant())
                .build();
        validator.validate(updated);

        store.saveEvent(updated);
        log.info("Updated event {} ({})", eventId, updated.getName());
        scheduler.update(eventId);
        return get(eventId);
    }

    public void delete(long eventId) {
        scheduler.delete(eventId);
        if (!store.deleteEvent(eventId)) {
            throw new EventNotFoundException(eventId);
        }
        log.info("Deleted event {}", eventId);
    }

    public Event activate(long eventId) {
        return activate(eventId, false);
    }

    /**
     * Make the event active, clearing its failure count, and arm its timer.
     * The execution count is cleared too when {@code resetCounter} is set or
     * the event has {@code resetCounterOnActive}.
     */
    public Event activate(long eventId, boolean resetCounter) {
        Event event = get(eventId);
        validator.validate(event);
        boolean clearCount = resetCounter || event.isResetCounterOnActive();
        store.updateEvent(eventId, e -> {
            e.setStatus(EventStatus.ACTIVE);
            e.setFailureCount(0);
            if (clearCount)
                e.setExecutionCount(0);
            e.setUpdatedAt(clock.instant());
        });
        scheduler.schedule(eventId);
        log.info("Activated event {} ({}){}", eventId, event.getName(), clearCount ? ", execution count reset" : "");
        return get(eventId);
    }

    /**
     * Clear the execution count without touching status or timers.
     */
    public Event resetCounter(long eventId) {
        get(eventId);
        store.updateEvent(eventId, e -> {
            e.setExecutionCount(0);
            e.setUpdatedAt(clock.instant());
        });
        log.info("Reset execution count of event {}", eventId);
        return get(eventId);
    }

    public Event pause(long eventId) {
        get(eventId);
        scheduler.cancel(eventId);
        store.updateEvent(eventId, e -> {
            e.setStatus(EventStatus.PAUSED);
            e.setNextRunAt(null);
            e.setUpdatedAt(clock.instant());
        });
        log.info("Paused event {}", eventId);
        return get(eventId);
    }

    /**
     * Run the event immediately on the calling thread.
     *
     * @return the outcome, or empty when a run of the event is already in flight
     */
    public Optional<DispatchOutcome> runNow(long eventId, Map<String, Object> input) {
        get(eventId);
        return scheduler.runNow(eventId, input);
    }

    public List<ExecutionLog> logs(long eventId, int limit) {
        get(eventId);
        return store.listLogs(eventId, limit);
    }
}
