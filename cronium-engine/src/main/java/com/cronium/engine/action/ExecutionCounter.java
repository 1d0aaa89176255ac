package com.cronium.engine.action;

import com.cronium.engine.model.Event;
import com.cronium.engine.model.EventStatus;
import com.cronium.engine.model.ExecutionLog;
import com.cronium.engine.model.LogStatus;
import com.cronium.engine.schedule.TimerControl;
import com.cronium.engine.store.EventStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Counter bookkeeping after a dispatch, and the automatic pause when an
 * event reaches its max-failures or max-executions limit.
 */
@Slf4j
public class ExecutionCounter {

    private final EventStore store;
    private final TimerControl timers;
    private final Clock clock;

    public ExecutionCounter(EventStore store, TimerControl timers, Clock clock) {
        this.store = store;
        this.timers = timers != null ? timers : TimerControl.NONE;
        this.clock = clock;
    }

    /**
     * Bump the success or failure count and the last-run time. A failure
     * that reaches the max-failures limit pauses the event, whatever its
     * status was (manual runs of drafts included).
     */
    public Optional<Event> recordOutcome(long eventId, boolean success) {
        Instant now = clock.instant();
        AtomicBoolean limitReached = new AtomicBoolean(false);
        Optional<Event> updated = store.updateEvent(eventId, e -> {
            e.setLastRunAt(now);
            if (success) {
                e.setSuccessCount(e.getSuccessCount() + 1);
            } else {
                e.setFailureCount(e.getFailureCount() + 1);
                if (e.getMaxFailures() > 0 && e.getFailureCount() >= e.getMaxFailures()
                        && e.getStatus() != EventStatus.PAUSED) {
                    pauseInPlace(e);
                    limitReached.set(true);
                }
            }
        });
        if (limitReached.get() && updated.isPresent()) {
            afterPause(updated.get(), "Automatically paused after reaching max failures ("
                    + updated.get().getMaxFailures() + ")");
        }
        return updated;
    }

    /**
     * Increment the execution count. Reaching the max-executions limit
     * pauses the event.
     */
    public Optional<Event> recordExecution(long eventId) {
        AtomicBoolean limitReached = new AtomicBoolean(false);
        Optional<Event> updated = store.updateEvent(eventId, e -> {
            e.setExecutionCount(e.getExecutionCount() + 1);
            if (e.getMaxExecutions() > 0 && e.getExecutionCount() >= e.getMaxExecutions()
                    && e.getStatus() == EventStatus.ACTIVE) {
                pauseInPlace(e);
                limitReached.set(true);
            }
        });
        if (limitReached.get() && updated.isPresent()) {
            afterPause(updated.get(), "Automatically paused after reaching max executions ("
                    + updated.get().getMaxExecutions() + ")");
        }
        return updated;
    }

    private static void pauseInPlace(Event e) {
        e.setStatus(EventStatus.PAUSED);
        e.setNextRunAt(null);
    }

    private void afterPause(Event event, String notice) {
        timers.cancel(event.getId());
        Instant now = clock.instant();
        store.createLog(ExecutionLog.builder()
                .eventId(event.getId())
                .eventName(event.getName())
                .scriptType(event.getScriptType())
                .userId(event.getUserId())
                .startTime(now)
                .endTime(now)
                .durationMs(0L)
                .status(LogStatus.PAUSED)
                .output(notice)
                .successful(false)
                .build());
        log.info("Event {} ({}): {}", event.getId(), event.getName(), notice);
    }
}
