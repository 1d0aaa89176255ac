package com.cronium.engine.lifecycle;

import com.cronium.common.config.CroniumConfig;
import com.cronium.engine.MutableClock;
import com.cronium.engine.TestEvents;
import com.cronium.engine.action.ActionValidationException;
import com.cronium.engine.action.ActionValidator;
import com.cronium.engine.dispatch.DispatchOutcome;
import com.cronium.engine.model.ActionTrigger;
import com.cronium.engine.model.Event;
import com.cronium.engine.model.EventStatus;
import com.cronium.engine.model.LogStatus;
import com.cronium.engine.model.ScheduleUnit;
import com.cronium.engine.schedule.JobScheduler;
import com.cronium.engine.store.InMemoryStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class EventLifecycleServiceTest {

    private InMemoryStore store;
    private JobScheduler scheduler;
    private EventLifecycleService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryStore();
        CroniumConfig config = TestEvents.fastConfig();
        MutableClock clock = new MutableClock(Instant.parse("2026-06-01T09:00:00Z"));
        scheduler = new JobScheduler(store, config.getScheduler(), clock);
        scheduler.setDispatcher((event, input) -> new DispatchOutcome(event.getId(), 0L, LogStatus.SUCCESS,
                "ran " + input.getOrDefault("who", "?"), null, null, null, List.of()));
        service = new EventLifecycleService(store, scheduler,
                new ActionValidator(store, store, config.getNotifications()), clock);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void create_activeScheduledEvent_armsTimerAndResetsCounters() {
        Event created = service.create(TestEvents.activeBash("nightly")
                .scheduleNumber(1).scheduleUnit(ScheduleUnit.HOURS)
                .executionCount(9).failureCount(3)
                .build());

        assertNotNull(created.getId());
        assertEquals(0, created.getExecutionCount());
        assertEquals(0, created.getFailureCount());
        assertTrue(scheduler.isScheduled(created.getId()));
        assertEquals(Instant.parse("2026-06-01T10:00:00Z"), created.getNextRunAt());
    }

    @Test
    void create_draft_isNotArmed() {
        Event created = service.create(TestEvents.activeBash("draft").status(EventStatus.DRAFT).build());

        assertFalse(scheduler.isScheduled(created.getId()));
    }

    @Test
    void update_rejectsSelfReference() {
        Event created = service.create(TestEvents.activeBash("a").build());
        Event changes = created.toBuilder()
                .actions(TestEvents.actions(TestEvents.runEvent(ActionTrigger.ON_SUCCESS, created.getId())))
                .build();

        assertThrows(ActionValidationException.class, () -> service.update(created.getId(), changes));
        assertTrue(service.get(created.getId()).getActions().isEmpty());
    }

    @Test
    void update_keepsCountersAndReArms() {
        Event created = service.create(TestEvents.activeBash("a").build());
        store.updateEvent(created.getId(), e -> e.setSuccessCount(5));

        Event updated = service.update(created.getId(), created.toBuilder()
                .name("renamed").scheduleNumber(5).scheduleUnit(ScheduleUnit.MINUTES).successCount(0).build());

        assertEquals("renamed", updated.getName());
        assertEquals(5, updated.getSuccessCount());
        assertEquals(Instant.parse("2026-06-01T09:05:00Z"), scheduler.nextInvocation(created.getId()).orElseThrow());
    }

    @Test
    void pauseAndActivate_toggleTimerAndResetFailures() {
        Event created = service.create(TestEvents.activeBash("a").build());
        store.updateEvent(created.getId(), e -> e.setFailureCount(4));

        Event paused = service.pause(created.getId());
        assertEquals(EventStatus.PAUSED, paused.getStatus());
        assertNull(paused.getNextRunAt());
        assertFalse(scheduler.isScheduled(created.getId()));

        Event active = service.activate(created.getId());
        assertEquals(EventStatus.ACTIVE, active.getStatus());
        assertEquals(0, active.getFailureCount());
        assertTrue(scheduler.isScheduled(created.getId()));
    }

    @Test
    void activate_keepsExecutionCountByDefault() {
        Event created = service.create(TestEvents.activeBash("limited").maxExecutions(3).build());
        store.updateEvent(created.getId(), e -> {
            e.setExecutionCount(3);
            e.setStatus(EventStatus.PAUSED);
        });

        Event active = service.activate(created.getId());

        assertEquals(3, active.getExecutionCount());
    }

    @Test
    void activate_withResetCounter_clearsExecutionCount() {
        Event created = service.create(TestEvents.activeBash("limited").maxExecutions(3).build());
        store.updateEvent(created.getId(), e -> {
            e.setExecutionCount(3);
            e.setStatus(EventStatus.PAUSED);
        });

        Event active = service.activate(created.getId(), true);

        assertEquals(EventStatus.ACTIVE, active.getStatus());
        assertEquals(0, active.getExecutionCount());
        assertTrue(scheduler.isScheduled(created.getId()));
    }

    @Test
    void activate_resetCounterOnActiveFlag_clearsExecutionCount() {
        Event created = service.create(TestEvents.activeBash("limited")
                .maxExecutions(3).resetCounterOnActive(true).build());
        store.updateEvent(created.getId(), e -> e.setExecutionCount(2));

        assertEquals(0, service.activate(created.getId()).getExecutionCount());
    }

    @Test
    void resetCounter_clearsCountOnly() {
        Event created = service.create(TestEvents.activeBash("a").status(EventStatus.PAUSED).build());
        store.updateEvent(created.getId(), e -> {
            e.setExecutionCount(7);
            e.setFailureCount(2);
        });

        Event reset = service.resetCounter(created.getId());

        assertEquals(0, reset.getExecutionCount());
        assertEquals(2, reset.getFailureCount());
        assertEquals(EventStatus.PAUSED, reset.getStatus());
        assertThrows(EventNotFoundException.class, () -> service.resetCounter(404));
    }

    @Test
    void delete_cancelsTimerThenRemoves() {
        Event created = service.create(TestEvents.activeBash("a").build());

        service.delete(created.getId());

        assertFalse(scheduler.isScheduled(created.getId()));
        assertThrows(EventNotFoundException.class, () -> service.get(created.getId()));
        assertThrows(EventNotFoundException.class, () -> service.delete(created.getId()));
    }

    @Test
    void runNow_passesInputToDispatcher() {
        Event created = service.create(TestEvents.activeBash("a").status(EventStatus.DRAFT).build());

        Optional<DispatchOutcome> outcome = service.runNow(created.getId(), Map.of("who", "api"));

        assertEquals("ran api", outcome.orElseThrow().output());
    }

    @Test
    void unknownEvent_isReported() {
        assertThrows(EventNotFoundException.class, () -> service.logs(42, 10));
        assertThrows(EventNotFoundException.class, () -> service.runNow(42, Map.of()));
    }
}
