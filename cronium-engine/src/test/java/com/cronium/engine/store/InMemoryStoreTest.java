package com.cronium.engine.store;

import com.cronium.engine.TestEvents;
import com.cronium.engine.model.Event;
import com.cronium.engine.model.EventStatus;
import com.cronium.engine.model.ExecutionLog;
import com.cronium.engine.model.LogStatus;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryStoreTest {

    private final InMemoryStore store = new InMemoryStore();

    // =========================================================================
    // Events
    // =========================================================================

    @Nested
    class Events {

        @Test
        void returnedEventsAreDetachedCopies() {
            Event saved = store.saveEvent(TestEvents.activeBash("e").build());
            saved.setName("changed locally");

            assertEquals("e", store.getEvent(saved.getId()).orElseThrow().getName());
        }

        @Test
        void updateEvent_appliesMutationAtomically() {
            long id = store.saveEvent(TestEvents.activeBash("e").build()).getId();

            Event updated = store.updateEvent(id, e -> e.setExecutionCount(e.getExecutionCount() + 1)).orElseThrow();

            assertEquals(1, updated.getExecutionCount());
            assertEquals(1, store.getEvent(id).orElseThrow().getExecutionCount());
            assertTrue(store.updateEvent(999, e -> e.setName("x")).isEmpty());
        }

        @Test
        void listActiveEvents_filtersByStatus() {
            store.saveEvent(TestEvents.activeBash("on").build());
            store.saveEvent(TestEvents.activeBash("off").status(EventStatus.PAUSED).build());

            assertEquals(List.of("on"), store.listActiveEvents().stream().map(Event::getName).toList());
            assertEquals(2, store.listEvents().size());
        }

        @Test
        void explicitIdsAdvanceTheSequence() {
            store.saveEvent(TestEvents.activeBash("imported").id(40L).build());

            assertEquals(41L, store.saveEvent(TestEvents.activeBash("next").build()).getId());
        }
    }

    // =========================================================================
    // Execution records
    // =========================================================================

    @Nested
    class Records {

        @Test
        void completeLog_setsOutcomeAndDuration() {
            ExecutionLog running = store.createLog(ExecutionLog.builder().eventId(1L)
                    .startTime(Instant.parse("2026-01-01T00:00:00Z")).build());
            assertEquals(LogStatus.RUNNING, running.getStatus());
            assertNull(running.getSuccessful());

            ExecutionLog done = store.completeLog(running.getId(), LogStatus.SUCCESS, "out", null,
                    Instant.parse("2026-01-01T00:00:02Z"));

            assertEquals(2000L, done.getDurationMs());
            assertTrue(done.getSuccessful());
        }

        @Test
        void secondTerminalUpdate_isRejected() {
            long id = store.createLog(ExecutionLog.builder().eventId(1L).build()).getId();
            store.completeLog(id, LogStatus.FAILURE, "", "err", null);

            assertThrows(IllegalStateException.class,
                    () -> store.completeLog(id, LogStatus.SUCCESS, "", null, null));
            assertEquals(LogStatus.FAILURE, store.getLog(id).orElseThrow().getStatus());
        }

        @Test
        void nonTerminalCompletion_isRejected() {
            long id = store.createLog(ExecutionLog.builder().eventId(1L).build()).getId();

            assertThrows(IllegalArgumentException.class,
                    () -> store.completeLog(id, LogStatus.RUNNING, "", null, null));
            assertThrows(IllegalStateException.class,
                    () -> store.completeLog(999, LogStatus.SUCCESS, "", null, null));
        }

        @Test
        void listLogs_isNewestFirstAndLimited() {
            for (int i = 0; i < 5; i++)
                store.createLog(ExecutionLog.builder().eventId(3L).output("run " + i).build());
            store.createLog(ExecutionLog.builder().eventId(4L).build());

            List<ExecutionLog> logs = store.listLogs(3, 2);

            assertEquals(List.of("run 4", "run 3"), logs.stream().map(ExecutionLog::getOutput).toList());
            assertEquals("run 4", store.latestLog(3).orElseThrow().getOutput());
        }
    }

    @Test
    void variables_arePerUser() {
        store.setVariable("u1", "k", "v");
        store.setVariable("u2", "k", "other");
        store.deleteVariable("u2", "k");

        assertEquals("v", store.getVariables("u1").get("k"));
        assertTrue(store.getVariables("u2").isEmpty());
        assertTrue(store.getVariables("nobody").isEmpty());
    }
}
