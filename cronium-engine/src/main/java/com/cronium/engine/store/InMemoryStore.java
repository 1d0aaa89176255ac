package com.cronium.engine.store;

import com.cronium.channel.ToolCredential;
import com.cronium.engine.model.Event;
import com.cronium.engine.model.EventStatus;
import com.cronium.engine.model.ExecutionLog;
import com.cronium.engine.model.LogStatus;
import com.cronium.sandbox.UserVariableStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Process-local store for events, execution records, credentials and user
 * variables. Objects are deep-copied through Jackson on the way in and out.
 */
public class InMemoryStore implements EventStore, CredentialStore, UserVariableStore {

    protected static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    protected final Map<Long, Event> events = new ConcurrentHashMap<>();
    protected final Map<Long, ExecutionLog> logs = new ConcurrentHashMap<>();
    protected final Map<Long, ToolCredential> credentials = new ConcurrentHashMap<>();
    protected final Map<String, Map<String, String>> variables = new ConcurrentHashMap<>();

    protected final AtomicLong eventIds = new AtomicLong();
    protected final AtomicLong logIds = new AtomicLong();
    protected final AtomicLong credentialIds = new AtomicLong();

    /** Called after every mutation. */
    protected void onChange() {
    }

    private static <T> T copy(T value, Class<T> type) {
        return value == null ? null : MAPPER.convertValue(value, type);
    }

    // ── Events ──

    @Override
    public Optional<Event> getEvent(long id) {
        return Optional.ofNullable(copy(events.get(id), Event.class));
    }

    @Override
    public List<Event> listEvents() {
        return events.values().stream()
                .sorted(Comparator.comparing(Event::getId))
                .map(e -> copy(e, Event.class))
                .toList();
    }

    @Override
    public List<Event> listActiveEvents() {
        return events.values().stream()
                .filter(e -> e.getStatus() == EventStatus.ACTIVE)
                .sorted(Comparator.comparing(Event::getId))
                .map(e -> copy(e, Event.class))
                .toList();
    }

    @Override
    public Event saveEvent(Event event) {
        Event stored = copy(event, Event.class);
        Instant now = Instant.now();
        if (stored.getId() == null) {
            stored.setId(eventIds.incrementAndGet());
            stored.setCreatedAt(now);
        } else {
            eventIds.accumulateAndGet(stored.getId(), Math::max);
            if (stored.getCreatedAt() == null)
                stored.setCreatedAt(now);
        }
        stored.setUpdatedAt(now);
        events.put(stored.getId(), stored);
        onChange();
        return copy(stored, Event.class);
    }

    @Override
    public Optional<Event> updateEvent(long id, Consumer<Event> mutation) {
        Event updated = events.computeIfPresent(id, (key, current) -> {
            Event working = copy(current, Event.class);
            mutation.accept(working);
            working.setId(key);
            working.setUpdatedAt(Instant.now());
            return working;
        });
        if (updated == null)
            return Optional.empty();
        onChange();
        return Optional.of(copy(updated, Event.class));
    }

    @Override
    public boolean deleteEvent(long id) {
        boolean removed = events.remove(id) != null;
        if (removed)
            onChange();
        return removed;
    }

    // ── Execution records ──

    @Override
    public ExecutionLog createLog(ExecutionLog log) {
        ExecutionLog stored = copy(log, ExecutionLog.class);
        stored.setId(logIds.incrementAndGet());
        if (stored.getStartTime() == null)
            stored.setStartTime(Instant.now());
        if (stored.getStatus() == null)
            stored.setStatus(LogStatus.RUNNING);
        logs.put(stored.getId(), stored);
        onChange();
        return copy(stored, ExecutionLog.class);
    }

    @Override
    public ExecutionLog completeLog(long logId, LogStatus status, String output, String error, Instant endTime) {
        if (status == null || !status.isTerminal()) {
            throw new IllegalArgumentException("Completion status must be terminal: " + status);
        }
        ExecutionLog completed = logs.compute(logId, (key, current) -> {
            if (current == null) {
                throw new IllegalStateException("Execution record not found: " + logId);
            }
            if (current.getStatus() != null && current.getStatus().isTerminal()) {
                throw new IllegalStateException(
                        "Execution record " + logId + " is already " + current.getStatus());
            }
            ExecutionLog working = copy(current, ExecutionLog.class);
            Instant end = endTime != null ? endTime : Instant.now();
            working.setStatus(status);
            working.setOutput(output);
            working.setError(error);
            working.setEndTime(end);
            working.setSuccessful(status == LogStatus.SUCCESS);
            if (working.getStartTime() != null) {
                working.setDurationMs(Duration.between(working.getStartTime(), end).toMillis());
            }
            return working;
        });
        onChange();
        return copy(completed, ExecutionLog.class);
    }

    @Override
    public Optional<ExecutionLog> getLog(long logId) {
        return Optional.ofNullable(copy(logs.get(logId), ExecutionLog.class));
    }

    @Override
    public Optional<ExecutionLog> latestLog(long eventId) {
        return logs.values().stream()
                .filter(l -> l.getEventId() != null && l.getEventId() == eventId)
                .max(Comparator.comparing(ExecutionLog::getId))
                .map(l -> copy(l, ExecutionLog.class));
    }

    @Override
    public List<ExecutionLog> listLogs(long eventId, int limit) {
        return logs.values().stream()
                .filter(l -> l.getEventId() != null && l.getEventId() == eventId)
                .sorted(Comparator.comparing(ExecutionLog::getId).reversed())
                .limit(Math.max(limit, 0))
                .map(l -> copy(l, ExecutionLog.class))
                .toList();
    }

    // ── Credentials ──

    @Override
    public Optional<ToolCredential> getCredential(long toolId) {
        return Optional.ofNullable(copy(credentials.get(toolId), ToolCredential.class));
    }

    @Override
    public ToolCredential saveCredential(ToolCredential credential) {
        ToolCredential stored = copy(credential, ToolCredential.class);
        if (stored.getId() == null) {
            stored.setId(credentialIds.incrementAndGet());
        } else {
            credentialIds.accumulateAndGet(stored.getId(), Math::max);
        }
        credentials.put(stored.getId(), stored);
        onChange();
        return copy(stored, ToolCredential.class);
    }

    // ── User variables ──

    @Override
    public Map<String, String> getVariables(String userId) {
        return new LinkedHashMap<>(variables.getOrDefault(userId, Map.of()));
    }

    @Override
    public void setVariable(String userId, String key, String value) {
        variables.computeIfAbsent(userId, k -> new ConcurrentHashMap<>()).put(key, value);
        onChange();
    }

    @Override
    public void deleteVariable(String userId, String key) {
        Map<String, String> forUser = variables.get(userId);
        if (forUser != null && forUser.remove(key) != null)
            onChange();
    }
}
