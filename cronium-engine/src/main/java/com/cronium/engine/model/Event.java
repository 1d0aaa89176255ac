package com.cronium.engine.model;

import com.cronium.sandbox.SandboxTypes.HttpRequestSpec;
import com.cronium.sandbox.ScriptType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A schedulable unit of script or HTTP work.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Event {
    private Long id;
    private String name;
    private String description;
    /** Owner; scopes user variables. */
    private String userId;

    // ── What to run ──
    @Builder.Default
    private ScriptType scriptType = ScriptType.BASH;
    private String content;
    private HttpRequestSpec httpRequest;
    @Builder.Default
    private Map<String, String> env = new LinkedHashMap<>();

    // ── When to run ──
    @Builder.Default
    private TriggerType triggerType = TriggerType.MANUAL;
    private Integer scheduleNumber;
    private ScheduleUnit scheduleUnit;
    /** Raw cron expression; takes precedence over number and unit. */
    private String customSchedule;
    private Instant startTime;

    // ── How to run ──
    @Builder.Default
    private int timeoutValue = 30;
    @Builder.Default
    private TimeoutUnit timeoutUnit = TimeoutUnit.SECONDS;
    private int retries;
    @Builder.Default
    private RunLocation runLocation = RunLocation.LOCAL;
    @Builder.Default
    private List<Server> servers = new ArrayList<>();

    // ── Limits and counters ──
    /** 0 = unlimited. */
    private int maxExecutions;
    private int executionCount;
    /** Clear the execution count whenever the event is activated. */
    private boolean resetCounterOnActive;
    /** 0 = unlimited. */
    private int maxFailures;
    private int failureCount;
    private int successCount;

    @Builder.Default
    private EventStatus status = EventStatus.DRAFT;
    private Instant lastRunAt;
    private Instant nextRunAt;
    private Instant createdAt;
    private Instant updatedAt;

    @Builder.Default
    private List<ConditionalAction> actions = new ArrayList<>();

    public long timeoutMs() {
        TimeoutUnit unit = timeoutUnit != null ? timeoutUnit : TimeoutUnit.SECONDS;
        return timeoutValue > 0 ? unit.toMillis(timeoutValue) : 30_000L;
    }

    @JsonIgnore
    public boolean isScheduled() {
        return triggerType == TriggerType.SCHEDULED;
    }

    public boolean hasCustomSchedule() {
        return customSchedule != null && !customSchedule.isBlank();
    }

    public List<ConditionalAction> actionsFor(ActionTrigger trigger) {
        if (actions == null)
            return List.of();
        return actions.stream().filter(a -> a.getTrigger() == trigger).toList();
    }

    /** Remote targets this event runs on; empty means local execution. */
    public List<Server> executionTargets() {
        if (runLocation != RunLocation.REMOTE || servers == null)
            return List.of();
        return servers;
    }
}
