package com.cronium.engine.model;

import com.cronium.sandbox.ScriptType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One execution record. Created as RUNNING and completed exactly once.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionLog {
    private Long id;
    private Long eventId;
    private String eventName;
    private ScriptType scriptType;
    private String userId;
    private Instant startTime;
    private Instant endTime;
    private Long durationMs;
    @Builder.Default
    private LogStatus status = LogStatus.RUNNING;
    private String output;
    private String error;
    /** Null while running. */
    private Boolean successful;
}
