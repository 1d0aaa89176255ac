package com.cronium.engine.dispatch;

import com.cronium.engine.model.LogStatus;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * What a single dispatch produced. {@code logId} names the one execution
 * record written for it. {@code data} and {@code condition} come from the
 * first successful target that produced each of them.
 */
public record DispatchOutcome(long eventId, long logId, LogStatus status, String output, String error,
        JsonNode data, Boolean condition, List<TargetOutcome> targets) {

    public boolean isSuccess() {
        return status == LogStatus.SUCCESS;
    }

    /** Partial runs count as failures for counters and actions. */
    public boolean countsAsFailure() {
        return !isSuccess();
    }
}
