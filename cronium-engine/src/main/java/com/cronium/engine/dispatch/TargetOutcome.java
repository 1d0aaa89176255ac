package com.cronium.engine.dispatch;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Result of running an event on one target (the local host or one server).
 *
 * @param target    server name, or the local server name
 * @param success   whether the run succeeded
 * @param timedOut  whether the run hit its timeout
 * @param output    captured stdout
 * @param error     stderr, warnings or the failure message
 * @param data      parsed output.json, if any
 * @param condition value written to condition.json, if any
 * @param attempts  number of attempts made
 */
public record TargetOutcome(String target, boolean success, boolean timedOut, String output, String error,
        JsonNode data, Boolean condition, int attempts) {

    static TargetOutcome failed(String target, String error, int attempts) {
        return new TargetOutcome(target, false, false, "", error, null, null, attempts);
    }

    TargetOutcome withAttempts(int n) {
        return new TargetOutcome(target, success, timedOut, output, error, data, condition, n);
    }
}
