package com.cronium.engine.dispatch;

import com.cronium.common.config.CroniumConfig;
import com.cronium.common.infra.Backoff;
import com.cronium.common.infra.ErrorUtils;
import com.cronium.engine.action.ConditionalActionDispatcher;
import com.cronium.engine.action.ExecutionCounter;
import com.cronium.engine.model.Event;
import com.cronium.engine.model.ExecutionLog;
import com.cronium.engine.model.LogStatus;
import com.cronium.engine.model.Server;
import com.cronium.engine.schedule.EventDispatcher;
import com.cronium.engine.store.EventStore;
import com.cronium.sandbox.SandboxException;
import com.cronium.sandbox.SandboxRunner;
import com.cronium.sandbox.SandboxTypes.ExecutionRequest;
import com.cronium.sandbox.SandboxTypes.ExecutionResult;
import com.cronium.sandbox.ScriptType;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs one accepted fire of an event end to end: execution record, sandbox
 * run on every target, counters, conditional actions and execution-count
 * bookkeeping.
 * <p>
 * Exactly one execution record is written per dispatch. With several remote
 * targets the runs are staggered, retried on errors and joined before the
 * record is completed with an aggregated status.
 */
@Slf4j
public class DispatchCoordinator implements EventDispatcher {

    static final String SEPARATOR = "=".repeat(50);

    private final EventStore store;
    private final SandboxRunner runner;
    private final ConditionalActionDispatcher actions;
    private final ExecutionCounter counter;
    private final TargetRetryPolicy retryPolicy;
    private final CroniumConfig.DispatchConfig config;
    private final String localServerName;
    private final int previewChars;
    private final Executor fanOutExecutor;
    private final Clock clock;

    public DispatchCoordinator(EventStore store, SandboxRunner runner, ConditionalActionDispatcher actions,
            ExecutionCounter counter, CroniumConfig config, Clock clock) {
        this(store, runner, actions, counter, config, clock, Executors.newCachedThreadPool(fanOutThreads()));
    }

    public DispatchCoordinator(EventStore store, SandboxRunner runner, ConditionalActionDispatcher actions,
            ExecutionCounter counter, CroniumConfig config, Clock clock, Executor fanOutExecutor) {
        this.store = store;
        this.runner = runner;
        this.actions = actions;
        this.counter = counter;
        this.config = config.getDispatch() != null ? config.getDispatch() : new CroniumConfig.DispatchConfig();
        this.retryPolicy = new TargetRetryPolicy(this.config);
        this.localServerName = config.getNotifications() != null
                ? config.getNotifications().getLocalServerName()
                : "Local";
        this.previewChars = config.getLogging() != null ? config.getLogging().getPreviewChars() : 200;
        this.fanOutExecutor = fanOutExecutor;
        this.clock = clock;
    }

    @Override
    public DispatchOutcome dispatch(Event event, Map<String, Object> input) {
        return dispatch(event, input, null);
    }

    /**
     * @param existingLogId running record created by the caller, or null to
     *                      create one here
     */
    public DispatchOutcome dispatch(Event event, Map<String, Object> input, Long existingLogId) {
        Map<String, Object> safeInput = input != null ? input : Map.of();
        long logId = existingLogId != null ? existingLogId : store.createLog(runningLog(event)).getId();

        List<Server> servers = event.getScriptType() == ScriptType.HTTP_REQUEST
                ? List.of()
                : event.executionTargets();
        log.info("Dispatching event {} ({}) on {} target(s), record {}", event.getId(), event.getName(),
                Math.max(1, servers.size()), logId);

        List<TargetOutcome> outcomes;
        LogStatus status;
        String output;
        String error;
        JsonNode data;
        Boolean condition;
        if (servers.size() <= 1) {
            TargetOutcome single = runSingle(event, safeInput, servers.isEmpty() ? null : servers.get(0));
            outcomes = List.of(single);
            status = single.success() ? LogStatus.SUCCESS
                    : single.timedOut() ? LogStatus.TIMEOUT : LogStatus.FAILURE;
            output = single.output();
            error = blankToNull(single.error());
            data = single.success() ? single.data() : null;
            condition = single.condition();
        } else {
            outcomes = fanOut(event, safeInput, servers);
            status = aggregateStatus(outcomes);
            output = combinedOutput(outcomes);
            error = combinedErrors(outcomes);
            data = firstProduced(outcomes, TargetOutcome::data);
            condition = firstProduced(outcomes, TargetOutcome::condition);
        }

        ExecutionLog record = complete(logId, event, status, output, error);
        boolean success = status == LogStatus.SUCCESS;
        if (success) {
            log.info("Event {} ({}) succeeded", event.getId(), event.getName());
        } else {
            log.warn("Event {} ({}) finished with {}: {}", event.getId(), event.getName(), status,
                    ErrorUtils.preview(error, previewChars));
        }

        Event current = counter.recordOutcome(event.getId(), success).orElse(event);
        actions.fireAll(current, record, success, condition);
        counter.recordExecution(event.getId());

        return new DispatchOutcome(event.getId(), logId, status, output, error, data, condition, outcomes);
    }

    // ── Single target ──

    private TargetOutcome runSingle(Event event, Map<String, Object> input, Server server) {
        try {
            return execute(event, input, server);
        } catch (SandboxException | RuntimeException e) {
            log.error("Event {} could not run on {}: {}", event.getId(), targetName(server),
                    ErrorUtils.formatErrorMessage(e));
            return TargetOutcome.failed(targetName(server), ErrorUtils.formatErrorMessage(e), 1);
        }
    }

    private TargetOutcome execute(Event event, Map<String, Object> input, Server server) throws SandboxException {
        ExecutionResult result;
        if (event.getScriptType() == ScriptType.HTTP_REQUEST) {
            if (event.getHttpRequest() == null) {
                throw new IllegalArgumentException("Event " + event.getId() + " has no HTTP request configured");
            }
            result = runner.runHttp(event.getHttpRequest());
        } else {
            result = runner.runScript(request(event, input, server), server != null ? server.toTarget() : null);
        }
        return new TargetOutcome(targetName(server), result.isSuccess(), result.isTimedOut(), result.getStdout(),
                result.errorText(), result.getOutput(), result.getCondition(), 1);
    }

    private ExecutionRequest request(Event event, Map<String, Object> input, Server server) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("id", event.getId());
        metadata.put("name", event.getName());
        metadata.put("scriptType", String.valueOf(event.getScriptType()));
        metadata.put("runLocation", String.valueOf(event.getRunLocation()));
        metadata.put("server", targetName(server));
        metadata.put("executionCount", event.getExecutionCount());
        metadata.put("successCount", event.getSuccessCount());
        metadata.put("failureCount", event.getFailureCount());

        return ExecutionRequest.builder()
                .scriptType(event.getScriptType())
                .content(event.getContent())
                .env(event.getEnv() != null ? new LinkedHashMap<>(event.getEnv()) : new LinkedHashMap<>())
                .timeoutMs(event.timeoutMs())
                .input(new LinkedHashMap<>(input))
                .metadata(metadata)
                .userId(event.getUserId())
                .build();
    }

    // ── Multiple targets ──

    private List<TargetOutcome> fanOut(Event event, Map<String, Object> input, List<Server> servers) {
        List<CompletableFuture<TargetOutcome>> futures = new ArrayList<>();
        for (int i = 0; i < servers.size(); i++) {
            Server server = servers.get(i);
            long delay = staggerDelay(i);
            Executor executor = delay > 0
                    ? CompletableFuture.delayedExecutor(delay, TimeUnit.MILLISECONDS, fanOutExecutor)
                    : fanOutExecutor;
            if (delay > 0)
                log.debug("Staggering server {} by {}ms", targetName(server), delay);
            futures.add(CompletableFuture.supplyAsync(() -> runWithRetry(event, input, server), executor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        return futures.stream().map(CompletableFuture::join).toList();
    }

    long staggerDelay(int index) {
        return index == 0 ? 0 : config.getStaggerBaseMs() + config.getStaggerStepMs() * index;
    }

    private TargetOutcome runWithRetry(Event event, Map<String, Object> input, Server server) {
        String name = targetName(server);
        for (int attempt = 1;; attempt++) {
            try {
                return execute(event, input, server).withAttempts(attempt);
            } catch (SandboxException | RuntimeException e) {
                String message = ErrorUtils.formatErrorMessage(e);
                if (!retryPolicy.shouldRetry(attempt)) {
                    log.error("Server {} failed after {} attempt(s): {}", name, attempt, message);
                    return TargetOutcome.failed(name, message, attempt);
                }
                long delay = retryPolicy.delayAfter(attempt, e);
                log.warn("Server {} attempt {}/{} failed: {}; retrying in {}ms", name, attempt,
                        retryPolicy.maxAttempts(), message, delay);
                try {
                    Backoff.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return TargetOutcome.failed(name, message, attempt);
                }
            }
        }
    }

    static LogStatus aggregateStatus(List<TargetOutcome> outcomes) {
        long succeeded = outcomes.stream().filter(TargetOutcome::success).count();
        if (succeeded == outcomes.size())
            return LogStatus.SUCCESS;
        return succeeded == 0 ? LogStatus.FAILURE : LogStatus.PARTIAL;
    }

    /**
     * Value from the first target that both succeeded and produced one.
     */
    static <T> T firstProduced(List<TargetOutcome> outcomes, Function<TargetOutcome, T> value) {
        return outcomes.stream()
                .filter(TargetOutcome::success)
                .map(value)
                .filter(Objects::nonNull)
                .findFirst()
                .orElse(null);
    }

    static String combinedOutput(List<TargetOutcome> outcomes) {
        return outcomes.stream()
                .map(o -> "Server: " + o.target() + "\n"
                        + "Status: " + (o.success() ? "SUCCESS" : "FAILED") + "\n"
                        + "Output: " + firstPresent(o.output(), o.error(), "No output") + "\n"
                        + SEPARATOR)
                .collect(Collectors.joining("\n\n"));
    }

    private static String combinedErrors(List<TargetOutcome> outcomes) {
        String errors = outcomes.stream()
                .filter(o -> !o.success())
                .map(o -> o.target() + ": " + firstPresent(o.error(), null, "Unknown error"))
                .collect(Collectors.joining("\n"));
        return errors.isEmpty() ? null : errors;
    }

    // ── Records ──

    private ExecutionLog runningLog(Event event) {
        return ExecutionLog.builder()
                .eventId(event.getId())
                .eventName(event.getName())
                .scriptType(event.getScriptType())
                .userId(event.getUserId())
                .startTime(clock.instant())
                .status(LogStatus.RUNNING)
                .build();
    }

    private ExecutionLog complete(long logId, Event event, LogStatus status, String output, String error) {
        Instant end = clock.instant();
        try {
            return store.completeLog(logId, status, output, error, end);
        } catch (IllegalStateException e) {
            log.error("Could not complete execution record {} of event {}: {}", logId, event.getId(),
                    e.getMessage());
            return ExecutionLog.builder()
                    .id(logId)
                    .eventId(event.getId())
                    .eventName(event.getName())
                    .scriptType(event.getScriptType())
                    .userId(event.getUserId())
                    .endTime(end)
                    .status(status)
                    .output(output)
                    .error(error)
                    .successful(status == LogStatus.SUCCESS)
                    .build();
        }
    }

    private String targetName(Server server) {
        return server != null ? server.toTarget().displayName() : localServerName;
    }

    private static String firstPresent(String first, String second, String fallback) {
        if (first != null && !first.isBlank())
            return first;
        if (second != null && !second.isBlank())
            return second;
        return fallback;
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }

    private static ThreadFactory fanOutThreads() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "cronium-fanout-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
