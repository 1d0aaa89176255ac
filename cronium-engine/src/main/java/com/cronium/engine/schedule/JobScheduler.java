package com.cronium.engine.schedule;

import com.cronium.common.config.CroniumConfig;
import com.cronium.common.infra.ErrorUtils;
import com.cronium.engine.action.EventLauncher;
import com.cronium.engine.dispatch.DispatchOutcome;
import com.cronium.engine.model.Event;
import com.cronium.engine.model.EventStatus;
import com.cronium.engine.store.EventStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keeps one live timer per active scheduled event and runs accepted fires
 * through the {@link EventDispatcher}.
 * <p>
 * Timer callbacks only re-arm and hand off; dispatch bodies run on a separate
 * worker pool. At most one dispatch per event is in flight at any time
 * (the execution lock table), and fires arriving sooner than
 * {@link DebouncePolicy#minimumInterval(Event)} after the previous accepted
 * fire are dropped.
 */
@Slf4j
public class JobScheduler implements TimerControl, EventLauncher {

    public enum FireResult {
        EXECUTED,
        SKIPPED_LOCKED,
        SKIPPED_INACTIVE,
        SKIPPED_DEBOUNCED
    }

    private final EventStore store;
    private final CroniumConfig.SchedulerConfig config;
    private final Clock clock;
    private final ZoneId zone;
    private final ScheduledExecutorService timers;
    private final ExecutorService workers;

    private final Map<Long, JobHandle> handles = new ConcurrentHashMap<>();
    private final Set<Long> executing = ConcurrentHashMap.newKeySet();
    private final Map<Long, Instant> lastExecution = new ConcurrentHashMap<>();

    private final AtomicBoolean initializing = new AtomicBoolean(false);
    private volatile boolean initialized;
    private volatile Instant lastInitializedAt;

    private EventDispatcher dispatcher;

    public JobScheduler(EventStore store, CroniumConfig.SchedulerConfig config) {
        this(store, config, Clock.systemDefaultZone());
    }

    public JobScheduler(EventStore store, CroniumConfig.SchedulerConfig config, Clock clock) {
        this.store = store;
        this.config = config != null ? config : new CroniumConfig.SchedulerConfig();
        this.clock = clock;
        this.zone = this.config.getTimezone() != null && !this.config.getTimezone().isBlank()
                ? ZoneId.of(this.config.getTimezone())
                : clock.getZone();
        this.timers = Executors.newScheduledThreadPool(Math.max(1, this.config.getTimerThreads()),
                daemonThreads("cronium-timer"));
        this.workers = Executors.newFixedThreadPool(Math.max(1, this.config.getWorkerThreads()),
                daemonThreads("cronium-worker"));
    }

    /**
     * Set the dispatcher that runs accepted fires (typically the dispatch
     * coordinator).
     */
    public void setDispatcher(EventDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    public ZoneId getZone() {
        return zone;
    }

    // ── Initialization ──

    /**
     * Rebuild every timer from the store. Concurrent callers return
     * immediately, as do calls inside the cooldown window after a completed
     * pass.
     */
    public void initialize() {
        if (!config.isEnabled()) {
            log.info("Scheduler disabled by configuration; no timers armed");
            return;
        }
        if (!initializing.compareAndSet(false, true)) {
            log.debug("Scheduler initialization already in progress");
            return;
        }
        try {
            Instant now = clock.instant();
            if (initialized && lastInitializedAt != null
                    && Duration.between(lastInitializedAt, now).toMillis() < config.getInitCooldownMs()) {
                log.debug("Scheduler initialized {} ago, skipping", Duration.between(lastInitializedAt, now));
                return;
            }

            cancelAll();
            executing.clear();
            lastExecution.clear();

            List<Event> active;
            try {
                active = store.listActiveEvents();
            } catch (RuntimeException e) {
                log.error("Failed to load active events: {}", ErrorUtils.formatErrorMessage(e));
                return;
            }

            int armed = 0;
            for (Event event : active) {
                if (event.getId() != null && schedule(event.getId()))
                    armed++;
            }
            initialized = true;
            lastInitializedAt = clock.instant();
            log.info("Scheduler initialized: {} of {} active events armed", armed, active.size());
        } finally {
            initializing.set(false);
        }
    }

    // ── Scheduling ──

    public boolean schedule(Event event) {
        return event.getId() != null && schedule(event.getId());
    }

    /**
     * Arm the timer for {@code eventId} from its stored state, replacing any
     * previous timer.
     *
     * @return whether a timer is now armed
     */
    public synchronized boolean schedule(long eventId) {
        cancel(eventId);

        Optional<Event> current = store.getEvent(eventId);
        if (current.isEmpty()) {
            log.warn("Event {} not found, not scheduling", eventId);
            return false;
        }
        Event event = current.get();
        if (event.getStatus() != EventStatus.ACTIVE || !event.isScheduled()) {
            log.debug("Event {} is {} / {}, not scheduling", eventId, event.getStatus(), event.getTriggerType());
            return false;
        }

        RecurrenceRule rule;
        try {
            rule = RecurrenceRuleBuilder.build(event);
        } catch (ScheduleException e) {
            log.error("Failed to schedule event {} ({}): {}", eventId, event.getName(), e.getMessage());
            return false;
        }

        JobHandle handle = new JobHandle(eventId, rule);
        handles.put(eventId, handle);
        Instant now = clock.instant();
        Instant start = event.getStartTime();
        if (start != null && start.isAfter(now)) {
            handle.armStart(start, now);
            log.info("Event {} ({}) starts at {}, then {}", eventId, event.getName(), start, rule.describe());
        } else {
            handle.armNext(now);
            log.info("Scheduled event {} ({}): {}, next at {}", eventId, event.getName(), rule.describe(),
                    handle.nextInvocation);
        }
        persistNextRun(eventId, handle.nextInvocation);
        return true;
    }

    /**
     * Re-read {@code eventId} and re-arm it if it is still active.
     */
    public boolean update(long eventId) {
        return schedule(eventId);
    }

    public void delete(long eventId) {
        cancel(eventId);
        lastExecution.remove(eventId);
    }

    @Override
    public synchronized void cancel(long eventId) {
        JobHandle handle = handles.remove(eventId);
        if (handle != null) {
            handle.cancel();
            log.debug("Cancelled timer for event {}", eventId);
        }
    }

    private synchronized void cancelAll() {
        handles.values().forEach(JobHandle::cancel);
        handles.clear();
    }

    public boolean isScheduled(long eventId) {
        return handles.containsKey(eventId);
    }

    public Set<Long> scheduledEventIds() {
        return new TreeSet<>(handles.keySet());
    }

    public Optional<Instant> nextInvocation(long eventId) {
        JobHandle handle = handles.get(eventId);
        return handle == null ? Optional.empty() : Optional.ofNullable(handle.nextInvocation);
    }

    public boolean isExecuting(long eventId) {
        return executing.contains(eventId);
    }

    // ── Execution ──

    /**
     * Handle one timer fire of {@code eventId}. Runs the dispatch on the
     * calling thread.
     */
    public FireResult fire(long eventId) {
        if (!executing.add(eventId)) {
            log.warn("Event {} is already executing, skipping this fire", eventId);
            return FireResult.SKIPPED_LOCKED;
        }
        FireResult result;
        try {
            Optional<Event> current = store.getEvent(eventId);
            if (current.isEmpty() || current.get().getStatus() != EventStatus.ACTIVE) {
                log.info("Event {} is missing or no longer active, cancelling its timer", eventId);
                cancel(eventId);
                return FireResult.SKIPPED_INACTIVE;
            }
            Event event = current.get();

            Instant now = clock.instant();
            Instant last = lastExecution.get(eventId);
            Duration minimum = DebouncePolicy.minimumInterval(event);
            if (last != null && Duration.between(last, now).compareTo(minimum) < 0) {
                log.warn("Event {} fired {}ms after the previous run (minimum {}ms), skipping duplicate",
                        eventId, Duration.between(last, now).toMillis(), minimum.toMillis());
                return FireResult.SKIPPED_DEBOUNCED;
            }
            lastExecution.put(eventId, now);

            runDispatch(event, Map.of());
            result = FireResult.EXECUTED;
        } finally {
            executing.remove(eventId);
        }

        JobHandle handle = handles.get(eventId);
        if (handle != null)
            persistNextRun(eventId, handle.nextInvocation);
        return result;
    }

    /**
     * Run {@code eventId} now on the calling thread, through the same
     * single-flight lock as timer fires but without the active-status and
     * debounce checks.
     *
     * @return the outcome, or empty when the event is already executing
     * @throws IllegalArgumentException if the event does not exist
     */
    public Optional<DispatchOutcome> runNow(long eventId, Map<String, Object> input) {
        Event event = store.getEvent(eventId)
                .orElseThrow(() -> new IllegalArgumentException("Event not found: " + eventId));
        if (!executing.add(eventId)) {
            log.warn("Event {} is already executing, manual run skipped", eventId);
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(runDispatch(event, input != null ? input : Map.of()));
        } finally {
            executing.remove(eventId);
        }
    }

    @Override
    public CompletableFuture<Optional<DispatchOutcome>> launch(long eventId) {
        return CompletableFuture.supplyAsync(() -> runNow(eventId, Map.of()), workers)
                .whenComplete((outcome, error) -> {
                    if (error != null) {
                        log.error("Independent run of event {} failed: {}", eventId,
                                ErrorUtils.formatErrorMessage(ErrorUtils.rootCause(error)));
                    }
                });
    }

    private DispatchOutcome runDispatch(Event event, Map<String, Object> input) {
        if (dispatcher == null) {
            log.warn("No dispatcher configured, event {} not run", event.getId());
            return null;
        }
        try {
            return dispatcher.dispatch(event, input);
        } catch (RuntimeException e) {
            log.error("Dispatch of event {} ({}) failed: {}", event.getId(), event.getName(),
                    ErrorUtils.formatErrorMessage(e), e);
            return null;
        }
    }

    private void persistNextRun(long eventId, Instant next) {
        try {
            store.updateEvent(eventId, e -> e.setNextRunAt(next));
        } catch (RuntimeException e) {
            log.warn("Could not record next run of event {}: {}", eventId, ErrorUtils.formatErrorMessage(e));
        }
    }

    public void shutdown() {
        cancelAll();
        timers.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Worker pool did not drain within 5s");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
        log.info("Scheduler shut down");
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    // ── Timer handle ──

    /**
     * Live timer of one event. A fire re-arms the next one before handing
     * the dispatch to the worker pool.
     */
    private final class JobHandle {
        private final long eventId;
        private final RecurrenceRule rule;
        private ScheduledFuture<?> future;
        private volatile Instant nextInvocation;
        private boolean cancelled;

        JobHandle(long eventId, RecurrenceRule rule) {
            this.eventId = eventId;
            this.rule = rule;
        }

        synchronized void armStart(Instant start, Instant now) {
            nextInvocation = start;
            future = timers.schedule(this::onStart, delayMs(now, start), TimeUnit.MILLISECONDS);
        }

        synchronized void armNext(Instant after) {
            if (cancelled)
                return;
            Optional<ZonedDateTime> next = rule.nextFireAfter(after.atZone(zone));
            if (next.isEmpty()) {
                log.warn("Event {} has no upcoming fire time for {}", eventId, rule.describe());
                nextInvocation = null;
                return;
            }
            Instant at = next.get().toInstant();
            nextInvocation = at;
            future = timers.schedule(() -> onTimer(at), delayMs(clock.instant(), at), TimeUnit.MILLISECONDS);
        }

        synchronized void cancel() {
            cancelled = true;
            nextInvocation = null;
            if (future != null)
                future.cancel(false);
        }

        private synchronized boolean isCancelled() {
            return cancelled;
        }

        private void onStart() {
            if (isCancelled())
                return;
            workers.execute(() -> {
                fire(eventId);
                armNext(clock.instant());
                if (!isCancelled())
                    persistNextRun(eventId, nextInvocation);
            });
        }

        private void onTimer(Instant scheduledAt) {
            if (isCancelled())
                return;
            Instant now = clock.instant();
            armNext(now.isAfter(scheduledAt) ? now : scheduledAt);
            workers.execute(() -> fire(eventId));
        }

        private long delayMs(Instant now, Instant at) {
            return Math.max(0, Duration.between(now, at).toMillis());
        }
    }
}
