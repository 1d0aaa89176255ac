package com.cronium.engine.schedule;

import com.cronium.common.infra.ErrorUtils;
import com.cronium.engine.model.Event;
import com.cronium.engine.model.ScheduleUnit;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns an event's schedule configuration into a {@link RecurrenceRule}.
 * Pure: equal configuration gives equal rules.
 */
public final class RecurrenceRuleBuilder {

    private RecurrenceRuleBuilder() {
    }

    public static final int PREVIEW_RUNS = 5;

    public record CronValidation(boolean valid, String error, List<ZonedDateTime> nextRuns) {
    }

    public static RecurrenceRule build(Event event) {
        return build(event.getScheduleNumber(), event.getScheduleUnit(), event.getCustomSchedule());
    }

    /**
     * A non-blank {@code cron} wins; otherwise {@code number} and {@code unit}
     * are expanded into explicit field sets.
     *
     * @throws ScheduleException for a missing or non-positive number or a
     *                           missing unit
     */
    public static RecurrenceRule build(Integer number, ScheduleUnit unit, String cron) {
        if (cron != null && !cron.isBlank()) {
            return new CronExpressionRule(cron);
        }
        if (unit == null) {
            throw new ScheduleException("Unsupported schedule unit: null");
        }
        if (number == null || number <= 0) {
            throw new ScheduleException("Schedule interval must be a positive number, got " + number);
        }
        int n = number;
        return switch (unit) {
            case SECONDS -> new FieldSetRule(secondsFor(n), null, null, null);
            case MINUTES -> new FieldSetRule(List.of(0), steps(n, 60), null, null);
            case HOURS -> new FieldSetRule(List.of(0), List.of(0), steps(n, 24), null);
            case DAYS -> new FieldSetRule(List.of(0), List.of(0), List.of(0), steps(n, 7));
        };
    }

    private static List<Integer> secondsFor(int n) {
        if (n == 15)
            return List.of(0, 15, 30, 45);
        if (n == 30)
            return List.of(0, 30);
        if (n > 59) {
            throw new ScheduleException("Second-based schedules support 1-59 seconds, got " + n);
        }
        return List.of(n);
    }

    /** {0, n, 2n, ...} below {@code bound}. */
    static List<Integer> steps(int n, int bound) {
        List<Integer> values = new ArrayList<>();
        for (int i = 0; i < bound; i += n) {
            values.add(i);
        }
        return List.copyOf(values);
    }

    /**
     * Next fire time of {@code event}'s schedule after {@code after}; empty
     * when the schedule is invalid or never fires.
     */
    public static Optional<Instant> nextRunAfter(Event event, Instant after, ZoneId zone) {
        try {
            return build(event).nextFireAfter(after.atZone(zone)).map(ZonedDateTime::toInstant);
        } catch (ScheduleException e) {
            return Optional.empty();
        }
    }

    /**
     * Check a cron expression and preview its next {@value #PREVIEW_RUNS}
     * fire times.
     */
    public static CronValidation validateCron(String expression, ZonedDateTime from) {
        CronExpressionRule rule;
        try {
            rule = new CronExpressionRule(expression);
        } catch (ScheduleException e) {
            return new CronValidation(false, ErrorUtils.formatErrorMessage(e), List.of());
        }
        List<ZonedDateTime> runs = new ArrayList<>();
        ZonedDateTime cursor = from;
        while (runs.size() < PREVIEW_RUNS) {
            Optional<ZonedDateTime> next = rule.nextFireAfter(cursor);
            if (next.isEmpty())
                break;
            runs.add(next.get());
            cursor = next.get();
        }
        return new CronValidation(true, null, runs);
    }
}
