package com.cronium.engine.schedule;

import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Rule given as explicit sets of allowed seconds, minutes, hours and days of
 * week (0 = Sunday). A null set allows every value. Fire times are aligned
 * to wall-clock boundaries rather than to the time the rule was armed.
 */
public record FieldSetRule(List<Integer> seconds, List<Integer> minutes, List<Integer> hours,
        List<Integer> daysOfWeek) implements RecurrenceRule {

    // Every rule fires at least once a week; the extra day absorbs DST shifts.
    private static final int SEARCH_DAYS = 8;

    public FieldSetRule {
        seconds = normalize("second", seconds, 59);
        minutes = normalize("minute", minutes, 59);
        hours = normalize("hour", hours, 23);
        daysOfWeek = normalize("day of week", daysOfWeek, 6);
    }

    private static List<Integer> normalize(String field, List<Integer> values, int max) {
        if (values == null)
            return null;
        if (values.isEmpty()) {
            throw new ScheduleException("Empty " + field + " set");
        }
        for (Integer v : values) {
            if (v == null || v < 0 || v > max) {
                throw new ScheduleException("Invalid " + field + ": " + v + " (allowed 0-" + max + ")");
            }
        }
        return values.stream().distinct().sorted().toList();
    }

    @Override
    public Optional<ZonedDateTime> nextFireAfter(ZonedDateTime after) {
        ZonedDateTime t = after.truncatedTo(ChronoUnit.SECONDS).plusSeconds(1);
        ZonedDateTime limit = after.plusDays(SEARCH_DAYS);
        while (!t.isAfter(limit)) {
            if (!allows(daysOfWeek, t.getDayOfWeek().getValue() % 7)) {
                t = t.toLocalDate().plusDays(1).atStartOfDay(t.getZone());
            } else if (!allows(hours, t.getHour())) {
                t = t.truncatedTo(ChronoUnit.HOURS).plusHours(1);
            } else if (!allows(minutes, t.getMinute())) {
                t = t.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
            } else if (!allows(seconds, t.getSecond())) {
                t = t.plusSeconds(1);
            } else {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }

    private static boolean allows(List<Integer> set, int value) {
        return set == null || set.contains(value);
    }

    @Override
    public String describe() {
        return "second=" + format(seconds) + " minute=" + format(minutes)
                + " hour=" + format(hours) + " dayOfWeek=" + format(daysOfWeek);
    }

    private static String format(List<Integer> set) {
        if (set == null)
            return "*";
        return set.stream().map(String::valueOf).collect(Collectors.joining(","));
    }
}
