package com.cronium.engine.schedule;

import com.cronium.engine.model.Event;
import com.cronium.engine.model.ScheduleUnit;

import java.time.Duration;

/**
 * Minimum spacing between two accepted timer fires of one event. Fires that
 * arrive sooner are treated as duplicates.
 */
public final class DebouncePolicy {

    private DebouncePolicy() {
    }

    public static final Duration FLOOR = Duration.ofMillis(500);
    public static final Duration ONE_MINUTE_BUFFER = Duration.ofSeconds(2);

    public static Duration minimumInterval(Event event) {
        if (event.hasCustomSchedule() || event.getScheduleNumber() == null) {
            return FLOOR;
        }
        int n = event.getScheduleNumber();
        if (event.getScheduleUnit() == ScheduleUnit.SECONDS) {
            return max(FLOOR, Duration.ofMillis(Math.round(n * 1000 * 0.8)));
        }
        if (event.getScheduleUnit() == ScheduleUnit.MINUTES) {
            if (n == 1)
                return ONE_MINUTE_BUFFER;
            return max(FLOOR, Duration.ofMillis(Math.round(n * 60_000 * 0.1)));
        }
        return FLOOR;
    }

    private static Duration max(Duration a, Duration b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
