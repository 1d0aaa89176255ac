package com.cronium.engine.model;

import java.time.Duration;

/**
 * Unit of a fixed-interval schedule.
 */
public enum ScheduleUnit {
    SECONDS(Duration.ofSeconds(1)),
    MINUTES(Duration.ofMinutes(1)),
    HOURS(Duration.ofHours(1)),
    DAYS(Duration.ofDays(1));

    private final Duration unit;

    ScheduleUnit(Duration unit) {
        this.unit = unit;
    }

    public Duration times(long n) {
        return unit.multipliedBy(n);
    }
}
