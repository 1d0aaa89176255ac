package com.cronium.engine.schedule;

import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Normalized timer specification for a scheduled event.
 */
public sealed interface RecurrenceRule permits FieldSetRule, CronExpressionRule {

    /**
     * First fire time strictly after {@code after}, in the same zone.
     */
    Optional<ZonedDateTime> nextFireAfter(ZonedDateTime after);

    String describe();
}
