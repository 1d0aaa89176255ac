package com.cronium.engine.schedule;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Raw cron expression. Five fields are read as Unix cron
 * ({@code min hour dom month dow}); six fields carry a leading seconds field.
 */
public record CronExpressionRule(String expression) implements RecurrenceRule {

    private static final CronParser UNIX_PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));
    private static final CronParser SECONDS_PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.SPRING));

    private static final Cache<String, ExecutionTime> PARSED = Caffeine.newBuilder()
            .maximumSize(1_000)
            .build();

    public CronExpressionRule {
        if (expression == null || expression.isBlank()) {
            throw new ScheduleException("Cron expression is empty");
        }
        expression = expression.trim().replaceAll("\\s+", " ");
        executionTime(expression);
    }

    static ExecutionTime executionTime(String expression) {
        ExecutionTime cached = PARSED.getIfPresent(expression);
        if (cached != null)
            return cached;
        ExecutionTime parsed = ExecutionTime.forCron(parse(expression));
        PARSED.put(expression, parsed);
        return parsed;
    }

    private static Cron parse(String expression) {
        int fields = expression.split(" ").length;
        CronParser parser = switch (fields) {
            case 5 -> UNIX_PARSER;
            case 6 -> SECONDS_PARSER;
            default -> throw new ScheduleException(
                    "Cron expression must have 5 or 6 fields, got " + fields + ": " + expression);
        };
        try {
            return parser.parse(expression).validate();
        } catch (IllegalArgumentException e) {
            throw new ScheduleException("Invalid cron expression '" + expression + "': " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<ZonedDateTime> nextFireAfter(ZonedDateTime after) {
        return executionTime(expression).nextExecution(after);
    }

    @Override
    public String describe() {
        return "cron=" + expression;
    }
}
