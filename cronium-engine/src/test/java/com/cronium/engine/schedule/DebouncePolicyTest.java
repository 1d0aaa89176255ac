package com.cronium.engine.schedule;

import com.cronium.engine.TestEvents;
import com.cronium.engine.model.Event;
import com.cronium.engine.model.ScheduleUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DebouncePolicyTest {

    @ParameterizedTest
    @CsvSource({
            "1,  SECONDS, 800",
            "30, SECONDS, 24000",
            "1,  MINUTES, 2000",
            "5,  MINUTES, 30000",
            "1,  HOURS,   500",
            "2,  DAYS,    500",
    })
    void minimumInterval_dependsOnUnit(int number, ScheduleUnit unit, long expectedMs) {
        Event event = TestEvents.activeBash("e").scheduleNumber(number).scheduleUnit(unit).build();

        assertEquals(Duration.ofMillis(expectedMs), DebouncePolicy.minimumInterval(event));
    }

    @Test
    void cronSchedules_useTheFloor() {
        Event event = TestEvents.activeBash("e").customSchedule("* * * * * *").build();

        assertEquals(DebouncePolicy.FLOOR, DebouncePolicy.minimumInterval(event));
    }
}
