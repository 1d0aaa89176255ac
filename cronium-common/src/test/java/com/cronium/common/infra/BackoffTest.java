package com.cronium.common.infra;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class BackoffTest {

    @ParameterizedTest
    @CsvSource({
            "2000, 1000, 1, 3000",
            "2000, 1000, 2, 4000",
            "500, 500, 1, 1000",
            "500, 500, 2, 1500"
    })
    void linear_delayFor(long base, long step, int attempt, long expected) {
        assertEquals(expected, new Backoff.Linear(base, step).delayFor(attempt));
    }

    @Test
    void sleep_nonPositive_returnsImmediately() throws InterruptedException {
        long start = System.nanoTime();
        Backoff.sleep(0);
        Backoff.sleep(-5);
        assertTrue(System.nanoTime() - start < 50_000_000L);
    }
}
