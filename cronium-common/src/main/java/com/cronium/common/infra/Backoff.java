package com.cronium.common.infra;

/**
 * Backoff computation for retried work.
 */
public final class Backoff {

    private Backoff() {
    }

    /**
     * Linear backoff: {@code baseMs + stepMs * attempt}.
     *
     * @param baseMs fixed part of the delay
     * @param stepMs growth per attempt
     */
    public record Linear(long baseMs, long stepMs) {

        public long delayFor(int attempt) {
            return baseMs + stepMs * Math.max(attempt, 0);
        }
    }

    /**
     * Sleep for the specified duration, respecting an interrupt.
     *
     * @param ms milliseconds to sleep; if {@code <= 0} returns immediately
     * @throws InterruptedException if the thread is interrupted during sleep
     */
    public static void sleep(long ms) throws InterruptedException {
        if (ms <= 0) {
            return;
        }
        Thread.sleep(ms);
    }
}
