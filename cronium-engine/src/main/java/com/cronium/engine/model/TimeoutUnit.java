package com.cronium.engine.model;

public enum TimeoutUnit {
    SECONDS,
    MINUTES;

    public long toMillis(long value) {
        return this == MINUTES ? value * 60_000L : value * 1_000L;
    }
}
