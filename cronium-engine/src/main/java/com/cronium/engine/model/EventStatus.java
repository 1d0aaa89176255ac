package com.cronium.engine.model;

/**
 * Lifecycle status of an event.
 */
public enum EventStatus {
    DRAFT, ACTIVE, PAUSED
}
