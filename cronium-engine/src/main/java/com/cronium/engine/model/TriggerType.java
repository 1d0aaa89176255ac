package com.cronium.engine.model;

/**
 * How an event is started.
 */
public enum TriggerType {
    MANUAL, SCHEDULED
}
