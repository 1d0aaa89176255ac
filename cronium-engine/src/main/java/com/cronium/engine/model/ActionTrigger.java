package com.cronium.engine.model;

/**
 * Outcome class a conditional action reacts to.
 */
public enum ActionTrigger {
    ON_SUCCESS, ON_FAILURE, ALWAYS, ON_CONDITION
}
