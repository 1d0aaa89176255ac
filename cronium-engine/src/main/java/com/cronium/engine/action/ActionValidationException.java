package com.cronium.engine.action;

/**
 * Conditional-action configuration rejected before it is stored.
 */
public class ActionValidationException extends RuntimeException {

    public ActionValidationException(String message) {
        super(message);
    }
}
