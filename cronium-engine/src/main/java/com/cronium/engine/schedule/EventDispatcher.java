package com.cronium.engine.schedule;

import com.cronium.engine.dispatch.DispatchOutcome;
import com.cronium.engine.model.Event;

import java.util.Map;

/**
 * Runs one accepted fire of an event.
 */
@FunctionalInterface
public interface EventDispatcher {

    DispatchOutcome dispatch(Event event, Map<String, Object> input);
}
