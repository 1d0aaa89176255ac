package com.cronium.engine.action;

import com.cronium.common.config.CroniumConfig;
import com.cronium.engine.model.ActionEffect;
import com.cronium.engine.model.ConditionalAction;
import com.cronium.engine.model.Event;
import com.cronium.engine.store.CredentialStore;
import com.cronium.engine.store.EventStore;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks an event's conditional actions against the stored events and
 * credentials before the event is saved.
 */
public class ActionValidator {

    private final EventStore events;
    private final CredentialStore credentials;
    private final CroniumConfig.NotificationsConfig notifications;

    public ActionValidator(EventStore events, CredentialStore credentials,
            CroniumConfig.NotificationsConfig notifications) {
        this.events = events;
        this.credentials = credentials;
        this.notifications = notifications != null ? notifications : new CroniumConfig.NotificationsConfig();
    }

    /**
     * @throws ActionValidationException on the first invalid action
     */
    public void validate(Event event) {
        if (event.getActions() == null)
            return;
        for (ConditionalAction action : event.getActions()) {
            if (action.getTrigger() == null) {
                throw new ActionValidationException("Conditional action is missing its trigger");
            }
            if (action.getEffect() == null) {
                throw new ActionValidationException("Conditional action is missing its effect");
            }
            if (action.getEffect() == ActionEffect.RUN_EVENT) {
                validateRunEvent(event, action);
            } else {
                validateSendMessage(action);
            }
        }
        List<Long> cycle = findCycle(event);
        if (!cycle.isEmpty()) {
            throw new ActionValidationException("Conditional actions form a cycle: "
                    + cycle.stream().map(String::valueOf).collect(Collectors.joining(" -> ")));
        }
    }

    private void validateRunEvent(Event event, ConditionalAction action) {
        Long target = action.getTargetEventId();
        if (target == null) {
            throw new ActionValidationException("Run-event action requires a target event");
        }
        if (Objects.equals(target, event.getId())) {
            throw new ActionValidationException("An event cannot run itself as a conditional action");
        }
        if (events.getEvent(target).isEmpty()) {
            throw new ActionValidationException("Target event " + target + " not found");
        }
    }

    private void validateSendMessage(ConditionalAction action) {
        if (action.getMessage() == null || action.getMessage().isBlank()) {
            throw new ActionValidationException("Send-message action requires a message");
        }
        if (action.getToolId() == null) {
            if (!notifications.isDefaultEmailEnabled()) {
                throw new ActionValidationException(
                        "Send-message action requires a tool when the system email channel is disabled");
            }
            return;
        }
        if (credentials.getCredential(action.getToolId()).isEmpty()) {
            throw new ActionValidationException("Tool " + action.getToolId() + " not found");
        }
    }

    /**
     * Path of event ids that leads from {@code event} back to itself through
     * run-event actions, or empty. The stored graph is used for every other
     * event.
     */
    List<Long> findCycle(Event event) {
        if (event.getId() == null)
            return List.of();
        Map<Long, List<Long>> edges = new HashMap<>();
        for (Event stored : events.listEvents()) {
            edges.put(stored.getId(), runTargets(stored));
        }
        edges.put(event.getId(), runTargets(event));

        Deque<List<Long>> paths = new ArrayDeque<>();
        paths.push(List.of(event.getId()));
        Set<Long> seen = new HashSet<>();
        while (!paths.isEmpty()) {
            List<Long> path = paths.pop();
            Long last = path.get(path.size() - 1);
            for (Long next : edges.getOrDefault(last, List.of())) {
                List<Long> extended = new ArrayList<>(path);
                extended.add(next);
                if (next.equals(event.getId()))
                    return extended;
                if (seen.add(next))
                    paths.push(extended);
            }
        }
        return List.of();
    }

    private static List<Long> runTargets(Event event) {
        if (event.getActions() == null)
            return List.of();
        return event.getActions().stream()
                .filter(a -> a.getEffect() == ActionEffect.RUN_EVENT && a.getTargetEventId() != null)
                .map(ConditionalAction::getTargetEventId)
                .toList();
    }
}
