package com.cronium.engine.action;

import com.cronium.channel.ChannelMessage;
import com.cronium.channel.ChannelType;
import com.cronium.channel.DeliveryResult;
import com.cronium.channel.Notifier;
import com.cronium.channel.ToolCredential;
import com.cronium.channel.template.TemplateContext;
import com.cronium.channel.template.TemplateRenderer;
import com.cronium.common.config.CroniumConfig;
import com.cronium.common.infra.ErrorUtils;
import com.cronium.engine.model.ActionTrigger;
import com.cronium.engine.model.ConditionalAction;
import com.cronium.engine.model.Event;
import com.cronium.engine.model.ExecutionLog;
import com.cronium.engine.store.CredentialStore;
import com.cronium.engine.store.EventStore;
import com.cronium.sandbox.UserVariableStore;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Fires an event's conditional actions after a dispatch. Failures of an
 * action are logged and never reach the triggering event or its record.
 */
@Slf4j
public class ConditionalActionDispatcher {

    private final EventStore events;
    private final CredentialStore credentials;
    private final UserVariableStore variables;
    private final TemplateRenderer renderer;
    private final Notifier notifier;
    private final EventLauncher launcher;
    private final CroniumConfig.NotificationsConfig config;

    public ConditionalActionDispatcher(EventStore events, CredentialStore credentials, UserVariableStore variables,
            TemplateRenderer renderer, Notifier notifier, EventLauncher launcher,
            CroniumConfig.NotificationsConfig config) {
        this.events = events;
        this.credentials = credentials;
        this.variables = variables;
        this.renderer = renderer;
        this.notifier = notifier;
        this.launcher = launcher;
        this.config = config != null ? config : new CroniumConfig.NotificationsConfig();
    }

    /**
     * Success or failure actions, then always actions, then condition actions
     * when the run produced a condition.
     */
    public void fireAll(Event event, ExecutionLog record, boolean success, Boolean condition) {
        if (success) {
            onSuccess(event, record);
        } else {
            onFailure(event, record);
        }
        always(event, record, success);
        if (condition != null)
            onCondition(event, record, condition);
    }

    public void onSuccess(Event event, ExecutionLog record) {
        fire(event, event.actionsFor(ActionTrigger.ON_SUCCESS), record, true);
    }

    public void onFailure(Event event, ExecutionLog record) {
        fire(event, event.actionsFor(ActionTrigger.ON_FAILURE), record, false);
    }

    public void always(Event event, ExecutionLog record, boolean success) {
        fire(event, event.actionsFor(ActionTrigger.ALWAYS), record, success);
    }

    /**
     * Condition actions fire only when {@code condition} is true.
     */
    public void onCondition(Event event, ExecutionLog record, boolean condition) {
        List<ConditionalAction> actions = event.actionsFor(ActionTrigger.ON_CONDITION);
        if (actions.isEmpty())
            return;
        if (!condition) {
            log.info("Condition false for event {}, skipping {} condition action(s)", event.getId(), actions.size());
            return;
        }
        log.info("Condition true for event {}, firing {} condition action(s)", event.getId(), actions.size());
        fire(event, actions, record, true);
    }

    private void fire(Event event, List<ConditionalAction> actions, ExecutionLog record, boolean success) {
        for (ConditionalAction action : actions) {
            try {
                execute(event, action, record, success);
            } catch (RuntimeException e) {
                log.error("Conditional action {} of event {} failed: {}", action.getId(), event.getId(),
                        ErrorUtils.formatErrorMessage(e), e);
            }
        }
    }

    private void execute(Event event, ConditionalAction action, ExecutionLog record, boolean success) {
        if (action.getEffect() == null) {
            log.warn("Conditional action {} of event {} has no effect", action.getId(), event.getId());
            return;
        }
        switch (action.getEffect()) {
            case SEND_MESSAGE -> sendMessage(event, action, record, success);
            case RUN_EVENT -> runEvent(event, action);
        }
    }

    // ── SEND_MESSAGE ──

    private void sendMessage(Event event, ConditionalAction action, ExecutionLog record, boolean success) {
        if (action.getMessage() == null || action.getMessage().isBlank()) {
            log.warn("Send-message action {} of event {} has no message", action.getId(), event.getId());
            return;
        }
        Optional<ToolCredential> credential = resolveCredential(action);
        if (credential.isEmpty())
            return;
        ToolCredential tool = credential.get();

        TemplateContext context = ExecutionContextFactory.create(event, record, success,
                userVariables(event), config.getLocalServerName());
        String body = renderer.render(action.getMessage(), context);

        String subject = null;
        if (action.getEmailSubject() != null && !action.getEmailSubject().isBlank()) {
            subject = renderer.render(action.getEmailSubject(), context);
        } else if (tool.getType() == ChannelType.EMAIL) {
            subject = "Event " + (success ? "Success" : "Failure") + ": "
                    + Objects.requireNonNullElse(event.getName(), "");
        }

        ChannelMessage message = ChannelMessage.builder()
                .recipients(action.getEmailAddresses())
                .subject(subject)
                .body(body)
                .html(true)
                .build();
        DeliveryResult result = notifier.send(tool, message);
        if (result.success()) {
            log.info("Send-message action {} of event {} delivered via {}", action.getId(), event.getId(),
                    tool.getType().key());
        } else {
            log.error("Send-message action {} of event {} failed: {}", action.getId(), event.getId(),
                    result.error());
        }
    }

    private Optional<ToolCredential> resolveCredential(ConditionalAction action) {
        if (action.getToolId() == null) {
            if (config.isDefaultEmailEnabled() && config.getSmtp() != null) {
                return Optional.of(ToolCredential.systemEmail(config.getSmtp()));
            }
            log.error("No tool specified for send-message action {}", action.getId());
            return Optional.empty();
        }
        Optional<ToolCredential> tool = credentials.getCredential(action.getToolId());
        if (tool.isEmpty())
            log.error("Tool {} not found for send-message action {}", action.getToolId(), action.getId());
        return tool;
    }

    private Map<String, String> userVariables(Event event) {
        if (event.getUserId() == null)
            return Map.of();
        try {
            return variables.getVariables(event.getUserId());
        } catch (RuntimeException e) {
            log.warn("Could not load variables of user {}: {}", event.getUserId(), ErrorUtils.formatErrorMessage(e));
            return Map.of();
        }
    }

    // ── RUN_EVENT ──

    private void runEvent(Event event, ConditionalAction action) {
        Long targetId = action.getTargetEventId();
        if (targetId == null) {
            log.warn("Run-event action {} of event {} has no target", action.getId(), event.getId());
            return;
        }
        if (targetId.equals(event.getId())) {
            log.error("Run-event action {} of event {} targets its own event, ignoring", action.getId(),
                    event.getId());
            return;
        }
        Optional<Event> target = events.getEvent(targetId);
        if (target.isEmpty()) {
            log.error("Target event {} of action {} not found", targetId, action.getId());
            return;
        }
        log.info("Event {} starting event {} ({}) as a conditional action", event.getId(), targetId,
                target.get().getName());
        launcher.launch(targetId);
    }
}
