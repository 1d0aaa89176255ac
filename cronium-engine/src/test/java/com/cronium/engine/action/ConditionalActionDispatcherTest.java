package com.cronium.engine.action;

import com.cronium.channel.ChannelMessage;
import com.cronium.channel.ChannelType;
import com.cronium.channel.DeliveryResult;
import com.cronium.channel.ToolCredential;
import com.cronium.channel.template.PlaceholderTemplateRenderer;
import com.cronium.common.config.CroniumConfig;
import com.cronium.engine.RecordingNotifier;
import com.cronium.engine.RecordingTimers;
import com.cronium.engine.TestEvents;
import com.cronium.engine.model.ActionTrigger;
import com.cronium.engine.model.ConditionalAction;
import com.cronium.engine.model.Event;
import com.cronium.engine.model.ExecutionLog;
import com.cronium.engine.model.LogStatus;
import com.cronium.engine.store.InMemoryStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConditionalActionDispatcherTest {

    private InMemoryStore store;
    private RecordingNotifier notifier;
    private RecordingTimers launcher;
    private CroniumConfig.NotificationsConfig config;
    private ConditionalActionDispatcher dispatcher;
    private long emailId;

    private final ExecutionLog record = ExecutionLog.builder()
            .id(7L)
            .startTime(Instant.parse("2026-03-01T12:00:00Z"))
            .durationMs(1500L)
            .status(LogStatus.SUCCESS)
            .output("42 rows")
            .build();

    @BeforeEach
    void setUp() {
        store = new InMemoryStore();
        notifier = new RecordingNotifier();
        launcher = new RecordingTimers();
        config = new CroniumConfig.NotificationsConfig();
        dispatcher = new ConditionalActionDispatcher(store, store, store, new PlaceholderTemplateRenderer(),
                notifier, launcher, config);
        CroniumConfig.SmtpConfig smtp = new CroniumConfig.SmtpConfig();
        smtp.setHost("smtp.example.test");
        emailId = store.saveCredential(ToolCredential.builder()
                .name("mail").type(ChannelType.EMAIL).smtp(smtp).build()).getId();
    }

    private Event event(ConditionalAction... actions) {
        return store.saveEvent(TestEvents.activeBash("nightly-report").actions(TestEvents.actions(actions)).build());
    }

    // =========================================================================
    // SEND_MESSAGE
    // =========================================================================

    @Nested
    class SendMessage {

        @Test
        void rendersBodyWithExecutionContextAndVariables() {
            store.setVariable("u1", "team", "data");
            Event event = event(TestEvents.message(ActionTrigger.ON_SUCCESS, emailId,
                    "{{cronium.event.name}} ({{cronium.event.status}}) on {{cronium.event.server}}: "
                            + "{{cronium.event.output}} for {{cronium.getVariables.team}} in "
                            + "{{formatDuration cronium.event.duration}}"));

            dispatcher.onSuccess(event, record);

            ChannelMessage sent = notifier.sent.get(0).message();
            assertEquals("nightly-report (success) on Local: 42 rows for data in 1.5s", sent.getBody());
            assertEquals("Event Success: nightly-report", sent.getSubject());
            assertTrue(sent.isHtml());
        }

        @Test
        void failureContext_defaultsErrorText() {
            Event event = event(TestEvents.message(ActionTrigger.ON_FAILURE, emailId, "{{cronium.event.error}}"));

            dispatcher.onFailure(event, record);

            ChannelMessage sent = notifier.sent.get(0).message();
            assertEquals("Unknown error", sent.getBody());
            assertEquals("Event Failure: nightly-report", sent.getSubject());
        }

        @Test
        void subjectTemplateAndRecipients_arePassedThrough() {
            ConditionalAction action = TestEvents.message(ActionTrigger.ALWAYS, emailId, "body");
            action.setEmailSubject("[{{cronium.event.status}}] {{cronium.event.name}}");
            action.setEmailAddresses("ops@example.test, dev@example.test");

            dispatcher.always(event(action), record, true);

            ChannelMessage sent = notifier.sent.get(0).message();
            assertEquals("[success] nightly-report", sent.getSubject());
            assertEquals("ops@example.test, dev@example.test", sent.getRecipients());
        }

        @Test
        void missingTool_usesSystemEmailWhenEnabled() {
            CroniumConfig.SmtpConfig smtp = new CroniumConfig.SmtpConfig();
            smtp.setHost("smtp.system.test");
            config.setDefaultEmailEnabled(true);
            config.setSmtp(smtp);
            ConditionalAction action = TestEvents.message(ActionTrigger.ON_SUCCESS, 0, "hi");
            action.setToolId(null);

            dispatcher.onSuccess(event(action), record);

            ToolCredential used = notifier.sent.get(0).credential();
            assertEquals("system-smtp", used.getName());
            assertEquals("smtp.system.test", used.getSmtp().getHost());
        }

        @Test
        void missingTool_isSkippedWhenSystemEmailDisabled() {
            ConditionalAction action = TestEvents.message(ActionTrigger.ON_SUCCESS, 0, "hi");
            action.setToolId(null);

            dispatcher.onSuccess(event(action), record);

            assertTrue(notifier.sent.isEmpty());
        }

        @Test
        void failedDeliveryAndUnknownTool_areContained() {
            notifier.result = DeliveryResult.failed("smtp down");
            Event event = event(
                    TestEvents.message(ActionTrigger.ON_SUCCESS, emailId, "first"),
                    TestEvents.message(ActionTrigger.ON_SUCCESS, 999, "unknown tool"),
                    TestEvents.message(ActionTrigger.ON_SUCCESS, emailId, "second"));

            assertDoesNotThrow(() -> dispatcher.onSuccess(event, record));

            assertEquals(List.of("first", "second"), notifier.bodies());
        }
    }

    // =========================================================================
    // RUN_EVENT
    // =========================================================================

    @Nested
    class RunEvent {

        @Test
        void launchesTargetEvent() {
            long target = store.saveEvent(TestEvents.activeBash("cleanup").build()).getId();
            Event event = event(TestEvents.runEvent(ActionTrigger.ON_SUCCESS, target));

            dispatcher.onSuccess(event, record);

            assertEquals(List.of(target), launcher.launched);
        }

        @Test
        void missingTargetOrSelfReference_isIgnored() {
            Event event = event(TestEvents.runEvent(ActionTrigger.ON_SUCCESS, 404));
            event.getActions().add(TestEvents.runEvent(ActionTrigger.ON_SUCCESS, event.getId()));

            dispatcher.onSuccess(event, record);

            assertTrue(launcher.launched.isEmpty());
        }
    }

    @Test
    void conditionActions_fireOnlyWhenTrue() {
        Event event = event(TestEvents.message(ActionTrigger.ON_CONDITION, emailId, "flagged"));

        dispatcher.onCondition(event, record, false);
        assertTrue(notifier.sent.isEmpty());

        dispatcher.onCondition(event, record, true);
        assertEquals(List.of("flagged"), notifier.bodies());
    }

    @Test
    void fireAll_runsOutcomeThenAlwaysThenCondition() {
        Event event = event(
                TestEvents.message(ActionTrigger.ON_CONDITION, emailId, "condition"),
                TestEvents.message(ActionTrigger.ALWAYS, emailId, "always"),
                TestEvents.message(ActionTrigger.ON_FAILURE, emailId, "failure"),
                TestEvents.message(ActionTrigger.ON_SUCCESS, emailId, "success"));

        dispatcher.fireAll(event, record, false, true);

        assertEquals(List.of("failure", "always", "condition"), notifier.bodies());
    }

    @Test
    void actionWithoutEffect_isSkipped() {
        ConditionalAction action = ConditionalAction.builder().trigger(ActionTrigger.ALWAYS).build();

        assertDoesNotThrow(() -> dispatcher.always(event(action), record, true));
        assertTrue(notifier.sent.isEmpty());
        assertTrue(launcher.launched.isEmpty());
    }
}
