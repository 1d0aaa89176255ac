package com.cronium.engine;

import com.cronium.common.config.CroniumConfig;
import com.cronium.engine.model.ActionEffect;
import com.cronium.engine.model.ActionTrigger;
import com.cronium.engine.model.ConditionalAction;
import com.cronium.engine.model.Event;
import com.cronium.engine.model.EventStatus;
import com.cronium.engine.model.RunLocation;
import com.cronium.engine.model.ScheduleUnit;
import com.cronium.engine.model.Server;
import com.cronium.engine.model.TriggerType;
import com.cronium.sandbox.ScriptType;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Builders shared by the engine tests.
 */
public final class TestEvents {

    private TestEvents() {
    }

    public static Event.EventBuilder activeBash(String name) {
        return Event.builder()
                .name(name)
                .userId("u1")
                .scriptType(ScriptType.BASH)
                .content("echo hi")
                .status(EventStatus.ACTIVE)
                .triggerType(TriggerType.SCHEDULED)
                .scheduleNumber(30)
                .scheduleUnit(ScheduleUnit.SECONDS);
    }

    public static Event.EventBuilder onServers(Event.EventBuilder builder, String... names) {
        List<Server> servers = new ArrayList<>();
        long id = 1;
        for (String name : names) {
            servers.add(Server.builder().id(id++).name(name).address(name + ".internal").username("deploy").build());
        }
        return builder.runLocation(RunLocation.REMOTE).servers(servers);
    }

    public static ConditionalAction message(ActionTrigger trigger, long toolId, String template) {
        return ConditionalAction.builder()
                .trigger(trigger)
                .effect(ActionEffect.SEND_MESSAGE)
                .toolId(toolId)
                .message(template)
                .build();
    }

    public static ConditionalAction runEvent(ActionTrigger trigger, long targetEventId) {
        return ConditionalAction.builder()
                .trigger(trigger)
                .effect(ActionEffect.RUN_EVENT)
                .targetEventId(targetEventId)
                .build();
    }

    public static List<ConditionalAction> actions(ConditionalAction... actions) {
        return Stream.of(actions).collect(Collectors.toCollection(ArrayList::new));
    }

    /** Configuration without stagger or retry delays. */
    public static CroniumConfig fastConfig() {
        CroniumConfig config = new CroniumConfig();
        CroniumConfig.DispatchConfig dispatch = new CroniumConfig.DispatchConfig();
        dispatch.setStaggerBaseMs(0);
        dispatch.setStaggerStepMs(0);
        dispatch.setConnectivityBackoffBaseMs(0);
        dispatch.setConnectivityBackoffStepMs(0);
        dispatch.setScriptBackoffBaseMs(0);
        dispatch.setScriptBackoffStepMs(0);
        config.setDispatch(dispatch);
        config.setNotifications(new CroniumConfig.NotificationsConfig());
        CroniumConfig.SchedulerConfig scheduler = new CroniumConfig.SchedulerConfig();
        scheduler.setTimezone("UTC");
        config.setScheduler(scheduler);
        return config;
    }
}
