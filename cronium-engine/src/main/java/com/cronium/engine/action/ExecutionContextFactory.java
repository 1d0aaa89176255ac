package com.cronium.engine.action;

import com.cronium.channel.template.TemplateContext;
import com.cronium.engine.model.Event;
import com.cronium.engine.model.ExecutionLog;
import com.cronium.engine.model.Server;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds the template context for messages about one execution.
 */
final class ExecutionContextFactory {

    static final String NO_OUTPUT = "No output available";
    static final String UNKNOWN_ERROR = "Unknown error";

    private ExecutionContextFactory() {
    }

    static TemplateContext create(Event event, ExecutionLog record, boolean success,
            Map<String, String> variables, String localServerName) {
        TemplateContext.EventInfo.EventInfoBuilder info = TemplateContext.EventInfo.builder()
                .id(event.getId())
                .name(event.getName())
                .status(success ? "success" : "failure")
                .server(serverName(event, localServerName));

        if (record != null) {
            Instant started = record.getStartTime() != null ? record.getStartTime() : Instant.now();
            info.executionTime(started.toString())
                    .duration(record.getDurationMs())
                    .output(record.getOutput() != null ? record.getOutput() : NO_OUTPUT);
            if (record.getError() != null) {
                info.error(record.getError());
            } else if (!success) {
                info.error(UNKNOWN_ERROR);
            }
        } else {
            info.executionTime(Instant.now().toString());
        }

        Map<String, Object> vars = new LinkedHashMap<>();
        if (variables != null)
            vars.putAll(variables);

        return TemplateContext.builder()
                .event(info.build())
                .variables(vars)
                .build();
    }

    static String serverName(Event event, String localServerName) {
        List<Server> servers = event.executionTargets();
        if (servers.isEmpty())
            return localServerName;
        return servers.stream()
                .map(s -> s.toTarget().displayName())
                .collect(Collectors.joining(", "));
    }
}
