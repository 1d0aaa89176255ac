package com.cronium.channel.template;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Data exposed to notification templates under the {@code cronium}
 * namespace: {@code cronium.event.*}, {@code cronium.getVariables.*},
 * {@code cronium.input.*} and {@code cronium.getCondition.*}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TemplateContext {

    private EventInfo event;
    @Builder.Default
    private Map<String, Object> variables = new LinkedHashMap<>();
    @Builder.Default
    private Map<String, Object> input = new LinkedHashMap<>();
    @Builder.Default
    private Map<String, Boolean> conditions = new LinkedHashMap<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EventInfo {
        private Long id;
        private String name;
        /** success, failure, timeout, partial or unknown. */
        @Builder.Default
        private String status = "unknown";
        private Long duration;
        private String executionTime;
        private String server;
        private String output;
        private String error;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> eventMap = new LinkedHashMap<>();
        if (event != null) {
            eventMap.put("id", event.getId());
            eventMap.put("name", event.getName());
            eventMap.put("status", event.getStatus() != null ? event.getStatus() : "unknown");
            putIfPresent(eventMap, "duration", event.getDuration());
            putIfPresent(eventMap, "executionTime", event.getExecutionTime());
            putIfPresent(eventMap, "server", event.getServer());
            putIfPresent(eventMap, "output", event.getOutput());
            putIfPresent(eventMap, "error", event.getError());
        }

        Map<String, Object> cronium = new LinkedHashMap<>();
        cronium.put("event", eventMap);
        cronium.put("getVariables", variables != null ? variables : Map.of());
        cronium.put("input", input != null ? input : Map.of());
        cronium.put("getCondition", conditions != null ? conditions : Map.of());

        Map<String, Object> root = new LinkedHashMap<>();
        root.put("cronium", cronium);
        return root;
    }

    private static void putIfPresent(Map<String, Object> map, String key, Object value) {
        if (value != null)
            map.put(key, value);
    }
}
