package com.cronium.sandbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * JSON files exchanged between the runner and a user script.
 * <p>
 * Before a run: {@code input.json}, {@code event.json}, {@code variables.json}.
 * After a run: {@code output.json}, {@code condition.json} and the possibly
 * rewritten {@code variables.json}.
 */
public final class HandoffFiles {

    public static final String INPUT = "input.json";
    public static final String EVENT = "event.json";
    public static final String VARIABLES = "variables.json";
    public static final String OUTPUT = "output.json";
    public static final String CONDITION = "condition.json";

    /** Timestamp key the helpers add on every variable write. */
    public static final String UPDATED_MARKER = "__updated__";

    static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .findAndRegisterModules();

    private HandoffFiles() {
    }

    /**
     * Outcome of reading a JSON result file: a value, a warning, or neither
     * when the file is absent.
     */
    public record Parsed<T>(T value, String warning) {

        static <T> Parsed<T> absent() {
            return new Parsed<>(null, null);
        }
    }

    /**
     * Keys to upsert and keys to delete after a run.
     */
    public record VariableDiff(Map<String, String> upserts, Set<String> removals) {

        public boolean isEmpty() {
            return upserts.isEmpty() && removals.isEmpty();
        }
    }

    // ── Writing ─────────────────────────────────────────────────────

    public static void writeInputs(Path dir, Map<String, Object> input, Map<String, Object> metadata,
            Map<String, String> variables) throws IOException {
        Files.writeString(dir.resolve(INPUT), toJson(input));
        Files.writeString(dir.resolve(EVENT), toJson(metadata));
        Files.writeString(dir.resolve(VARIABLES), toJson(variables));
    }

    public static String toJson(Object value) throws JsonProcessingException {
        return MAPPER.writeValueAsString(value != null ? value : Map.of());
    }

    // ── Reading ─────────────────────────────────────────────────────

    public static Parsed<JsonNode> readOutput(Path dir) {
        Path file = dir.resolve(OUTPUT);
        if (!Files.exists(file))
            return Parsed.absent();
        try {
            return parseOutput(Files.readString(file));
        } catch (IOException e) {
            return new Parsed<>(null, "Failed to read " + OUTPUT + ": " + e.getMessage());
        }
    }

    public static Parsed<JsonNode> parseOutput(String content) {
        try {
            return new Parsed<>(MAPPER.readTree(content), null);
        } catch (JsonProcessingException e) {
            return new Parsed<>(null, "Failed to parse " + OUTPUT + ": " + e.getOriginalMessage());
        }
    }

    public static Parsed<Boolean> readCondition(Path dir) {
        Path file = dir.resolve(CONDITION);
        if (!Files.exists(file))
            return Parsed.absent();
        try {
            return parseCondition(Files.readString(file));
        } catch (IOException e) {
            return new Parsed<>(null, "Failed to read " + CONDITION + ": " + e.getMessage());
        }
    }

    /**
     * Parse {@code {"condition": <value>}}; the value is coerced to a boolean
     * the way a script language would (non-empty strings and non-zero numbers
     * are true).
     */
    public static Parsed<Boolean> parseCondition(String content) {
        JsonNode node;
        try {
            node = MAPPER.readTree(content);
        } catch (JsonProcessingException e) {
            return new Parsed<>(null, "Failed to parse " + CONDITION + ": " + e.getOriginalMessage());
        }
        if (node == null || !node.isObject() || !node.has("condition")) {
            return new Parsed<>(null, "Invalid " + CONDITION + " format: missing 'condition' field");
        }
        JsonNode value = node.get("condition");
        boolean flag;
        if (value.isBoolean()) {
            flag = value.booleanValue();
        } else if (value.isNumber()) {
            flag = value.doubleValue() != 0;
        } else if (value.isTextual()) {
            flag = !value.textValue().isEmpty() && !"false".equalsIgnoreCase(value.textValue());
        } else {
            flag = !value.isNull();
        }
        return new Parsed<>(flag, null);
    }

    public static Parsed<Map<String, String>> readVariables(Path dir) {
        Path file = dir.resolve(VARIABLES);
        if (!Files.exists(file))
            return Parsed.absent();
        try {
            return parseVariables(Files.readString(file));
        } catch (IOException e) {
            return new Parsed<>(null, "Failed to read " + VARIABLES + ": " + e.getMessage());
        }
    }

    /**
     * Parse a variables document; every value must be a string.
     */
    public static Parsed<Map<String, String>> parseVariables(String content) {
        Map<String, Object> raw;
        try {
            raw = MAPPER.readValue(content, new TypeReference<LinkedHashMap<String, Object>>() {
            });
        } catch (JsonProcessingException e) {
            return new Parsed<>(null, "Failed to parse " + VARIABLES + ": " + e.getOriginalMessage());
        }
        Map<String, String> variables = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : raw.entrySet()) {
            if (!(entry.getValue() instanceof String s)) {
                return new Parsed<>(null, "Invalid " + VARIABLES + " format: expected object with string values");
            }
            variables.put(entry.getKey(), s);
        }
        return new Parsed<>(variables, null);
    }

    // ── Diff ────────────────────────────────────────────────────────

    /**
     * Compare the pre-run snapshot with the post-run document. The helpers'
     * {@value #UPDATED_MARKER} key is not a user variable and never persisted.
     */
    public static VariableDiff diffVariables(Map<String, String> before, Map<String, String> after) {
        Map<String, String> upserts = new LinkedHashMap<>();
        Set<String> removals = new LinkedHashSet<>();
        for (Map.Entry<String, String> entry : after.entrySet()) {
            if (UPDATED_MARKER.equals(entry.getKey()))
                continue;
            if (!entry.getValue().equals(before.get(entry.getKey()))) {
                upserts.put(entry.getKey(), entry.getValue());
            }
        }
        for (String key : before.keySet()) {
            if (!after.containsKey(key)) {
                removals.add(key);
            }
        }
        return new VariableDiff(upserts, removals);
    }

    /**
     * Persist the difference between {@code before} and {@code after} and
     * return any warning produced on the way.
     */
    public static List<String> persistVariables(UserVariableStore store, String userId,
            Map<String, String> before, Map<String, String> after) {
        if (store == null || userId == null || after == null)
            return List.of();
        VariableDiff diff = diffVariables(before, after);
        if (diff.isEmpty())
            return List.of();
        try {
            store.apply(userId, diff);
            return List.of();
        } catch (RuntimeException e) {
            return List.of("Failed to persist variable changes: " + e.getMessage());
        }
    }
}
