package com.cronium.channel.template;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Mustache-style placeholder substitution.
 * <p>
 * {@code {{a.b.c}}} resolves a dotted path in the context and HTML-escapes
 * the value; {@code {{{a.b.c}}}} inserts it raw. Missing values render as
 * the empty string. Helpers: {@code formatDuration}, {@code formatTime} and
 * {@code json}, each taking one path argument. Block sections are not
 * supported and are reported as template errors.
 */
@Slf4j
public class PlaceholderTemplateRenderer implements TemplateRenderer {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final List<String> HELPERS = List.of("formatDuration", "formatTime", "json");

    private final ZoneId zone;

    public PlaceholderTemplateRenderer() {
        this(ZoneId.systemDefault());
    }

    public PlaceholderTemplateRenderer(ZoneId zone) {
        this.zone = zone;
    }

    @Override
    public String render(String template, Map<String, Object> context) {
        if (template == null || template.isEmpty())
            return "";
        try {
            return substitute(template, context != null ? context : Map.of());
        } catch (TemplateSyntaxException e) {
            log.warn("Template processing error: {}", e.getMessage());
            return "[Template Error: " + e.getMessage() + "]\n\n" + template;
        }
    }

    private String substitute(String template, Map<String, Object> context) {
        StringBuilder out = new StringBuilder(template.length());
        int pos = 0;
        while (pos < template.length()) {
            int open = template.indexOf("{{", pos);
            if (open < 0) {
                out.append(template, pos, template.length());
                break;
            }
            out.append(template, pos, open);

            boolean raw = template.startsWith("{{{", open);
            String closeToken = raw ? "}}}" : "}}";
            int start = open + (raw ? 3 : 2);
            int close = template.indexOf(closeToken, start);
            if (close < 0) {
                throw new TemplateSyntaxException("Unclosed placeholder at offset " + open);
            }
            String expression = template.substring(start, close).trim();
            String value = evaluate(expression, context);
            out.append(raw ? value : escapeHtml(value));
            pos = close + closeToken.length();
        }
        return out.toString();
    }

    private String evaluate(String expression, Map<String, Object> context) {
        if (expression.isEmpty()) {
            throw new TemplateSyntaxException("Empty placeholder");
        }
        char first = expression.charAt(0);
        if (first == '#' || first == '/' || first == '^') {
            throw new TemplateSyntaxException("Block sections are not supported: " + expression);
        }
        if (first == '!') {
            return "";
        }

        String[] parts = expression.split("\\s+");
        if (parts.length == 1) {
            return stringify(resolve(parts[0], context));
        }
        if (parts.length > 2 || !HELPERS.contains(parts[0])) {
            throw new TemplateSyntaxException("Missing helper: \"" + parts[0] + "\"");
        }
        Object argument = resolve(parts[1], context);
        return switch (parts[0]) {
            case "formatDuration" -> formatDuration(argument);
            case "formatTime" -> formatTime(argument);
            default -> toJson(argument);
        };
    }

    @SuppressWarnings("unchecked")
    static Object resolve(String path, Map<String, Object> context) {
        Object current = context;
        for (String key : path.split("\\.")) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<String, Object>) current).get(key);
        }
        return current;
    }

    private static String stringify(Object value) {
        if (value == null)
            return "";
        if (value instanceof Map || value instanceof List) {
            return toJson(value);
        }
        return String.valueOf(value);
    }

    static String formatDuration(Object value) {
        if (!(value instanceof Number number)) {
            return "Less than 1 second";
        }
        double ms = number.doubleValue();
        if (Double.isNaN(ms))
            return "Less than 1 second";
        if (ms < 1000)
            return number.longValue() + "ms";
        if (ms < 60_000)
            return String.format(Locale.ROOT, "%.1fs", ms / 1000);
        if (ms < 3_600_000)
            return String.format(Locale.ROOT, "%.1fm", ms / 60_000);
        return String.format(Locale.ROOT, "%.1fh", ms / 3_600_000);
    }

    private String formatTime(Object value) {
        if (value == null || String.valueOf(value).isBlank())
            return "Unknown";
        String text = String.valueOf(value);
        try {
            return TIME_FORMAT.format(Instant.parse(text).atZone(zone));
        } catch (DateTimeParseException e) {
            return text;
        }
    }

    private static String toJson(Object value) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    static String escapeHtml(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '"' -> sb.append("&quot;");
                case '\'' -> sb.append("&#x27;");
                case '`' -> sb.append("&#x60;");
                case '=' -> sb.append("&#x3D;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    private static class TemplateSyntaxException extends RuntimeException {
        TemplateSyntaxException(String message) {
            super(message);
        }
    }
}
