package com.cronium.sandbox;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Request and result types shared by the local, remote and HTTP runners.
 */
public final class SandboxTypes {

    private SandboxTypes() {
    }

    // ── Script execution ────────────────────────────────────────────

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ExecutionRequest {
        private ScriptType scriptType;
        private String content;
        @Builder.Default
        private Map<String, String> env = new LinkedHashMap<>();
        @Builder.Default
        private long timeoutMs = 30_000;
        /** Written to input.json. */
        @Builder.Default
        private Map<String, Object> input = new LinkedHashMap<>();
        /** Written to event.json. */
        @Builder.Default
        private Map<String, Object> metadata = new LinkedHashMap<>();
        /** Owner of the variables exposed through variables.json; null disables variable handoff. */
        private String userId;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ExecutionResult {
        @Builder.Default
        private String stdout = "";
        @Builder.Default
        private String stderr = "";
        /** Parsed output.json, if the script wrote one. */
        private JsonNode output;
        /** Parsed condition.json, if the script wrote one. */
        private Boolean condition;
        private boolean timedOut;
        @Builder.Default
        private int exitCode = 0;
        /** Non-fatal handoff problems (unparseable output.json and the like). */
        @Builder.Default
        private List<String> warnings = new ArrayList<>();
        /** Contents of variables.json after the run; null when not collected. */
        private Map<String, String> variablesAfter;

        /**
         * A run succeeds when it finished in time, exited with 0 and wrote nothing
         * to stderr.
         */
        public boolean isSuccess() {
            return !timedOut && exitCode == 0 && (stderr == null || stderr.isBlank());
        }

        /**
         * Error text for the execution record: stderr plus any warnings.
         */
        public String errorText() {
            StringBuilder sb = new StringBuilder(stderr == null ? "" : stderr.strip());
            if (timedOut && sb.length() == 0) {
                sb.append("Execution timed out");
            } else if (exitCode != 0 && sb.length() == 0) {
                sb.append("Process exited with code ").append(exitCode);
            }
            for (String warning : warnings) {
                if (sb.length() > 0)
                    sb.append('\n');
                sb.append("Warning: ").append(warning);
            }
            return sb.toString();
        }
    }

    // ── Remote execution ────────────────────────────────────────────

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RemoteTarget {
        private Long id;
        private String name;
        private String address;
        @Builder.Default
        private int port = 22;
        private String username;
        /** Path of the private key file; null uses the ssh client's defaults. */
        private String sshKeyPath;

        public String displayName() {
            return name != null ? name : address;
        }
    }

    public record ConnectionTest(boolean success, String message) {
    }

    // ── HTTP execution ──────────────────────────────────────────────

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class HttpRequestSpec {
        @Builder.Default
        private String method = "GET";
        private String url;
        @Builder.Default
        private Map<String, String> headers = new LinkedHashMap<>();
        /** Object for JSON/form/multipart bodies, text node for raw bodies. */
        private JsonNode body;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class HttpResponseWrapper {
        /** HTTP status, or 0 when the request never produced a response. */
        private int status;
        @Builder.Default
        private Map<String, String> headers = new LinkedHashMap<>();
        @Builder.Default
        private String body = "";
        /** Transport error message, null when a response arrived. */
        private String error;
        private long durationMs;

        public boolean isSuccess() {
            return error == null && status > 0 && status < 400;
        }
    }
}
