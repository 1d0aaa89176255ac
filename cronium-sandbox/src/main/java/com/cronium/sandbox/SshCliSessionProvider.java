package com.cronium.sandbox;

import com.cronium.common.config.CroniumConfig;
import com.cronium.sandbox.SandboxTypes.ConnectionTest;
import com.cronium.sandbox.SandboxTypes.ExecutionResult;
import com.cronium.sandbox.SandboxTypes.RemoteTarget;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * {@link RemoteSessionProvider} backed by the OpenSSH {@code ssh} client.
 * <p>
 * A bootstrap script is fed to {@code bash -s} on the remote side. It creates a
 * temporary directory, decodes the handoff files, helper and script into it,
 * runs the script under {@code timeout}, then prints the result files
 * base64-encoded after a per-run marker line. The directory is removed by an
 * exit trap.
 */
@Slf4j
public class SshCliSessionProvider implements RemoteSessionProvider {

    private static final Pattern ENV_KEY = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final String HEREDOC = "__CRONIUM_EOF__";
    private static final String TIMEOUT_SECTION = "TIMEOUT";

    private final CroniumConfig.SandboxConfig config;

    public SshCliSessionProvider(CroniumConfig.SandboxConfig config) {
        this.config = config;
    }

    @Override
    public ConnectionTest testConnection(RemoteTarget target) {
        try {
            SshResult result = ssh(target, List.of("echo", "cronium-ok"), null, config.getConnectTimeoutMs());
            if (result.exitCode == 0 && result.stdout.contains("cronium-ok")) {
                return new ConnectionTest(true, "Connection successful");
            }
            String message = result.timedOut ? "No response from server"
                    : result.stderr.isBlank() ? "ssh exited with code " + result.exitCode : result.stderr.strip();
            return new ConnectionTest(false, message);
        } catch (IOException e) {
            return new ConnectionTest(false, e.getMessage());
        }
    }

    @Override
    public ExecutionResult run(ScriptType scriptType, String content, Map<String, String> env, RemoteTarget target,
            long timeoutMs, Map<String, Object> input, Map<String, Object> metadata,
            Map<String, String> variables) throws SandboxException {
        String marker = "__CRONIUM_" + UUID.randomUUID().toString().replace("-", "") + "__";
        try {
            String bootstrap = buildBootstrap(scriptType, content, env, timeoutMs, input, metadata, variables, marker);
            // Allow the remote timeout to fire first; the local guard only covers a hung connection.
            long guardMs = timeoutMs + config.getConnectTimeoutMs();
            SshResult ssh = ssh(target, List.of("bash", "-s"), bootstrap, guardMs);

            ExecutionResult result = parseTranscript(ssh.stdout, marker);
            result.setStderr(ssh.stderr);
            result.setExitCode(ssh.exitCode);
            if (ssh.timedOut || result.isTimedOut()) {
                result.setTimedOut(true);
                String notice = "Script execution timed out after " + timeoutMs + "ms";
                result.setStderr(ssh.stderr.isBlank() ? notice : ssh.stderr.strip() + "\n" + notice);
            }
            return result;
        } catch (SandboxException e) {
            throw e;
        } catch (IOException e) {
            throw new SandboxException("Remote execution on " + target.displayName() + " failed: " + e.getMessage(), e);
        }
    }

    // ── Bootstrap script ────────────────────────────────────────────

    static String buildBootstrap(ScriptType type, String content, Map<String, String> env, long timeoutMs,
            Map<String, Object> input, Map<String, Object> metadata, Map<String, String> variables,
            String marker) throws IOException {
        StringBuilder sb = new StringBuilder();
        sb.append("WORK_DIR=$(mktemp -d /tmp/cronium_run_XXXXXX) || exit 97\n");
        sb.append("trap 'rm -rf \"$WORK_DIR\"' EXIT\n");
        sb.append("cd \"$WORK_DIR\" || exit 97\n");
        appendFile(sb, HandoffFiles.INPUT, HandoffFiles.toJson(input));
        appendFile(sb, HandoffFiles.EVENT, HandoffFiles.toJson(metadata));
        appendFile(sb, HandoffFiles.VARIABLES, HandoffFiles.toJson(variables));
        appendFile(sb, type.helperFile(), RuntimeHelpers.helperSource(type));
        String scriptName = "script" + type.extension();
        appendFile(sb, scriptName, RuntimeHelpers.wrapScript(type, content));

        if (env != null) {
            for (Map.Entry<String, String> entry : env.entrySet()) {
                if (!ENV_KEY.matcher(entry.getKey()).matches()) {
                    log.warn("Skipping invalid environment variable name: {}", entry.getKey());
                    continue;
                }
                sb.append("export ").append(entry.getKey()).append('=')
                        .append(shellQuote(entry.getValue() != null ? entry.getValue() : "")).append('\n');
            }
        }

        long seconds = Math.max(1, (timeoutMs + 999) / 1000);
        String interpreter = switch (type) {
            case BASH -> "bash";
            case PYTHON -> "python3";
            case NODEJS -> "node";
            case HTTP_REQUEST -> throw new SandboxException("HTTP requests cannot run over ssh");
        };
        // timeout(1) also exits 124 when the script itself does; only a run that
        // lasted the full limit counts as timed out.
        sb.append("TIMED_OUT=0\n");
        sb.append("if command -v timeout >/dev/null 2>&1; then\n");
        sb.append("  START=$(date +%s)\n");
        sb.append("  timeout ").append(seconds).append("s ").append(interpreter).append(' ').append(scriptName).append('\n');
        sb.append("  CODE=$?\n");
        sb.append("  if [ \"$CODE\" -eq 124 ] && [ $(( $(date +%s) - START )) -ge ").append(seconds)
                .append(" ]; then TIMED_OUT=1; fi\n");
        sb.append("else\n");
        sb.append("  ").append(interpreter).append(' ').append(scriptName).append('\n');
        sb.append("  CODE=$?\n");
        sb.append("fi\n");
        sb.append("printf '\\n%s\\n' '").append(marker).append(":RESULTS'\n");
        sb.append("if [ \"$TIMED_OUT\" -eq 1 ]; then echo '").append(marker).append(':').append(TIMEOUT_SECTION)
                .append("'; fi\n");
        for (String file : List.of(HandoffFiles.OUTPUT, HandoffFiles.CONDITION, HandoffFiles.VARIABLES)) {
            sb.append("if [ -f ").append(file).append(" ]; then echo '").append(marker).append(':').append(file)
                    .append("'; base64 < ").append(file).append("; fi\n");
        }
        sb.append("echo '").append(marker).append(":END'\n");
        sb.append("exit $CODE\n");
        return sb.toString();
    }

    private static void appendFile(StringBuilder sb, String name, String content) {
        String encoded = Base64.getMimeEncoder().encodeToString(content.getBytes(StandardCharsets.UTF_8));
        sb.append("base64 -d > ").append(name).append(" <<'").append(HEREDOC).append("'\n")
                .append(encoded).append('\n')
                .append(HEREDOC).append('\n');
    }

    static String shellQuote(String value) {
        return "'" + value.replace("'", "'\\''") + "'";
    }

    // ── Transcript parsing ──────────────────────────────────────────

    /**
     * Split the remote stdout into the script's own output and the result
     * files printed after the marker.
     */
    static ExecutionResult parseTranscript(String stdout, String marker) {
        ExecutionResult result = ExecutionResult.builder().build();
        String resultsLine = "\n" + marker + ":RESULTS\n";
        int idx = stdout.lastIndexOf(resultsLine);
        if (idx < 0) {
            result.setStdout(stdout);
            return result;
        }
        result.setStdout(stdout.substring(0, idx));

        Map<String, StringBuilder> sections = new LinkedHashMap<>();
        StringBuilder current = null;
        for (String line : stdout.substring(idx + resultsLine.length()).split("\n")) {
            if (line.startsWith(marker + ":")) {
                String name = line.substring(marker.length() + 1).strip();
                if ("END".equals(name))
                    break;
                current = new StringBuilder();
                sections.put(name, current);
            } else if (current != null) {
                current.append(line.strip());
            }
        }

        result.setTimedOut(sections.containsKey(TIMEOUT_SECTION));
        StringBuilder output = sections.get(HandoffFiles.OUTPUT);
        if (output != null) {
            HandoffFiles.Parsed<JsonNode> parsed = HandoffFiles.parseOutput(decode(output));
            result.setOutput(parsed.value());
            addWarning(result, parsed.warning());
        }
        StringBuilder condition = sections.get(HandoffFiles.CONDITION);
        if (condition != null) {
            HandoffFiles.Parsed<Boolean> parsed = HandoffFiles.parseCondition(decode(condition));
            result.setCondition(parsed.value());
            addWarning(result, parsed.warning());
        }
        StringBuilder variables = sections.get(HandoffFiles.VARIABLES);
        if (variables != null) {
            HandoffFiles.Parsed<Map<String, String>> parsed = HandoffFiles.parseVariables(decode(variables));
            result.setVariablesAfter(parsed.value());
            addWarning(result, parsed.warning());
        }
        return result;
    }

    private static String decode(StringBuilder base64) {
        return new String(Base64.getMimeDecoder().decode(base64.toString()), StandardCharsets.UTF_8);
    }

    private static void addWarning(ExecutionResult result, String warning) {
        if (warning != null)
            result.getWarnings().add(warning);
    }

    // ── Process plumbing ────────────────────────────────────────────

    private record SshResult(String stdout, String stderr, int exitCode, boolean timedOut) {
    }

    List<String> sshCommand(RemoteTarget target, List<String> remoteCommand) {
        List<String> command = new ArrayList<>();
        command.add(config.getSshCommand());
        command.add("-o");
        command.add("BatchMode=yes");
        command.add("-o");
        command.add("StrictHostKeyChecking=accept-new");
        command.add("-o");
        command.add("ConnectTimeout=" + Math.max(1, config.getConnectTimeoutMs() / 1000));
        command.add("-p");
        command.add(String.valueOf(target.getPort()));
        if (target.getSshKeyPath() != null && !target.getSshKeyPath().isBlank()) {
            command.add("-i");
            command.add(target.getSshKeyPath());
        }
        String host = target.getUsername() != null && !target.getUsername().isBlank()
                ? target.getUsername() + "@" + target.getAddress()
                : target.getAddress();
        command.add(host);
        command.addAll(remoteCommand);
        return command;
    }

    private SshResult ssh(RemoteTarget target, List<String> remoteCommand, String stdin, long timeoutMs)
            throws IOException {
        Path scratch = Files.createTempDirectory("cronium_ssh_");
        try {
            Path in = scratch.resolve("stdin");
            Path out = scratch.resolve("stdout");
            Path err = scratch.resolve("stderr");
            Files.writeString(in, stdin != null ? stdin : "");

            Process proc = new ProcessBuilder(sshCommand(target, remoteCommand))
                    .redirectInput(in.toFile())
                    .redirectOutput(out.toFile())
                    .redirectError(err.toFile())
                    .start();
            boolean timedOut = false;
            try {
                if (!proc.waitFor(timeoutMs, TimeUnit.MILLISECONDS)) {
                    timedOut = true;
                    proc.destroyForcibly();
                    proc.waitFor(5, TimeUnit.SECONDS);
                }
            } catch (InterruptedException e) {
                proc.destroyForcibly();
                Thread.currentThread().interrupt();
                throw new SandboxException("ssh to " + target.displayName() + " interrupted");
            }
            String stdout = new String(Files.readAllBytes(out), StandardCharsets.UTF_8);
            String stderr = new String(Files.readAllBytes(err), StandardCharsets.UTF_8);
            return new SshResult(stdout, stderr, timedOut ? -1 : proc.exitValue(), timedOut);
        } finally {
            LocalScriptRunner.deleteRecursively(scratch);
        }
    }
}
