package com.cronium.sandbox;

import com.cronium.common.config.CroniumConfig;
import com.cronium.common.infra.ErrorUtils;
import com.cronium.sandbox.SandboxTypes.ExecutionRequest;
import com.cronium.sandbox.SandboxTypes.ExecutionResult;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Runs one script as a child process in a fresh working directory.
 * <p>
 * The directory receives the handoff files and the language helper before
 * the run and is removed afterwards whatever the outcome.
 */
@Slf4j
public class LocalScriptRunner {

    static final String STDOUT_FILE = ".cronium-stdout";
    static final String STDERR_FILE = ".cronium-stderr";

    private final CroniumConfig.SandboxConfig config;
    private final UserVariableStore variableStore;

    public LocalScriptRunner(CroniumConfig.SandboxConfig config, UserVariableStore variableStore) {
        this.config = config;
        this.variableStore = variableStore;
    }

    public ExecutionResult run(ExecutionRequest request) throws SandboxException {
        ScriptType type = request.getScriptType();
        if (type == null || !type.isScript()) {
            throw new SandboxException("Unsupported script type for local execution: " + type);
        }

        Path dir = createWorkDir();
        try {
            Map<String, String> before = loadVariables(request.getUserId());
            HandoffFiles.writeInputs(dir, request.getInput(), request.getMetadata(), before);
            Path script = RuntimeHelpers.install(dir, type, request.getContent());

            ExecutionResult result = execute(dir, script, request);
            collectResults(dir, result, request.getUserId(), before);
            return result;
        } catch (SandboxException e) {
            throw e;
        } catch (IOException e) {
            throw new SandboxException("Local execution failed: " + ErrorUtils.formatErrorMessage(e), e);
        } finally {
            deleteRecursively(dir);
        }
    }

    private ExecutionResult execute(Path dir, Path script, ExecutionRequest request) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(interpreter(request.getScriptType()), script.toString())
                .directory(dir.toFile())
                .redirectOutput(dir.resolve(STDOUT_FILE).toFile())
                .redirectError(dir.resolve(STDERR_FILE).toFile());
        if (request.getEnv() != null) {
            pb.environment().putAll(request.getEnv());
        }

        long timeoutMs = request.getTimeoutMs() > 0 ? request.getTimeoutMs() : config.getDefaultTimeoutMs();
        Process proc = pb.start();
        boolean timedOut = false;
        try {
            if (!proc.waitFor(timeoutMs, TimeUnit.MILLISECONDS)) {
                timedOut = true;
                kill(proc);
            }
        } catch (InterruptedException e) {
            kill(proc);
            Thread.currentThread().interrupt();
            throw new SandboxException("Script execution interrupted");
        }

        String stdout = readText(dir.resolve(STDOUT_FILE));
        String stderr = readText(dir.resolve(STDERR_FILE));
        if (timedOut) {
            log.warn("Script timed out after {}ms in {}", timeoutMs, dir);
            String notice = "Script execution timed out after " + timeoutMs + "ms";
            stderr = stderr.isBlank() ? notice : stderr.strip() + "\n" + notice;
        }

        return ExecutionResult.builder()
                .stdout(stdout)
                .stderr(stderr)
                .timedOut(timedOut)
                .exitCode(timedOut ? -1 : proc.exitValue())
                .build();
    }

    private void collectResults(Path dir, ExecutionResult result, String userId, Map<String, String> before) {
        HandoffFiles.Parsed<JsonNode> output = HandoffFiles.readOutput(dir);
        result.setOutput(output.value());
        addWarning(result, output.warning());

        HandoffFiles.Parsed<Boolean> condition = HandoffFiles.readCondition(dir);
        result.setCondition(condition.value());
        addWarning(result, condition.warning());

        if (userId == null || variableStore == null)
            return;
        HandoffFiles.Parsed<Map<String, String>> variables = HandoffFiles.readVariables(dir);
        addWarning(result, variables.warning());
        if (variables.value() != null) {
            result.setVariablesAfter(variables.value());
            List<String> warnings = HandoffFiles.persistVariables(variableStore, userId, before, variables.value());
            warnings.forEach(w -> addWarning(result, w));
        }
    }

    private Map<String, String> loadVariables(String userId) {
        if (userId == null || variableStore == null)
            return Map.of();
        try {
            return variableStore.getVariables(userId);
        } catch (RuntimeException e) {
            log.error("Failed to fetch user variables for user {}: {}", userId, e.getMessage());
            return Map.of();
        }
    }

    private String interpreter(ScriptType type) {
        return switch (type) {
            case BASH -> config.getBashCommand();
            case PYTHON -> config.getPythonCommand();
            case NODEJS -> config.getNodeCommand();
            case HTTP_REQUEST -> throw new IllegalArgumentException("HTTP requests have no interpreter");
        };
    }

    private Path createWorkDir() throws SandboxException {
        try {
            if (config.getWorkDir() != null) {
                Path parent = Path.of(config.getWorkDir());
                Files.createDirectories(parent);
                return Files.createTempDirectory(parent, "cronium_run_");
            }
            return Files.createTempDirectory("cronium_run_");
        } catch (IOException e) {
            throw new SandboxException("Failed to create working directory", e);
        }
    }

    private static void addWarning(ExecutionResult result, String warning) {
        if (warning != null) {
            log.warn("Script handoff warning: {}", warning);
            result.getWarnings().add(warning);
        }
    }

    private static void kill(Process proc) throws SandboxException {
        proc.descendants().forEach(ProcessHandle::destroyForcibly);
        proc.destroyForcibly();
        try {
            proc.waitFor(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SandboxException("Interrupted while stopping script");
        }
    }

    private static String readText(Path file) throws IOException {
        if (!Files.exists(file))
            return "";
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    static void deleteRecursively(Path dir) {
        if (dir == null || !Files.exists(dir))
            return;
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    log.warn("Failed to delete {}: {}", path, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.error("Failed to remove working directory {}: {}", dir, e.getMessage());
        }
    }
}
