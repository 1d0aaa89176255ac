package com.cronium.sandbox;

import com.cronium.sandbox.SandboxTypes.ConnectionTest;
import com.cronium.sandbox.SandboxTypes.ExecutionRequest;
import com.cronium.sandbox.SandboxTypes.ExecutionResult;
import com.cronium.sandbox.SandboxTypes.RemoteTarget;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Runs a script on one remote host: check the connection, execute, then persist variable changes.
 */
@Slf4j
public class RemoteScriptRunner {

    private final RemoteSessionProvider provider;
    private final UserVariableStore variableStore;

    public RemoteScriptRunner(RemoteSessionProvider provider, UserVariableStore variableStore) {
        this.provider = provider;
        this.variableStore = variableStore;
    }

    public ExecutionResult run(ExecutionRequest request, RemoteTarget target) throws SandboxException {
        ScriptType type = request.getScriptType();
        if (type == null || !type.isScript()) {
            throw new SandboxException("Unsupported script type for remote execution: " + type);
        }

        ConnectionTest connection = provider.testConnection(target);
        if (!connection.success()) {
            throw new SandboxException.HostUnreachableException(
                    "Server " + target.displayName() + " is not reachable: " + connection.message());
        }
        log.debug("Server {} connectivity verified", target.displayName());

        Map<String, String> before = loadVariables(request.getUserId());
        ExecutionResult result = provider.run(type, request.getContent(), request.getEnv(), target,
                request.getTimeoutMs(), request.getInput(), request.getMetadata(), before);

        if (request.getUserId() != null && result.getVariablesAfter() != null) {
            HandoffFiles.persistVariables(variableStore, request.getUserId(), before, result.getVariablesAfter())
                    .forEach(w -> result.getWarnings().add(w));
        }
        return result;
    }

    private Map<String, String> loadVariables(String userId) {
        if (userId == null || variableStore == null)
            return Map.of();
        try {
            return variableStore.getVariables(userId);
        } catch (RuntimeException e) {
            log.error("Failed to fetch user variables for remote execution of user {}: {}", userId, e.getMessage());
            return Map.of();
        }
    }
}
