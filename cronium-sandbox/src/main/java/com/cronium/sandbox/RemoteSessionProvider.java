package com.cronium.sandbox;

import com.cronium.sandbox.SandboxTypes.ConnectionTest;
import com.cronium.sandbox.SandboxTypes.ExecutionResult;
import com.cronium.sandbox.SandboxTypes.RemoteTarget;

import java.util.Map;

/**
 * Opens sessions on remote hosts.
 * <p>
 * Implementations materialize the same handoff files and helper stub as the
 * local runner, enforce the timeout, and report the post-run variables
 * document through {@link ExecutionResult#getVariablesAfter()}.
 */
public interface RemoteSessionProvider {

    /**
     * Cheap reachability check; never throws.
     */
    ConnectionTest testConnection(RemoteTarget target);

    ExecutionResult run(ScriptType scriptType, String content, Map<String, String> env, RemoteTarget target,
            long timeoutMs, Map<String, Object> input, Map<String, Object> metadata,
            Map<String, String> variables) throws SandboxException;
}
