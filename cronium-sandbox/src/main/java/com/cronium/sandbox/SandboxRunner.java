package com.cronium.sandbox;

import com.cronium.sandbox.SandboxTypes.ExecutionRequest;
import com.cronium.sandbox.SandboxTypes.ExecutionResult;
import com.cronium.sandbox.SandboxTypes.HttpRequestSpec;
import com.cronium.sandbox.SandboxTypes.RemoteTarget;

/**
 * Runs one event invocation in isolation from prior runs.
 */
public interface SandboxRunner {

    /**
     * Run a script locally when {@code target} is null, otherwise on that host.
     *
     * @throws SandboxException when the run cannot be set up or the host is unreachable
     */
    ExecutionResult runScript(ExecutionRequest request, RemoteTarget target) throws SandboxException;

    /**
     * Execute an HTTP request; never throws for HTTP-level failures.
     */
    ExecutionResult runHttp(HttpRequestSpec spec);
}
