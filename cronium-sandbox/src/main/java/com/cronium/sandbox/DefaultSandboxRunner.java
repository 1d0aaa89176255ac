package com.cronium.sandbox;

import com.cronium.sandbox.SandboxTypes.ExecutionRequest;
import com.cronium.sandbox.SandboxTypes.ExecutionResult;
import com.cronium.sandbox.SandboxTypes.HttpRequestSpec;
import com.cronium.sandbox.SandboxTypes.RemoteTarget;

/**
 * Routes scripts to the local or remote runner and HTTP requests to the
 * HTTP runner.
 */
public class DefaultSandboxRunner implements SandboxRunner {

    private final LocalScriptRunner localRunner;
    private final RemoteScriptRunner remoteRunner;
    private final HttpRequestRunner httpRunner;

    public DefaultSandboxRunner(LocalScriptRunner localRunner, RemoteScriptRunner remoteRunner,
            HttpRequestRunner httpRunner) {
        this.localRunner = localRunner;
        this.remoteRunner = remoteRunner;
        this.httpRunner = httpRunner;
    }

    @Override
    public ExecutionResult runScript(ExecutionRequest request, RemoteTarget target) throws SandboxException {
        if (target == null) {
            return localRunner.run(request);
        }
        return remoteRunner.run(request, target);
    }

    @Override
    public ExecutionResult runHttp(HttpRequestSpec spec) {
        return httpRunner.run(spec);
    }
}
