package com.cronium.engine;

import com.cronium.sandbox.SandboxException;
import com.cronium.sandbox.SandboxRunner;
import com.cronium.sandbox.SandboxTypes.ExecutionRequest;
import com.cronium.sandbox.SandboxTypes.ExecutionResult;
import com.cronium.sandbox.SandboxTypes.HttpRequestSpec;
import com.cronium.sandbox.SandboxTypes.RemoteTarget;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Scripted sandbox. Responses are queued per target name ("local" for local
 * runs); the last queued response repeats.
 */
public class FakeSandboxRunner implements SandboxRunner {

    @FunctionalInterface
    public interface Response {
        ExecutionResult respond(ExecutionRequest request, RemoteTarget target) throws SandboxException;
    }

    public static final String LOCAL = "local";

    private final Map<String, Deque<Response>> scripted = new ConcurrentHashMap<>();
    private volatile Response fallback = (request, target) -> ok("ok");
    private volatile ExecutionResult httpResult = ok("{}");

    public final List<String> calls = Collections.synchronizedList(new ArrayList<>());
    public final List<ExecutionRequest> requests = Collections.synchronizedList(new ArrayList<>());

    public FakeSandboxRunner on(String target, Response... responses) {
        scripted.put(target, new ArrayDeque<>(List.of(responses)));
        return this;
    }

    public FakeSandboxRunner otherwise(Response response) {
        this.fallback = response;
        return this;
    }

    public FakeSandboxRunner http(ExecutionResult result) {
        this.httpResult = result;
        return this;
    }

    public long callsFor(String target) {
        synchronized (calls) {
            return calls.stream().filter(target::equals).count();
        }
    }

    @Override
    public ExecutionResult runScript(ExecutionRequest request, RemoteTarget target) throws SandboxException {
        String name = target == null ? LOCAL : target.getName();
        calls.add(name);
        requests.add(request);
        Response response;
        Deque<Response> queue = scripted.get(name);
        if (queue == null) {
            response = fallback;
        } else {
            synchronized (queue) {
                response = queue.size() > 1 ? queue.poll() : queue.peek();
            }
        }
        return response.respond(request, target);
    }

    @Override
    public ExecutionResult runHttp(HttpRequestSpec spec) {
        calls.add("http");
        return httpResult;
    }

    // ── Canned results ──

    public static ExecutionResult ok(String stdout) {
        return ExecutionResult.builder().stdout(stdout).build();
    }

    public static ExecutionResult okWithCondition(String stdout, boolean condition) {
        return ExecutionResult.builder().stdout(stdout).condition(condition).build();
    }

    public static ExecutionResult failed(String stderr) {
        return ExecutionResult.builder().stderr(stderr).exitCode(1).build();
    }

    public static ExecutionResult timedOut() {
        return ExecutionResult.builder().stdout("partial").timedOut(true).exitCode(-1).build();
    }

    public static Response returning(ExecutionResult result) {
        return (request, target) -> result;
    }

    public static Response unreachable() {
        return (request, target) -> {
            throw new SandboxException.HostUnreachableException(
                    "Server " + target.getName() + " is not reachable: Connection refused");
        };
    }
}
