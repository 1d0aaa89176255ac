package com.cronium.sandbox;

import com.cronium.sandbox.SandboxTypes.ConnectionTest;
import com.cronium.sandbox.SandboxTypes.ExecutionRequest;
import com.cronium.sandbox.SandboxTypes.ExecutionResult;
import com.cronium.sandbox.SandboxTypes.RemoteTarget;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RemoteScriptRunnerTest {

    private final RemoteTarget target = RemoteTarget.builder().name("db-1").address("10.0.0.9").build();

    /** Provider that answers the connection check with a fixed result and echoes the variables back. */
    private static class FakeProvider implements RemoteSessionProvider {
        final ConnectionTest connection;
        final AtomicInteger runs = new AtomicInteger();
        Map<String, String> seenVariables;
        Map<String, String> variablesAfter;

        FakeProvider(ConnectionTest connection) {
            this.connection = connection;
        }

        @Override
        public ConnectionTest testConnection(RemoteTarget target) {
            return connection;
        }

        @Override
        public ExecutionResult run(ScriptType scriptType, String content, Map<String, String> env,
                RemoteTarget target, long timeoutMs, Map<String, Object> input, Map<String, Object> metadata,
                Map<String, String> variables) {
            runs.incrementAndGet();
            seenVariables = variables;
            return ExecutionResult.builder().stdout("ran on " + target.getName())
                    .variablesAfter(variablesAfter).build();
        }
    }

    @Test
    void unreachableHost_abortsWithDescriptiveError() {
        FakeProvider provider = new FakeProvider(new ConnectionTest(false, "Connection refused"));
        RemoteScriptRunner runner = new RemoteScriptRunner(provider, new InMemoryVariableStore());

        SandboxException e = assertThrows(SandboxException.HostUnreachableException.class,
                () -> runner.run(ExecutionRequest.builder().scriptType(ScriptType.BASH).content("true").build(),
                        target));

        assertEquals("Server db-1 is not reachable: Connection refused", e.getMessage());
        assertEquals(0, provider.runs.get());
    }

    @Test
    void reachableHost_runsAndPersistsVariableChanges() throws Exception {
        InMemoryVariableStore store = new InMemoryVariableStore().with("u7", Map.of("counter", "1"));
        FakeProvider provider = new FakeProvider(new ConnectionTest(true, "ok"));
        Map<String, String> after = new LinkedHashMap<>();
        after.put("counter", "2");
        after.put("__updated__", "now");
        provider.variablesAfter = after;

        ExecutionResult result = new RemoteScriptRunner(provider, store).run(ExecutionRequest.builder()
                .scriptType(ScriptType.PYTHON).content("print(1)").userId("u7").build(), target);

        assertEquals("ran on db-1", result.getStdout());
        assertEquals(Map.of("counter", "1"), provider.seenVariables);
        assertEquals(Map.of("counter", "2"), store.getVariables("u7"));
    }

    @Test
    void httpType_isRejected() {
        RemoteScriptRunner runner = new RemoteScriptRunner(new FakeProvider(new ConnectionTest(true, "ok")), null);
        assertThrows(SandboxException.class, () -> runner.run(
                ExecutionRequest.builder().scriptType(ScriptType.HTTP_REQUEST).build(), target));
    }
}
