package com.cronium.sandbox;

import com.cronium.sandbox.SandboxTypes.ExecutionResult;
import com.cronium.sandbox.SandboxTypes.HttpRequestSpec;
import com.cronium.sandbox.SandboxTypes.HttpResponseWrapper;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class HttpRequestRunnerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private MockWebServer server;
    private HttpRequestRunner runner;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        runner = new HttpRequestRunner(new OkHttpClient.Builder()
                .callTimeout(Duration.ofSeconds(5))
                .build());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private ObjectNode body() {
        return mapper.createObjectNode().put("name", "cronium").put("n", 3);
    }

    @Test
    void post_defaultsToJsonBody() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"id\": 42}").setHeader("Content-Type", "application/json"));

        HttpResponseWrapper response = runner.execute(HttpRequestSpec.builder()
                .method("post").url(server.url("/items").toString()).body(body()).build());

        RecordedRequest recorded = server.takeRequest(2, TimeUnit.SECONDS);
        assertEquals("POST", recorded.getMethod());
        assertTrue(recorded.getHeader("Content-Type").startsWith("application/json"));
        assertEquals(body(), mapper.readTree(recorded.getBody().readUtf8()));
        assertEquals(200, response.getStatus());
        assertEquals("{\"id\": 42}", response.getBody());
        assertEquals("application/json", response.getHeaders().get("content-type"));
        assertTrue(response.isSuccess());
    }

    @Test
    void post_formEncoded() throws Exception {
        server.enqueue(new MockResponse().setBody("ok"));

        runner.execute(HttpRequestSpec.builder()
                .method("POST").url(server.url("/form").toString())
                .headers(Map.of("Content-Type", "application/x-www-form-urlencoded"))
                .body(body()).build());

        RecordedRequest recorded = server.takeRequest(2, TimeUnit.SECONDS);
        assertTrue(recorded.getHeader("Content-Type").startsWith("application/x-www-form-urlencoded"));
        assertEquals("name=cronium&n=3", recorded.getBody().readUtf8());
    }

    @Test
    void post_multipart() throws Exception {
        server.enqueue(new MockResponse().setBody("ok"));

        runner.execute(HttpRequestSpec.builder()
                .method("POST").url(server.url("/upload").toString())
                .headers(Map.of("content-type", "multipart/form-data"))
                .body(body()).build());

        RecordedRequest recorded = server.takeRequest(2, TimeUnit.SECONDS);
        assertTrue(recorded.getHeader("Content-Type").startsWith("multipart/form-data; boundary="));
        String payload = recorded.getBody().readUtf8();
        assertTrue(payload.contains("name=\"name\""));
        assertTrue(payload.contains("cronium"));
    }

    @Test
    void get_sendsCustomHeadersWithoutBody() throws Exception {
        server.enqueue(new MockResponse().setBody("[]"));

        runner.execute(HttpRequestSpec.builder()
                .url(server.url("/list").toString())
                .headers(Map.of("X-Api-Key", "secret"))
                .body(body()).build());

        RecordedRequest recorded = server.takeRequest(2, TimeUnit.SECONDS);
        assertEquals("GET", recorded.getMethod());
        assertEquals("secret", recorded.getHeader("X-Api-Key"));
        assertEquals(0, recorded.getBodySize());
    }

    @Test
    void run_serverError_isFailedResultNotException() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("{\"error\": \"down\"}"));

        ExecutionResult result = runner.run(HttpRequestSpec.builder().url(server.url("/x").toString()).build());

        assertFalse(result.isSuccess());
        assertTrue(result.getStderr().startsWith("HTTP 500"));
        assertEquals(500, result.getOutput().get("status").asInt());
        assertEquals("down", result.getOutput().get("data").get("error").asText());
    }

    @Test
    void run_success_exposesBodyAsOutputData() {
        server.enqueue(new MockResponse().setBody("{\"temp\": 21}"));

        ExecutionResult result = runner.run(HttpRequestSpec.builder().url(server.url("/w").toString()).build());

        assertTrue(result.isSuccess());
        assertEquals(21, result.getOutput().get("data").get("temp").asInt());
        assertTrue(result.getStdout().contains("\"temp\" : 21"));
    }

    @Test
    void execute_transportError_isWrapped() throws IOException {
        MockWebServer dead = new MockWebServer();
        dead.start();
        String url = dead.url("/gone").toString();
        dead.shutdown();

        HttpResponseWrapper response = runner.execute(HttpRequestSpec.builder().url(url).build());

        assertEquals(0, response.getStatus());
        assertNotNull(response.getError());
        assertFalse(response.isSuccess());
    }

    @Test
    void execute_invalidUrl_isWrapped() {
        HttpResponseWrapper response = runner.execute(HttpRequestSpec.builder().url("not a url").build());

        assertTrue(response.getError().startsWith("Invalid HTTP request"));
    }

    @Test
    void execute_missingUrl_isWrapped() {
        HttpResponseWrapper response = runner.execute(HttpRequestSpec.builder().url(null).build());

        assertEquals("Invalid HTTP request: URL is required", response.getError());
        assertFalse(response.isSuccess());
    }

    @Test
    void run_missingUrl_isFailedResult() {
        ExecutionResult result = runner.run(HttpRequestSpec.builder().build());

        assertFalse(result.isSuccess());
        assertTrue(result.getStderr().contains("URL is required"));
    }

    @Test
    void execute_headerWithoutValue_isSkipped() throws InterruptedException {
        server.enqueue(new MockResponse().setBody("ok"));
        Map<String, String> headers = new HashMap<>();
        headers.put("X-Empty", null);
        headers.put("X-Trace", "t-1");

        HttpResponseWrapper response = runner.execute(HttpRequestSpec.builder()
                .url(server.url("/h").toString())
                .headers(headers)
                .build());

        assertEquals(200, response.getStatus());
        RecordedRequest recorded = server.takeRequest();
        assertNull(recorded.getHeader("X-Empty"));
        assertEquals("t-1", recorded.getHeader("X-Trace"));
    }
}
