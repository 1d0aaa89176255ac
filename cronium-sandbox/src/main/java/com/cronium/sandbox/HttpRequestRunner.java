package com.cronium.sandbox;

import com.cronium.common.config.CroniumConfig;
import com.cronium.common.infra.ErrorUtils;
import com.cronium.sandbox.SandboxTypes.ExecutionResult;
import com.cronium.sandbox.SandboxTypes.HttpRequestSpec;
import com.cronium.sandbox.SandboxTypes.HttpResponseWrapper;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import okhttp3.FormBody;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Executes HTTP-request events.
 * <p>
 * Always returns a {@link HttpResponseWrapper}; transport errors and invalid
 * requests are reported in {@link HttpResponseWrapper#getError()}.
 */
@Slf4j
public class HttpRequestRunner {

    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");
    private static final Set<String> BODYLESS = Set.of("GET", "HEAD");
    private static final Set<String> BODY_REQUIRED = Set.of("POST", "PUT", "PATCH");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public HttpRequestRunner(CroniumConfig.SandboxConfig config) {
        this(new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .callTimeout(Duration.ofMillis(config.getHttpTimeoutMs()))
                .build());
    }

    public HttpRequestRunner(OkHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    public HttpResponseWrapper execute(HttpRequestSpec spec) {
        long start = System.currentTimeMillis();
        Request request;
        try {
            request = buildRequest(spec);
        } catch (RuntimeException | IOException e) {
            log.warn("Rejected HTTP request to {}: {}", spec.getUrl(), ErrorUtils.formatErrorMessage(e));
            return HttpResponseWrapper.builder()
                    .error("Invalid HTTP request: " + ErrorUtils.formatErrorMessage(e))
                    .durationMs(System.currentTimeMillis() - start)
                    .build();
        }

        try (Response response = httpClient.newCall(request).execute()) {
            Map<String, String> headers = new LinkedHashMap<>();
            for (String name : response.headers().names()) {
                headers.put(name.toLowerCase(Locale.ROOT), response.header(name));
            }
            ResponseBody body = response.body();
            return HttpResponseWrapper.builder()
                    .status(response.code())
                    .headers(headers)
                    .body(body != null ? body.string() : "")
                    .durationMs(System.currentTimeMillis() - start)
                    .build();
        } catch (IOException e) {
            log.warn("HTTP {} {} failed: {}", spec.getMethod(), spec.getUrl(), e.getMessage());
            return HttpResponseWrapper.builder()
                    .error(ErrorUtils.formatErrorMessage(e))
                    .durationMs(System.currentTimeMillis() - start)
                    .build();
        }
    }

    /**
     * Execute and shape the response like a script result: the body goes to
     * stdout, {@code {status, headers, data}} to the structured output, and
     * transport errors or statuses of 400 and above to stderr.
     */
    public ExecutionResult run(HttpRequestSpec spec) {
        HttpResponseWrapper response = execute(spec);
        JsonNode data = parseBody(response.getBody());

        ObjectNode output = objectMapper.createObjectNode();
        output.put("status", response.getStatus());
        output.set("headers", objectMapper.valueToTree(response.getHeaders()));
        output.set("data", data);

        String stderr = "";
        if (response.getError() != null) {
            stderr = response.getError();
        } else if (response.getStatus() >= 400) {
            stderr = "HTTP " + response.getStatus() + ": " + ErrorUtils.preview(response.getBody(), 500);
        }

        String stdout;
        try {
            stdout = data.isTextual() ? data.textValue()
                    : objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(data);
        } catch (IOException e) {
            stdout = response.getBody();
        }

        return ExecutionResult.builder()
                .stdout(stdout)
                .stderr(stderr)
                .output(output)
                .exitCode(response.isSuccess() ? 0 : 1)
                .build();
    }

    Request buildRequest(HttpRequestSpec spec) throws IOException {
        if (spec.getUrl() == null || spec.getUrl().isBlank()) {
            throw new IllegalArgumentException("URL is required");
        }
        String method = spec.getMethod() != null ? spec.getMethod().toUpperCase(Locale.ROOT) : "GET";
        Request.Builder builder = new Request.Builder().url(spec.getUrl());

        String contentType = null;
        if (spec.getHeaders() != null) {
            for (Map.Entry<String, String> header : spec.getHeaders().entrySet()) {
                if (header.getKey() == null || header.getValue() == null) {
                    log.debug("Skipping header {} without a value", header.getKey());
                    continue;
                }
                if ("content-type".equalsIgnoreCase(header.getKey())) {
                    contentType = header.getValue();
                    continue;
                }
                builder.header(header.getKey(), header.getValue());
            }
        }

        RequestBody body = BODYLESS.contains(method) ? null : encodeBody(spec.getBody(), contentType);
        if (body == null && BODY_REQUIRED.contains(method)) {
            body = RequestBody.create(new byte[0], null);
        }
        return builder.method(method, body).build();
    }

    private RequestBody encodeBody(JsonNode body, String contentType) throws IOException {
        if (body == null || body.isNull() || body.isMissingNode())
            return null;
        String type = contentType != null ? contentType.toLowerCase(Locale.ROOT) : "";

        if (type.contains("application/x-www-form-urlencoded") && body.isObject()) {
            FormBody.Builder form = new FormBody.Builder();
            for (Iterator<Map.Entry<String, JsonNode>> it = body.fields(); it.hasNext();) {
                Map.Entry<String, JsonNode> field = it.next();
                form.add(field.getKey(), field.getValue().isTextual() ? field.getValue().textValue()
                        : field.getValue().toString());
            }
            return form.build();
        }

        if (type.contains("multipart/form-data") && body.isObject()) {
            MultipartBody.Builder multipart = new MultipartBody.Builder().setType(MultipartBody.FORM);
            for (Iterator<Map.Entry<String, JsonNode>> it = body.fields(); it.hasNext();) {
                Map.Entry<String, JsonNode> field = it.next();
                multipart.addFormDataPart(field.getKey(), field.getValue().isTextual()
                        ? field.getValue().textValue() : field.getValue().toString());
            }
            return multipart.build();
        }

        MediaType mediaType = contentType != null ? MediaType.parse(contentType) : JSON;
        String raw = body.isTextual() ? body.textValue() : objectMapper.writeValueAsString(body);
        return RequestBody.create(raw, mediaType != null ? mediaType : JSON);
    }

    private JsonNode parseBody(String body) {
        if (body == null || body.isBlank())
            return objectMapper.createObjectNode();
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            return objectMapper.getNodeFactory().textNode(body);
        }
    }
}
