package com.cronium.channel.delivery;

import com.cronium.channel.ChannelMessage;
import com.cronium.channel.DeliveryResult;
import com.cronium.channel.ToolCredential;
import com.cronium.common.infra.ErrorUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Duration;

/**
 * Incoming-webhook delivery. A rendered body that parses as a JSON object is
 * posted as-is; anything else is wrapped under the variant's text field.
 */
@Slf4j
public abstract sealed class WebhookChannel implements NotificationChannel permits SlackChannel, DiscordChannel {

    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final OkHttpClient httpClient;

    protected WebhookChannel(OkHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    protected static OkHttpClient defaultClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .callTimeout(Duration.ofSeconds(30))
                .build();
    }

    /** JSON field holding plain text for this webhook flavour. */
    protected abstract String textField();

    /** Upper bound on the plain text length, or 0 for none. */
    protected int textLimit() {
        return 0;
    }

    /**
     * Build the JSON document to post for {@code body}.
     */
    public String shapePayload(String body) {
        String text = body != null ? body : "";
        JsonNode parsed = tryParseObject(text);
        if (parsed != null)
            return text;
        int limit = textLimit();
        if (limit > 0 && text.length() > limit) {
            text = text.substring(0, limit);
        }
        ObjectNode payload = MAPPER.createObjectNode();
        payload.put(textField(), text);
        return payload.toString();
    }

    @Override
    public DeliveryResult deliver(ToolCredential credential, ChannelMessage message) {
        String url = credential.getWebhookUrl();
        if (url == null || url.isBlank()) {
            return DeliveryResult.failed("Webhook URL not found in credentials");
        }
        Request request;
        try {
            request = new Request.Builder()
                    .url(url)
                    .post(RequestBody.create(shapePayload(message.getBody()), JSON))
                    .build();
        } catch (IllegalArgumentException e) {
            return DeliveryResult.failed("Invalid webhook URL: " + e.getMessage());
        }

        try (Response response = httpClient.newCall(request).execute()) {
            if (response.isSuccessful())
                return DeliveryResult.ok();
            ResponseBody responseBody = response.body();
            String detail = responseBody != null ? ErrorUtils.preview(responseBody.string(), 200) : "";
            return DeliveryResult.failed("Webhook returned HTTP " + response.code()
                    + (detail.isBlank() ? "" : ": " + detail));
        } catch (IOException e) {
            log.debug("Webhook post to {} failed", request.url().host(), e);
            return DeliveryResult.failed(ErrorUtils.formatErrorMessage(e));
        }
    }

    private static JsonNode tryParseObject(String text) {
        String trimmed = text.trim();
        if (!trimmed.startsWith("{"))
            return null;
        try {
            JsonNode node = MAPPER.readTree(trimmed);
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}
