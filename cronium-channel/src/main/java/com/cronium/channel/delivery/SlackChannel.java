package com.cronium.channel.delivery;

import okhttp3.OkHttpClient;

/**
 * Slack incoming webhook ({@code {"text": ...}}).
 */
public final class SlackChannel extends WebhookChannel {

    public SlackChannel() {
        this(defaultClient());
    }

    public SlackChannel(OkHttpClient httpClient) {
        super(httpClient);
    }

    @Override
    protected String textField() {
        return "text";
    }
}
